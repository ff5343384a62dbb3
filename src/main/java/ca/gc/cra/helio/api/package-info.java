/**
 * Command-line entry points for HELIO.
 *
 * <p>{@link ca.gc.cra.helio.api.Main} dispatches to {@code acquire} and {@code inspect}; each command returns an
 * {@link ca.gc.cra.helio.api.ExitCode} instead of calling {@link System#exit(int)} so it can be tested in-process.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.helio.api;
