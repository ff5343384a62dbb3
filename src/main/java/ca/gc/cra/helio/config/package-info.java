/**
 * <strong>Purpose:</strong> Configuration for HELIO: embedded defaults, YAML loading, CLI precedence, the
 * immutable {@link ca.gc.cra.helio.config.AcquireConfig}, and adapter wiring.
 * <p><strong>Precedence:</strong> CLI {@code key=value} &gt; YAML ({@code common} then mode section) &gt;
 * {@link ca.gc.cra.helio.config.DefaultsForMode}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.helio.config;
