/**
 * <strong>Purpose:</strong> Input validation helpers shared by the CLI and configuration layers.
 * <p><strong>Pipeline role:</strong> Runs before the acquire pipeline opens connections or files.
 * <p><strong>Concurrency:</strong> Stateless utilities; thread-safe.
 * <p><strong>Observability:</strong> Failures surface as {@link java.lang.IllegalArgumentException}s that the CLI
 * reports with usage text.
 *
 * @since 0.1.0
 */
package ca.gc.cra.helio.validation;
