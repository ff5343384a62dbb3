/**
 * Executor construction for the acquire waves.
 *
 * @since 0.1.0
 */
package ca.gc.cra.helio.infrastructure.exec;
