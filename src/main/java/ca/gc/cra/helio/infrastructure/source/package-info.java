/**
 * HTTP adapter for the solar image archive, built on OkHttp.
 *
 * @since 0.1.0
 */
package ca.gc.cra.helio.infrastructure.source;
