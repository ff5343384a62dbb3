/**
 * Runtime logging controls for the CLI (SLF4J over Logback).
 *
 * @since 0.1.0
 */
package ca.gc.cra.helio.logging;
