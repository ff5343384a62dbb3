/**
 * Acquisition domain: channel requests and results, the reconciled outcome, and the channel/fatal failure
 * taxonomy.
 * <p><strong>Concurrency:</strong> Types are immutable; results are safe to hand across wave threads.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.helio.domain.acquire;
