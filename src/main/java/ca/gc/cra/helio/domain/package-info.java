/**
 * Core domain model for HELIO acquire → reconcile → assemble pipelines.
 * <p><strong>Role:</strong> Domain layer describing channels, outcomes, and container records without
 * infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable unless noted; safe to share across wave threads.</p>
 * <p><strong>Performance:</strong> Byte arrays are copied at construction and access; plane-sized copies are
 * accepted in exchange for ownership safety.</p>
 */
package ca.gc.cra.helio.domain;
