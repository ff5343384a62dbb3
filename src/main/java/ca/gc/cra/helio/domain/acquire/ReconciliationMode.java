package ca.gc.cra.helio.domain.acquire;

/**
 * Strategy used to fetch channels and choose the canonical timestamp of a batch.
 *
 * @since 0.1.0
 */
public enum ReconciliationMode {
  /** One wave at the nominal timestamp; canonical timestamp is the latest actual timestamp. */
  INDEPENDENT,
  /**
   * Reference channel first, then a second wave at the reference's actual timestamp; canonical timestamp is the
   * reference's actual timestamp.
   */
  ANCHORED,
  /** Exactly one channel; its actual timestamp is canonical and its failure is fatal. */
  SINGLE
}
