package ca.gc.cra.helio.domain.container;

/**
 * One image entry of a {@link Container}.
 *
 * @since 0.1.0
 */
public sealed interface ImageRecord permits PlaneRecord, CompositeRecord, CompressedRecord {
  /**
   * Returns the number of bytes this record occupies once serialized, including its field prefix.
   *
   * @return serialized length in bytes
   */
  long serializedLength();
}
