package ca.gc.cra.helio.domain.container;

/**
 * Container layouts HELIO can emit. Files carry no discriminator, so readers must know the schema out-of-band.
 *
 * @since 0.1.0
 */
public enum ContainerSchema {
  /** One grayscale plane per channel, in arrival order. */
  RAW,
  /** One RGB image per group of three channels, channels sorted by id. */
  COMPOSITE,
  /** One length-prefixed encoded image per channel, in arrival order. */
  COMPRESSED
}
