/**
 * <strong>Purpose:</strong> Container serialization and filesystem output.
 * <p><strong>Pipeline role:</strong> Final stage of {@code helio acquire}; {@link
 * ca.gc.cra.helio.infrastructure.container.ContainerCodec#decode} also backs {@code helio inspect}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.helio.infrastructure.container;
