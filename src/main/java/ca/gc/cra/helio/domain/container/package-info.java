/**
 * Container domain: the three record layouts, the container aggregate, and assembly failures.
 * <p>All multi-byte fields are little-endian; the header is a one-byte record count followed by a 19-byte ASCII
 * timestamp. There is no magic number, version, or checksum.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.helio.domain.container;
