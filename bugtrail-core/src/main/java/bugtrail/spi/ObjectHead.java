package bugtrail.spi;

/**
 * Metadata of a stored object.
 *
 * @param key  storage key
 * @param size size in bytes
 */
public record ObjectHead(String key, long size) {
}
