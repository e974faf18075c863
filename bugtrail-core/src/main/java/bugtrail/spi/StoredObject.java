package bugtrail.spi;

/**
 * Result of an upload.
 *
 * @param key  storage key the object was written under
 * @param url  URL the object can be served from
 * @param size size in bytes
 */
public record StoredObject(String key, String url, long size) {
}
