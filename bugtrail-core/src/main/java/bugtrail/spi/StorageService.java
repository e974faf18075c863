package bugtrail.spi;

/**
 * Narrow object-storage contract (S3, local filesystem, ...).
 *
 * <p>Implementations throw {@link StorageException} on backend failure.
 */
public interface StorageService {

    StoredObject upload(String key, byte[] data, String contentType);

    /**
     * Returns object metadata, or {@code null} if the object does not exist.
     */
    ObjectHead headObject(String key);

    /**
     * Deletes an object. Deleting a missing object is not an error.
     */
    void deleteObject(String key);
}
