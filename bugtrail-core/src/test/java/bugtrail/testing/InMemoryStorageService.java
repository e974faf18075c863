package bugtrail.testing;

import bugtrail.spi.ObjectHead;
import bugtrail.spi.StorageException;
import bugtrail.spi.StorageService;
import bugtrail.spi.StoredObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed {@link StorageService} for unit tests. Keys added to {@link #failing} throw a
 * 503 {@link StorageException} on every call.
 */
public class InMemoryStorageService implements StorageService {
  public static final String BASE_URL = "https://storage.test/";

  public final Map<String, byte[]> objects = new ConcurrentHashMap<>();
  public final Set<String> failing = Collections.synchronizedSet(new HashSet<>());
  public final List<String> deleted = Collections.synchronizedList(new ArrayList<>());

  public InMemoryStorageService put(String key, int size) {
    objects.put(key, new byte[size]);
    return this;
  }

  public static String url(String key) {
    return BASE_URL + key;
  }

  @Override
  public StoredObject upload(String key, byte[] data, String contentType) {
    check(key);
    objects.put(key, data);
    return new StoredObject(key, url(key), data.length);
  }

  @Override
  public ObjectHead headObject(String key) {
    check(key);
    byte[] data = objects.get(key);
    return data == null ? null : new ObjectHead(key, data.length);
  }

  @Override
  public void deleteObject(String key) {
    check(key);
    objects.remove(key);
    deleted.add(key);
  }

  private void check(String key) {
    if (failing.contains(key)) {
      throw new StorageException("storage unavailable for " + key, 503, null);
    }
  }
}
