package bugtrail.retention.archive;

import bugtrail.spi.StorageArchiver;
import bugtrail.spi.StorageService;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Registry of archive strategies by name.
 *
 * <p>{@value DeletionArchiveStrategy#NAME} is registered by default. Names are
 * case-insensitive.
 */
public final class StorageArchivers {
  private final Map<String, Function<StorageService, StorageArchiver>> factories = new TreeMap<>();

  public StorageArchivers() {
    register(DeletionArchiveStrategy.NAME, DeletionArchiveStrategy::new);
  }

  /**
   * Registers or replaces a strategy factory.
   */
  public synchronized StorageArchivers register(String name, Function<StorageService, StorageArchiver> factory) {
    Objects.requireNonNull(factory, "factory");
    factories.put(normalize(name), factory);
    return this;
  }

  /**
   * Creates the named strategy over the given storage.
   *
   * @throws IllegalArgumentException if no strategy is registered under the name
   */
  public synchronized StorageArchiver create(String name, StorageService storage) {
    Function<StorageService, StorageArchiver> factory = factories.get(normalize(name));
    if (factory == null) {
      throw new IllegalArgumentException("Unknown archive strategy: " + name
          + ". Available: " + String.join(", ", factories.keySet()));
    }
    return factory.apply(Objects.requireNonNull(storage, "storage"));
  }

  private static String normalize(String name) {
    Objects.requireNonNull(name, "name");
    return name.trim().toLowerCase(Locale.ROOT);
  }
}
