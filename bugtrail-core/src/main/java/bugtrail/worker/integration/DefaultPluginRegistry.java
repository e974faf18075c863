package bugtrail.worker.integration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe in-memory {@link PluginRegistry}. Platform keys are case-insensitive.
 */
public final class DefaultPluginRegistry implements PluginRegistry {
  private final Map<String, IntegrationPlugin> plugins = new ConcurrentHashMap<>();

  /**
   * Registers a plugin under its {@link IntegrationPlugin#platform()} key.
   *
   * @throws IllegalStateException if a plugin is already registered for that platform
   */
  public DefaultPluginRegistry register(IntegrationPlugin plugin) {
    Objects.requireNonNull(plugin, "plugin");
    String key = normalize(plugin.platform());
    if (plugins.putIfAbsent(key, plugin) != null) {
      throw new IllegalStateException("Plugin already registered for platform: " + key);
    }
    return this;
  }

  @Override
  public IntegrationPlugin get(String platform) {
    return platform == null ? null : plugins.get(normalize(platform));
  }

  @Override
  public List<String> supportedPlatforms() {
    List<String> keys = new ArrayList<>(plugins.keySet());
    Collections.sort(keys);
    return keys;
  }

  private static String normalize(String platform) {
    Objects.requireNonNull(platform, "platform");
    return platform.trim().toLowerCase(Locale.ROOT);
  }
}
