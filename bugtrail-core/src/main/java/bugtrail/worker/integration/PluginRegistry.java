package bugtrail.worker.integration;

import java.util.List;

/**
 * Resolves integration plugins by platform key.
 */
public interface PluginRegistry {

    /**
     * Returns the plugin for a platform, or {@code null} if none is registered.
     */
    IntegrationPlugin get(String platform);

    /**
     * Registered platform keys, sorted.
     */
    List<String> supportedPlatforms();
}
