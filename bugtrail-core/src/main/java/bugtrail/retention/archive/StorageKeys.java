package bugtrail.retention.archive;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Derives storage keys from the URLs stored on bug reports.
 */
public final class StorageKeys {

  private StorageKeys() {}

  /**
   * Returns the URL path without its leading {@code /}, or the input unchanged when it is
   * not an absolute URL.
   */
  public static String fromUrl(String url) {
    if (url == null || url.isBlank()) {
      return null;
    }
    try {
      URI uri = new URI(url);
      if (uri.getScheme() == null || uri.getRawPath() == null) {
        return url;
      }
      String path = uri.getPath();
      return path.startsWith("/") ? path.substring(1) : path;
    } catch (URISyntaxException e) {
      return url;
    }
  }
}
