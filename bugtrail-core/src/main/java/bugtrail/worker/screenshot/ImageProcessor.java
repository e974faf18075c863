package bugtrail.worker.screenshot;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Base64;
import java.util.Iterator;
import java.util.regex.Pattern;

/**
 * Decoding, scaling and JPEG encoding of screenshots with {@code javax.imageio}.
 */
public final class ImageProcessor {
  private static final Pattern DATA_URL_PREFIX = Pattern.compile("^data:image/[\\w.+-]+;base64,");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private ImageProcessor() {}

  /**
   * Decodes base64 image data, stripping a {@code data:image/...;base64,} prefix if present.
   *
   * @throws IllegalArgumentException if the data is empty or not valid base64
   */
  public static byte[] decodeBase64(String data) {
    if (data == null || data.isBlank()) {
      throw new IllegalArgumentException("Screenshot data is empty");
    }
    String base64 = WHITESPACE.matcher(DATA_URL_PREFIX.matcher(data.trim()).replaceFirst("")).replaceAll("");
    return Base64.getDecoder().decode(base64);
  }

  /**
   * @throws IllegalArgumentException if the bytes are not an image format ImageIO can read
   */
  public static BufferedImage read(byte[] bytes) throws IOException {
    BufferedImage image = ImageIO.read(new ByteArrayInputStream(bytes));
    if (image == null) {
      throw new IllegalArgumentException("Unsupported image format");
    }
    return image;
  }

  /**
   * Scales an image to fit inside {@code maxWidth x maxHeight}, keeping its aspect ratio.
   * Images that already fit are returned unchanged.
   */
  public static BufferedImage fitInside(BufferedImage image, int maxWidth, int maxHeight) {
    int width = image.getWidth();
    int height = image.getHeight();
    double scale = Math.min(1.0, Math.min((double) maxWidth / width, (double) maxHeight / height));
    if (scale >= 1.0) {
      return image;
    }
    int targetWidth = Math.max(1, (int) Math.round(width * scale));
    int targetHeight = Math.max(1, (int) Math.round(height * scale));
    BufferedImage scaled = new BufferedImage(targetWidth, targetHeight, BufferedImage.TYPE_INT_RGB);
    Graphics2D g = scaled.createGraphics();
    try {
      g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
      g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
      g.drawImage(image, 0, 0, targetWidth, targetHeight, Color.WHITE, null);
    } finally {
      g.dispose();
    }
    return scaled;
  }

  /**
   * Encodes an image as baseline JPEG. Transparency is flattened onto white.
   *
   * @param quality 1-100
   */
  public static byte[] toJpeg(BufferedImage image, int quality) throws IOException {
    BufferedImage rgb = toRgb(image);
    Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
    if (!writers.hasNext()) {
      throw new IOException("No JPEG writer available");
    }
    ImageWriter writer = writers.next();
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (ImageOutputStream stream = ImageIO.createImageOutputStream(out)) {
      writer.setOutput(stream);
      ImageWriteParam param = writer.getDefaultWriteParam();
      param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
      param.setCompressionQuality(quality / 100f);
      writer.write(null, new IIOImage(rgb, null, null), param);
    } finally {
      writer.dispose();
    }
    return out.toByteArray();
  }

  private static BufferedImage toRgb(BufferedImage image) {
    if (image.getType() == BufferedImage.TYPE_INT_RGB) {
      return image;
    }
    BufferedImage rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
    Graphics2D g = rgb.createGraphics();
    try {
      g.drawImage(image, 0, 0, Color.WHITE, null);
    } finally {
      g.dispose();
    }
    return rgb;
  }
}
