package com.s3vectors.filesearch.service.embedding;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Base64;

import javax.imageio.ImageIO;

/**
 * Normalizes an image (RGB, fixed size, fixed encoding) and renders it as base64 text. Images go
 * through the text embedding model, so similarity between images is only as good as that allows.
 */
class ImageContentExtractor implements ContentExtractor {

  private final int width;
  private final int height;
  private final String format;

  ImageContentExtractor(int width, int height, String format) {
    this.width = width;
    this.height = height;
    this.format = format;
  }

  @Override
  public String extractText(Path file) throws IOException {
    BufferedImage source = ImageIO.read(file.toFile());
    if (source == null) {
      throw new IOException("Unsupported or corrupt image: " + file.getFileName());
    }

    BufferedImage rgb = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
    Graphics2D graphics = rgb.createGraphics();
    try {
      graphics.setRenderingHint(
          RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
      graphics.drawImage(source, 0, 0, width, height, null);
    } finally {
      graphics.dispose();
    }

    ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    if (!ImageIO.write(rgb, format, buffer)) {
      throw new IOException("No image writer available for format " + format);
    }

    return "image: " + Base64.getEncoder().encodeToString(buffer.toByteArray());
  }
}
