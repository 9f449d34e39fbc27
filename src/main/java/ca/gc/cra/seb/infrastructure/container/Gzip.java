package ca.gc.cra.seb.infrastructure.container;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/** In-memory gzip helpers. */
final class Gzip {
  private static final int BUFFER_SIZE = 8 * 1024;

  private Gzip() {}

  static byte[] compress(byte[] data) {
    ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, data.length / 2));
    try (GZIPOutputStream gzip = new GZIPOutputStream(out, BUFFER_SIZE)) {
      gzip.write(data);
    } catch (IOException e) {
      // ByteArrayOutputStream never throws; reaching this means the JDK deflater failed.
      throw new UncheckedIOException("gzip compression failed", e);
    }
    return out.toByteArray();
  }

  /**
   * Decompresses a complete gzip stream.
   *
   * @param data gzip bytes
   * @return decompressed bytes
   * @throws IOException when the data is not gzip or is truncated
   */
  static byte[] decompress(byte[] data) throws IOException {
    try (GZIPInputStream gzip = new GZIPInputStream(new ByteArrayInputStream(data), BUFFER_SIZE)) {
      return gzip.readAllBytes();
    }
  }
}
