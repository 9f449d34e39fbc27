package ca.gc.cra.seb.infrastructure.container;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Optional;

/**
 * Four-byte ASCII tag at the start of the decompressed container.
 *
 * @since 0.1.0
 */
public enum ContainerTag {
  /** Unencrypted payload: {@code gzip(xml)}. */
  PLAIN("plnd"),
  /** Password-encrypted payload: {@code salt || iv || AES-256-CBC(gzip(xml))}. */
  PASSWORD("pwcc");

  /** Tag length in bytes. */
  public static final int LENGTH = 4;

  private final String text;
  private final byte[] bytes;

  ContainerTag(String text) {
    this.text = text;
    this.bytes = text.getBytes(StandardCharsets.US_ASCII);
  }

  /**
   * Tag text as written to the container.
   *
   * @return four ASCII characters
   */
  public String text() {
    return text;
  }

  byte[] bytes() {
    return bytes.clone();
  }

  /**
   * Matches the first {@link #LENGTH} bytes of {@code data}.
   *
   * @param data decompressed container bytes; must hold at least four bytes
   * @return tag, or empty when unrecognized
   */
  static Optional<ContainerTag> match(byte[] data) {
    byte[] head = Arrays.copyOf(data, LENGTH);
    for (ContainerTag tag : values()) {
      if (Arrays.equals(tag.bytes, head)) {
        return Optional.of(tag);
      }
    }
    return Optional.empty();
  }
}
