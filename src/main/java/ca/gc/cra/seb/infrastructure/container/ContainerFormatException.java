package ca.gc.cra.seb.infrastructure.container;

import java.util.Optional;

/**
 * Raised when bytes are not a well-formed SEB container: the outer stream is not gzip, the input is truncated,
 * or the inner tag is neither {@code plnd} nor {@code pwcc}.
 *
 * @since 0.1.0
 */
public final class ContainerFormatException extends ContainerException {
  private static final long serialVersionUID = 1L;

  private final String tag;

  public ContainerFormatException(String message) {
    super(message);
    this.tag = null;
  }

  public ContainerFormatException(String message, Throwable cause) {
    super(message, cause);
    this.tag = null;
  }

  /**
   * Reports an unrecognized tag.
   *
   * @param tag the four characters found where the tag belongs
   * @return exception naming the tag
   */
  public static ContainerFormatException unrecognizedTag(String tag) {
    return new ContainerFormatException("Unrecognized SEB container tag: '" + tag + "'", tag);
  }

  private ContainerFormatException(String message, String tag) {
    super(message);
    this.tag = tag;
  }

  /**
   * Tag found in the container, when the failure was an unrecognized tag.
   *
   * @return found tag
   */
  public Optional<String> tag() {
    return Optional.ofNullable(tag);
  }
}
