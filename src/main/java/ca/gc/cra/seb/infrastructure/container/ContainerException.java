package ca.gc.cra.seb.infrastructure.container;

/**
 * Base type for failures while reading or writing an SEB container. Every failure is local to one call; no
 * partial output is ever returned.
 *
 * @since 0.1.0
 */
public class ContainerException extends Exception {
  private static final long serialVersionUID = 1L;

  public ContainerException(String message) {
    super(message);
  }

  public ContainerException(String message, Throwable cause) {
    super(message, cause);
  }
}
