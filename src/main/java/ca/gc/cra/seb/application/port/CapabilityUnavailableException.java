package ca.gc.cra.seb.application.port;

/**
 * Raised when a required capability handle (digest facility or client bridge) is absent in the current execution
 * environment. Fatal for the call that needed it only.
 *
 * @since 0.1.0
 */
public final class CapabilityUnavailableException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception naming the missing capability.
   *
   * @param message description of the missing capability
   */
  public CapabilityUnavailableException(String message) {
    super(message);
  }

  /**
   * Creates an exception naming the missing capability and the lookup failure.
   *
   * @param message description of the missing capability
   * @param cause provider lookup failure
   */
  public CapabilityUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
