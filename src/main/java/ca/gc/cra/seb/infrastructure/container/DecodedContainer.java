package ca.gc.cra.seb.infrastructure.container;

import java.util.Objects;

/**
 * Payload recovered from a container together with the tag it was framed under.
 *
 * @param tag container tag
 * @param xml plist payload
 * @since 0.1.0
 */
public record DecodedContainer(ContainerTag tag, String xml) {
  public DecodedContainer {
    Objects.requireNonNull(tag, "tag");
    Objects.requireNonNull(xml, "xml");
  }
}
