package ca.gc.cra.seb.application.export;

import java.util.Arrays;
import java.util.Objects;

/**
 * Output of an export: the container bytes and the plist they wrap.
 *
 * @param data container bytes, ready to be written as a {@code .seb} file
 * @param xml plist payload
 * @param size container size in bytes
 * @since 0.1.0
 */
public record ExportResult(byte[] data, String xml, int size) {
  public ExportResult {
    data = Objects.requireNonNull(data, "data").clone();
    Objects.requireNonNull(xml, "xml");
  }

  @Override
  public byte[] data() {
    return data.clone();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof ExportResult other
        && size == other.size
        && xml.equals(other.xml)
        && Arrays.equals(data, other.data);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(data) + xml.hashCode();
  }

  @Override
  public String toString() {
    return "ExportResult[size=" + size + ", xmlChars=" + xml.length() + "]";
  }
}
