package ca.gc.cra.seb.infrastructure.container;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.seb.testutil.RecordingMetrics;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ContainerCodecTest {
  private static final String XML = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n<plist version=\"1.0\">\n"
      + "<dict>\n\t<key>startURL</key>\n\t<string>https://exam.example.com/é</string>\n</dict>\n</plist>";

  private final RecordingMetrics metrics = new RecordingMetrics();
  private final ContainerCodec codec = new ContainerCodec(metrics);

  @Test
  void plainContainerIsGzipOfTagAndGzippedXml() throws Exception {
    byte[] encoded = codec.encodePlain(XML);

    byte[] framed = Gzip.decompress(encoded);
    assertArrayEquals("plnd".getBytes(StandardCharsets.US_ASCII), Arrays.copyOf(framed, 4));
    byte[] xml = Gzip.decompress(Arrays.copyOfRange(framed, 4, framed.length));
    assertEquals(XML, new String(xml, StandardCharsets.UTF_8));

    assertEquals(XML, codec.decode(encoded));
    assertEquals(ContainerTag.PLAIN, codec.inspect(encoded));
    assertEquals(1, metrics.count("container.encode.plain"));
    assertEquals(List.of((long) encoded.length), metrics.observed("container.encode.bytes"));
  }

  @Test
  void plainContainerIgnoresSuppliedPassword() throws Exception {
    assertEquals(XML, codec.decode(codec.encodePlain(XML), Optional.of("unused")));
  }

  @Test
  void encryptedContainerRoundTripsWithPassword() throws Exception {
    byte[] encoded = codec.encodeEncrypted(XML, "s3cret");

    byte[] framed = Gzip.decompress(encoded);
    assertArrayEquals("pwcc".getBytes(StandardCharsets.US_ASCII), Arrays.copyOf(framed, 4));
    int cipherLength = framed.length - 4 - 32;
    assertTrue(cipherLength > 0 && cipherLength % 16 == 0);

    assertEquals(ContainerTag.PASSWORD, codec.inspect(encoded));
    assertEquals(XML, codec.decode(encoded, Optional.of("s3cret")));
    assertEquals(1, metrics.count("container.encode.encrypted"));
    assertEquals(1, metrics.count("container.decode.success"));
  }

  @Test
  void openReturnsTagAlongsidePayload() throws Exception {
    DecodedContainer plain = codec.open(codec.encodePlain(XML), Optional.empty());
    assertEquals(ContainerTag.PLAIN, plain.tag());
    assertEquals(XML, plain.xml());

    DecodedContainer encrypted = codec.open(codec.encodeEncrypted(XML, "pw"), Optional.of("pw"));
    assertEquals(ContainerTag.PASSWORD, encrypted.tag());
    assertEquals(XML, encrypted.xml());
    assertEquals(2, metrics.count("container.decode.success"));
  }

  @Test
  void encryptionUsesFreshSaltAndIv() throws Exception {
    byte[] first = Gzip.decompress(codec.encodeEncrypted(XML, "pw"));
    byte[] second = Gzip.decompress(codec.encodeEncrypted(XML, "pw"));
    assertTrue(!Arrays.equals(Arrays.copyOfRange(first, 4, 36), Arrays.copyOfRange(second, 4, 36)));
  }

  @Test
  void encryptedContainerWithoutPasswordRequiresOne() {
    byte[] encoded = codec.encodeEncrypted(XML, "s3cret");

    assertThrows(PasswordRequiredException.class, () -> codec.decode(encoded));
    assertThrows(PasswordRequiredException.class, () -> codec.decode(encoded, Optional.of("")));
    assertEquals(2, metrics.count("container.decode.failure"));
  }

  @Test
  void wrongPasswordFailsDecryption() {
    byte[] encoded = codec.encodeEncrypted(XML, "s3cret");

    DecryptionException ex =
        assertThrows(DecryptionException.class, () -> codec.decode(encoded, Optional.of("wrong")));
    assertTrue(ex.getMessage().contains("password"));
  }

  @Test
  void unknownTagIsReportedVerbatim() {
    byte[] data = Gzip.compress("pswdpayload".getBytes(StandardCharsets.US_ASCII));

    ContainerFormatException ex = assertThrows(ContainerFormatException.class, () -> codec.decode(data));
    assertEquals(Optional.of("pswd"), ex.tag());
    assertTrue(ex.getMessage().contains("'pswd'"));
  }

  @Test
  void nonGzipInputIsAFormatError() {
    byte[] garbage = "definitely not gzip".getBytes(StandardCharsets.US_ASCII);
    ContainerFormatException ex = assertThrows(ContainerFormatException.class, () -> codec.decode(garbage));
    assertTrue(ex.tag().isEmpty());
    assertTrue(ex.getCause() instanceof IOException);
  }

  @Test
  void truncatedFramesAreFormatErrors() {
    assertThrows(ContainerFormatException.class, () -> codec.decode(Gzip.compress(new byte[] {'p', 'l'})));

    byte[] shortCipher = new byte[4 + 40];
    System.arraycopy("pwcc".getBytes(StandardCharsets.US_ASCII), 0, shortCipher, 0, 4);
    assertThrows(ContainerFormatException.class,
        () -> codec.decode(Gzip.compress(shortCipher), Optional.of("pw")));
  }

  @Test
  void emptyPasswordIsRejectedOnEncode() {
    assertThrows(IllegalArgumentException.class, () -> codec.encodeEncrypted(XML, ""));
  }
}
