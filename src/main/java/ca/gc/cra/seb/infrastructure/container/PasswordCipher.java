package ca.gc.cra.seb.infrastructure.container;

import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import javax.crypto.BadPaddingException;
import javax.crypto.Cipher;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;

/**
 * <strong>What:</strong> Password-based AES-256-CBC for {@code pwcc} containers.
 * <p><strong>Role:</strong> Infrastructure helper composing JCA primitives; no cryptography is implemented here.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use; ciphers are created per call.</p>
 * <p><strong>Performance:</strong> Dominated by the {@value #ITERATIONS} PBKDF2 iterations per call.</p>
 *
 * @implNote The password is fed to PBKDF2 as UTF-8 bytes, matching other SEB tooling.
 * @since 0.1.0
 */
final class PasswordCipher {
  static final int SALT_LENGTH = 16;
  static final int IV_LENGTH = 16;
  static final int ITERATIONS = 10_000;
  static final int KEY_BITS = 256;
  private static final int BLOCK_SIZE = 16;
  private static final String KDF = "PBKDF2WithHmacSHA256";
  private static final String TRANSFORMATION = "AES/CBC/PKCS5Padding";

  private final SecureRandom random;

  PasswordCipher() {
    this(new SecureRandom());
  }

  PasswordCipher(SecureRandom random) {
    this.random = random;
  }

  /**
   * Encrypts {@code plaintext} under a fresh salt and IV.
   *
   * @return {@code salt || iv || ciphertext}
   */
  byte[] encrypt(byte[] plaintext, String password) {
    byte[] salt = new byte[SALT_LENGTH];
    byte[] iv = new byte[IV_LENGTH];
    random.nextBytes(salt);
    random.nextBytes(iv);
    try {
      Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(Cipher.ENCRYPT_MODE, deriveKey(password, salt), new IvParameterSpec(iv));
      byte[] ciphertext = cipher.doFinal(plaintext);
      byte[] out = new byte[SALT_LENGTH + IV_LENGTH + ciphertext.length];
      System.arraycopy(salt, 0, out, 0, SALT_LENGTH);
      System.arraycopy(iv, 0, out, SALT_LENGTH, IV_LENGTH);
      System.arraycopy(ciphertext, 0, out, SALT_LENGTH + IV_LENGTH, ciphertext.length);
      return out;
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("AES-256-CBC encryption unavailable", e);
    }
  }

  /**
   * Decrypts {@code salt || iv || ciphertext}.
   *
   * @throws ContainerFormatException when the framing is truncated
   * @throws DecryptionException when the password is wrong
   */
  byte[] decrypt(byte[] framed, String password) throws ContainerException {
    if (framed.length < SALT_LENGTH + IV_LENGTH + BLOCK_SIZE) {
      throw new ContainerFormatException("Encrypted SEB payload is truncated");
    }
    int cipherLength = framed.length - SALT_LENGTH - IV_LENGTH;
    if (cipherLength % BLOCK_SIZE != 0) {
      throw new ContainerFormatException("Encrypted SEB payload is not a whole number of AES blocks");
    }
    byte[] salt = Arrays.copyOfRange(framed, 0, SALT_LENGTH);
    byte[] iv = Arrays.copyOfRange(framed, SALT_LENGTH, SALT_LENGTH + IV_LENGTH);
    Cipher cipher;
    try {
      cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(Cipher.DECRYPT_MODE, deriveKey(password, salt), new IvParameterSpec(iv));
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("AES-256-CBC decryption unavailable", e);
    }
    try {
      return cipher.doFinal(framed, SALT_LENGTH + IV_LENGTH, cipherLength);
    } catch (BadPaddingException e) {
      throw new DecryptionException("Failed to decrypt SEB file; the password may be wrong", e);
    } catch (GeneralSecurityException e) {
      throw new DecryptionException("Failed to decrypt SEB file", e);
    }
  }

  private static SecretKeySpec deriveKey(String password, byte[] salt) throws GeneralSecurityException {
    char[] chars = password.toCharArray();
    PBEKeySpec spec = new PBEKeySpec(chars, salt, ITERATIONS, KEY_BITS);
    try {
      byte[] key = SecretKeyFactory.getInstance(KDF).generateSecret(spec).getEncoded();
      return new SecretKeySpec(key, "AES");
    } finally {
      spec.clearPassword();
      Arrays.fill(chars, '\0');
    }
  }
}
