package ca.gc.cra.seb.application.canonical;

import com.ibm.icu.text.Collator;
import com.ibm.icu.util.ULocale;
import java.util.Comparator;
import java.util.Locale;

/**
 * <strong>What:</strong> Case-insensitive, locale-aware ordering of configuration keys.
 * <p><strong>Why:</strong> The canonical form and the plist rendering must list keys in the same order so a
 * plist can be diffed against the data that was hashed.</p>
 * <p><strong>Role:</strong> Shared comparator for {@link CanonicalSerializer} and the plist renderer.</p>
 * <p><strong>Thread-safety:</strong> The collator is frozen after configuration, so comparisons may run
 * concurrently.</p>
 *
 * @implNote Keys are lower-cased with {@link Locale#ROOT} and compared by the ICU English collator at primary
 * strength. Spaces and punctuation keep their primary weights, which sort below letters and digits.
 * Keys equal under that comparison keep their original relative order because callers sort stably.
 * @since 0.1.0
 */
public final class KeyOrdering implements Comparator<String> {
  private static final KeyOrdering INSTANCE = new KeyOrdering();

  private final Collator collator;

  private KeyOrdering() {
    Collator english = Collator.getInstance(ULocale.ENGLISH);
    english.setStrength(Collator.PRIMARY);
    this.collator = english.freeze();
  }

  /**
   * Returns the shared ordering.
   *
   * @return comparator instance
   */
  public static KeyOrdering instance() {
    return INSTANCE;
  }

  @Override
  public int compare(String left, String right) {
    return collator.compare(left.toLowerCase(Locale.ROOT), right.toLowerCase(Locale.ROOT));
  }
}
