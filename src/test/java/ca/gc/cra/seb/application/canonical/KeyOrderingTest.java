package ca.gc.cra.seb.application.canonical;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class KeyOrderingTest {

  @Test
  void ordersIgnoringCase() {
    List<String> keys = new ArrayList<>(List.of("zoomMode", "Browser", "allowQuit", "URLFilterEnable"));
    keys.sort(KeyOrdering.instance());
    assertEquals(List.of("allowQuit", "Browser", "URLFilterEnable", "zoomMode"), keys);
  }

  @Test
  void caseVariantsCompareEqualAndKeepInsertionOrder() {
    assertEquals(0, KeyOrdering.instance().compare("Key", "kEY"));
    List<String> keys = new ArrayList<>(List.of("b", "KEY", "key"));
    keys.sort(KeyOrdering.instance());
    assertEquals(List.of("b", "KEY", "key"), keys);
  }

  @Test
  void prefixesSortFirst() {
    assertTrue(KeyOrdering.instance().compare("allow", "allowQuit") < 0);
  }

  @Test
  void spaceAndHyphenSortBeforeLetters() {
    assertTrue(KeyOrdering.instance().compare("a-c", "ab") < 0);
    assertTrue(KeyOrdering.instance().compare("a c", "ab") < 0);
    assertTrue(KeyOrdering.instance().compare("ab", "a-c") > 0);

    List<String> keys = new ArrayList<>(List.of("ab", "a-c", "a c", "aa"));
    keys.sort(KeyOrdering.instance());
    assertEquals(List.of("a c", "a-c", "aa", "ab"), keys);
  }
}
