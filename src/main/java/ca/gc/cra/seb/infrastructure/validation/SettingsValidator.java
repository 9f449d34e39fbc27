package ca.gc.cra.seb.infrastructure.validation;

import ca.gc.cra.seb.application.port.ConfigValidationException;
import ca.gc.cra.seb.application.port.ConfigurationValidator;
import ca.gc.cra.seb.domain.config.ConfigurationDocument;
import ca.gc.cra.seb.domain.value.ConfigValue;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * <strong>What:</strong> Checks SEB settings against a table of well-known option names.
 * <p><strong>Why:</strong> A mistyped value (a string where SEB expects an integer, an out-of-range policy) yields a
 * file SEB silently misreads, and a Config Key that never matches.</p>
 * <p><strong>Role:</strong> Infrastructure implementation of {@link ConfigurationValidator}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Check value kinds and integer ranges of known root options.</li>
 *   <li>Check the dictionaries inside {@code urlFilterRules}, {@code additionalResources},
 *   {@code prohibitedProcesses} and {@code permittedProcesses}.</li>
 *   <li>Collect every violation before failing.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent use.</p>
 *
 * @implNote Unknown keys pass unchecked and no defaults are ever added: the validated document is returned as is.
 * @since 0.1.0
 */
public final class SettingsValidator implements ConfigurationValidator {
  private static final Map<String, Rule> ROOT_RULES = buildRootRules();

  @Override
  public ConfigurationDocument validate(ConfigurationDocument document) {
    List<String> violations = new ArrayList<>();
    checkFields(document.root(), ROOT_RULES, Set.of(), "", violations);
    if (!violations.isEmpty()) {
      throw new ConfigValidationException(violations);
    }
    return document;
  }

  private static void checkFields(
      ConfigValue.MapValue map, Map<String, Rule> rules, Set<String> required, String prefix, List<String> out) {
    for (String key : required) {
      if (map.get(key) == null) {
        out.add(prefix + key + ": required");
      }
    }
    for (Map.Entry<String, ConfigValue> entry : map.entries().entrySet()) {
      Rule rule = rules.get(entry.getKey());
      if (rule != null) {
        rule.check(prefix + entry.getKey(), entry.getValue(), out);
      }
    }
  }

  /** Check applied to one option value. */
  @FunctionalInterface
  interface Rule {
    void check(String path, ConfigValue value, List<String> violations);
  }

  static Rule bool() {
    return (path, value, out) -> {
      if (!(value instanceof ConfigValue.Bool)) {
        out.add(path + ": expected boolean but was " + value.kind());
      }
    };
  }

  static Rule string() {
    return (path, value, out) -> {
      if (!(value instanceof ConfigValue.Str)) {
        out.add(path + ": expected string but was " + value.kind());
      }
    };
  }

  static Rule data() {
    return (path, value, out) -> {
      if (!(value instanceof ConfigValue.Bytes)) {
        out.add(path + ": expected data but was " + value.kind());
      }
    };
  }

  static Rule integer() {
    return integer(Long.MIN_VALUE, Long.MAX_VALUE);
  }

  static Rule integer(long min, long max) {
    return (path, value, out) -> {
      Long number = integralValue(value);
      if (number == null) {
        out.add(path + ": expected integer but was " + value.kind());
      } else if (number < min || number > max) {
        out.add(path + ": " + number + " is outside " + describeRange(min, max));
      }
    };
  }

  static Rule url() {
    return (path, value, out) -> {
      if (!(value instanceof ConfigValue.Str str)) {
        out.add(path + ": expected URL string but was " + value.kind());
      } else if (!isAbsoluteUrl(str.value())) {
        out.add(path + ": not an absolute URL: " + str.value());
      }
    };
  }

  static Rule httpUrl() {
    return (path, value, out) -> {
      if (!(value instanceof ConfigValue.Str str)) {
        out.add(path + ": expected URL string but was " + value.kind());
        return;
      }
      String scheme = schemeOf(str.value());
      if (!isAbsoluteUrl(str.value()) || !("http".equals(scheme) || "https".equals(scheme))) {
        out.add(path + ": expected http(s) URL but was " + str.value());
      }
    };
  }

  static Rule arrayOf(Rule item) {
    return (path, value, out) -> {
      if (!(value instanceof ConfigValue.ListValue list)) {
        out.add(path + ": expected array but was " + value.kind());
        return;
      }
      for (int i = 0; i < list.items().size(); i++) {
        item.check(path + "[" + i + "]", list.items().get(i), out);
      }
    };
  }

  static Rule dict(Map<String, Rule> fields, Set<String> required) {
    return (path, value, out) -> {
      if (!(value instanceof ConfigValue.MapValue map)) {
        out.add(path + ": expected dictionary but was " + value.kind());
        return;
      }
      checkFields(map, fields, required, path + ".", out);
    };
  }

  private static Long integralValue(ConfigValue value) {
    if (value instanceof ConfigValue.Int integer) {
      return integer.value();
    }
    if (value instanceof ConfigValue.Real real) {
      double d = real.value();
      if (Double.isFinite(d) && d == Math.rint(d) && Math.abs(d) < 0x1p63) {
        return (long) d;
      }
    }
    return null;
  }

  private static String describeRange(long min, long max) {
    if (max == Long.MAX_VALUE) {
      return "[" + min + ", ...)";
    }
    return "[" + min + ", " + max + "]";
  }

  private static boolean isAbsoluteUrl(String text) {
    try {
      URI uri = new URI(text);
      return uri.isAbsolute() && (uri.getHost() != null || "file".equals(schemeOf(text)));
    } catch (URISyntaxException e) {
      return false;
    }
  }

  private static String schemeOf(String text) {
    int colon = text.indexOf(':');
    return colon <= 0 ? "" : text.substring(0, colon).toLowerCase(Locale.ROOT);
  }

  private static Map<String, Rule> buildRootRules() {
    Map<String, Rule> rules = new LinkedHashMap<>();
    rules.put("startURL", httpUrl());
    for (String key : List.of(
        "quitURL", "restartExamURL", "restartExamText", "hashedQuitPassword", "hashedAdminPassword",
        "downloadDirectoryOSX", "downloadDirectoryWin", "logDirectoryOSX", "logDirectoryWin",
        ConfigurationDocument.ORIGINATOR_VERSION_KEY, "browserMessagingSocket", "browserUserAgent")) {
      rules.put(key, string());
    }
    for (String key : List.of(
        "allowQuit", "ignoreExitKeys", "restartExamPasswordProtected", "restartExamUseStartURL",
        "quitURLConfirm", "quitURLRestart", "browserScreenKeyboard", "touchOptimized", "enableTouchExit",
        "allowPreferencesWindow", "showTaskBar", "browserWindowAllowReload", "browserWindowShowReloadWarning",
        "newBrowserWindowAllowReload", "newBrowserWindowNavigation", "newBrowserWindowShowReloadWarning",
        "allowBrowsingBackForward", "enableBrowserWindowToolbar", "hideBrowserWindowToolbar", "showMenuBar",
        "showReloadButton", "showReloadWarning", "browserWindowAllowAddressBar", "allowFind",
        "enableURLFilter", "enableURLContentFilter", "urlFilterEnableContentFilter", "blockPopUpWindows",
        "allowAudioCapture", "allowVideoCapture", "audioControlEnabled", "audioMute", "audioSetVolumeLevel",
        "allowSpellCheck", "allowDictionaryLookup", "allowPDFPlugIn", "allowFlashFullscreen",
        "allowScreenSharing", "allowDisplayMirroring", "allowSiri", "allowDictation", "allowAirPlay",
        "allowSwitchToApplications", "allowUserSwitching", "allowVirtualMachine", "allowDownUploads",
        "openDownloads", "downloadAndOpenSebConfig", "downloadPDFFiles", "allowPDFReaderToolbar", "allowWlan",
        "sendBrowserExamKey", "browserExamKeySalt", "browserURLSalt", "allowApplicationLog", "enableLogging",
        "allowedDisplayBuiltin", "createNewDesktop", "killExplorerShell", "enablePrivateClipboard",
        "enableZoomPage", "enableZoomText", "monitorProcesses", "browserMessagingSocketEnabled",
        "enableSebBrowser", "showTime", "examSessionClearCookiesOnEnd", "examSessionClearCookiesOnStart",
        "detectStoppedProcess", "enableAppSwitcherCheck", "forceAppFolderInstall", "pinEmbeddedCertificates",
        "removeBrowserProfile", "removeLocalStorage")) {
      rules.put(key, bool());
    }
    rules.put("browserViewMode", integer(0, 1));
    rules.put("newBrowserWindowByLinkPolicy", integer(0, 3));
    rules.put("newBrowserWindowByScriptPolicy", integer(0, 3));
    rules.put("browserWindowWebView", integer(0, 4));
    rules.put("audioVolumeLevel", integer(0, 100));
    rules.put("allowedDisplaysMaxNumber", integer(1, Long.MAX_VALUE));
    rules.put("zoomMode", integer(0, 2));
    rules.put("proxySettingsPolicy", integer(0, 1));
    rules.put("sebConfigPurpose", integer(0, 1));
    rules.put("sebMode", integer(0, 2));
    rules.put("sebServicePolicy", integer(0, 2));
    rules.put("browserUserAgentMac", integer());
    rules.put("browserUserAgentWin", integer());
    rules.put("examKeySalt", data());
    rules.put("configKeySalt", data());
    rules.put("urlFilterRules", arrayOf(urlFilterRule()));
    rules.put("additionalResources", arrayOf(additionalResource()));
    rules.put("prohibitedProcesses", arrayOf(dict(processFields(), Set.of("executable"))));
    rules.put("permittedProcesses", arrayOf(dict(permittedProcessFields(), Set.of("executable"))));
    return Map.copyOf(rules);
  }

  private static Rule urlFilterRule() {
    Map<String, Rule> fields = new LinkedHashMap<>();
    fields.put("active", bool());
    fields.put("regex", bool());
    fields.put("expression", string());
    fields.put("action", integer(0, 2));
    return dict(fields, Set.of("expression"));
  }

  private static Rule additionalResource() {
    Map<String, Rule> fields = new LinkedHashMap<>();
    for (String key : List.of("active", "autoOpen", "confirm", "iconInTaskbar")) {
      fields.put(key, bool());
    }
    fields.put("URL", url());
    for (String key : List.of("title", "linkURL", "refererFilter", "resourceDataFilename", "resourceDataLauncher")) {
      fields.put(key, string());
    }
    return dict(fields, Set.of("URL", "title"));
  }

  private static Map<String, Rule> processFields() {
    Map<String, Rule> fields = new LinkedHashMap<>();
    for (String key : List.of("active", "currentUser", "strongKill")) {
      fields.put(key, bool());
    }
    for (String key : List.of(
        "executable", "identifier", "originalName", "description", "user", "windowHandlingProcess")) {
      fields.put(key, string());
    }
    fields.put("os", integer(0, 2));
    return fields;
  }

  private static Map<String, Rule> permittedProcessFields() {
    Map<String, Rule> fields = processFields();
    for (String key : List.of("allowUser", "autostart", "iconInTaskbar", "runInBackground")) {
      fields.put(key, bool());
    }
    fields.put("arguments", arrayOf(string()));
    return fields;
  }
}
