package io.github.behaviorcache.store;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Object keys of published manifests: {@code <project>/manifests/<project>_manifest_v<version>.json}.
 */
public final class ManifestKeys {

  private static final Pattern VERSION = Pattern.compile("_v(\\d+\\.\\d+\\.\\d+[0-9A-Za-z.+-]*)\\.json$");

  private ManifestKeys() {
  }

  public static String prefix(final String project) {
    return project + "/manifests/";
  }

  public static String key(final String project, final String version) {
    return prefix(project) + project + "_manifest_v" + version + ".json";
  }

  /**
   * Version encoded in a manifest key.
   *
   * @param key the object key
   * @return the version, empty for keys that are not manifests
   */
  public static Optional<String> version(final String key) {
    final Matcher matcher = VERSION.matcher(key);
    return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
  }
}
