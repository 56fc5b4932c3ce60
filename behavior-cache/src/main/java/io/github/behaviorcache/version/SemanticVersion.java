package io.github.behaviorcache.version;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A SemVer 2.0.0 version. Release segments compare numerically, a release ranks above its
 * prereleases, and build metadata is ignored for ordering.
 */
public final class SemanticVersion implements Comparable<SemanticVersion> {

  private static final Pattern SEMVER = Pattern.compile(
      "^v?(0|[1-9]\\d*)\\.(0|[1-9]\\d*)\\.(0|[1-9]\\d*)"
          + "(?:-([0-9A-Za-z-]+(?:\\.[0-9A-Za-z-]+)*))?"
          + "(?:\\+([0-9A-Za-z-]+(?:\\.[0-9A-Za-z-]+)*))?$");

  private final long major;
  private final long minor;
  private final long patch;
  private final List<String> prerelease;
  private final String text;

  private SemanticVersion(final long major, final long minor, final long patch,
                          final List<String> prerelease, final String text) {
    this.major = major;
    this.minor = minor;
    this.patch = patch;
    this.prerelease = prerelease;
    this.text = text;
  }

  /**
   * Parse a version string.
   *
   * @param version the version
   * @return the semantic version
   * @throws IllegalArgumentException if the text is not a semantic version
   */
  public static SemanticVersion parse(final String version) {
    Objects.requireNonNull(version, "version");
    final String trimmed = version.trim();
    final Matcher matcher = SEMVER.matcher(trimmed);
    if (!matcher.matches()) {
      throw new IllegalArgumentException("Not a semantic version: '" + version + "'");
    }
    final List<String> pre = matcher.group(4) == null
        ? List.of()
        : List.of(matcher.group(4).split("\\."));
    return new SemanticVersion(
        Long.parseLong(matcher.group(1)),
        Long.parseLong(matcher.group(2)),
        Long.parseLong(matcher.group(3)),
        pre,
        trimmed);
  }

  /**
   * Whether the text parses as a semantic version.
   *
   * @param version the version
   * @return true if valid
   */
  public static boolean isValid(final String version) {
    return version != null && SEMVER.matcher(version.trim()).matches();
  }

  /**
   * Sort version strings ascending by semantic order.
   *
   * @param versions the versions
   * @return a new sorted list
   */
  public static List<String> sort(final Iterable<String> versions) {
    final List<SemanticVersion> parsed = new ArrayList<>();
    versions.forEach(v -> parsed.add(parse(v)));
    Collections.sort(parsed);
    final List<String> result = new ArrayList<>(parsed.size());
    parsed.forEach(v -> result.add(v.toString()));
    return result;
  }

  public long major() {
    return major;
  }

  public long minor() {
    return minor;
  }

  public long patch() {
    return patch;
  }

  public boolean isPrerelease() {
    return !prerelease.isEmpty();
  }

  /**
   * Whether this version lies in [min, max).
   *
   * @param min inclusive lower bound
   * @param max exclusive upper bound
   * @return true if inside
   */
  public boolean isWithin(final SemanticVersion min, final SemanticVersion max) {
    return compareTo(min) >= 0 && compareTo(max) < 0;
  }

  @Override
  public int compareTo(final SemanticVersion other) {
    int cmp = Long.compare(major, other.major);
    if (cmp != 0) {
      return cmp;
    }
    cmp = Long.compare(minor, other.minor);
    if (cmp != 0) {
      return cmp;
    }
    cmp = Long.compare(patch, other.patch);
    if (cmp != 0) {
      return cmp;
    }
    if (prerelease.isEmpty() || other.prerelease.isEmpty()) {
      return Boolean.compare(prerelease.isEmpty(), other.prerelease.isEmpty());
    }
    final int n = Math.min(prerelease.size(), other.prerelease.size());
    for (int i = 0; i < n; i++) {
      cmp = comparePrereleaseToken(prerelease.get(i), other.prerelease.get(i));
      if (cmp != 0) {
        return cmp;
      }
    }
    return Integer.compare(prerelease.size(), other.prerelease.size());
  }

  private static int comparePrereleaseToken(final String a, final String b) {
    final boolean aNum = a.chars().allMatch(Character::isDigit);
    final boolean bNum = b.chars().allMatch(Character::isDigit);
    if (aNum && bNum) {
      return new BigInteger(a).compareTo(new BigInteger(b));
    }
    // numeric identifiers have lower precedence
    if (aNum) {
      return -1;
    }
    if (bNum) {
      return 1;
    }
    return a.compareTo(b);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SemanticVersion)) {
      return false;
    }
    return compareTo((SemanticVersion) o) == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hash(major, minor, patch, prerelease);
  }

  @Override
  public String toString() {
    return text;
  }
}
