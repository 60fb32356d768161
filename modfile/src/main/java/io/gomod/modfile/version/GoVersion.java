/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.gomod.modfile.version;

import com.google.auto.value.AutoValue;
import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ComparisonChain;
import com.google.errorprone.annotations.Immutable;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Go toolchain and language versions.
 *
 * <p>Toolchain versions are written {@code goN}, {@code goN.N} or {@code goN.N.N}; missing
 * components are zero. The empty string and anything unparsable sort below every real version.
 *
 * <p>Language versions, as written in a {@code go} directive, are {@code 1.N}, {@code 1.N.N}, with
 * an optional prerelease suffix such as {@code rc1}.
 */
@AutoValue
@Immutable
public abstract class GoVersion implements Comparable<GoVersion> {

  private static final Pattern LANGUAGE_VERSION =
      Pattern.compile("^([1-9][0-9]*)\\.(0|[1-9][0-9]*)(\\.(0|[1-9][0-9]*))?([a-z]+[0-9]+)?$");

  private static final Pattern LAX_LANGUAGE_VERSION =
      Pattern.compile("^v?(([1-9][0-9]*)\\.(0|[1-9][0-9]*))([^0-9].*)$");

  private static final CharMatcher DIGITS = CharMatcher.inRange('0', '9');

  public static GoVersion create(int major, int minor, int patch) {
    return new AutoValue_GoVersion(major, minor, patch);
  }

  public abstract int major();

  public abstract int minor();

  public abstract int patch();

  /** Parses a toolchain version such as {@code go1.21.3}. */
  public static Optional<GoVersion> parseToolchain(String version) {
    if (!version.startsWith("go")) {
      return Optional.empty();
    }
    List<String> parts = Splitter.on('.').splitToList(version.substring("go".length()));
    if (parts.size() > 3) {
      return Optional.empty();
    }
    int[] components = new int[3];
    for (int i = 0; i < parts.size(); i++) {
      String part = parts.get(i);
      if (part.isEmpty() || part.length() > 9 || !DIGITS.matchesAllOf(part)) {
        return Optional.empty();
      }
      components[i] = Integer.parseInt(part);
    }
    return Optional.of(create(components[0], components[1], components[2]));
  }

  /** Compares two toolchain versions; unparsable versions sort below every real version. */
  public static int compareToolchains(String x, String y) {
    Optional<GoVersion> vx = parseToolchain(x);
    Optional<GoVersion> vy = parseToolchain(y);
    if (vx.isPresent() && vy.isPresent()) {
      return vx.get().compareTo(vy.get());
    }
    return Boolean.compare(vx.isPresent(), vy.isPresent());
  }

  /** Returns true if {@code version} is a well-formed {@code go} directive argument. */
  public static boolean isValidLanguageVersion(String version) {
    return LANGUAGE_VERSION.matcher(version).matches();
  }

  /**
   * Reduces a loosely written language version such as {@code v1.15beta} or {@code 1.15.x} to
   * {@code 1.15}.
   */
  public static Optional<String> fixLanguageVersion(String version) {
    Matcher m = LAX_LANGUAGE_VERSION.matcher(version);
    return m.matches() ? Optional.of(m.group(1)) : Optional.empty();
  }

  /**
   * Returns true if the language version is at least {@code major.minor}. A prerelease of exactly
   * that release, e.g. {@code 1.21rc1}, is below it.
   */
  public static boolean languageAtLeast(String version, int major, int minor) {
    Matcher m = LANGUAGE_VERSION.matcher(version);
    if (!m.matches() || m.group(1).length() > 9 || m.group(2).length() > 9) {
      return false;
    }
    GoVersion parsed = create(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), 0);
    int c = parsed.compareTo(create(major, minor, 0));
    if (c != 0) {
      return c > 0;
    }
    return m.group(3) != null || m.group(5) == null;
  }

  @Override
  public int compareTo(GoVersion other) {
    return ComparisonChain.start()
        .compare(major(), other.major())
        .compare(minor(), other.minor())
        .compare(patch(), other.patch())
        .result();
  }

  @Override
  public final String toString() {
    return major() + "." + minor() + "." + patch();
  }
}
