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

import java.util.Optional;

/** Module path helpers: major version suffixes and local directory replacements. */
public final class ModulePaths {

  private static final String GOPKG_IN = "gopkg.in/";
  private static final String UNSTABLE = "-unstable";
  private static final String INCOMPATIBLE = "+incompatible";

  /**
   * Returns the major version suffix of a module path: {@code /v2} for {@code example.com/m/v2},
   * {@code .v1} for {@code gopkg.in/yaml.v1}, or "" for a path without one. Returns empty if the
   * path has a malformed suffix such as {@code /v1} or {@code /v2.1}.
   */
  public static Optional<String> pathMajor(String path) {
    if (path.startsWith(GOPKG_IN)) {
      return gopkgInMajor(path);
    }
    int i = path.length();
    boolean dot = false;
    while (i > 0 && (isDigit(path.charAt(i - 1)) || path.charAt(i - 1) == '.')) {
      if (path.charAt(i - 1) == '.') {
        dot = true;
      }
      i--;
    }
    if (i <= 1 || i == path.length() || path.charAt(i - 1) != 'v' || path.charAt(i - 2) != '/') {
      return Optional.of("");
    }
    String major = path.substring(i - 2);
    if (dot || major.length() <= 2 || major.charAt(2) == '0' || major.equals("/v1")) {
      return Optional.empty();
    }
    return Optional.of(major);
  }

  private static Optional<String> gopkgInMajor(String path) {
    int i = path.length();
    if (path.endsWith(UNSTABLE)) {
      i -= UNSTABLE.length();
    }
    while (i > 0 && isDigit(path.charAt(i - 1))) {
      i--;
    }
    // every gopkg.in path ends in .vN
    if (i <= 1 || path.charAt(i - 1) != 'v' || path.charAt(i - 2) != '.') {
      return Optional.empty();
    }
    String major = path.substring(i - 2);
    if (major.length() <= 2 || (major.charAt(2) == '0' && !major.equals(".v0"))) {
      return Optional.empty();
    }
    return Optional.of(major);
  }

  /**
   * Checks that a canonical version agrees with the major version suffix of its module path.
   *
   * @throws InvalidVersionException if they disagree
   */
  public static void checkPathMajor(String version, String pathMajor)
      throws InvalidVersionException {
    if (pathMajor.startsWith(".v") && pathMajor.endsWith(UNSTABLE)) {
      pathMajor = pathMajor.substring(0, pathMajor.length() - UNSTABLE.length());
    }
    if (version.startsWith("v0.0.0-") && pathMajor.equals(".v1")) {
      // old pseudo-versions of gopkg.in .v1 paths
      return;
    }
    String major = Semver.major(version);
    String want;
    if (pathMajor.isEmpty()) {
      if (major.equals("v0") || major.equals("v1") || Semver.build(version).equals(INCOMPATIBLE)) {
        return;
      }
      want = "v0 or v1";
    } else {
      want = pathMajor.substring(1);
      if (major.equals(want)) {
        return;
      }
    }
    throw new InvalidVersionException(version, "should be " + want + ", not " + major);
  }

  /**
   * Returns the canonical form of a module version, or "" if it is not a valid semantic version.
   * Unlike {@link Semver#canonical}, an {@code +incompatible} build suffix is kept.
   */
  public static String canonicalVersion(String version) {
    String canonical = Semver.canonical(version);
    if (Semver.build(version).equals(INCOMPATIBLE)) {
      canonical += INCOMPATIBLE;
    }
    return canonical;
  }

  /**
   * Returns true if the replacement path names a local directory. Both Unix and Windows forms are
   * recognized.
   */
  public static boolean isDirectoryPath(String path) {
    return path.equals(".")
        || path.startsWith("./")
        || path.startsWith(".\\")
        || path.equals("..")
        || path.startsWith("../")
        || path.startsWith("..\\")
        || path.startsWith("/")
        || path.startsWith("\\")
        || (path.length() >= 2 && isLetter(path.charAt(0)) && path.charAt(1) == ':');
  }

  private static boolean isDigit(char c) {
    return '0' <= c && c <= '9';
  }

  private static boolean isLetter(char c) {
    return ('A' <= c && c <= 'Z') || ('a' <= c && c <= 'z');
  }

  private ModulePaths() {}
}
