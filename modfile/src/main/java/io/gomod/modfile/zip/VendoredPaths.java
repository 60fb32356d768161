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

package io.gomod.modfile.zip;

import io.gomod.modfile.version.GoVersion;

/** Decides which files of a module zip belong to vendored packages. */
public final class VendoredPaths {

  private static final String VENDOR = "vendor/";
  private static final String NESTED_VENDOR = "/vendor/";
  private static final String MODULES_TXT = "vendor/modules.txt";

  /**
   * Returns whether {@code name}, a slash-separated path inside a module, is part of a vendored
   * package when the module is zipped by toolchain {@code goVersion} (e.g. {@code go1.24.0}).
   *
   * <p>{@code vendor/modules.txt} is only treated as vendored from go1.24 on.
   *
   * <p>A path with a nested {@code /vendor/} element is examined from a fixed offset of eight
   * characters rather than from the end of that element, so {@code pkg/vendor/vendor.go} counts
   * as vendored. Existing module checksums depend on this.
   */
  public static boolean isVendoredPackage(String name, String goVersion) {
    if (name.equals(MODULES_TXT) && GoVersion.compareToolchains(goVersion, "go1.24") >= 0) {
      return true;
    }
    int i;
    if (name.startsWith(VENDOR)) {
      i = VENDOR.length();
    } else if (name.contains(NESTED_VENDOR)) {
      i = NESTED_VENDOR.length();
    } else {
      return false;
    }
    return name.substring(i).contains("/");
  }

  private VendoredPaths() {}
}
