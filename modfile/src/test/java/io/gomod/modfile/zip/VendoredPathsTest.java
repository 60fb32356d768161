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

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.google.common.collect.ImmutableList;
import java.util.stream.Stream;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

class VendoredPathsTest {

  private static final ImmutableList<String> PRE_1_24 =
      ImmutableList.of(
          "", "go1.14", "go1.21.0", "go1.22.4", "go1.23", "go1.23.1", "go1.2", "go1.7", "go1.9");

  private static final ImmutableList<String> FROM_1_24 =
      ImmutableList.of("go1.24.0", "go1.24", "go1.99.0");

  static Stream<Arguments> isVendoredPackage() {
    Stream.Builder<Arguments> cases = Stream.builder();
    add(cases, "vendor/foo/foo.go", true, PRE_1_24);
    add(cases, "pkg/vendor/foo/foo.go", true, PRE_1_24);
    add(cases, "longpackagename/vendor/foo/foo.go", true, PRE_1_24);
    add(cases, "vendor/vendor.go", false, PRE_1_24);
    add(cases, "vendor/foo/modules.txt", true, PRE_1_24);
    add(cases, "modules.txt", false, PRE_1_24);
    add(cases, "vendor/amodules.txt", false, PRE_1_24);
    add(cases, "vendor/modules.txt", false, PRE_1_24);
    add(cases, "vendor/modules.txt", true, FROM_1_24);
    // the nested vendor offset is kept as is, so these are vendored too
    add(cases, "pkg/vendor/vendor.go", true, PRE_1_24);
    add(cases, "longpackagename/vendor/vendor.go", true, FROM_1_24);
    add(cases, "src/main.go", false, FROM_1_24);
    return cases.build();
  }

  private static void add(
      Stream.Builder<Arguments> cases, String path, boolean want, ImmutableList<String> versions) {
    for (String version : versions) {
      cases.add(Arguments.of(path, version, want));
    }
  }

  @ParameterizedTest(name = "{0} {1}")
  @MethodSource
  void isVendoredPackage(String path, String goVersion, boolean want) {
    assertEquals(want, VendoredPaths.isVendoredPackage(path, goVersion));
  }
}
