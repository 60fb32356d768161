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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class GoVersionTest {

  @ParameterizedTest
  @ValueSource(strings = {"1.14", "1.21.0", "1.21rc1", "1.21.3", "2.0", "1.100.12"})
  void validLanguageVersions(String version) {
    assertTrue(GoVersion.isValidLanguageVersion(version));
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "1", "v1.14", "1.14beta", "01.14", "1.014", "1.14.x", "go1.14"})
  void invalidLanguageVersions(String version) {
    assertFalse(GoVersion.isValidLanguageVersion(version));
  }

  @ParameterizedTest
  @CsvSource({"v1.15beta, 1.15", "1.15.x, 1.15", "1.8-rc, 1.8", "v1.2.3.4, 1.2"})
  void fixLanguageVersion(String version, String want) {
    assertEquals(Optional.of(want), GoVersion.fixLanguageVersion(version));
  }

  @Test
  void unfixableLanguageVersion() {
    assertEquals(Optional.empty(), GoVersion.fixLanguageVersion("banana"));
    assertEquals(Optional.empty(), GoVersion.fixLanguageVersion("1.15"));
  }

  @Test
  void languageAtLeast() {
    assertTrue(GoVersion.languageAtLeast("1.21", 1, 21));
    assertTrue(GoVersion.languageAtLeast("1.21.0", 1, 21));
    assertTrue(GoVersion.languageAtLeast("1.22rc1", 1, 21));
    assertTrue(GoVersion.languageAtLeast("2.0", 1, 21));
    assertFalse(GoVersion.languageAtLeast("1.21rc2", 1, 21));
    assertFalse(GoVersion.languageAtLeast("1.20.14", 1, 21));
    assertFalse(GoVersion.languageAtLeast("bogus", 1, 21));
  }

  @Test
  void toolchains() {
    assertEquals(Optional.of(GoVersion.create(1, 24, 0)), GoVersion.parseToolchain("go1.24"));
    assertEquals(Optional.of(GoVersion.create(1, 0, 0)), GoVersion.parseToolchain("go1"));
    assertEquals(Optional.empty(), GoVersion.parseToolchain("1.24"));
    assertEquals(Optional.empty(), GoVersion.parseToolchain("go1.24.0.1"));
    assertEquals(Optional.empty(), GoVersion.parseToolchain("go1.x"));

    assertEquals(0, GoVersion.compareToolchains("go1.24", "go1.24.0"));
    assertTrue(GoVersion.compareToolchains("go1.23.9", "go1.24") < 0);
    assertTrue(GoVersion.compareToolchains("go1.99.0", "go1.24") > 0);
    assertTrue(GoVersion.compareToolchains("", "go1") < 0);
    assertEquals(0, GoVersion.compareToolchains("", "junk"));
  }

  @Test
  void format() {
    assertEquals("1.21.3", GoVersion.create(1, 21, 3).toString());
  }
}
