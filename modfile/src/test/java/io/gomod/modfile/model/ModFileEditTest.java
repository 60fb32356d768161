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

package io.gomod.modfile.model;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import io.gomod.modfile.diag.ModFileError;
import java.util.function.Consumer;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

class ModFileEditTest {

  static String text(String... lines) {
    return String.join("\n", lines) + "\n";
  }

  /** Applies an edit and compares the result with the canonical form of {@code want}. */
  static ModFile assertEdit(String in, String want, boolean strict, Consumer<ModFile> edit) {
    ModFile f = parse("in", in, strict);
    String golden = new String(parse("out", want, strict).format(), UTF_8);
    edit.accept(f);
    assertEquals(golden, new String(f.format(), UTF_8));
    return f;
  }

  private static ModFile parse(String name, String data, boolean strict) {
    return strict
        ? ModFile.parse(name, data.getBytes(UTF_8), null)
        : ModFile.parseLax(name, data.getBytes(UTF_8), null);
  }

  static Stream<Arguments> addRequire() {
    return Stream.of(
        Arguments.of(
            "existing",
            text("module m", "require x.y/z v1.2.3"),
            "x.y/z",
            "v1.5.6",
            text("module m", "require x.y/z v1.5.6")),
        Arguments.of(
            "new",
            text("module m", "require x.y/z v1.2.3"),
            "x.y/w",
            "v1.5.6",
            text("module m", "require (", "\tx.y/z v1.2.3", "\tx.y/w v1.5.6", ")")),
        Arguments.of(
            "new_joins_last_require_line",
            text("module m", "require x.y/z v1.2.3", "require x.y/q/v2 v2.3.4"),
            "x.y/w",
            "v1.5.6",
            text(
                "module m",
                "require x.y/z v1.2.3",
                "require (",
                "\tx.y/q/v2 v2.3.4",
                "\tx.y/w v1.5.6",
                ")")),
        Arguments.of(
            "later_duplicates_removed",
            text("module m", "require x.y/z v1.2.3", "require x.y/z v1.3.0"),
            "x.y/z",
            "v1.5.6",
            text("module m", "require x.y/z v1.5.6")));
  }

  @ParameterizedTest(name = "{0}")
  @MethodSource
  void addRequire(String desc, String in, String path, String version, String want) {
    ModFile f = assertEdit(in, want, true, file -> file.addRequire(path, version));
    assertEquals(
        1, f.require().stream().filter(r -> r.mod().path().equals(path)).count());
  }

  @Test
  void addRequireRejectsWrongMajorVersion() {
    ModFile f = ModFile.parse("go.mod", text("module m").getBytes(UTF_8), null);
    ModFileError e =
        assertThrows(ModFileError.class, () -> f.addRequire("x.y/z/v2", "v1.0.0"));
    assertEquals(
        "require x.y/z/v2: version \"v1.0.0\" invalid: should be v2, not v1",
        e.diagnostics().get(0).message());
    assertEquals(text("module m"), new String(f.format(), UTF_8));
  }

  static Stream<Arguments> setRequire() {
    return Stream.of(
        Arguments.of(
            "existing",
            text(
                "module m",
                "require (",
                "\tx.y/b v1.2.3",
                "",
                "\tx.y/a v1.2.3",
                "\tx.y/d v1.2.3",
                ")"),
            ImmutableList.of(
                Require.of("x.y/a", "v1.2.3", false),
                Require.of("x.y/b", "v1.2.3", false),
                Require.of("x.y/c", "v1.2.3", false)),
            text(
                "module m",
                "require (",
                "\tx.y/a v1.2.3",
                "\tx.y/b v1.2.3",
                "\tx.y/c v1.2.3",
                ")")),
        Arguments.of(
            "existing_indirect",
            text(
                "module m",
                "require (",
                "\tx.y/a v1.2.3",
                "\tx.y/b v1.2.3 //",
                "\tx.y/c v1.2.3 //c",
                "\tx.y/d v1.2.3 //   c",
                "\tx.y/e v1.2.3 // indirect",
                "\tx.y/f v1.2.3 //indirect",
                "\tx.y/g v1.2.3 //\tindirect",
                ")"),
            ImmutableList.of(
                Require.of("x.y/a", "v1.2.3", true),
                Require.of("x.y/b", "v1.2.3", true),
                Require.of("x.y/c", "v1.2.3", true),
                Require.of("x.y/d", "v1.2.3", true),
                Require.of("x.y/e", "v1.2.3", true),
                Require.of("x.y/f", "v1.2.3", true),
                Require.of("x.y/g", "v1.2.3", true)),
            text(
                "module m",
                "require (",
                "\tx.y/a v1.2.3 // indirect",
                "\tx.y/b v1.2.3 // indirect",
                "\tx.y/c v1.2.3 // indirect; c",
                "\tx.y/d v1.2.3 // indirect; c",
                "\tx.y/e v1.2.3 // indirect",
                "\tx.y/f v1.2.3 //indirect",
                "\tx.y/g v1.2.3 //\tindirect",
                ")")),
        Arguments.of(
            "direct_again",
            text(
                "module m",
                "require (",
                "\tx.y/a v1.2.3 // indirect",
                "\tx.y/b v1.2.3 // indirect; keep",
                ")"),
            ImmutableList.of(
                Require.of("x.y/a", "v1.3.0", false), Require.of("x.y/b", "v1.2.3", false)),
            text("module m", "require (", "\tx.y/a v1.3.0", "\tx.y/b v1.2.3 // keep", ")")));
  }

  @ParameterizedTest(name = "{0}")
  @MethodSource
  void setRequire(String desc, String in, ImmutableList<Require> requirements, String want) {
    ModFile f = assertEdit(in, want, true, file -> file.setRequire(requirements));
    f.cleanup();
    assertEquals(requirements.size(), f.require().size());
    for (Require r : f.require()) {
      assertEquals(
          requirements.stream()
              .filter(listed -> listed.mod().path().equals(r.mod().path()))
              .findFirst()
              .get()
              .indirect(),
          r.indirect());
    }
  }

  @Test
  void setRequireKeepsLastListedVersion() {
    ModFile f =
        assertEdit(
            text("module m", "require x.y/a v1.0.0 // pinned"),
            text("module m", "require x.y/a v1.2.0 // pinned"),
            true,
            file ->
                file.setRequire(
                    ImmutableList.of(
                        Require.of("x.y/a", "v1.1.0", false),
                        Require.of("x.y/a", "v1.2.0", false))));
    assertEquals(1, f.require().size());
    assertEquals("v1.2.0", f.require().get(0).mod().version());
  }

  @Test
  void setRequireLeavesFileUnchangedOnBadVersion() {
    String in = text("module m", "require (", "\tx.y/a v1.0.0", "\tx.y/b v1.0.0", ")");
    ModFile f = ModFile.parse("go.mod", in.getBytes(UTF_8), null);
    byte[] before = f.format();
    ModFileError e =
        assertThrows(
            ModFileError.class,
            () ->
                f.setRequire(
                    ImmutableList.of(
                        Require.of("x.y/a", "v1.1.0", false),
                        Require.of("x.y/c", "bogus", false))));
    assertEquals(
        "require x.y/c: version \"bogus\" invalid: must be of the form v1.2.3",
        e.diagnostics().get(0).message());
    assertArrayEquals(before, f.format());
    assertEquals(2, f.require().size());
    assertEquals("v1.0.0", f.require().get(0).mod().version());
  }

  @Test
  void setRequireRejectsBadVersionForExistingPath() {
    ModFile f =
        ModFile.parse("go.mod", text("module m", "require x.y/a v1.0.0").getBytes(UTF_8), null);
    byte[] before = f.format();
    assertThrows(
        ModFileError.class,
        () -> f.setRequire(ImmutableList.of(Require.of("x.y/a", "not a version", false))));
    assertArrayEquals(before, f.format());
  }

  static Stream<Arguments> addGo() {
    return Stream.of(
        Arguments.of("module_only", text("module m"), "1.14", text("module m", "go 1.14")),
        Arguments.of(
            "module_before_require",
            text("module m", "require x.y/a v1.2.3"),
            "1.14",
            text("module m", "go 1.14", "require x.y/a v1.2.3")),
        Arguments.of(
            "require_before_module",
            text("require x.y/a v1.2.3", "module example.com/inverted"),
            "1.14",
            text("require x.y/a v1.2.3", "module example.com/inverted", "go 1.14")),
        Arguments.of(
            "require_only",
            text("require x.y/a v1.2.3"),
            "1.14",
            text("go 1.14", "require x.y/a v1.2.3")),
        Arguments.of(
            "update", text("module m", "go 1.13"), "1.21.0", text("module m", "go 1.21.0")),
        Arguments.of("empty", "", "1.14", text("go 1.14")));
  }

  @ParameterizedTest(name = "{0}")
  @MethodSource
  void addGo(String desc, String in, String version, String want) {
    ModFile f = assertEdit(in, want, true, file -> file.addGoStmt(version));
    assertEquals(version, f.go().get().version());
  }

  @Test
  void addGoRejectsInvalidVersion() {
    ModFile f = ModFile.parse("go.mod", text("module m").getBytes(UTF_8), null);
    assertThrows(ModFileError.class, () -> f.addGoStmt("v1.14"));
    assertEquals(false, f.go().isPresent());
  }

  static Stream<Arguments> addRetract() {
    return Stream.of(
        Arguments.of(
            "new_singleton",
            text("module m"),
            "v1.2.3",
            "v1.2.3",
            "",
            text("module m", "retract v1.2.3")),
        Arguments.of(
            "new_interval",
            text("module m"),
            "v1.0.0",
            "v1.1.0",
            "",
            "module m\nretract [v1.0.0, v1.1.0]"),
        Arguments.of(
            "duplicate_with_rationale",
            text("module m", "retract v1.2.3"),
            "v1.2.3",
            "v1.2.3",
            "bad",
            text("module m", "retract (", "\tv1.2.3", "\t// bad", "\tv1.2.3", ")")),
        Arguments.of(
            "duplicate_multiline_rationale",
            text("module m", "retract [v1.2.3, v1.2.3]"),
            "v1.2.3",
            "v1.2.3",
            "multi\nline",
            text(
                "module m",
                "retract\t(",
                "\t[v1.2.3, v1.2.3]",
                "\t// multi",
                "\t// line",
                "\tv1.2.3",
                ")")),
        Arguments.of(
            "duplicate_interval",
            text("module m", "retract [v1.0.0, v1.1.0]"),
            "v1.0.0",
            "v1.1.0",
            "",
            text("module m", "retract (", "\t[v1.0.0, v1.1.0]", "\t[v1.0.0, v1.1.0]", ")")),
        Arguments.of(
            "duplicate_singleton",
            text("module m", "retract v1.2.3"),
            "v1.2.3",
            "v1.2.3",
            "",
            text("module m", "retract\t(", "\tv1.2.3", "\tv1.2.3", ")")));
  }

  @ParameterizedTest(name = "{0}")
  @MethodSource
  void addRetract(String desc, String in, String low, String high, String rationale, String want) {
    ModFile f =
        assertEdit(
            in, want, true, file -> file.addRetract(VersionInterval.create(low, high), rationale));
    Retract added = f.retract().get(f.retract().size() - 1);
    assertEquals(rationale, f.retractRationale(added));
  }

  @Test
  void addRetractRejectsInvertedInterval() {
    ModFile f = ModFile.parse("go.mod", text("module m").getBytes(UTF_8), null);
    assertThrows(
        ModFileError.class, () -> f.addRetract(VersionInterval.create("v1.2.0", "v1.1.0"), ""));
    assertThrows(
        ModFileError.class, () -> f.addRetract(VersionInterval.of("1.2.0"), ""));
    assertEquals(text("module m"), new String(f.format(), UTF_8));
  }

  static Stream<Arguments> dropRetract() {
    return Stream.of(
        Arguments.of(
            "singleton_no_match",
            text("module m", "retract v1.2.3"),
            "v1.0.0",
            "v1.0.0",
            text("module m", "retract v1.2.3")),
        Arguments.of(
            "singleton_match_one",
            text("module m", "retract v1.2.2", "retract v1.2.3", "retract v1.2.4"),
            "v1.2.3",
            "v1.2.3",
            text("module m", "retract v1.2.2", "retract v1.2.4")),
        Arguments.of(
            "singleton_match_all",
            text("module m", "retract v1.2.3 // first", "retract v1.2.3 // second"),
            "v1.2.3",
            "v1.2.3",
            text("module m")),
        Arguments.of(
            "interval_match",
            text("module m", "retract [v1.2.3, v1.2.3]"),
            "v1.2.3",
            "v1.2.3",
            text("module m")),
        Arguments.of(
            "interval_superset_no_match",
            text("module m", "retract [v1.0.0, v1.1.0]"),
            "v1.0.0",
            "v1.2.0",
            text("module m", "retract [v1.0.0, v1.1.0]")),
        Arguments.of(
            "interval_match_middle_block",
            text("module m", "retract (", "\tv1.0.0", "\t[v1.1.0, v1.2.0]", "\tv1.3.0", ")"),
            "v1.1.0",
            "v1.2.0",
            text("module m", "retract (", "\tv1.0.0", "\tv1.3.0", ")")),
        Arguments.of(
            "interval_match_all",
            text("module m", "retract [v1.0.0, v1.1.0]", "retract [v1.0.0, v1.1.0]"),
            "v1.0.0",
            "v1.1.0",
            text("module m")));
  }

  @ParameterizedTest(name = "{0}")
  @MethodSource
  void dropRetract(String desc, String in, String low, String high, String want) {
    assertEdit(
        in,
        want,
        true,
        file -> {
          file.dropRetract(VersionInterval.create(low, high));
          file.cleanup();
        });
  }

  static Stream<Arguments> retractRationale() {
    return Stream.of(
        Arguments.of("no_comment", "module m\nretract v1.0.0", ""),
        Arguments.of("prefix_one", text("module m", "//   prefix", "retract v1.0.0 "), "prefix"),
        Arguments.of(
            "prefix_multiline",
            "module m\n//  one\n//\n//     two\n//\n// three  \nretract v1.0.0",
            "one\n\ntwo\n\nthree"),
        Arguments.of("suffix", text("module m", "retract v1.0.0 // suffix"), "suffix"),
        Arguments.of(
            "prefix_suffix_after",
            text("module m", "// prefix", "retract v1.0.0 // suffix"),
            "prefix\nsuffix"),
        Arguments.of("block_only", text("// block", "retract (", "\tv1.0.0", ")"), "block"),
        Arguments.of(
            "block_and_line", text("// block", "retract (", "\t// line", "\tv1.0.0", ")"), "line"));
  }

  @ParameterizedTest(name = "{0}")
  @MethodSource
  void retractRationale(String desc, String in, String want) {
    ModFile f = ModFile.parse("in", in.getBytes(UTF_8), null);
    assertEquals(1, f.retract().size());
    assertEquals(want, f.retract().get(0).rationale());
    assertEquals(want, f.retractRationale(f.retract().get(0)));
  }

  static Stream<Arguments> sortBlocks() {
    return Stream.of(
        Arguments.of(
            "exclude_duplicates_removed",
            text(
                "module m",
                "exclude x.y/z v1.0.0 // a",
                "exclude x.y/z v1.0.0 // b",
                "exclude (",
                "\tx.y/w v1.1.0",
                "\tx.y/z v1.0.0 // c",
                ")"),
            text("module m", "exclude x.y/z v1.0.0 // a", "exclude (", "\tx.y/w v1.1.0", ")"),
            true),
        Arguments.of(
            "replace_duplicates_removed",
            text(
                "module m",
                "replace x.y/z v1.0.0 => ./a",
                "replace x.y/z v1.1.0 => ./b",
                "replace (",
                "\tx.y/z v1.0.0 => ./c",
                ")"),
            text(
                "module m",
                "replace x.y/z v1.1.0 => ./b",
                "replace (",
                "\tx.y/z v1.0.0 => ./c",
                ")"),
            true),
        Arguments.of(
            "require_duplicate_paths_keep_last",
            text(
                "module m",
                "require x.y/a v1.0.0 // first",
                "require (",
                "\tx.y/b v1.0.0",
                "\tx.y/a v1.1.0 // second",
                ")"),
            text("module m", "require (", "\tx.y/a v1.1.0 // second", "\tx.y/b v1.0.0", ")"),
            true),
        Arguments.of(
            "retract_duplicates_not_removed",
            text("module m", "// block", "retract (", "\tv1.0.0 // one", "\tv1.0.0 // two", ")"),
            text("module m", "// block", "retract (", "\tv1.0.0 // one", "\tv1.0.0 // two", ")"),
            true),
        Arguments.of(
            "sort_lexicographically",
            text(
                "module m",
                "sort (",
                "\taa",
                "\tcc",
                "\tbb",
                "\tzz",
                "\tv1.2.0",
                "\tv1.11.0",
                ")"),
            text(
                "module m",
                "sort (",
                "\taa",
                "\tbb",
                "\tcc",
                "\tv1.11.0",
                "\tv1.2.0",
                "\tzz",
                ")"),
            false),
        Arguments.of(
            "sort_retract",
            text(
                "module m",
                "retract (",
                "\t[v1.2.0, v1.3.0]",
                "\t[v1.1.0, v1.3.0]",
                "\t[v1.1.0, v1.2.0]",
                "\tv1.0.0",
                "\tv1.1.0",
                "\tv1.2.0",
                "\tv1.3.0",
                "\tv1.4.0",
                ")"),
            text(
                "module m",
                "retract (",
                "\tv1.4.0",
                "\tv1.3.0",
                "\t[v1.2.0, v1.3.0]",
                "\tv1.2.0",
                "\t[v1.1.0, v1.3.0]",
                "\t[v1.1.0, v1.2.0]",
                "\tv1.1.0",
                "\tv1.0.0",
                ")"),
            false),
        Arguments.of(
            "exclude_semver_order_from_go_1_21",
            text(
                "module m",
                "go 1.21",
                "exclude (",
                "\tx.y/z v1.10.0",
                "\tx.y/z v1.9.0",
                "\tx.y/a v1.0.0",
                ")"),
            text(
                "module m",
                "go 1.21",
                "exclude (",
                "\tx.y/a v1.0.0",
                "\tx.y/z v1.9.0",
                "\tx.y/z v1.10.0",
                ")"),
            true),
        Arguments.of(
            "exclude_lexical_order_before_go_1_21",
            text("module m", "go 1.20", "exclude (", "\tx.y/z v1.9.0", "\tx.y/z v1.10.0", ")"),
            text("module m", "go 1.20", "exclude (", "\tx.y/z v1.10.0", "\tx.y/z v1.9.0", ")"),
            true));
  }

  @ParameterizedTest(name = "{0}")
  @MethodSource
  void sortBlocks(String desc, String in, String want, boolean strict) {
    assertEdit(in, want, strict, ModFile::sortBlocks);
  }

  @Test
  void sortBlocksDropsDuplicateEntities() {
    ModFile f =
        ModFile.parse(
            "go.mod",
            text("module m", "exclude x.y/z v1.0.0", "exclude x.y/z v1.0.0").getBytes(UTF_8),
            null);
    assertEquals(2, f.exclude().size());
    f.sortBlocks();
    assertEquals(1, f.exclude().size());
  }

  @Test
  void addAndDropExclude() {
    ModFile f =
        assertEdit(
            text("module m", "exclude x.y/z v1.0.0", "require x.y/a v1.0.0"),
            text(
                "module m",
                "exclude (",
                "\tx.y/z v1.0.0",
                "\tx.y/z v1.1.0",
                ")",
                "require x.y/a v1.0.0"),
            true,
            file -> {
              file.addExclude("x.y/z", "v1.1.0");
              file.addExclude("x.y/z", "v1.0.0");
            });
    assertEquals(2, f.exclude().size());
    f.dropExclude("x.y/z", "v1.0.0");
    f.cleanup();
    assertEquals(
        text("module m", "", "exclude x.y/z v1.1.0", "", "require x.y/a v1.0.0"),
        new String(f.format(), UTF_8));
  }

  @Test
  void addReplaceUpdatesMatchingEntry() {
    ModFile f =
        assertEdit(
            text("module m", "replace x.y/z v1.0.0 => ./a", "replace x.y/z v1.1.0 => ./b"),
            text("module m", "replace x.y/z => x.y/fork v1.2.0"),
            true,
            file -> {
              file.addReplace("x.y/z", "", "x.y/fork", "v1.2.0");
              file.cleanup();
            });
    Replace r = f.replace().get(0);
    assertEquals(ModuleVersion.create("x.y/z", ""), r.oldMod());
    assertEquals(ModuleVersion.create("x.y/fork", "v1.2.0"), r.newMod());
  }

  @Test
  void addReplaceNextToSamePath() {
    assertEdit(
        text("module m", "replace x.y/z v1.0.0 => ./a", "replace x.y/w => ./w"),
        text(
            "module m",
            "replace (",
            "\tx.y/z v1.0.0 => ./a",
            "\tx.y/z v1.1.0 => ./b",
            ")",
            "replace x.y/w => ./w"),
        true,
        file -> file.addReplace("x.y/z", "v1.1.0", "./b", ""));
  }

  @Test
  void addReplaceRejectsVersionedDirectory() {
    ModFile f = ModFile.parse("go.mod", text("module m").getBytes(UTF_8), null);
    assertThrows(ModFileError.class, () -> f.addReplace("x.y/z", "", "./z", "v1.0.0"));
    assertThrows(ModFileError.class, () -> f.addReplace("x.y/z", "", "x.y/fork", ""));
    assertEquals(0, f.replace().size());
  }

  @Test
  void dropReplace() {
    ModFile f =
        assertEdit(
            text("module m", "replace (", "\tx.y/z v1.0.0 => ./a", "\tx.y/w => ./w", ")"),
            text("module m", "replace x.y/w => ./w"),
            true,
            file -> {
              file.dropReplace("x.y/z", "v1.0.0");
              file.dropReplace("x.y/z", "v9.9.9");
              file.cleanup();
            });
    assertEquals(1, f.replace().size());
  }

  @Test
  void dropRequire() {
    ModFile f =
        assertEdit(
            text("module m", "require (", "\tx.y/a v1.0.0", "\tx.y/b v1.0.0 // indirect", ")"),
            text("module m", "require x.y/a v1.0.0"),
            true,
            file -> {
              file.dropRequire("x.y/b");
              file.cleanup();
            });
    assertEquals(1, f.require().size());
    assertEquals(ModuleVersion.create("x.y/a", "v1.0.0"), f.require().get(0).mod());
  }

  @Test
  void addNewRequireMarksIndirect() {
    ModFile f =
        assertEdit(
            text("module m"),
            text("module m", "require x.y/a v1.0.0 // indirect"),
            true,
            file -> file.addNewRequire("x.y/a", "v1.0.0", true));
    assertEquals(true, f.require().get(0).indirect());
  }

  @Test
  void addModuleStmt() {
    ModFile f =
        assertEdit(
            text("go 1.21"),
            text("go 1.21", "module example.com/m"),
            true,
            file -> file.addModuleStmt("example.com/m"));
    f.addModuleStmt("example.com/other");
    assertEquals("example.com/other", f.module().get().path());
    assertEquals(
        text("go 1.21", "", "module example.com/other"), new String(f.format(), UTF_8));
  }

  @Test
  void handlesSurviveCleanup() {
    ModFile f =
        ModFile.parse(
            "go.mod",
            text("module m", "require (", "\tx.y/a v1.0.0 // indirect", ")").getBytes(UTF_8),
            null);
    Require r = f.require().get(0);
    f.cleanup();
    assertEquals(
        ImmutableList.of("require", "x.y/a", "v1.0.0"), f.syntax().line(r.handle()).tokens());
    assertEquals(
        text("module m", "", "require x.y/a v1.0.0 // indirect"), new String(f.format(), UTF_8));
  }
}
