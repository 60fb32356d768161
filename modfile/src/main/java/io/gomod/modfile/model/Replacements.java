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

import com.google.common.collect.ImmutableList;
import io.gomod.modfile.diag.ModFileError;
import io.gomod.modfile.diag.ModFileError.ErrorKind;
import io.gomod.modfile.parse.QuotedStrings;
import io.gomod.modfile.tree.FileSyntax;
import io.gomod.modfile.tree.Tree.Line;
import io.gomod.modfile.version.ModulePaths;
import java.util.ArrayList;
import java.util.List;

/** Edits of {@code replace} directives, shared by go.mod and go.work files. */
final class Replacements {

  /**
   * Points {@code oldPath@oldVersion} at a new module or directory. The first matching entry is
   * updated and later ones removed; otherwise a line is added next to entries for the same path.
   * An empty {@code oldVersion} matches every version.
   */
  static void add(
      FileSyntax syntax,
      List<Replace> replace,
      String oldPath,
      String oldVersion,
      String newPath,
      String newVersion) {
    validate(oldPath, oldVersion, newPath, newVersion);
    ModuleVersion oldMod = ModuleVersion.create(oldPath, oldVersion);
    ModuleVersion newMod = ModuleVersion.create(newPath, newVersion);
    List<String> tokens = new ArrayList<>();
    tokens.add("replace");
    tokens.add(QuotedStrings.autoQuote(oldPath));
    if (!oldVersion.isEmpty()) {
      tokens.add(oldVersion);
    }
    tokens.add("=>");
    tokens.add(QuotedStrings.autoQuote(newPath));
    if (!newVersion.isEmpty()) {
      tokens.add(newVersion);
    }

    boolean need = true;
    Line hint = null;
    for (Replace r : ImmutableList.copyOf(replace)) {
      Line line = syntax.line(r.handle());
      if (r.oldMod().path().equals(oldPath)
          && (oldVersion.isEmpty() || r.oldMod().version().equals(oldVersion))) {
        if (need) {
          syntax.updateLine(line, tokens);
          replace.set(replace.indexOf(r), Replace.create(oldMod, newMod, r.handle()));
          need = false;
          continue;
        }
        syntax.markRemoved(line);
        replace.remove(r);
        continue;
      }
      if (r.oldMod().path().equals(oldPath)) {
        hint = line;
      }
    }
    if (need) {
      Line line = syntax.addLine(hint, tokens);
      replace.add(Replace.create(oldMod, newMod, line.id()));
    }
  }

  /** Removes the replacement of exactly {@code oldPath@oldVersion}; a miss is a no-op. */
  static void drop(FileSyntax syntax, List<Replace> replace, String oldPath, String oldVersion) {
    for (Replace r : ImmutableList.copyOf(replace)) {
      if (r.oldMod().path().equals(oldPath) && r.oldMod().version().equals(oldVersion)) {
        syntax.markRemoved(syntax.line(r.handle()));
        replace.remove(r);
      }
    }
  }

  private static void validate(
      String oldPath, String oldVersion, String newPath, String newVersion) {
    if (oldPath.isEmpty() || newPath.isEmpty()) {
      throw ModFileError.format(ErrorKind.INVALID_EDIT, "replace: empty module path");
    }
    if (!oldVersion.isEmpty()) {
      ModFile.checkCanonicalVersion("replace", oldPath, oldVersion);
    }
    if (newVersion.isEmpty()) {
      if (!ModulePaths.isDirectoryPath(newPath)) {
        throw ModFileError.format(
            ErrorKind.INVALID_REPLACEMENT,
            oldPath,
            "replacement module without version must be directory path"
                + " (rooted or starting with . or ..)");
      }
    } else {
      if (ModulePaths.isDirectoryPath(newPath)) {
        throw ModFileError.format(
            ErrorKind.INVALID_REPLACEMENT,
            oldPath,
            "replacement module directory path \"" + newPath + "\" cannot have version");
      }
      ModFile.checkCanonicalVersion("replace", newPath, newVersion);
    }
  }

  private Replacements() {}
}
