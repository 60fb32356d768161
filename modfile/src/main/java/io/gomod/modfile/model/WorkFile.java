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

import com.google.common.collect.ImmutableList;
import io.gomod.modfile.diag.ModFileError;
import io.gomod.modfile.diag.ModFileError.ErrorKind;
import io.gomod.modfile.diag.ModFileLog;
import io.gomod.modfile.diag.SourceFile;
import io.gomod.modfile.edit.BlockSorter;
import io.gomod.modfile.edit.DirectiveKind.Dialect;
import io.gomod.modfile.parse.ParsePolicy;
import io.gomod.modfile.parse.Parser;
import io.gomod.modfile.parse.QuotedStrings;
import io.gomod.modfile.parse.VersionFixer;
import io.gomod.modfile.tree.FileSyntax;
import io.gomod.modfile.tree.Pretty;
import io.gomod.modfile.tree.Tree;
import io.gomod.modfile.tree.Tree.Line;
import io.gomod.modfile.version.GoVersion;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/** A parsed go.work file. */
public final class WorkFile {

  private final FileSyntax syntax;
  private @Nullable GoStmt go;
  private final List<Directory> directory = new ArrayList<>();
  private final List<Use> use = new ArrayList<>();
  private final List<Replace> replace = new ArrayList<>();

  private WorkFile(FileSyntax syntax) {
    this.syntax = syntax;
  }

  public static WorkFile parse(String name, byte[] data, @Nullable VersionFixer fixer) {
    SourceFile source = SourceFile.fromBytes(name, data);
    WorkFile file = new WorkFile(Parser.parse(source));
    ModFileLog log = new ModFileLog(source);
    DirectiveReader reader = new DirectiveReader(file.syntax, log, fixer, ParsePolicy.strict());
    reader.forEach((block, line, verb, args) -> file.read(reader, line, verb, args));
    log.maybeThrow();
    return file;
  }

  private void read(DirectiveReader reader, Line line, String verb, List<String> args)
      throws DirectiveException {
    switch (verb) {
      case "go":
        if (go != null) {
          throw new DirectiveException(line.position(), ErrorKind.REPEATED_DIRECTIVE, "go");
        }
        go = GoStmt.create(reader.goVersion(line, args), line.id());
        break;
      case "directory":
        directory.add(Directory.create(path(reader, line, verb, args), "", line.id()));
        break;
      case "use":
        use.add(Use.create(path(reader, line, verb, args), "", line.id()));
        break;
      case "replace":
        replace.add(reader.replace(line, verb, args));
        break;
      default:
        reader.unknown(line, verb);
    }
  }

  private static String path(DirectiveReader reader, Line line, String verb, List<String> args)
      throws DirectiveException {
    if (args.size() != 1) {
      throw DirectiveReader.usage(line, verb + " local/dir");
    }
    return reader.string(line, 0);
  }

  public FileSyntax syntax() {
    return syntax;
  }

  public Optional<GoStmt> go() {
    return Optional.ofNullable(go);
  }

  public ImmutableList<Directory> directory() {
    return ImmutableList.copyOf(directory);
  }

  public ImmutableList<Use> use() {
    return ImmutableList.copyOf(use);
  }

  public ImmutableList<Replace> replace() {
    return ImmutableList.copyOf(replace);
  }

  /** Sets the go version; a new directive goes below the comments at the top of the file. */
  public void addGoStmt(String version) {
    if (!GoVersion.isValidLanguageVersion(version)) {
      throw ModFileError.format(
          ErrorKind.INVALID_EDIT, String.format("invalid language version \"%s\"", version));
    }
    ImmutableList<String> tokens = ImmutableList.of("go", version);
    if (go != null) {
      syntax.updateLine(syntax.line(go.handle()), tokens);
      go = GoStmt.create(version, go.handle());
      return;
    }
    int index = 0;
    for (Tree stmt : syntax.statements()) {
      if (stmt.kind() != Tree.Kind.COMMENT_BLOCK) {
        break;
      }
      index++;
    }
    go = GoStmt.create(version, syntax.insertLine(index, tokens).id());
  }

  /**
   * Adds a module directory. The first entry for {@code path} is updated and later ones removed.
   * Only the directory is written to the file.
   */
  public void addDirectory(String path, String modulePath) {
    checkPath("directory", path);
    ImmutableList<String> tokens = ImmutableList.of("directory", QuotedStrings.autoQuote(path));
    boolean need = true;
    for (Directory d : ImmutableList.copyOf(directory)) {
      if (!d.path().equals(path)) {
        continue;
      }
      if (need) {
        syntax.updateLine(syntax.line(d.handle()), tokens);
        directory.set(directory.indexOf(d), Directory.create(path, modulePath, d.handle()));
        need = false;
      } else {
        syntax.markRemoved(syntax.line(d.handle()));
        directory.remove(d);
      }
    }
    if (need) {
      Line line = syntax.addLine(null, tokens);
      directory.add(Directory.create(path, modulePath, line.id()));
    }
  }

  public void dropDirectory(String path) {
    checkPath("directory", path);
    for (Directory d : ImmutableList.copyOf(directory)) {
      if (d.path().equals(path)) {
        syntax.markRemoved(syntax.line(d.handle()));
        directory.remove(d);
      }
    }
  }

  /** Like {@link #addDirectory}, for {@code use} directives. */
  public void addUse(String path, String modulePath) {
    checkPath("use", path);
    ImmutableList<String> tokens = ImmutableList.of("use", QuotedStrings.autoQuote(path));
    boolean need = true;
    for (Use u : ImmutableList.copyOf(use)) {
      if (!u.path().equals(path)) {
        continue;
      }
      if (need) {
        syntax.updateLine(syntax.line(u.handle()), tokens);
        use.set(use.indexOf(u), Use.create(path, modulePath, u.handle()));
        need = false;
      } else {
        syntax.markRemoved(syntax.line(u.handle()));
        use.remove(u);
      }
    }
    if (need) {
      Line line = syntax.addLine(null, tokens);
      use.add(Use.create(path, modulePath, line.id()));
    }
  }

  public void dropUse(String path) {
    checkPath("use", path);
    for (Use u : ImmutableList.copyOf(use)) {
      if (u.path().equals(path)) {
        syntax.markRemoved(syntax.line(u.handle()));
        use.remove(u);
      }
    }
  }

  private static void checkPath(String verb, String path) {
    if (path.isEmpty()) {
      throw ModFileError.format(ErrorKind.INVALID_EDIT, verb + ": empty directory path");
    }
  }

  public void addReplace(String oldPath, String oldVersion, String newPath, String newVersion) {
    Replacements.add(syntax, replace, oldPath, oldVersion, newPath, newVersion);
  }

  public void dropReplace(String oldPath, String oldVersion) {
    Replacements.drop(syntax, replace, oldPath, oldVersion);
  }

  public void sortBlocks() {
    if (!new BlockSorter(syntax, Dialect.WORK, false).sort().isEmpty()) {
      dropRemoved();
    }
  }

  public void cleanup() {
    syntax.cleanup();
    dropRemoved();
  }

  private void dropRemoved() {
    directory.removeIf(d -> syntax.line(d.handle()).isRemoved());
    use.removeIf(u -> syntax.line(u.handle()).isRemoved());
    replace.removeIf(r -> syntax.line(r.handle()).isRemoved());
  }

  public byte[] format() {
    return Pretty.format(syntax).getBytes(UTF_8);
  }
}
