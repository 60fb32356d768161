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
import com.google.common.collect.ImmutableSet;
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
import io.gomod.modfile.tree.Comment;
import io.gomod.modfile.tree.FileSyntax;
import io.gomod.modfile.tree.Pretty;
import io.gomod.modfile.tree.Tree.Line;
import io.gomod.modfile.tree.Tree.LineBlock;
import io.gomod.modfile.version.GoVersion;
import io.gomod.modfile.version.InvalidVersionException;
import io.gomod.modfile.version.ModulePaths;
import io.gomod.modfile.version.Semver;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A parsed go.mod file: the syntax tree plus the directives read from it.
 *
 * <p>Directives are views of lines in {@link #syntax()}. Edits change the tree and the directive
 * lists together, and check their arguments before changing anything.
 */
public final class ModFile {

  private static final Logger logger = LoggerFactory.getLogger(ModFile.class);

  private static final Pattern DEPRECATED =
      Pattern.compile("(?s)(?:^|\n\n)Deprecated: *(.*?)(?:$|\n\n)");

  private final FileSyntax syntax;
  private @Nullable ModuleStmt module;
  private @Nullable GoStmt go;
  private final List<Require> require = new ArrayList<>();
  private final List<Exclude> exclude = new ArrayList<>();
  private final List<Replace> replace = new ArrayList<>();
  private final List<Retract> retract = new ArrayList<>();

  private ModFile(FileSyntax syntax) {
    this.syntax = syntax;
  }

  /** Parses the go.mod file of a main module. */
  public static ModFile parse(String name, byte[] data, @Nullable VersionFixer fixer) {
    return parse(name, data, fixer, ParsePolicy.strict());
  }

  /**
   * Parses the go.mod file of a dependency. Unknown directives and directives that only apply
   * to the main module are kept but not interpreted.
   */
  public static ModFile parseLax(String name, byte[] data, @Nullable VersionFixer fixer) {
    return parse(name, data, fixer, ParsePolicy.lax());
  }

  public static ModFile parse(
      String name, byte[] data, @Nullable VersionFixer fixer, ParsePolicy policy) {
    SourceFile source = SourceFile.fromBytes(name, data);
    ModFile file = new ModFile(Parser.parse(source));
    ModFileLog log = new ModFileLog(source);
    DirectiveReader reader = new DirectiveReader(file.syntax, log, fixer, policy);
    reader.forEach((block, line, verb, args) -> file.read(reader, block, line, verb, args));
    log.maybeThrow();
    return file;
  }

  private void read(
      DirectiveReader reader, @Nullable LineBlock block, Line line, String verb, List<String> args)
      throws DirectiveException {
    ParsePolicy policy = reader.policy();
    switch (verb) {
      case "module":
        readModule(reader, block, line, args);
        return;
      case "go":
        if (go != null) {
          throw new DirectiveException(line.position(), ErrorKind.REPEATED_DIRECTIVE, "go");
        }
        go = GoStmt.create(reader.goVersion(line, args), line.id());
        return;
      case "require":
        readRequire(reader, line, verb, args);
        return;
      case "retract":
        readRetract(reader, block, line, args);
        return;
      case "exclude":
      case "replace":
        if (!policy.interpretMainModuleDirectives()) {
          logger.debug("{}: ignoring {} directive of a dependency", syntax.name(), verb);
          return;
        }
        if (verb.equals("exclude")) {
          readExclude(reader, line, verb, args);
        } else {
          replace.add(reader.replace(line, verb, args));
        }
        return;
      default:
        reader.unknown(line, verb);
    }
  }

  private void readModule(
      DirectiveReader reader, @Nullable LineBlock block, Line line, List<String> args)
      throws DirectiveException {
    if (module != null) {
      throw new DirectiveException(line.position(), ErrorKind.REPEATED_DIRECTIVE, "module");
    }
    if (args.size() != 1) {
      throw DirectiveReader.usage(line, "module module/path");
    }
    String deprecated = deprecation(DirectiveReader.directiveComment(block, line));
    module = ModuleStmt.create(reader.string(line, 0), deprecated, line.id());
  }

  /** Returns the deprecation message of a module comment, or an empty string. */
  static String deprecation(String comment) {
    Matcher m = DEPRECATED.matcher(comment);
    return m.find() ? m.group(1) : "";
  }

  private void readRequire(DirectiveReader reader, Line line, String verb, List<String> args)
      throws DirectiveException {
    ModuleVersion mod = moduleVersion(reader, line, verb, args);
    require.add(Require.create(mod, IndirectMarker.isIndirect(line), line.id()));
  }

  private void readExclude(DirectiveReader reader, Line line, String verb, List<String> args)
      throws DirectiveException {
    exclude.add(Exclude.create(moduleVersion(reader, line, verb, args), line.id()));
  }

  private static ModuleVersion moduleVersion(
      DirectiveReader reader, Line line, String verb, List<String> args)
      throws DirectiveException {
    if (args.size() != 2) {
      throw DirectiveReader.usage(line, verb + " module/path v1.2.3");
    }
    String path = reader.string(line, 0);
    String version = reader.version(verb, path, line, 1);
    DirectiveReader.checkPathMajor(verb, path, version, line, 1);
    return ModuleVersion.create(path, version);
  }

  private void readRetract(
      DirectiveReader reader, @Nullable LineBlock block, Line line, List<String> args)
      throws DirectiveException {
    VersionInterval interval;
    try {
      interval = interval(reader, line, args);
    } catch (DirectiveException e) {
      if (reader.policy().ignoreMalformedRetractions()) {
        logger.debug("{}: ignoring malformed retraction: {}", syntax.name(), line.tokens());
        return;
      }
      throw e;
    }
    retract.add(
        Retract.create(interval, DirectiveReader.directiveComment(block, line), line.id()));
  }

  /** Reads {@code v} or {@code [low, high]}; unexpected trailing tokens are rejected. */
  private VersionInterval interval(DirectiveReader reader, Line line, List<String> args)
      throws DirectiveException {
    String path = module == null ? "" : module.path();
    if (args.isEmpty() || args.get(0).equals("(")) {
      throw intervalError(line, 0, "expected '[' or version");
    }
    int next;
    VersionInterval interval;
    if (!args.get(0).equals("[")) {
      interval = VersionInterval.of(reader.version("retract", path, line, 0));
      next = 1;
    } else {
      if (args.size() < 2) {
        throw intervalError(line, 1, "expected version after '['");
      }
      String low = reader.version("retract", path, line, 1);
      if (args.size() < 3 || !args.get(2).equals(",")) {
        throw intervalError(line, 2, "expected ',' after version");
      }
      if (args.size() < 4) {
        throw intervalError(line, 3, "expected version after ','");
      }
      String high = reader.version("retract", path, line, 3);
      if (args.size() < 5 || !args.get(4).equals("]")) {
        throw intervalError(line, 4, "expected ']' after version");
      }
      if (Semver.compare(low, high) > 0) {
        throw intervalError(
            line, 1, String.format("low version %s is higher than high version %s", low, high));
      }
      interval = VersionInterval.create(low, high);
      next = 5;
    }
    if (args.size() > next && reader.policy().rejectUnknownDirectives()) {
      throw new DirectiveException(
          DirectiveReader.argPosition(line, next), ErrorKind.UNEXPECTED_ARGUMENT, args.get(next));
    }
    return interval;
  }

  private static DirectiveException intervalError(Line line, int arg, String message) {
    int index = line.inBlock() ? arg : arg + 1;
    int position =
        index < line.tokens().size() ? DirectiveReader.argPosition(line, arg) : line.position();
    return new DirectiveException(position, ErrorKind.INVALID_INTERVAL, "retract", message);
  }

  public FileSyntax syntax() {
    return syntax;
  }

  public Optional<ModuleStmt> module() {
    return Optional.ofNullable(module);
  }

  public Optional<GoStmt> go() {
    return Optional.ofNullable(go);
  }

  public ImmutableList<Require> require() {
    return ImmutableList.copyOf(require);
  }

  public ImmutableList<Exclude> exclude() {
    return ImmutableList.copyOf(exclude);
  }

  public ImmutableList<Replace> replace() {
    return ImmutableList.copyOf(replace);
  }

  public ImmutableList<Retract> retract() {
    return ImmutableList.copyOf(retract);
  }

  /** Sets the module path, adding a module directive at the end of the file if there is none. */
  public void addModuleStmt(String path) {
    if (path.isEmpty()) {
      throw ModFileError.format(ErrorKind.INVALID_EDIT, "module: empty module path");
    }
    ImmutableList<String> tokens = ImmutableList.of("module", QuotedStrings.autoQuote(path));
    if (module == null) {
      Line line = syntax.addLine(null, tokens);
      module = ModuleStmt.create(path, "", line.id());
    } else {
      syntax.updateLine(syntax.line(module.handle()), tokens);
      module = ModuleStmt.create(path, module.deprecated(), module.handle());
    }
  }

  /**
   * Sets the go version. A new directive goes right after the module directive, or before the
   * first require directive of a file without one.
   */
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
    int index;
    if (module != null) {
      index = syntax.indexOf(syntax.line(module.handle())) + 1;
    } else {
      index = syntax.indexOfVerb("require");
      if (index == -1) {
        index = syntax.statements().size();
      }
    }
    go = GoStmt.create(version, syntax.insertLine(index, tokens).id());
  }

  /**
   * Requires {@code path} at {@code version}. The first requirement of the path is updated and
   * any later ones removed.
   */
  public void addRequire(String path, String version) {
    checkCanonicalVersion("require", path, version);
    ImmutableList<String> tokens =
        ImmutableList.of("require", QuotedStrings.autoQuote(path), version);
    boolean need = true;
    for (Require r : ImmutableList.copyOf(require)) {
      if (!r.mod().path().equals(path)) {
        continue;
      }
      Line line = syntax.line(r.handle());
      if (need) {
        syntax.updateLine(line, tokens);
        require.set(require.indexOf(r), r.withVersion(version, r.indirect()));
        need = false;
      } else {
        syntax.markRemoved(line);
        require.remove(r);
      }
    }
    if (need) {
      addNewRequire(path, version, false);
    }
  }

  /**
   * Adds a requirement without looking for an existing one. The line joins the last require
   * block, or turns the last require line into a block, or is appended to the file.
   */
  public void addNewRequire(String path, String version, boolean indirect) {
    checkCanonicalVersion("require", path, version);
    Line line =
        syntax.addLine(null, ImmutableList.of("require", QuotedStrings.autoQuote(path), version));
    IndirectMarker.setIndirect(line, indirect);
    require.add(Require.create(ModuleVersion.create(path, version), indirect, line.id()));
  }

  /**
   * Replaces the requirements with {@code requirements}. Requirements already in the file keep
   * their lines and comments; the others are removed, and new ones added in the given order.
   * When a path is listed more than once the last entry wins. Blocks are sorted afterwards.
   */
  public void setRequire(List<Require> requirements) {
    Map<String, Require> need = new LinkedHashMap<>();
    for (Require r : requirements) {
      checkCanonicalVersion("require", r.mod().path(), r.mod().version());
      // a later entry for the same path overrides an earlier one
      need.put(r.mod().path(), r);
    }
    Set<String> updated = new HashSet<>();
    for (Require r : ImmutableList.copyOf(require)) {
      Line line = syntax.line(r.handle());
      Require want = need.get(r.mod().path());
      if (want == null || !updated.add(r.mod().path())) {
        syntax.markRemoved(line);
        require.remove(r);
        continue;
      }
      List<Comment> before = line.comments().before();
      if (before.size() == 1 && before.get(0).isBlank()) {
        before.clear();
      }
      syntax.updateLine(
          line,
          ImmutableList.of(
              "require", QuotedStrings.autoQuote(r.mod().path()), want.mod().version()));
      IndirectMarker.setIndirect(line, want.indirect());
      require.set(require.indexOf(r), r.withVersion(want.mod().version(), want.indirect()));
    }
    syntax.prune();
    for (Require r : need.values()) {
      if (!updated.contains(r.mod().path())) {
        addNewRequire(r.mod().path(), r.mod().version(), r.indirect());
      }
    }
    sortBlocks();
  }

  /** Removes every requirement of {@code path}. */
  public void dropRequire(String path) {
    for (Require r : ImmutableList.copyOf(require)) {
      if (r.mod().path().equals(path)) {
        syntax.markRemoved(syntax.line(r.handle()));
        require.remove(r);
      }
    }
  }

  /** Excludes {@code path@version}, next to other exclusions of the same path if any. */
  public void addExclude(String path, String version) {
    checkCanonicalVersion("exclude", path, version);
    Line hint = null;
    for (Exclude x : exclude) {
      if (x.mod().path().equals(path)) {
        if (x.mod().version().equals(version)) {
          return;
        }
        hint = syntax.line(x.handle());
      }
    }
    Line line =
        syntax.addLine(hint, ImmutableList.of("exclude", QuotedStrings.autoQuote(path), version));
    exclude.add(Exclude.create(ModuleVersion.create(path, version), line.id()));
  }

  public void dropExclude(String path, String version) {
    for (Exclude x : ImmutableList.copyOf(exclude)) {
      if (x.mod().path().equals(path) && x.mod().version().equals(version)) {
        syntax.markRemoved(syntax.line(x.handle()));
        exclude.remove(x);
      }
    }
  }

  /**
   * Replaces {@code oldPath@oldVersion}, or every version of {@code oldPath} when {@code
   * oldVersion} is empty, with a module version or a directory (when {@code newVersion} is
   * empty).
   */
  public void addReplace(String oldPath, String oldVersion, String newPath, String newVersion) {
    Replacements.add(syntax, replace, oldPath, oldVersion, newPath, newVersion);
  }

  public void dropReplace(String oldPath, String oldVersion) {
    Replacements.drop(syntax, replace, oldPath, oldVersion);
  }

  /**
   * Retracts an interval of versions of this module. Each line of {@code rationale} becomes a
   * comment above the new entry.
   */
  public void addRetract(VersionInterval interval, String rationale) {
    checkInterval(interval);
    List<String> tokens = new ArrayList<>();
    tokens.add("retract");
    if (interval.isSingleton()) {
      tokens.add(QuotedStrings.autoQuote(interval.low()));
    } else {
      tokens.add("[");
      tokens.add(QuotedStrings.autoQuote(interval.low()));
      tokens.add(",");
      tokens.add(QuotedStrings.autoQuote(interval.high()));
      tokens.add("]");
    }
    Line line = syntax.addLine(null, tokens);
    if (!rationale.isEmpty()) {
      for (String text : rationale.split("\n", -1)) {
        line.comments().before().add(Comment.synthetic("// " + text, false));
      }
    }
    retract.add(Retract.create(interval, rationale, line.id()));
  }

  /**
   * Removes the retractions of exactly {@code interval}. The lines are only marked removed;
   * {@link #cleanup} drops them.
   */
  public void dropRetract(VersionInterval interval) {
    checkInterval(interval);
    for (Retract r : ImmutableList.copyOf(retract)) {
      if (r.interval().equals(interval)) {
        syntax.markRemoved(syntax.line(r.handle()));
        retract.remove(r);
      }
    }
  }

  private void checkInterval(VersionInterval interval) {
    String path = module == null ? "" : module.path();
    checkCanonicalVersion("retract", path, interval.low());
    checkCanonicalVersion("retract", path, interval.high());
    if (Semver.compare(interval.low(), interval.high()) > 0) {
      throw ModFileError.format(
          ErrorKind.INVALID_INTERVAL,
          "retract",
          String.format(
              "low version %s is higher than high version %s", interval.low(), interval.high()));
    }
  }

  /** Returns the comments of a retraction as they currently read in the tree. */
  public String retractRationale(Retract entry) {
    Line line = syntax.line(entry.handle());
    return DirectiveReader.directiveComment(syntax.blockOf(line), line);
  }

  /** Removes duplicate entries and sorts the lines of every block. */
  public void sortBlocks() {
    boolean semverExcludes = go != null && GoVersion.languageAtLeast(go.version(), 1, 21);
    ImmutableSet<Integer> removed = new BlockSorter(syntax, Dialect.MODULE, semverExcludes).sort();
    if (!removed.isEmpty()) {
      dropRemoved();
    }
  }

  /** Drops removed lines and empty blocks, and turns single-line blocks into plain lines. */
  public void cleanup() {
    syntax.cleanup();
    dropRemoved();
  }

  private void dropRemoved() {
    require.removeIf(r -> syntax.line(r.handle()).isRemoved());
    exclude.removeIf(x -> syntax.line(x.handle()).isRemoved());
    replace.removeIf(r -> syntax.line(r.handle()).isRemoved());
    retract.removeIf(r -> syntax.line(r.handle()).isRemoved());
  }

  /** Returns the file in canonical form. */
  public byte[] format() {
    return Pretty.format(syntax).getBytes(UTF_8);
  }

  /**
   * Checks that an edit uses a canonical version that agrees with the major version suffix of
   * its module path.
   */
  static void checkCanonicalVersion(String verb, String path, String version) {
    try {
      if (version.isEmpty() || !version.equals(ModulePaths.canonicalVersion(version))) {
        throw new InvalidVersionException(version, "must be of the form v1.2.3");
      }
      Optional<String> major = ModulePaths.pathMajor(path);
      if (major.isPresent()) {
        ModulePaths.checkPathMajor(version, major.get());
      }
    } catch (InvalidVersionException e) {
      throw ModFileError.format(ErrorKind.INVALID_VERSION, verb, path, e.version(), e.reason());
    }
  }
}
