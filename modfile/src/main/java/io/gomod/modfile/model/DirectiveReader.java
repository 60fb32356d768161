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

import com.google.common.base.Joiner;
import io.gomod.modfile.diag.ModFileError.ErrorKind;
import io.gomod.modfile.diag.ModFileLog;
import io.gomod.modfile.parse.ParsePolicy;
import io.gomod.modfile.parse.QuotedStrings;
import io.gomod.modfile.parse.VersionFixer;
import io.gomod.modfile.tree.Comment;
import io.gomod.modfile.tree.Comments;
import io.gomod.modfile.tree.FileSyntax;
import io.gomod.modfile.tree.Tree;
import io.gomod.modfile.tree.Tree.Line;
import io.gomod.modfile.tree.Tree.LineBlock;
import io.gomod.modfile.version.GoVersion;
import io.gomod.modfile.version.InvalidVersionException;
import io.gomod.modfile.version.ModulePaths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Interprets the lines of a parsed file as directives. Argument helpers canonicalize what they
 * read and write it back into the line, so that formatting shows the canonical form.
 */
class DirectiveReader {

  private static final Logger logger = LoggerFactory.getLogger(DirectiveReader.class);

  /** Handles one directive line. */
  interface Handler {
    void handle(@Nullable LineBlock block, Line line, String verb, List<String> args)
        throws DirectiveException;
  }

  private final FileSyntax syntax;
  private final ModFileLog log;
  private final @Nullable VersionFixer fixer;
  private final ParsePolicy policy;

  DirectiveReader(
      FileSyntax syntax, ModFileLog log, @Nullable VersionFixer fixer, ParsePolicy policy) {
    this.syntax = syntax;
    this.log = log;
    this.fixer = fixer;
    this.policy = policy;
  }

  ParsePolicy policy() {
    return policy;
  }

  /** Calls {@code handler} for every directive line, logging the errors it reports. */
  void forEach(Handler handler) {
    for (Tree stmt : syntax.statements()) {
      if (stmt instanceof Line) {
        Line line = (Line) stmt;
        List<String> tokens = line.tokens();
        dispatch(handler, null, line, tokens.get(0), tokens.subList(1, tokens.size()));
      } else if (stmt instanceof LineBlock) {
        LineBlock block = (LineBlock) stmt;
        if (block.verb().size() > 1) {
          if (policy.rejectUnknownDirectives()) {
            log.error(
                block.position(), ErrorKind.UNKNOWN_DIRECTIVE, Joiner.on(' ').join(block.verb()));
          }
          continue;
        }
        for (Line line : block.lines()) {
          dispatch(handler, block, line, block.verb().get(0), line.tokens());
        }
      }
    }
  }

  private void dispatch(
      Handler handler, @Nullable LineBlock block, Line line, String verb, List<String> args) {
    try {
      handler.handle(block, line, verb, args);
    } catch (DirectiveException e) {
      log.error(e.position(), e.kind(), e.args());
    }
  }

  /** Reports or ignores a verb the dialect does not know, depending on the policy. */
  void unknown(Line line, String verb) throws DirectiveException {
    if (policy.rejectUnknownDirectives()) {
      throw new DirectiveException(line.position(), ErrorKind.UNKNOWN_DIRECTIVE, verb);
    }
    logger.debug("{}: ignoring unknown directive {}", syntax.name(), verb);
  }

  static DirectiveException usage(Line line, String usage) {
    return new DirectiveException(line.position(), ErrorKind.USAGE, usage);
  }

  private static int tokenIndex(Line line, int arg) {
    return line.inBlock() ? arg : arg + 1;
  }

  static int argPosition(Line line, int arg) {
    return line.tokenPosition(tokenIndex(line, arg));
  }

  /** Reads a possibly quoted string argument. */
  String string(Line line, int arg) throws DirectiveException {
    int index = tokenIndex(line, arg);
    String token = line.token(index);
    String value;
    if (token.startsWith("\"") || token.startsWith("`")) {
      Optional<String> unquoted = QuotedStrings.unquote(token);
      if (unquoted.isEmpty()) {
        throw new DirectiveException(
            line.tokenPosition(index), ErrorKind.INVALID_QUOTED_STRING, token);
      }
      value = unquoted.get();
    } else if (token.indexOf('"') != -1 || token.indexOf('\'') != -1 || token.indexOf('`') != -1) {
      throw new DirectiveException(
          line.tokenPosition(index), ErrorKind.INVALID_QUOTED_STRING, token);
    } else {
      value = token;
    }
    line.setToken(index, QuotedStrings.autoQuote(value));
    return value;
  }

  /**
   * Reads a version argument of module {@code path}, passing it through the version fixer. The
   * result is canonical.
   */
  String version(String verb, String path, Line line, int arg) throws DirectiveException {
    int index = tokenIndex(line, arg);
    int position = line.tokenPosition(index);
    String version = string(line, arg);
    if (fixer != null) {
      try {
        version = fixer.fix(path, version);
      } catch (InvalidVersionException e) {
        throw new DirectiveException(
            position, ErrorKind.INVALID_VERSION, verb, path, e.version(), e.reason());
      }
    }
    String canonical = ModulePaths.canonicalVersion(version);
    if (canonical.isEmpty()) {
      throw new DirectiveException(
          position, ErrorKind.INVALID_VERSION, verb, path, version, "must be of the form v1.2.3");
    }
    line.setToken(index, canonical);
    return canonical;
  }

  /** Returns the major version suffix of a module path argument. */
  static String pathMajor(String verb, String path, Line line, int arg) throws DirectiveException {
    Optional<String> major = ModulePaths.pathMajor(path);
    if (major.isEmpty()) {
      throw new DirectiveException(
          argPosition(line, arg),
          ErrorKind.INVALID_MODULE_PATH,
          verb,
          path,
          "invalid major version suffix");
    }
    return major.get();
  }

  static void checkPathMajor(String verb, String path, String version, Line line, int arg)
      throws DirectiveException {
    String major = pathMajor(verb, path, line, 0);
    try {
      ModulePaths.checkPathMajor(version, major);
    } catch (InvalidVersionException e) {
      throw new DirectiveException(
          argPosition(line, arg), ErrorKind.INVALID_VERSION, verb, path, e.version(), e.reason());
    }
  }

  /** Reads the argument of a {@code go} directive. */
  String goVersion(Line line, List<String> args) throws DirectiveException {
    if (args.size() != 1) {
      throw usage(line, "go 1.23");
    }
    String version = args.get(0);
    if (GoVersion.isValidLanguageVersion(version)) {
      return version;
    }
    if (policy.fixLanguageVersions()) {
      Optional<String> fixed = GoVersion.fixLanguageVersion(version);
      if (fixed.isPresent()) {
        logger.debug("{}: reading go version {} as {}", syntax.name(), version, fixed.get());
        line.setToken(tokenIndex(line, 0), fixed.get());
        return fixed.get();
      }
    }
    throw new DirectiveException(argPosition(line, 0), ErrorKind.INVALID_GO_VERSION, version);
  }

  /** Reads {@code replace old [v] => new [v]}. */
  Replace replace(Line line, String verb, List<String> args) throws DirectiveException {
    int arrow = args.size() >= 2 && args.get(1).equals("=>") ? 1 : 2;
    if (args.size() < arrow + 2 || args.size() > arrow + 3 || !args.get(arrow).equals("=>")) {
      throw usage(
          line,
          verb
              + " module/path [v1.2.3] => other/module v1.4 or "
              + verb
              + " module/path [v1.2.3] => ../local/directory");
    }
    String oldPath = string(line, 0);
    String oldMajor = pathMajor(verb, oldPath, line, 0);
    String oldVersion = "";
    if (arrow == 2) {
      oldVersion = version(verb, oldPath, line, 1);
      try {
        ModulePaths.checkPathMajor(oldVersion, oldMajor);
      } catch (InvalidVersionException e) {
        throw new DirectiveException(
            argPosition(line, 1),
            ErrorKind.INVALID_VERSION,
            verb,
            oldPath,
            e.version(),
            e.reason());
      }
    }
    String newPath = string(line, arrow + 1);
    String newVersion = "";
    if (args.size() == arrow + 2) {
      if (!ModulePaths.isDirectoryPath(newPath)) {
        throw new DirectiveException(
            argPosition(line, arrow + 1),
            ErrorKind.INVALID_REPLACEMENT,
            oldPath,
            newPath.contains("@")
                ? "replacement module must match format 'path version', not 'path@version'"
                : "replacement module without version must be directory path"
                    + " (rooted or starting with . or ..)");
      }
    } else {
      newVersion = version(verb, newPath, line, arrow + 2);
      if (ModulePaths.isDirectoryPath(newPath)) {
        throw new DirectiveException(
            argPosition(line, arrow + 1),
            ErrorKind.INVALID_REPLACEMENT,
            oldPath,
            "replacement module directory path \"" + newPath + "\" cannot have version");
      }
    }
    return Replace.create(
        ModuleVersion.create(oldPath, oldVersion),
        ModuleVersion.create(newPath, newVersion),
        line.id());
  }

  /**
   * Returns the comment text belonging to a directive: the comments above and after its line, or
   * when there are none, those of the enclosing block. Blank comment lines separate paragraphs.
   */
  static String directiveComment(@Nullable LineBlock block, Line line) {
    Comments comments = line.comments();
    if (block != null && comments.isEmpty()) {
      comments = block.comments();
    }
    List<String> lines = new ArrayList<>();
    for (Comment c : comments.before()) {
      if (!c.isBlank()) {
        lines.add(c.text());
      }
    }
    for (Comment c : comments.suffix()) {
      lines.add(c.text());
    }
    return String.join("\n", lines);
  }
}
