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

package io.gomod.modfile.diag;

import static java.util.stream.Collectors.joining;

import com.google.common.collect.ImmutableList;

/** A syntax, directive or edit error, carrying one or more diagnostics. */
public class ModFileError extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** A diagnostic kind. */
  public enum ErrorKind {
    INVALID_UTF8("invalid UTF-8 encoding"),
    UNEXPECTED_INPUT("unexpected input character %s"),
    UNEXPECTED_TOKEN("syntax error (unexpected %s)"),
    UNTERMINATED_STRING("unterminated quoted string"),
    BLOCK_COMMENT("mod files must use // comments, not /* */ comments"),
    UNMATCHED_PAREN("syntax error (unmatched '%s')"),
    UNTERMINATED_BLOCK("syntax error (unterminated block)"),
    EXPECTED_NEWLINE("syntax error (expected newline after closing paren)"),
    UNKNOWN_DIRECTIVE("unknown directive: %s"),
    REPEATED_DIRECTIVE("repeated %s statement"),
    USAGE("usage: %s"),
    INVALID_QUOTED_STRING("invalid quoted string: %s"),
    INVALID_GO_VERSION("invalid go version '%s': must match format 1.23.0"),
    INVALID_VERSION("%s %s: version \"%s\" invalid: %s"),
    INVALID_MODULE_PATH("%s: malformed module path \"%s\": %s"),
    INVALID_REPLACEMENT("replace %s: %s"),
    INVALID_INTERVAL("%s: %s"),
    UNEXPECTED_ARGUMENT("unexpected token after version: \"%s\""),
    INVALID_EDIT("%s");

    private final String message;

    ErrorKind(String message) {
      this.message = message;
    }

    String format(Object... args) {
      return String.format(message, args);
    }
  }

  /** Formats an error that is not tied to a source position, e.g. a rejected edit. */
  public static ModFileError format(ErrorKind kind, Object... args) {
    return new ModFileError(ImmutableList.of(ModFileDiagnostic.format(kind, args)));
  }

  /**
   * Formats an error at a source position.
   *
   * @param source the file being parsed
   * @param position the offset of the offending token
   * @param kind the error kind
   * @param args format args
   */
  public static ModFileError format(
      SourceFile source, int position, ErrorKind kind, Object... args) {
    return new ModFileError(
        ImmutableList.of(ModFileDiagnostic.format(source, position, kind, args)));
  }

  private final ImmutableList<ModFileDiagnostic> diagnostics;

  public ModFileError(ImmutableList<ModFileDiagnostic> diagnostics) {
    this.diagnostics = diagnostics;
  }

  @Override
  public String getMessage() {
    return diagnostics.stream().map(ModFileDiagnostic::diagnostic).collect(joining("\n"));
  }

  public ImmutableList<ModFileDiagnostic> diagnostics() {
    return diagnostics;
  }
}
