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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import io.gomod.modfile.diag.ModFileError.ErrorKind;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/** A single error report. */
public class ModFileDiagnostic {

  private final ErrorKind kind;
  private final ImmutableList<Object> args;
  private final @Nullable SourceFile source;
  private final int position;

  private ModFileDiagnostic(
      ErrorKind kind, ImmutableList<Object> args, @Nullable SourceFile source, int position) {
    this.kind = requireNonNull(kind);
    this.args = requireNonNull(args);
    this.source = source;
    this.position = position;
  }

  static ModFileDiagnostic format(ErrorKind kind, Object... args) {
    return new ModFileDiagnostic(kind, ImmutableList.copyOf(args), null, -1);
  }

  /**
   * Formats a diagnostic.
   *
   * @param source the current source file
   * @param position the diagnostic position
   * @param kind the error kind
   * @param args format args
   */
  public static ModFileDiagnostic format(
      SourceFile source, int position, ErrorKind kind, Object... args) {
    return new ModFileDiagnostic(kind, ImmutableList.copyOf(args), source, position);
  }

  /** The diagnostic kind. */
  public ErrorKind kind() {
    return kind;
  }

  /** The diagnostic arguments. */
  public ImmutableList<Object> args() {
    return args;
  }

  /** The rendered diagnostic, {@code file:line:column: message}. */
  public String diagnostic() {
    StringBuilder sb = new StringBuilder(path());
    if (line() != -1) {
      sb.append(':').append(line()).append(':').append(column());
    }
    return sb.append(": ").append(message()).toString();
  }

  public String path() {
    return source != null && source.path() != null ? source.path() : "<>";
  }

  @SuppressWarnings("nullness") // position != -1 implies source is non-null
  public int line() {
    return position != -1 ? source.lineMap().lineNumber(position) : -1;
  }

  /** The one-indexed column, or -1 if the diagnostic has no position. */
  @SuppressWarnings("nullness") // position != -1 implies source is non-null
  public int column() {
    return position != -1 ? source.lineMap().column(position) + 1 : -1;
  }

  public String message() {
    return kind.format(args.toArray());
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, source, position);
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (!(obj instanceof ModFileDiagnostic)) {
      return false;
    }
    ModFileDiagnostic that = (ModFileDiagnostic) obj;
    return kind.equals(that.kind)
        && args.equals(that.args)
        && Objects.equals(source, that.source)
        && position == that.position;
  }

  @Override
  public String toString() {
    return diagnostic();
  }
}
