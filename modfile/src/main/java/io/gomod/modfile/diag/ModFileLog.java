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

import com.google.common.collect.ImmutableList;
import io.gomod.modfile.diag.ModFileError.ErrorKind;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Collects the directive errors of one file, so that all of them can be reported together once
 * the whole file has been read.
 */
public class ModFileLog {

  private final Set<ModFileDiagnostic> diagnostics = new LinkedHashSet<>();
  private final SourceFile source;

  public ModFileLog(SourceFile source) {
    this.source = source;
  }

  public SourceFile source() {
    return source;
  }

  public ImmutableList<ModFileDiagnostic> diagnostics() {
    return ImmutableList.copyOf(diagnostics);
  }

  public boolean anyErrors() {
    return !diagnostics.isEmpty();
  }

  /** Throws a {@link ModFileError} holding every diagnostic, if there are any. */
  public void maybeThrow() {
    if (anyErrors()) {
      throw new ModFileError(diagnostics());
    }
  }

  public void error(int position, ErrorKind kind, Object... args) {
    diagnostics.add(ModFileDiagnostic.format(source, position, kind, args));
  }
}
