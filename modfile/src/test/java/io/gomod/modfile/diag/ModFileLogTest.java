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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.common.collect.ImmutableList;
import io.gomod.modfile.diag.ModFileError.ErrorKind;
import org.junit.jupiter.api.Test;

class ModFileLogTest {

  @Test
  void collectsInOrderWithoutDuplicates() {
    SourceFile source = new SourceFile("go.mod", "module m\nfoo bar\n");
    ModFileLog log = new ModFileLog(source);
    assertFalse(log.anyErrors());
    log.maybeThrow();

    log.error(9, ErrorKind.UNKNOWN_DIRECTIVE, "foo");
    log.error(0, ErrorKind.REPEATED_DIRECTIVE, "module");
    log.error(9, ErrorKind.UNKNOWN_DIRECTIVE, "foo");
    assertTrue(log.anyErrors());
    assertEquals(2, log.diagnostics().size());

    ModFileError e = assertThrows(ModFileError.class, log::maybeThrow);
    assertEquals(
        "go.mod:2:1: unknown directive: foo\ngo.mod:1:1: repeated module statement",
        e.getMessage());
    assertEquals(ImmutableList.of(2, 1), ImmutableList.of(
        e.diagnostics().get(0).line(), e.diagnostics().get(1).line()));
  }

  @Test
  void positionlessError() {
    ModFileError e = ModFileError.format(ErrorKind.INVALID_EDIT, "no module");
    ModFileDiagnostic d = e.diagnostics().get(0);
    assertEquals("<>", d.path());
    assertEquals(-1, d.line());
    assertEquals(-1, d.column());
    assertEquals("no module", d.message());
    assertEquals("<>: no module", e.getMessage());
  }

  @Test
  void positionedError() {
    SourceFile source = new SourceFile("go.work", "go 1.21\nuse ./a\n");
    ModFileError e = ModFileError.format(source, 12, ErrorKind.USAGE, "use local/dir");
    ModFileDiagnostic d = e.diagnostics().get(0);
    assertEquals(ErrorKind.USAGE, d.kind());
    assertEquals(ImmutableList.of("use local/dir"), d.args());
    assertEquals("go.work:2:5: usage: use local/dir", d.diagnostic());
  }
}
