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

package io.gomod.modfile.parse;

import io.gomod.modfile.diag.SourceFile;

/** A go.mod lexer. */
public interface Lexer {
  /** Returns the next token in the input stream, or {@code EOF}. */
  Token next();

  /**
   * Returns the text of the current token. Quoted strings keep their quotes; comments are returned
   * without their line terminator.
   */
  String stringValue();

  /** Returns the start position of the current token. */
  int position();

  /** Returns the source file for diagnostics. */
  SourceFile source();
}
