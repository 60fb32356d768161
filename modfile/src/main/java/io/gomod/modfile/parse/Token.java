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

/** go.mod and go.work tokens. */
public enum Token {
  IDENT("<identifier>"),
  STRING("<quoted string>"),
  VERSION("<version>"),
  LPAREN("("),
  RPAREN(")"),
  LBRACK("["),
  RBRACK("]"),
  COMMA(","),
  /** A comment on a line of its own. */
  COMMENT("<comment>"),
  /** A comment following other tokens on the same line. */
  EOL_COMMENT("<comment>"),
  NEWLINE("newline"),
  EOF("EOF");

  private final String value;

  Token(String value) {
    this.value = value;
  }

  @Override
  public String toString() {
    return value;
  }

  /** Returns true for the tokens that end a line. */
  public boolean isEol() {
    return this == NEWLINE || this == EOL_COMMENT || this == EOF;
  }
}
