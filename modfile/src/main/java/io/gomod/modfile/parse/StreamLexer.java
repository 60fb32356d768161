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

import com.google.common.base.CharMatcher;
import io.gomod.modfile.diag.ModFileError;
import io.gomod.modfile.diag.ModFileError.ErrorKind;
import io.gomod.modfile.diag.SourceFile;

/** A {@link Lexer} over the decoded text of a {@link SourceFile}. */
public class StreamLexer implements Lexer {

  private static final CharMatcher TRAILING_SPACE = CharMatcher.whitespace();

  private final SourceFile source;
  private final String input;

  /** The offset of the next unread character. */
  private int offset;

  /** The start position of the current token. */
  private int position;

  /** The text of the current token. */
  private String value = "";

  /** Whether a non-comment token has been seen on the current line. */
  private boolean lineHasToken;

  public StreamLexer(SourceFile source) {
    this.source = source;
    this.input = source.source();
  }

  @Override
  public String stringValue() {
    return value;
  }

  @Override
  public int position() {
    return position;
  }

  @Override
  public SourceFile source() {
    return source;
  }

  private int peek(int ahead) {
    int i = offset + ahead;
    return i < input.length() ? input.charAt(i) : -1;
  }

  private Token punct(Token token) {
    offset++;
    value = token.toString();
    lineHasToken = true;
    return token;
  }

  @Override
  public Token next() {
    while (true) {
      position = offset;
      int ch = peek(0);
      switch (ch) {
        case -1:
          value = "";
          return Token.EOF;
        case ' ':
        case '\t':
        case '\r':
          offset++;
          continue;
        case '\n':
          offset++;
          value = "\n";
          lineHasToken = false;
          return Token.NEWLINE;
        case '(':
          return punct(Token.LPAREN);
        case ')':
          return punct(Token.RPAREN);
        case '[':
          return punct(Token.LBRACK);
        case ']':
          return punct(Token.RBRACK);
        case ',':
          return punct(Token.COMMA);
        case '"':
        case '`':
          return quoted((char) ch);
        case '/':
          if (peek(1) == '/') {
            return comment();
          }
          if (peek(1) == '*') {
            throw error(ErrorKind.BLOCK_COMMENT);
          }
          return identifier();
        case '{':
        case '}':
          throw error(ErrorKind.UNEXPECTED_INPUT, String.format("'%c'", (char) ch));
        default:
          if (Character.isISOControl(ch)) {
            throw error(ErrorKind.UNEXPECTED_INPUT, String.format("U+%04X", ch));
          }
          return identifier();
      }
    }
  }

  /** Reads a comment through the end of the line, consuming the line terminator. */
  private Token comment() {
    int end = input.indexOf('\n', offset);
    if (end == -1) {
      end = input.length();
      offset = end;
    } else {
      offset = end + 1;
    }
    value = TRAILING_SPACE.trimTrailingFrom(input.substring(position, end));
    boolean suffix = lineHasToken;
    lineHasToken = false;
    return suffix ? Token.EOL_COMMENT : Token.COMMENT;
  }

  private Token quoted(char quote) {
    offset++;
    while (true) {
      int ch = peek(0);
      if (ch == -1 || ch == '\n') {
        throw error(ErrorKind.UNTERMINATED_STRING);
      }
      offset++;
      if (ch == quote) {
        break;
      }
      if (ch == '\\' && quote == '"' && peek(0) != -1 && peek(0) != '\n') {
        offset++;
      }
    }
    value = input.substring(position, offset);
    lineHasToken = true;
    return Token.STRING;
  }

  private Token identifier() {
    while (offset < input.length()) {
      char c = input.charAt(offset);
      if (isIdentTerminator(c)) {
        break;
      }
      if (c == '/' && peek(1) == '/') {
        break;
      }
      if (c == '/' && peek(1) == '*') {
        throw error(ErrorKind.BLOCK_COMMENT);
      }
      offset++;
    }
    value = input.substring(position, offset);
    lineHasToken = true;
    return isVersionLike(value) ? Token.VERSION : Token.IDENT;
  }

  private static boolean isIdentTerminator(char c) {
    switch (c) {
      case ' ':
      case '\t':
      case '\r':
      case '\n':
      case '(':
      case ')':
      case '[':
      case ']':
      case '{':
      case '}':
      case ',':
        return true;
      default:
        return Character.isWhitespace(c) || Character.isISOControl(c);
    }
  }

  /** Returns true for {@code v1...}, {@code 1.2...} and {@code go1...} shaped identifiers. */
  static boolean isVersionLike(String s) {
    int i = 0;
    if (s.startsWith("go")) {
      i = 2;
    } else if (s.startsWith("v")) {
      i = 1;
    }
    return i < s.length() && Character.isDigit(s.charAt(i));
  }

  private ModFileError error(ErrorKind kind, Object... args) {
    return ModFileError.format(source, offset, kind, args);
  }
}
