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

import java.util.Optional;

/** Quoting of directive arguments that cannot be written as bare identifiers. */
public final class QuotedStrings {

  /** Returns true if {@code s} must be quoted to survive a parse/format round trip. */
  public static boolean mustQuote(String s) {
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      switch (c) {
        case ' ':
        case '"':
        case '\'':
        case '`':
          return true;
        case '(':
        case ')':
        case '[':
        case ']':
        case '{':
        case '}':
        case ',':
          if (s.length() > 1) {
            return true;
          }
          break;
        default:
          if (!isPrintable(c)) {
            return true;
          }
      }
    }
    return s.isEmpty() || s.contains("//") || s.contains("/*");
  }

  /** Returns {@code s}, quoted only if {@link #mustQuote} requires it. */
  public static String autoQuote(String s) {
    return mustQuote(s) ? quote(s) : s;
  }

  /** Returns {@code s} as a double-quoted string with backslash escapes. */
  public static String quote(String s) {
    StringBuilder sb = new StringBuilder(s.length() + 2).append('"');
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      switch (c) {
        case '"':
          sb.append("\\\"");
          break;
        case '\\':
          sb.append("\\\\");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\t':
          sb.append("\\t");
          break;
        case '\r':
          sb.append("\\r");
          break;
        case '\b':
          sb.append("\\b");
          break;
        case '\f':
          sb.append("\\f");
          break;
        default:
          if (isPrintable(c) || c == ' ') {
            sb.append(c);
          } else {
            sb.append(String.format("\\u%04x", (int) c));
          }
      }
    }
    return sb.append('"').toString();
  }

  /**
   * Interprets a double-quoted or back-quoted string literal. Returns empty if the literal is
   * malformed.
   */
  public static Optional<String> unquote(String literal) {
    if (literal.length() < 2) {
      return Optional.empty();
    }
    char quote = literal.charAt(0);
    if (literal.charAt(literal.length() - 1) != quote) {
      return Optional.empty();
    }
    String body = literal.substring(1, literal.length() - 1);
    if (quote == '`') {
      if (body.indexOf('`') != -1) {
        return Optional.empty();
      }
      return Optional.of(body.replace("\r", ""));
    }
    if (quote != '"') {
      return Optional.empty();
    }
    StringBuilder sb = new StringBuilder(body.length());
    int i = 0;
    while (i < body.length()) {
      char c = body.charAt(i++);
      if (c == '"' || c == '\n') {
        return Optional.empty();
      }
      if (c != '\\') {
        sb.append(c);
        continue;
      }
      if (i == body.length()) {
        return Optional.empty();
      }
      char e = body.charAt(i++);
      switch (e) {
        case 'a':
          sb.append('\u0007');
          break;
        case 'b':
          sb.append('\b');
          break;
        case 'f':
          sb.append('\f');
          break;
        case 'n':
          sb.append('\n');
          break;
        case 'r':
          sb.append('\r');
          break;
        case 't':
          sb.append('\t');
          break;
        case 'v':
          sb.append('\u000b');
          break;
        case '\\':
        case '"':
          sb.append(e);
          break;
        case 'x':
        case 'u':
        case 'U':
          {
            int digits = e == 'x' ? 2 : e == 'u' ? 4 : 8;
            if (i + digits > body.length()) {
              return Optional.empty();
            }
            int codePoint;
            try {
              codePoint = Integer.parseInt(body.substring(i, i + digits), 16);
            } catch (NumberFormatException ex) {
              return Optional.empty();
            }
            if (!Character.isValidCodePoint(codePoint)) {
              return Optional.empty();
            }
            sb.appendCodePoint(codePoint);
            i += digits;
            break;
          }
        default:
          if ('0' <= e && e <= '7') {
            if (i + 2 > body.length()) {
              return Optional.empty();
            }
            String octal = body.substring(i - 1, i + 2);
            int value = 0;
            for (int k = 0; k < octal.length(); k++) {
              char d = octal.charAt(k);
              if (d < '0' || d > '7') {
                return Optional.empty();
              }
              value = value * 8 + (d - '0');
            }
            if (value > 0xff) {
              return Optional.empty();
            }
            sb.append((char) value);
            i += 2;
            break;
          }
          return Optional.empty();
      }
    }
    return Optional.of(sb.toString());
  }

  private static boolean isPrintable(char c) {
    if (c == ' ') {
      // printable, but a separator
      return true;
    }
    return !Character.isISOControl(c)
        && !Character.isWhitespace(c)
        && Character.getType(c) != Character.UNASSIGNED
        && Character.getType(c) != Character.FORMAT
        && !Character.isSurrogate(c);
  }

  private QuotedStrings() {}
}
