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

package io.gomod.modfile.tree;

import com.google.auto.value.AutoValue;
import com.google.errorprone.annotations.Immutable;

/**
 * A {@code //} comment. A comment with an empty token marks a blank line inside a block.
 */
@AutoValue
@Immutable
public abstract class Comment {

  private static final String SLASH_SLASH = "//";

  public static Comment create(int position, String token, boolean suffix) {
    return new AutoValue_Comment(position, token, suffix);
  }

  /** A comment written by an edit rather than read from source. */
  public static Comment synthetic(String token, boolean suffix) {
    return create(-1, token, suffix);
  }

  /** A blank-line marker. */
  public static Comment blank() {
    return create(-1, "", false);
  }

  /** The source offset, or -1 for comments created by edits. */
  public abstract int position();

  /** The comment text including the leading {@code //}, or "" for a blank-line marker. */
  public abstract String token();

  /** Whether the comment follows other tokens on its line. */
  public abstract boolean suffix();

  public boolean isBlank() {
    return token().isEmpty();
  }

  /** The text after {@code //}, trimmed. */
  public String text() {
    String token = token();
    if (token.startsWith(SLASH_SLASH)) {
      token = token.substring(SLASH_SLASH.length());
    }
    return token.trim();
  }

  /** Returns a copy with a different token. */
  public Comment withToken(String token) {
    return create(position(), token, suffix());
  }
}
