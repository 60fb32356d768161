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

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import io.gomod.modfile.tree.Comment;
import io.gomod.modfile.tree.Tree.Line;
import java.util.List;

/**
 * The {@code // indirect} suffix comment of a require line. Other text in the comment is kept
 * after an {@code indirect;} prefix.
 */
final class IndirectMarker {

  private static final String SLASH_SLASH = "//";
  private static final String INDIRECT = "indirect";
  private static final String INDIRECT_PREFIX = "indirect;";

  private static final Splitter FIELDS =
      Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

  static boolean isIndirect(Line line) {
    List<Comment> suffix = line.comments().suffix();
    if (suffix.isEmpty()) {
      return false;
    }
    List<String> fields = FIELDS.splitToList(stripSlashes(suffix.get(0).token()));
    return (fields.size() == 1 && fields.get(0).equals(INDIRECT))
        || (fields.size() > 1 && fields.get(0).equals(INDIRECT_PREFIX));
  }

  /** Adds or removes the marker. A comment that already reads as intended is left untouched. */
  static void setIndirect(Line line, boolean indirect) {
    if (isIndirect(line) == indirect) {
      return;
    }
    List<Comment> suffix = line.comments().suffix();
    if (indirect) {
      if (suffix.isEmpty()) {
        suffix.add(Comment.synthetic("// indirect", true));
        return;
      }
      Comment comment = suffix.get(0);
      String text = stripSlashes(comment.token()).trim();
      if (text.isEmpty()) {
        suffix.set(0, comment.withToken("// indirect"));
      } else {
        suffix.set(0, comment.withToken("// indirect; " + text));
      }
      return;
    }
    Comment comment = suffix.get(0);
    if (stripSlashes(comment.token()).trim().equals(INDIRECT)) {
      suffix.remove(0);
      return;
    }
    String token = comment.token();
    int i = token.indexOf(INDIRECT_PREFIX);
    suffix.set(0, comment.withToken(SLASH_SLASH + token.substring(i + INDIRECT_PREFIX.length())));
  }

  private static String stripSlashes(String token) {
    return token.startsWith(SLASH_SLASH) ? token.substring(SLASH_SLASH.length()) : token;
  }

  private IndirectMarker() {}
}
