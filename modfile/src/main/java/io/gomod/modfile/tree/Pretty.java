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

import com.google.common.base.CharMatcher;
import com.google.common.base.Strings;
import io.gomod.modfile.tree.Tree.CommentBlock;
import io.gomod.modfile.tree.Tree.Line;
import io.gomod.modfile.tree.Tree.LineBlock;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Prints a {@link FileSyntax} in canonical form: one blank line between statements, block contents
 * indented with a tab, suffix comments separated from their line by a single space.
 */
public class Pretty implements Tree.Visitor<@Nullable Void, @Nullable Void> {

  private static final CharMatcher SPACE_OR_TAB = CharMatcher.anyOf(" \t");

  /** Formats a file. The result is empty or ends with exactly one newline. */
  public static String format(FileSyntax file) {
    Pretty pretty = new Pretty();
    List<Tree> statements = file.statements();
    boolean first = true;
    for (Tree stmt : statements) {
      if (stmt instanceof Line && ((Line) stmt).isRemoved()) {
        continue;
      }
      if (!first) {
        pretty.newline();
      }
      first = false;
      stmt.accept(pretty, null);
      if (!(stmt instanceof CommentBlock)) {
        pretty.newline();
      }
    }
    return pretty.finish();
  }

  private final StringBuilder sb = new StringBuilder();

  /** Suffix comments waiting for the end of the current line. */
  private final List<Comment> pending = new ArrayList<>();

  private int margin = 0;

  /** Whether nothing has been printed since the last opening paren. */
  private boolean blockStart = false;

  private void trim() {
    int end = sb.length();
    while (end > 0 && SPACE_OR_TAB.matches(sb.charAt(end - 1))) {
      end--;
    }
    sb.setLength(end);
  }

  /** Ends the current line, flushing pending suffix comments. */
  private void newline() {
    if (!pending.isEmpty()) {
      sb.append(' ');
      for (int i = 0; i < pending.size(); i++) {
        if (i > 0) {
          trim();
          sb.append('\n').append(Strings.repeat("\t", margin));
        }
        sb.append(pending.get(i).token().trim());
      }
      pending.clear();
    }
    trim();
    int n = sb.length();
    if (n == 0 || (n >= 2 && sb.charAt(n - 1) == '\n' && sb.charAt(n - 2) == '\n')) {
      // no blank line at the top of the file, and never two in a row
      return;
    }
    sb.append('\n').append(Strings.repeat("\t", margin));
  }

  private String finish() {
    trim();
    int end = sb.length();
    while (end > 0 && sb.charAt(end - 1) == '\n') {
      end--;
    }
    sb.setLength(end);
    if (end > 0) {
      sb.append('\n');
    }
    return sb.toString();
  }

  private void printBefore(List<Comment> before) {
    for (Comment c : before) {
      if (c.isBlank() && blockStart) {
        continue;
      }
      sb.append(c.token().trim());
      blockStart = false;
      newline();
    }
  }

  private void tokens(List<String> tokens) {
    String sep = "";
    for (String t : tokens) {
      if (t.equals(",") || t.equals(")") || t.equals("]")) {
        sep = "";
      }
      sb.append(sep).append(t);
      sep = " ";
      if (t.equals("(") || t.equals("[")) {
        sep = "";
      }
    }
  }

  @Override
  public @Nullable Void visitLine(Line line, @Nullable Void input) {
    printBefore(line.comments().before());
    tokens(line.tokens());
    blockStart = false;
    pending.addAll(line.comments().suffix());
    return null;
  }

  @Override
  public @Nullable Void visitLineBlock(LineBlock block, @Nullable Void input) {
    printBefore(block.comments().before());
    tokens(block.verb());
    sb.append(" (");
    pending.addAll(block.lparen().suffix());
    blockStart = true;
    margin++;
    for (Line line : block.lines()) {
      if (line.isRemoved()) {
        continue;
      }
      newline();
      line.accept(this, null);
    }
    for (Comment c : block.rparen().before()) {
      newline();
      sb.append(c.token().trim());
    }
    margin--;
    newline();
    sb.append(')');
    blockStart = false;
    pending.addAll(block.comments().suffix());
    return null;
  }

  @Override
  public @Nullable Void visitCommentBlock(CommentBlock block, @Nullable Void input) {
    printBefore(block.comments().before());
    return null;
  }
}
