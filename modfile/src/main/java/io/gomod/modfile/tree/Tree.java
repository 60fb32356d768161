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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A statement of a go.mod or go.work file.
 *
 * <p>Unlike most syntax trees, statements are mutable: edits update tokens and comments in place
 * so that the comments and block structure around an edited line survive.
 */
public abstract class Tree {

  public abstract Kind kind();

  public abstract <I extends @Nullable Object, O extends @Nullable Object> O accept(
      Visitor<I, O> visitor, I input);

  private final int position;
  private final Comments comments = new Comments();

  protected Tree(int position) {
    this.position = position;
  }

  /** The source offset of the statement, or -1 if it was created by an edit. */
  public int position() {
    return position;
  }

  /** Comments above the statement and at the end of its (last) line. */
  public Comments comments() {
    return comments;
  }

  /** Statement kind. */
  public enum Kind {
    LINE,
    LINE_BLOCK,
    COMMENT_BLOCK
  }

  /**
   * A single line of tokens. A free-standing line starts with its verb; a line inside a block
   * omits it. A line whose tokens are empty has been removed and is dropped by the next cleanup.
   */
  public static class Line extends Tree {

    private final int id;
    private final List<String> tokens;
    private final List<Integer> tokenPositions;
    private boolean inBlock;

    Line(int id, int position, List<String> tokens, List<Integer> tokenPositions, boolean inBlock) {
      super(position);
      this.id = id;
      this.tokens = new ArrayList<>(tokens);
      this.tokenPositions = new ArrayList<>(tokenPositions);
      this.inBlock = inBlock;
    }

    @Override
    public Kind kind() {
      return Kind.LINE;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitLine(this, input);
    }

    /** The handle of this line in its file's line arena. */
    public int id() {
      return id;
    }

    public List<String> tokens() {
      return Collections.unmodifiableList(tokens);
    }

    public String token(int index) {
      return tokens.get(index);
    }

    /**
     * The source offset of a token. Falls back to the line position for tokens that were written
     * by an edit.
     */
    public int tokenPosition(int index) {
      return index < tokenPositions.size() ? tokenPositions.get(index) : position();
    }

    /** Rewrites a single token, e.g. to its canonical form. */
    public void setToken(int index, String token) {
      tokens.set(index, token);
    }

    /** Replaces all tokens. Source positions of the old tokens are forgotten. */
    public void setTokens(List<String> newTokens) {
      tokens.clear();
      tokens.addAll(newTokens);
      tokenPositions.clear();
    }

    public boolean inBlock() {
      return inBlock;
    }

    void setInBlock(boolean inBlock) {
      this.inBlock = inBlock;
    }

    public boolean isRemoved() {
      return tokens.isEmpty();
    }
  }

  /** A verb followed by a parenthesized list of lines. */
  public static class LineBlock extends Tree {

    private final ImmutableList<String> verb;
    private final List<Line> lines;
    private final Comments lparen = new Comments();
    private final Comments rparen = new Comments();

    public LineBlock(int position, ImmutableList<String> verb, List<Line> lines) {
      super(position);
      this.verb = verb;
      this.lines = new ArrayList<>(lines);
    }

    @Override
    public Kind kind() {
      return Kind.LINE_BLOCK;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitLineBlock(this, input);
    }

    /** The tokens before the opening paren; usually just the verb. */
    public ImmutableList<String> verb() {
      return verb;
    }

    /** The lines inside the block, in order. */
    public List<Line> lines() {
      return lines;
    }

    /** Comments after the opening paren. */
    public Comments lparen() {
      return lparen;
    }

    /** Comments above the closing paren. */
    public Comments rparen() {
      return rparen;
    }
  }

  /** A group of whole-line comments that is not attached to a statement. */
  public static class CommentBlock extends Tree {

    public CommentBlock(int position) {
      super(position);
    }

    @Override
    public Kind kind() {
      return Kind.COMMENT_BLOCK;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitCommentBlock(this, input);
    }
  }

  /** A visitor for {@link Tree}s. */
  public interface Visitor<I extends @Nullable Object, O extends @Nullable Object> {
    O visitLine(Line line, I input);

    O visitLineBlock(LineBlock block, I input);

    O visitCommentBlock(CommentBlock block, I input);
  }
}
