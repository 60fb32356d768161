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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import io.gomod.modfile.tree.Tree.Line;
import io.gomod.modfile.tree.Tree.LineBlock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The statements of one file, plus an arena of every {@link Line} created in it.
 *
 * <p>A line's index in the arena is its handle. Handles stay valid until the line is removed:
 * cleanup collapses a single-line block by rewriting the inner line in place.
 */
public class FileSyntax {

  private static final Logger logger = LoggerFactory.getLogger(FileSyntax.class);

  private final String name;
  private final List<Tree> statements = new ArrayList<>();
  private final List<Line> arena = new ArrayList<>();

  public FileSyntax(String name) {
    this.name = name;
  }

  /** The file name used in diagnostics. */
  public String name() {
    return name;
  }

  public List<Tree> statements() {
    return Collections.unmodifiableList(statements);
  }

  /** Appends a parsed statement. */
  public void addStatement(Tree statement) {
    statements.add(statement);
  }

  /** Creates a line and registers it in the arena. The line is not yet part of any statement. */
  public Line newLine(
      int position, List<String> tokens, List<Integer> tokenPositions, boolean inBlock) {
    Line line = new Line(arena.size(), position, tokens, tokenPositions, inBlock);
    arena.add(line);
    return line;
  }

  private Line newLine(List<String> tokens, boolean inBlock) {
    return newLine(-1, tokens, ImmutableList.of(), inBlock);
  }

  /** Resolves a line handle. */
  public Line line(int handle) {
    checkElementIndex(handle, arena.size(), "line handle");
    return arena.get(handle);
  }

  /** The comments at the top of the file, if the first statement is a free comment group. */
  public ImmutableList<Comment> leadingComments() {
    if (statements.isEmpty() || statements.get(0).kind() != Tree.Kind.COMMENT_BLOCK) {
      return ImmutableList.of();
    }
    return ImmutableList.copyOf(statements.get(0).comments().before());
  }

  /** Returns the block containing {@code line}, or {@code null} for a free-standing line. */
  public @Nullable LineBlock blockOf(Line line) {
    if (!line.inBlock()) {
      return null;
    }
    for (Tree stmt : statements) {
      if (stmt instanceof LineBlock && ((LineBlock) stmt).lines().contains(line)) {
        return (LineBlock) stmt;
      }
    }
    return null;
  }

  /** Returns the statement index of the first statement for the given verb, or -1. */
  public int indexOfVerb(String verb) {
    for (int i = 0; i < statements.size(); i++) {
      if (verb.equals(verbOf(statements.get(i)))) {
        return i;
      }
    }
    return -1;
  }

  /** Returns the index of the top-level statement that is or contains {@code tree}, or -1. */
  public int indexOf(Tree tree) {
    for (int i = 0; i < statements.size(); i++) {
      Tree stmt = statements.get(i);
      if (stmt == tree) {
        return i;
      }
      if (stmt instanceof LineBlock && ((LineBlock) stmt).lines().contains(tree)) {
        return i;
      }
    }
    return -1;
  }

  /** Returns the verb of a free-standing line or block, or {@code null}. */
  public static @Nullable String verbOf(Tree stmt) {
    switch (stmt.kind()) {
      case LINE:
        Line line = (Line) stmt;
        return line.isRemoved() ? null : line.token(0);
      case LINE_BLOCK:
        return ((LineBlock) stmt).verb().get(0);
      case COMMENT_BLOCK:
        return null;
    }
    throw new AssertionError(stmt.kind());
  }

  /** Inserts a new free-standing line at the given statement index. */
  @CanIgnoreReturnValue
  public Line insertLine(int index, List<String> tokens) {
    checkArgument(!tokens.isEmpty(), "empty line");
    Line line = newLine(tokens, false);
    statements.add(index, line);
    return line;
  }

  /**
   * Adds a line of tokens, starting with its verb, next to related statements.
   *
   * <p>Without a hint the line joins the last statement with the same verb: it is appended to a
   * block, or a free-standing line is turned into a block holding both. With a hint the line is
   * placed after the hint. Otherwise it is appended at the end of the file.
   */
  @CanIgnoreReturnValue
  public Line addLine(@Nullable Tree hint, List<String> tokens) {
    checkArgument(!tokens.isEmpty(), "empty line");
    String verb = tokens.get(0);
    List<String> args = tokens.subList(1, tokens.size());
    if (hint == null) {
      for (int i = statements.size() - 1; i >= 0; i--) {
        if (verb.equals(verbOf(statements.get(i)))) {
          hint = statements.get(i);
          break;
        }
      }
    }
    if (hint != null) {
      for (int i = 0; i < statements.size(); i++) {
        Tree stmt = statements.get(i);
        if (stmt instanceof Line && stmt == hint) {
          Line line = (Line) stmt;
          if (!verb.equals(verbOf(line))) {
            return insertLine(i + 1, tokens);
          }
          LineBlock block = new LineBlock(line.position(), ImmutableList.of(verb), List.of(line));
          line.setTokens(ImmutableList.copyOf(line.tokens().subList(1, line.tokens().size())));
          line.setInBlock(true);
          statements.set(i, block);
          Line added = newLine(args, true);
          block.lines().add(added);
          logger.debug("{}: merged {} lines into a block", name, verb);
          return added;
        }
        if (stmt instanceof LineBlock) {
          LineBlock block = (LineBlock) stmt;
          if (stmt == hint) {
            if (!verb.equals(verbOf(block))) {
              return insertLine(i + 1, tokens);
            }
            Line added = newLine(args, true);
            block.lines().add(added);
            return added;
          }
          int j = block.lines().indexOf(hint);
          if (j != -1) {
            if (!verb.equals(verbOf(block))) {
              return insertLine(i + 1, tokens);
            }
            Line added = newLine(args, true);
            block.lines().add(j + 1, added);
            return added;
          }
        }
      }
    }
    return insertLine(statements.size(), tokens);
  }

  /** Replaces the tokens of a line; {@code tokens} starts with the verb. */
  public void updateLine(Line line, List<String> tokens) {
    line.setTokens(line.inBlock() ? tokens.subList(1, tokens.size()) : tokens);
  }

  /** Marks a line removed. It is no longer printed and is dropped by {@link #prune}. */
  public void markRemoved(Line line) {
    line.setTokens(ImmutableList.of());
    line.comments().suffix().clear();
  }

  /** Drops removed lines and empty blocks. */
  public void prune() {
    Iterator<Tree> it = statements.iterator();
    while (it.hasNext()) {
      Tree stmt = it.next();
      if (stmt instanceof Line && ((Line) stmt).isRemoved()) {
        it.remove();
      } else if (stmt instanceof LineBlock) {
        List<Line> lines = ((LineBlock) stmt).lines();
        lines.removeIf(Line::isRemoved);
        if (lines.isEmpty()) {
          it.remove();
        }
      }
    }
  }

  /**
   * Drops removed lines and empty blocks, and rewrites a block holding a single line as a
   * free-standing line, unless there are comments above its closing paren.
   */
  public void cleanup() {
    prune();
    for (int i = 0; i < statements.size(); i++) {
      if (!(statements.get(i) instanceof LineBlock)) {
        continue;
      }
      LineBlock block = (LineBlock) statements.get(i);
      if (block.lines().size() != 1 || !block.rparen().before().isEmpty()) {
        continue;
      }
      Line line = block.lines().get(0);
      List<Comment> before = new ArrayList<>(block.comments().before());
      for (Comment c : line.comments().before()) {
        if (!c.isBlank()) {
          before.add(c);
        }
      }
      List<Comment> suffix = new ArrayList<>(line.comments().suffix());
      suffix.addAll(block.lparen().suffix());
      suffix.addAll(block.comments().suffix());
      List<String> tokens = new ArrayList<>(block.verb());
      tokens.addAll(line.tokens());
      line.setTokens(tokens);
      line.setInBlock(false);
      replace(line.comments().before(), before);
      replace(line.comments().suffix(), suffix);
      statements.set(i, line);
    }
  }

  private static void replace(List<Comment> target, List<Comment> contents) {
    target.clear();
    target.addAll(contents);
  }
}
