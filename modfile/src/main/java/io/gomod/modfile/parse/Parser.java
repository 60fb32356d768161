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

import com.google.common.collect.ImmutableList;
import io.gomod.modfile.diag.ModFileError;
import io.gomod.modfile.diag.ModFileError.ErrorKind;
import io.gomod.modfile.diag.SourceFile;
import io.gomod.modfile.tree.Comment;
import io.gomod.modfile.tree.Comments;
import io.gomod.modfile.tree.FileSyntax;
import io.gomod.modfile.tree.Tree;
import io.gomod.modfile.tree.Tree.CommentBlock;
import io.gomod.modfile.tree.Tree.Line;
import io.gomod.modfile.tree.Tree.LineBlock;
import java.util.ArrayList;
import java.util.List;

/**
 * A parser for the line-oriented syntax shared by go.mod and go.work files.
 *
 * <p>The result is a {@link FileSyntax}; directives are not interpreted here. Syntax errors are
 * reported by throwing a {@link ModFileError} at the first problem.
 */
public class Parser {

  private final Lexer lexer;
  private final FileSyntax file;
  private Token token;

  public Parser(Lexer lexer) {
    this.lexer = lexer;
    this.file = new FileSyntax(lexer.source().path());
    this.token = lexer.next();
  }

  /** Parses the given source file. */
  public static FileSyntax parse(SourceFile source) {
    return new Parser(new StreamLexer(source)).file();
  }

  private void next() {
    token = lexer.next();
  }

  public FileSyntax file() {
    List<Comment> group = new ArrayList<>();
    int groupStart = -1;
    while (true) {
      switch (token) {
        case EOF:
          flushCommentGroup(group, groupStart);
          return file;
        case NEWLINE:
          // a blank line ends a comment group that is not attached to a statement
          next();
          flushCommentGroup(group, groupStart);
          break;
        case COMMENT:
          if (group.isEmpty()) {
            groupStart = lexer.position();
          }
          group.add(Comment.create(lexer.position(), lexer.stringValue(), false));
          next();
          break;
        default:
          Tree stmt = statement();
          stmt.comments().before().addAll(group);
          group.clear();
          file.addStatement(stmt);
          break;
      }
    }
  }

  private void flushCommentGroup(List<Comment> group, int start) {
    if (group.isEmpty()) {
      return;
    }
    CommentBlock block = new CommentBlock(start);
    block.comments().before().addAll(group);
    file.addStatement(block);
    group.clear();
  }

  /** Parses a free-standing line, or a block if the line ends with an opening paren. */
  private Tree statement() {
    int start = lexer.position();
    switch (token) {
      case IDENT:
      case STRING:
      case VERSION:
        break;
      default:
        throw error(ErrorKind.UNEXPECTED_TOKEN, describe());
    }
    List<String> tokens = new ArrayList<>();
    List<Integer> positions = new ArrayList<>();
    int depth = 0;
    int openParen = -1;
    while (true) {
      if (token.isEol()) {
        if (depth > 0) {
          throw ModFileError.format(
              lexer.source(), openParen, ErrorKind.UNMATCHED_PAREN, Token.LPAREN);
        }
        Line line = file.newLine(start, tokens, positions, false);
        endOfLine(line.comments());
        return line;
      }
      if (token == Token.LPAREN && depth == 0) {
        int lparen = lexer.position();
        next();
        if (token.isEol()) {
          return block(start, tokens);
        }
        if (token == Token.RPAREN) {
          int rparen = lexer.position();
          next();
          if (token.isEol()) {
            // verb ()
            LineBlock empty =
                new LineBlock(start, ImmutableList.copyOf(tokens), ImmutableList.of());
            endOfLine(empty.comments());
            return empty;
          }
          tokens.add(Token.LPAREN.toString());
          positions.add(lparen);
          tokens.add(Token.RPAREN.toString());
          positions.add(rparen);
          continue;
        }
        tokens.add(Token.LPAREN.toString());
        positions.add(lparen);
        openParen = lparen;
        depth++;
        continue;
      }
      depth = addToken(tokens, positions, depth);
      if (depth == 1 && token == Token.LPAREN) {
        openParen = lexer.position();
      }
      next();
    }
  }

  /** Parses the body of a block; the current token ends the line holding the opening paren. */
  private LineBlock block(int start, List<String> verb) {
    LineBlock block = new LineBlock(start, ImmutableList.copyOf(verb), ImmutableList.of());
    if (token == Token.EOL_COMMENT) {
      block.lparen().suffix().add(Comment.create(lexer.position(), lexer.stringValue(), true));
    }
    if (token != Token.EOF) {
      next();
    }
    List<Comment> comments = new ArrayList<>();
    while (true) {
      switch (token) {
        case EOF:
          throw ModFileError.format(lexer.source(), start, ErrorKind.UNTERMINATED_BLOCK);
        case NEWLINE:
          next();
          // keep one marker per run of blank lines, but none directly after the paren
          if (comments.isEmpty()
              ? !block.lines().isEmpty()
              : !comments.get(comments.size() - 1).isBlank()) {
            comments.add(Comment.blank());
          }
          break;
        case COMMENT:
        case EOL_COMMENT:
          comments.add(Comment.create(lexer.position(), lexer.stringValue(), false));
          next();
          break;
        case RPAREN:
          next();
          while (!comments.isEmpty() && comments.get(comments.size() - 1).isBlank()) {
            comments.remove(comments.size() - 1);
          }
          block.rparen().before().addAll(comments);
          if (!token.isEol()) {
            throw error(ErrorKind.EXPECTED_NEWLINE);
          }
          endOfLine(block.comments());
          return block;
        default:
          Line line = blockLine();
          line.comments().before().addAll(comments);
          comments.clear();
          block.lines().add(line);
          break;
      }
    }
  }

  /** Parses a line inside a block. Parens must balance within the line. */
  private Line blockLine() {
    int start = lexer.position();
    List<String> tokens = new ArrayList<>();
    List<Integer> positions = new ArrayList<>();
    int depth = 0;
    int openParen = -1;
    while (!token.isEol()) {
      depth = addToken(tokens, positions, depth);
      if (depth == 1 && token == Token.LPAREN) {
        openParen = lexer.position();
      }
      next();
    }
    if (depth > 0) {
      throw ModFileError.format(lexer.source(), openParen, ErrorKind.UNMATCHED_PAREN, Token.LPAREN);
    }
    Line line = file.newLine(start, tokens, positions, true);
    endOfLine(line.comments());
    return line;
  }

  /** Records the current token and returns the updated paren depth. */
  private int addToken(List<String> tokens, List<Integer> positions, int depth) {
    if (token == Token.RPAREN) {
      if (depth == 0) {
        throw error(ErrorKind.UNMATCHED_PAREN, Token.RPAREN);
      }
      depth--;
    } else if (token == Token.LPAREN) {
      depth++;
    }
    tokens.add(lexer.stringValue());
    positions.add(lexer.position());
    return depth;
  }

  /** Consumes the end of a line, attaching a trailing comment to {@code comments}. */
  private void endOfLine(Comments comments) {
    switch (token) {
      case EOL_COMMENT:
        comments.suffix().add(Comment.create(lexer.position(), lexer.stringValue(), true));
        next();
        break;
      case NEWLINE:
        next();
        break;
      default:
        break;
    }
  }

  private String describe() {
    switch (token) {
      case NEWLINE:
      case EOF:
        return token.toString();
      default:
        return "'" + lexer.stringValue() + "'";
    }
  }

  private ModFileError error(ErrorKind kind, Object... args) {
    return ModFileError.format(lexer.source(), lexer.position(), kind, args);
  }
}
