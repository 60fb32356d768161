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

package io.gomod.modfile.edit;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.LinkedListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Lists;
import io.gomod.modfile.edit.DirectiveKind.Dedup;
import io.gomod.modfile.edit.DirectiveKind.Dialect;
import io.gomod.modfile.tree.FileSyntax;
import io.gomod.modfile.tree.Tree;
import io.gomod.modfile.tree.Tree.Line;
import io.gomod.modfile.tree.Tree.LineBlock;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes duplicate entries and sorts the lines of every block, as described by {@link
 * DirectiveKind#TABLE}.
 *
 * <p>Sorting is stable and only moves lines within their block; free-standing lines keep their
 * place. Duplicates are looked for across all statements of a verb, in file order.
 */
public final class BlockSorter {

  private static final Logger logger = LoggerFactory.getLogger(BlockSorter.class);

  private final FileSyntax file;
  private final Dialect dialect;
  private final boolean semverExcludes;

  /**
   * @param semverExcludes whether exclude versions are ordered by precedence rather than text,
   *     which the go directive enables from 1.21 on
   */
  public BlockSorter(FileSyntax file, Dialect dialect, boolean semverExcludes) {
    this.file = file;
    this.dialect = dialect;
    this.semverExcludes = semverExcludes;
  }

  /**
   * Deduplicates and sorts.
   *
   * @return the handles of the lines removed as duplicates
   */
  public ImmutableSet<Integer> sort() {
    ImmutableSet<Integer> removed = removeDuplicates();
    if (!removed.isEmpty()) {
      file.prune();
    }
    for (Tree stmt : file.statements()) {
      if (stmt instanceof LineBlock) {
        sortBlock((LineBlock) stmt);
      }
    }
    return removed;
  }

  private ImmutableSet<Integer> removeDuplicates() {
    ListMultimap<String, Line> byVerb = LinkedListMultimap.create();
    for (Tree stmt : file.statements()) {
      if (stmt instanceof Line) {
        Line line = (Line) stmt;
        if (!line.isRemoved()) {
          byVerb.put(line.token(0), line);
        }
      } else if (stmt instanceof LineBlock) {
        LineBlock block = (LineBlock) stmt;
        if (block.verb().size() != 1) {
          continue;
        }
        for (Line line : block.lines()) {
          if (!line.isRemoved()) {
            byVerb.put(block.verb().get(0), line);
          }
        }
      }
    }
    ImmutableSet.Builder<Integer> removed = ImmutableSet.builder();
    for (String verb : byVerb.keySet()) {
      DirectiveKind kind = DirectiveKind.forVerb(dialect, verb);
      if (kind.dedup() == Dedup.NONE) {
        continue;
      }
      List<Line> lines = byVerb.get(verb);
      if (kind.dedup() == Dedup.KEEP_LAST) {
        lines = Lists.reverse(lines);
      }
      Set<List<String>> seen = new HashSet<>();
      for (Line line : ImmutableList.copyOf(lines)) {
        List<String> key = ImmutableList.copyOf(kind.key().of(args(line)));
        if (!seen.add(key)) {
          logger.debug("{}: dropping duplicate {} {}", file.name(), verb, key);
          file.markRemoved(line);
          removed.add(line.id());
        }
      }
    }
    return removed.build();
  }

  private void sortBlock(LineBlock block) {
    DirectiveKind kind = DirectiveKind.forVerb(dialect, block.verb().get(0));
    if (block.verb().size() != 1) {
      kind = DirectiveKind.create(
          dialect,
          block.verb().get(0),
          DirectiveKind.Key.ALL_TOKENS,
          DirectiveKind.Order.LEXICAL,
          Dedup.NONE);
    }
    Comparator<List<String>> order = kind.order().comparator(semverExcludes);
    block.lines().sort((x, y) -> order.compare(x.tokens(), y.tokens()));
  }

  /** The arguments of a line, without the verb of a free-standing line. */
  static List<String> args(Line line) {
    List<String> tokens = line.tokens();
    return line.inBlock() ? tokens : tokens.subList(1, tokens.size());
  }
}
