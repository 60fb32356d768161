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

package io.gomod.modfile.diag;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableRangeMap;
import com.google.common.collect.Range;

/**
 * Converts source offsets to line and column information.
 *
 * <p>Offsets equal to the length of the source are accepted and map to the end of the last line,
 * so that errors at end of input can be reported.
 */
public class LineMap {

  private final String source;
  private final ImmutableRangeMap<Integer, Integer> lines;

  private LineMap(String source, ImmutableRangeMap<Integer, Integer> lines) {
    this.source = source;
    this.lines = lines;
  }

  public static LineMap create(String source) {
    int last = 0;
    int line = 1;
    ImmutableRangeMap.Builder<Integer, Integer> builder = ImmutableRangeMap.builder();
    for (int idx = 0; idx < source.length(); idx++) {
      if (source.charAt(idx) == '\n') {
        builder.put(Range.closedOpen(last, idx + 1), line++);
        last = idx + 1;
      }
    }
    // the remainder of the file, possibly empty, is the last line
    builder.put(Range.closed(last, source.length()), line);
    return new LineMap(source, builder.build());
  }

  /** The zero-indexed column of the given offset. */
  public int column(int position) {
    checkPosition(position);
    return position - requireNonNull(lines.getEntry(position)).getKey().lowerEndpoint();
  }

  /** The one-indexed line number of the given offset. */
  public int lineNumber(int position) {
    checkPosition(position);
    return requireNonNull(lines.get(position));
  }

  /** The text of the line containing the given offset, without its terminator. */
  public String line(int position) {
    checkPosition(position);
    Range<Integer> range = requireNonNull(lines.getEntry(position)).getKey();
    int end = Math.min(range.upperEndpoint(), source.length());
    String text = source.substring(range.lowerEndpoint(), end);
    if (text.endsWith("\n")) {
      text = text.substring(0, text.length() - 1);
    }
    if (text.endsWith("\r")) {
      text = text.substring(0, text.length() - 1);
    }
    return text;
  }

  private void checkPosition(int position) {
    checkArgument(0 <= position && position <= source.length(), "%s", position);
  }
}
