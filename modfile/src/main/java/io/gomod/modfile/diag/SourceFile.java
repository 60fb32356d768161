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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import io.gomod.modfile.diag.ModFileError.ErrorKind;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/** The text of a go.mod or go.work file, with the name used in diagnostics. */
public class SourceFile {

  private final String path;
  private final String source;

  private final Supplier<LineMap> lineMap = Suppliers.memoize(this::createLineMap);

  public SourceFile(String path, String source) {
    this.path = path;
    this.source = source;
  }

  /**
   * Decodes UTF-8 file contents.
   *
   * @throws ModFileError at the first byte that is not valid UTF-8
   */
  public static SourceFile fromBytes(String path, byte[] data) {
    CharsetDecoder decoder =
        UTF_8
            .newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
    CharBuffer out = CharBuffer.allocate(data.length + 1);
    CoderResult result = decoder.decode(ByteBuffer.wrap(data), out, true);
    if (result.isUnderflow()) {
      result = decoder.flush(out);
    }
    out.flip();
    if (!result.isUnderflow()) {
      SourceFile decoded = new SourceFile(path, out.toString());
      throw ModFileError.format(decoded, decoded.source().length(), ErrorKind.INVALID_UTF8);
    }
    return new SourceFile(path, out.toString());
  }

  /** The file name, as given by the caller. */
  public String path() {
    return path;
  }

  /** The file contents. */
  public String source() {
    return source;
  }

  LineMap lineMap() {
    return lineMap.get();
  }

  private LineMap createLineMap() {
    return LineMap.create(source);
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (!(obj instanceof SourceFile)) {
      return false;
    }
    SourceFile that = (SourceFile) obj;
    return Objects.equals(path, that.path) && source.equals(that.source);
  }

  @Override
  public int hashCode() {
    return path != null ? path.hashCode() : 0;
  }
}
