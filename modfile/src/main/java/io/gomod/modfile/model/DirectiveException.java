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

import com.google.common.collect.ImmutableList;
import io.gomod.modfile.diag.ModFileError.ErrorKind;

/** A problem with one directive, reported by the reader at the offending token. */
class DirectiveException extends Exception {

  private static final long serialVersionUID = 1L;

  private final int position;
  private final ErrorKind kind;
  private final ImmutableList<Object> args;

  DirectiveException(int position, ErrorKind kind, Object... args) {
    super(kind.name());
    this.position = position;
    this.kind = kind;
    this.args = ImmutableList.copyOf(args);
  }

  int position() {
    return position;
  }

  ErrorKind kind() {
    return kind;
  }

  Object[] args() {
    return args.toArray();
  }
}
