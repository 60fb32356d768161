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

import java.util.ArrayList;
import java.util.List;

/** The comments attached to a statement or to a block's parentheses. */
public class Comments {

  private final List<Comment> before = new ArrayList<>();
  private final List<Comment> suffix = new ArrayList<>();

  /** Whole-line comments above the owner. */
  public List<Comment> before() {
    return before;
  }

  /** Comments at the end of the owner's line. */
  public List<Comment> suffix() {
    return suffix;
  }

  public boolean isEmpty() {
    return before.isEmpty() && suffix.isEmpty();
  }
}
