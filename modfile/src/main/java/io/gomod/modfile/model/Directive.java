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

/** A directive read from, or added to, a file. */
public interface Directive {

  /**
   * The handle of the line holding this directive; see {@link
   * io.gomod.modfile.tree.FileSyntax#line}. Directives that are not attached to a file return -1.
   */
  int handle();
}
