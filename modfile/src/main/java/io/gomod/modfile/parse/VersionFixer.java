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

import io.gomod.modfile.version.InvalidVersionException;

/**
 * Rewrites a version literal read from a file, for example to resolve a branch name to a
 * pseudo-version. Called once for every version literal; the result must be a valid semantic
 * version.
 */
@FunctionalInterface
public interface VersionFixer {

  /**
   * @param path the module path the version belongs to
   * @param version the version as written, unquoted
   * @throws InvalidVersionException if the version cannot be used
   */
  String fix(String path, String version) throws InvalidVersionException;
}
