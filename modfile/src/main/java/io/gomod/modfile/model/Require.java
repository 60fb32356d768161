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

import com.google.auto.value.AutoValue;

/** A {@code require} entry. */
@AutoValue
public abstract class Require implements Directive {

  /** A requirement that is not attached to a file, as passed to {@link ModFile#setRequire}. */
  public static Require of(String path, String version, boolean indirect) {
    return create(ModuleVersion.create(path, version), indirect, -1);
  }

  static Require create(ModuleVersion mod, boolean indirect, int handle) {
    return new AutoValue_Require(mod, indirect, handle);
  }

  public abstract ModuleVersion mod();

  /** Whether the requirement is marked with an {@code // indirect} comment. */
  public abstract boolean indirect();

  @Override
  public abstract int handle();

  Require withVersion(String version, boolean indirect) {
    return create(ModuleVersion.create(mod().path(), version), indirect, handle());
  }
}
