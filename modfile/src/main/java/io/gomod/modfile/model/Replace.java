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

/**
 * A {@code replace} entry. The old version is "" when every version is replaced; the new version
 * is "" when the replacement is a local directory.
 */
@AutoValue
public abstract class Replace implements Directive {

  static Replace create(ModuleVersion oldMod, ModuleVersion newMod, int handle) {
    return new AutoValue_Replace(oldMod, newMod, handle);
  }

  public abstract ModuleVersion oldMod();

  public abstract ModuleVersion newMod();

  @Override
  public abstract int handle();
}
