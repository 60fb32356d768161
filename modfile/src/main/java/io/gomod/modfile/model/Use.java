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

/** A {@code use} entry of a go.work file. */
@AutoValue
public abstract class Use implements Directive {

  static Use create(String path, String modulePath, int handle) {
    return new AutoValue_Use(path, modulePath, handle);
  }

  public abstract String path();

  /** The module path, if known; it is not written to the file. */
  public abstract String modulePath();

  @Override
  public abstract int handle();
}
