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
import com.google.errorprone.annotations.Immutable;

/** A module path and version. The version is "" where a directive allows it to be omitted. */
@AutoValue
@Immutable
public abstract class ModuleVersion {

  public static ModuleVersion create(String path, String version) {
    return new AutoValue_ModuleVersion(path, version);
  }

  public abstract String path();

  public abstract String version();
}
