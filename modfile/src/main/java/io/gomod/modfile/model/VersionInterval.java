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

/** An inclusive range of versions. A single retracted version has {@code low == high}. */
@AutoValue
@Immutable
public abstract class VersionInterval {

  public static VersionInterval create(String low, String high) {
    return new AutoValue_VersionInterval(low, high);
  }

  /** The interval holding just {@code version}. */
  public static VersionInterval of(String version) {
    return create(version, version);
  }

  public abstract String low();

  public abstract String high();

  public boolean isSingleton() {
    return low().equals(high());
  }
}
