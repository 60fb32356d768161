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

/** A {@code retract} entry. */
@AutoValue
public abstract class Retract implements Directive {

  static Retract create(VersionInterval interval, String rationale, int handle) {
    return new AutoValue_Retract(interval, rationale, handle);
  }

  public abstract VersionInterval interval();

  /** The rationale as read or written; {@link ModFile#retractRationale} reflects later edits. */
  public abstract String rationale();

  @Override
  public abstract int handle();
}
