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

import com.google.auto.value.AutoValue;
import com.google.errorprone.annotations.Immutable;

/**
 * How directives are interpreted once a file has been parsed. The syntax accepted is the same for
 * every policy; only the directive checks differ.
 */
@AutoValue
@Immutable
public abstract class ParsePolicy {

  /** Whether a directive with an unknown verb is an error, rather than being kept uninterpreted. */
  public abstract boolean rejectUnknownDirectives();

  /**
   * Whether directives that only matter to the main module ({@code exclude}, {@code replace}) are
   * interpreted. When false they are kept in the syntax tree without any argument checks.
   */
  public abstract boolean interpretMainModuleDirectives();

  /** Whether go versions such as {@code 1.15beta} are reduced to {@code 1.15} and accepted. */
  public abstract boolean fixLanguageVersions();

  /** Whether a malformed retract interval is skipped instead of reported. */
  public abstract boolean ignoreMalformedRetractions();

  public static Builder builder() {
    return new AutoValue_ParsePolicy.Builder()
        .setRejectUnknownDirectives(true)
        .setInterpretMainModuleDirectives(true)
        .setFixLanguageVersions(false)
        .setIgnoreMalformedRetractions(false);
  }

  public abstract Builder toBuilder();

  /** The policy for a main module's own go.mod file, or for a go.work file. */
  public static ParsePolicy strict() {
    return builder().build();
  }

  /** The policy for go.mod files of dependencies, which may have been written by any Go version. */
  public static ParsePolicy lax() {
    return builder()
        .setRejectUnknownDirectives(false)
        .setInterpretMainModuleDirectives(false)
        .setFixLanguageVersions(true)
        .setIgnoreMalformedRetractions(true)
        .build();
  }

  /** A builder for {@link ParsePolicy}s. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setRejectUnknownDirectives(boolean value);

    public abstract Builder setInterpretMainModuleDirectives(boolean value);

    public abstract Builder setFixLanguageVersions(boolean value);

    public abstract Builder setIgnoreMalformedRetractions(boolean value);

    public abstract ParsePolicy build();
  }
}
