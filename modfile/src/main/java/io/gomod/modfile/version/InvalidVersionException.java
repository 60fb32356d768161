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

package io.gomod.modfile.version;

/** A version string that cannot be used, with the reason. */
public class InvalidVersionException extends Exception {

  private static final long serialVersionUID = 1L;

  private final String version;
  private final String reason;

  public InvalidVersionException(String version, String reason) {
    super(String.format("version \"%s\" invalid: %s", version, reason));
    this.version = version;
    this.reason = reason;
  }

  /** The rejected version. */
  public String version() {
    return version;
  }

  /** Why the version was rejected, e.g. {@code must be of the form v1.2.3}. */
  public String reason() {
    return reason;
  }
}
