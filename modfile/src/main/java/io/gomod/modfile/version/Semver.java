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

import java.util.Comparator;
import org.jspecify.annotations.Nullable;

/**
 * Semantic versions as used for module versions: a leading {@code v}, then {@code
 * MAJOR[.MINOR[.PATCH]]}, an optional {@code -prerelease} and an optional {@code +build}.
 *
 * <p>The shorthands {@code v1} and {@code v1.2} are valid and mean {@code v1.0.0} and {@code
 * v1.2.0}; they may not carry a prerelease or build suffix. Invalid versions compare equal to each
 * other and less than every valid version.
 */
public final class Semver {

  /** Orders versions by precedence, lowest first. */
  public static final Comparator<String> PRECEDENCE = Semver::compare;

  private static final class Parsed {
    String major = "";
    String minor = "";
    String patch = "";
    String prerelease = "";
    String build = "";
  }

  public static boolean isValid(String v) {
    return parse(v) != null;
  }

  /** Returns the canonical form {@code vMAJOR.MINOR.PATCH[-prerelease]}, or "" if invalid. */
  public static String canonical(String v) {
    Parsed p = parse(v);
    if (p == null) {
      return "";
    }
    return "v" + p.major + "." + p.minor + "." + p.patch + p.prerelease;
  }

  /** Returns {@code vMAJOR}, or "" if invalid. */
  public static String major(String v) {
    Parsed p = parse(v);
    return p == null ? "" : "v" + p.major;
  }

  /** Returns the build suffix including its {@code +}, or "". */
  public static String build(String v) {
    Parsed p = parse(v);
    return p == null ? "" : p.build;
  }

  /** Returns the prerelease suffix including its {@code -}, or "". */
  public static String prerelease(String v) {
    Parsed p = parse(v);
    return p == null ? "" : p.prerelease;
  }

  /** Compares by semver precedence; the build suffix is ignored. */
  public static int compare(String v, String w) {
    Parsed pv = parse(v);
    Parsed pw = parse(w);
    if (pv == null && pw == null) {
      return 0;
    }
    if (pv == null) {
      return -1;
    }
    if (pw == null) {
      return 1;
    }
    int c = compareInt(pv.major, pw.major);
    if (c != 0) {
      return c;
    }
    c = compareInt(pv.minor, pw.minor);
    if (c != 0) {
      return c;
    }
    c = compareInt(pv.patch, pw.patch);
    if (c != 0) {
      return c;
    }
    return comparePrerelease(pv.prerelease, pw.prerelease);
  }

  private static @Nullable Parsed parse(String v) {
    if (v.isEmpty() || v.charAt(0) != 'v') {
      return null;
    }
    Parsed p = new Parsed();
    int i = 1;
    int end = numberEnd(v, i);
    if (end < 0) {
      return null;
    }
    p.major = v.substring(i, end);
    if (end == v.length()) {
      p.minor = "0";
      p.patch = "0";
      return p;
    }
    if (v.charAt(end) != '.') {
      return null;
    }
    i = end + 1;
    end = numberEnd(v, i);
    if (end < 0) {
      return null;
    }
    p.minor = v.substring(i, end);
    if (end == v.length()) {
      p.patch = "0";
      return p;
    }
    if (v.charAt(end) != '.') {
      return null;
    }
    i = end + 1;
    end = numberEnd(v, i);
    if (end < 0) {
      return null;
    }
    p.patch = v.substring(i, end);
    i = end;
    if (i < v.length() && v.charAt(i) == '-') {
      end = suffixEnd(v, i, true);
      if (end < 0) {
        return null;
      }
      p.prerelease = v.substring(i, end);
      i = end;
    }
    if (i < v.length() && v.charAt(i) == '+') {
      end = suffixEnd(v, i, false);
      if (end < 0) {
        return null;
      }
      p.build = v.substring(i, end);
      i = end;
    }
    if (i != v.length()) {
      return null;
    }
    return p;
  }

  /** Returns the end of a decimal number without leading zeros starting at {@code start}. */
  private static int numberEnd(String v, int start) {
    int i = start;
    while (i < v.length() && isDigit(v.charAt(i))) {
      i++;
    }
    if (i == start || (v.charAt(start) == '0' && i != start + 1)) {
      return -1;
    }
    return i;
  }

  /**
   * Returns the end of a dot-separated identifier list introduced by the character at {@code
   * start}. Numeric prerelease identifiers may not have leading zeros.
   */
  private static int suffixEnd(String v, int start, boolean prerelease) {
    int i = start + 1;
    int identStart = i;
    while (i < v.length() && (!prerelease || v.charAt(i) != '+')) {
      char c = v.charAt(i);
      if (c == '.') {
        if (identStart == i || (prerelease && isBadNum(v.substring(identStart, i)))) {
          return -1;
        }
        identStart = i + 1;
      } else if (!isIdentChar(c)) {
        return -1;
      }
      i++;
    }
    if (identStart == i || (prerelease && isBadNum(v.substring(identStart, i)))) {
      return -1;
    }
    return i;
  }

  private static int compareInt(String x, String y) {
    if (x.length() != y.length()) {
      return x.length() < y.length() ? -1 : 1;
    }
    return Integer.signum(x.compareTo(y));
  }

  private static int comparePrerelease(String x, String y) {
    // a version without prerelease has higher precedence than one with
    if (x.equals(y)) {
      return 0;
    }
    if (x.isEmpty()) {
      return 1;
    }
    if (y.isEmpty()) {
      return -1;
    }
    String[] xs = x.substring(1).split("\\.", -1);
    String[] ys = y.substring(1).split("\\.", -1);
    for (int k = 0; k < xs.length && k < ys.length; k++) {
      String dx = xs[k];
      String dy = ys[k];
      if (dx.equals(dy)) {
        continue;
      }
      boolean ix = isNum(dx);
      boolean iy = isNum(dy);
      if (ix != iy) {
        return ix ? -1 : 1;
      }
      if (ix && dx.length() != dy.length()) {
        return dx.length() < dy.length() ? -1 : 1;
      }
      return dx.compareTo(dy) < 0 ? -1 : 1;
    }
    return Integer.compare(xs.length, ys.length);
  }

  private static boolean isDigit(char c) {
    return '0' <= c && c <= '9';
  }

  private static boolean isIdentChar(char c) {
    return isDigit(c) || ('a' <= c && c <= 'z') || ('A' <= c && c <= 'Z') || c == '-';
  }

  private static boolean isNum(String s) {
    if (s.isEmpty()) {
      return false;
    }
    for (int i = 0; i < s.length(); i++) {
      if (!isDigit(s.charAt(i))) {
        return false;
      }
    }
    return true;
  }

  private static boolean isBadNum(String s) {
    return isNum(s) && s.length() > 1 && s.charAt(0) == '0';
  }

  private Semver() {}
}
