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

package io.gomod.modfile.edit;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.Immutable;
import io.gomod.modfile.version.Semver;
import java.util.Comparator;
import java.util.List;

/**
 * How the lines of one directive verb are deduplicated and ordered by {@link BlockSorter}.
 *
 * <p>Each row of {@link #TABLE} names a verb of one dialect, the key that identifies duplicate
 * entries, which duplicate survives, and the order of lines inside a block. Verbs without a row,
 * including unknown verbs kept by a lax parse, are sorted by their tokens and never deduplicated.
 */
@AutoValue
@Immutable
public abstract class DirectiveKind {

  /** The file type a directive belongs to. */
  public enum Dialect {
    MODULE,
    WORK
  }

  /** Which of several entries with the same key is kept. */
  public enum Dedup {
    NONE,
    KEEP_FIRST,
    KEEP_LAST
  }

  /** Extracts the identity of an entry from the arguments of its line. */
  public enum Key {
    /** The first argument. */
    PATH {
      @Override
      List<String> of(List<String> args) {
        return args.subList(0, Math.min(1, args.size()));
      }
    },
    /** The first two arguments. */
    PATH_VERSION {
      @Override
      List<String> of(List<String> args) {
        return args.subList(0, Math.min(2, args.size()));
      }
    },
    /** The arguments before {@code =>}. */
    REPLACED {
      @Override
      List<String> of(List<String> args) {
        int arrow = args.indexOf("=>");
        return arrow == -1 ? args : args.subList(0, arrow);
      }
    },
    ALL_TOKENS {
      @Override
      List<String> of(List<String> args) {
        return args;
      }
    };

    abstract List<String> of(List<String> args);
  }

  /** The order of lines inside a block. */
  public enum Order {
    /** Ascending by tokens. */
    LEXICAL,
    /** Ascending by path, then by version precedence once the go version allows it. */
    EXCLUDE,
    /** Descending by the low version of the interval, then by the high version. */
    RETRACT_DESCENDING;

    Comparator<List<String>> comparator(boolean semverExcludes) {
      switch (this) {
        case LEXICAL:
          return BY_TOKENS;
        case EXCLUDE:
          return semverExcludes ? BY_PATH_THEN_SEMVER.thenComparing(BY_TOKENS) : BY_TOKENS;
        case RETRACT_DESCENDING:
          return BY_INTERVAL_DESCENDING.thenComparing(BY_TOKENS);
      }
      throw new AssertionError(this);
    }
  }

  public static final ImmutableList<DirectiveKind> TABLE =
      ImmutableList.of(
          create(Dialect.MODULE, "require", Key.PATH, Order.LEXICAL, Dedup.KEEP_LAST),
          create(Dialect.MODULE, "exclude", Key.PATH_VERSION, Order.EXCLUDE, Dedup.KEEP_FIRST),
          create(Dialect.MODULE, "replace", Key.REPLACED, Order.LEXICAL, Dedup.KEEP_LAST),
          create(
              Dialect.MODULE, "retract", Key.ALL_TOKENS, Order.RETRACT_DESCENDING, Dedup.NONE),
          create(Dialect.WORK, "directory", Key.PATH, Order.LEXICAL, Dedup.NONE),
          create(Dialect.WORK, "use", Key.PATH, Order.LEXICAL, Dedup.KEEP_LAST),
          create(Dialect.WORK, "replace", Key.REPLACED, Order.LEXICAL, Dedup.KEEP_LAST));

  public static DirectiveKind create(
      Dialect dialect, String verb, Key key, Order order, Dedup dedup) {
    return new AutoValue_DirectiveKind(dialect, verb, key, order, dedup);
  }

  /** Returns the row for a verb, or a lexically sorted kind without dedup. */
  public static DirectiveKind forVerb(Dialect dialect, String verb) {
    for (DirectiveKind kind : TABLE) {
      if (kind.dialect() == dialect && kind.verb().equals(verb)) {
        return kind;
      }
    }
    return create(dialect, verb, Key.ALL_TOKENS, Order.LEXICAL, Dedup.NONE);
  }

  public abstract Dialect dialect();

  public abstract String verb();

  public abstract Key key();

  public abstract Order order();

  public abstract Dedup dedup();

  static final Comparator<List<String>> BY_TOKENS =
      (x, y) -> {
        for (int i = 0; i < x.size() && i < y.size(); i++) {
          int c = compareCodePoints(x.get(i), y.get(i));
          if (c != 0) {
            return c;
          }
        }
        return Integer.compare(x.size(), y.size());
      };

  private static final Comparator<List<String>> BY_PATH_THEN_SEMVER =
      (x, y) -> {
        if (x.size() != 2 || y.size() != 2) {
          return 0;
        }
        int c = compareCodePoints(x.get(0), y.get(0));
        return c != 0 ? c : Semver.compare(x.get(1), y.get(1));
      };

  private static final Comparator<List<String>> BY_INTERVAL_DESCENDING =
      (x, y) -> {
        String[] ix = interval(x);
        String[] iy = interval(y);
        int c = Semver.compare(iy[0], ix[0]);
        return c != 0 ? c : Semver.compare(iy[1], ix[1]);
      };

  /** Orders strings by code point, which matches the byte order of their UTF-8 encoding. */
  static int compareCodePoints(String x, String y) {
    int i = 0;
    int j = 0;
    while (i < x.length() && j < y.length()) {
      int cx = x.codePointAt(i);
      int cy = y.codePointAt(j);
      if (cx != cy) {
        return Integer.compare(cx, cy);
      }
      i += Character.charCount(cx);
      j += Character.charCount(cy);
    }
    return Boolean.compare(i < x.length(), j < y.length());
  }

  /** Returns {low, high} of a retract line; a line in an unknown form is an invalid interval. */
  private static String[] interval(List<String> args) {
    if (args.size() == 1) {
      return new String[] {args.get(0), args.get(0)};
    }
    if (args.size() == 5
        && args.get(0).equals("[")
        && args.get(2).equals(",")
        && args.get(4).equals("]")) {
      return new String[] {args.get(1), args.get(3)};
    }
    return new String[] {"", ""};
  }
}
