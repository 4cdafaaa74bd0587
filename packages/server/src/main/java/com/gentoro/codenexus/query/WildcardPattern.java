package com.gentoro.codenexus.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Tag pattern where {@code *} stands for zero or more characters. All other characters match
 * themselves, case-sensitively.
 *
 * <p>The literal segments between stars are anchored in order: the first at the start of the
 * candidate (unless the pattern starts with {@code *}), the last at its end (unless the pattern
 * ends with {@code *}), and the ones in between left to right without overlapping.
 */
public final class WildcardPattern {
  private final String pattern;
  private final List<String> segments;
  private final boolean anchoredStart;
  private final boolean anchoredEnd;

  private WildcardPattern(String pattern) {
    this.pattern = pattern;
    this.anchoredStart = !pattern.startsWith("*");
    this.anchoredEnd = !pattern.endsWith("*");
    List<String> parts = new ArrayList<>();
    for (String part : pattern.split("\\*", -1)) {
      if (!part.isEmpty()) parts.add(part);
    }
    this.segments = List.copyOf(parts);
  }

  public static WildcardPattern compile(String pattern) {
    return new WildcardPattern(Objects.requireNonNull(pattern, "pattern must not be null"));
  }

  public static boolean isWildcard(String literal) {
    return literal != null && literal.indexOf('*') >= 0;
  }

  public boolean matches(String candidate) {
    if (candidate == null) return false;
    if (segments.isEmpty()) {
      // Only stars: matches anything.
      return true;
    }
    int pos = 0;
    int first = 0;
    int last = segments.size() - 1;

    if (anchoredStart) {
      String head = segments.get(0);
      if (!candidate.startsWith(head)) return false;
      pos = head.length();
      first = 1;
    }

    int endLimit = candidate.length();
    if (anchoredEnd) {
      String tail = segments.get(last);
      if (first > last) {
        // Single segment used as head already; it must also be the whole candidate.
        return candidate.length() == pos;
      }
      if (!candidate.endsWith(tail) || candidate.length() - tail.length() < pos) return false;
      endLimit = candidate.length() - tail.length();
      last--;
    }

    for (int i = first; i <= last; i++) {
      int idx = candidate.indexOf(segments.get(i), pos);
      if (idx < 0 || idx + segments.get(i).length() > endLimit) return false;
      pos = idx + segments.get(i).length();
    }
    return true;
  }

  public String pattern() {
    return pattern;
  }

  @Override
  public String toString() {
    return pattern;
  }
}
