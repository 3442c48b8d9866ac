package com.onkiup.linker.primitives.matcher;

import com.onkiup.linker.primitives.Attempt;
import com.onkiup.linker.primitives.Parser;
import com.onkiup.linker.primitives.Source;
import com.onkiup.linker.primitives.Verdict;

/**
 * Matches a literal string at the head of the input
 */
public class TerminalMatcher implements Parser<String> {

  private final String pattern;
  private final int patternLen;
  private final boolean ignoreCase;

  public TerminalMatcher(String pattern) {
    this(pattern, false);
  }

  public TerminalMatcher(String pattern, boolean ignoreCase) {
    if (pattern == null) {
      throw new IllegalArgumentException("null terminal");
    }
    this.pattern = pattern;
    this.patternLen = pattern.length();
    this.ignoreCase = ignoreCase;
  }

  public static String describe(String literal) {
    return '"' + literal + '"';
  }

  public String pattern() {
    return pattern;
  }

  public boolean ignoresCase() {
    return ignoreCase;
  }

  @Override
  public String expectedDescription() {
    return ignoreCase ? describe(pattern) + " (ignoring case)" : describe(pattern);
  }

  @Override
  public Attempt<String> attempt(Source source, String input) {
    if (patternLen > input.length()) {
      return Verdict.endOfInput(expectedDescription(), source);
    }

    // input is at least as long as the pattern here
    if (!input.regionMatches(ignoreCase, 0, pattern, 0, patternLen)) {
      return Verdict.unexpected(expectedDescription(), source, input);
    }

    String token = ignoreCase ? input.substring(0, patternLen) : pattern;
    return Verdict.match(token, input.substring(patternLen));
  }

  @Override
  public String toString() {
    return expectedDescription();
  }
}
