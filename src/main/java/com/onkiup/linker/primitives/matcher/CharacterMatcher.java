package com.onkiup.linker.primitives.matcher;

import com.onkiup.linker.primitives.Attempt;
import com.onkiup.linker.primitives.Parser;
import com.onkiup.linker.primitives.Source;
import com.onkiup.linker.primitives.Verdict;

/**
 * Matches exactly one given character
 */
public class CharacterMatcher implements Parser<Character> {

  private final char expected;

  public CharacterMatcher(char expected) {
    this.expected = expected;
  }

  public char expected() {
    return expected;
  }

  @Override
  public String expectedDescription() {
    return "'" + expected + "'";
  }

  @Override
  public Attempt<Character> attempt(Source source, String input) {
    if (input.isEmpty()) {
      return Verdict.endOfInput(expectedDescription(), source);
    }

    if (input.charAt(0) != expected) {
      return Verdict.unexpected(expectedDescription(), source, input);
    }

    return Verdict.match(expected, input.substring(1));
  }

  @Override
  public String toString() {
    return expectedDescription();
  }
}
