package com.onkiup.linker.primitives.matcher;

import com.onkiup.linker.primitives.Attempt;
import com.onkiup.linker.primitives.Parser;
import com.onkiup.linker.primitives.Source;
import com.onkiup.linker.primitives.Verdict;

/**
 * Consumes any single character, fails only at the end of input
 */
public class AnyCharMatcher implements Parser<Character> {

  @Override
  public String expectedDescription() {
    return "any char";
  }

  @Override
  public Attempt<Character> attempt(Source source, String input) {
    if (input.isEmpty()) {
      return Verdict.endOfInput(expectedDescription(), source);
    }

    return Verdict.match(input.charAt(0), input.substring(1));
  }

  @Override
  public String toString() {
    return expectedDescription();
  }
}
