package com.onkiup.linker.primitives.matcher;

import com.onkiup.linker.primitives.Attempt;
import com.onkiup.linker.primitives.Parser;
import com.onkiup.linker.primitives.Source;
import com.onkiup.linker.primitives.Verdict;

/**
 * Consumes nothing and always succeeds with {@code null}
 */
public class NullMatcher<A> implements Parser<A> {

  public static final String DESCRIPTION = "empty string";

  @Override
  public String expectedDescription() {
    return DESCRIPTION;
  }

  @Override
  public Attempt<A> attempt(Source source, String input) {
    return Verdict.match(null, input);
  }

  @Override
  public String toString() {
    return expectedDescription();
  }
}
