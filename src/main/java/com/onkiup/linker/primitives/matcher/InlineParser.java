package com.onkiup.linker.primitives.matcher;

import java.util.function.BiFunction;

import com.onkiup.linker.primitives.Attempt;
import com.onkiup.linker.primitives.Parser;
import com.onkiup.linker.primitives.Source;

/**
 * Parser assembled from a description and a function
 */
public class InlineParser<A> implements Parser<A> {

  private final String expectedDescription;
  private final BiFunction<Source, String, Attempt<A>> attempt;

  public InlineParser(String expectedDescription, BiFunction<Source, String, Attempt<A>> attempt) {
    if (expectedDescription == null) {
      throw new IllegalArgumentException("Description cannot be null");
    }
    if (attempt == null) {
      throw new IllegalArgumentException("Attempt function cannot be null");
    }
    this.expectedDescription = expectedDescription;
    this.attempt = attempt;
  }

  @Override
  public String expectedDescription() {
    return expectedDescription;
  }

  @Override
  public Attempt<A> attempt(Source source, String input) {
    return attempt.apply(source, input);
  }

  @Override
  public String toString() {
    return expectedDescription;
  }
}
