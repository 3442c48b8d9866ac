package com.onkiup.linker.primitives.matcher;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableSet;
import com.onkiup.linker.primitives.Attempt;
import com.onkiup.linker.primitives.Parser;
import com.onkiup.linker.primitives.Source;
import com.onkiup.linker.primitives.Verdict;

/**
 * Base for matchers that consume one character and decide by its membership in a set
 */
public abstract class CharSetMatcher implements Parser<Character> {

  private static final Joiner JOINER = Joiner.on(", ");

  private final ImmutableSet<Character> characters;

  protected CharSetMatcher(Iterable<Character> characters) {
    this.characters = ImmutableSet.copyOf(characters);
  }

  public ImmutableSet<Character> characters() {
    return characters;
  }

  /**
   * @param character the first character of the input
   * @return true if the character can be consumed
   */
  protected abstract boolean accepts(char character);

  protected String describeCharacters() {
    return "{" + JOINER.join(characters) + "}";
  }

  @Override
  public Attempt<Character> attempt(Source source, String input) {
    if (input.isEmpty()) {
      return Verdict.endOfInput(expectedDescription(), source);
    }

    char value = input.charAt(0);
    if (!accepts(value)) {
      return Verdict.unexpected(expectedDescription(), source, input);
    }

    return Verdict.match(value, input.substring(1));
  }

  @Override
  public String toString() {
    return expectedDescription();
  }
}
