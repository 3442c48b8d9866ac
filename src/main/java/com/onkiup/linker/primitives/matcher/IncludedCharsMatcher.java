package com.onkiup.linker.primitives.matcher;

public class IncludedCharsMatcher extends CharSetMatcher {

  public IncludedCharsMatcher(Iterable<Character> included) {
    super(included);
  }

  @Override
  protected boolean accepts(char character) {
    return characters().contains(character);
  }

  @Override
  public String expectedDescription() {
    return "any char of " + describeCharacters();
  }
}
