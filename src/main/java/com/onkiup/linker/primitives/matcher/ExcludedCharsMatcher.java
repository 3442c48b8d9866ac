package com.onkiup.linker.primitives.matcher;

public class ExcludedCharsMatcher extends CharSetMatcher {

  public ExcludedCharsMatcher(Iterable<Character> excluded) {
    super(excluded);
  }

  @Override
  protected boolean accepts(char character) {
    return !characters().contains(character);
  }

  @Override
  public String expectedDescription() {
    return "any char except " + describeCharacters();
  }
}
