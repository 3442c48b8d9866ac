package com.onkiup.linker.primitives;

import java.util.Optional;

import com.onkiup.linker.primitives.util.TextUtils;

public class UnexpectedTokenError extends ParseError {

  private final String found;

  public UnexpectedTokenError(String found, String expected, ParserLocation location, Source source) {
    super("Unexpected token '" + TextUtils.sanitize(found) + "' at " + location + ", expected " + expected,
        expected, location, source);
    this.found = found;
  }

  @Override
  public Optional<String> found() {
    return Optional.of(found);
  }
}
