package com.onkiup.linker.primitives;

import java.util.Optional;

/**
 * Terminal parsing failure. Carries the failed expectation, where it failed and what source was parsed.
 */
public abstract class ParseError extends RuntimeException {

  private final String expected;
  private final ParserLocation location;
  private final Source source;

  protected ParseError(String message, String expected, ParserLocation location, Source source) {
    super(message);
    this.expected = expected;
    this.location = location;
    this.source = source;
  }

  public String expected() {
    return expected;
  }

  public ParserLocation location() {
    return location;
  }

  public Source source() {
    return source;
  }

  /**
   * @return bounded preview of the input found at the failure location, if there was any input left
   */
  public Optional<String> found() {
    return Optional.empty();
  }
}
