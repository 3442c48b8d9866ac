package com.onkiup.linker.primitives;

public class UnexpectedEofError extends ParseError {

  public UnexpectedEofError(String expected, ParserLocation location, Source source) {
    super("Unexpected end of input at " + location + ", expected " + expected, expected, location, source);
  }
}
