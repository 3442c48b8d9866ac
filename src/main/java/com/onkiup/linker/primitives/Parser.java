package com.onkiup.linker.primitives;

import java.io.File;
import java.io.Reader;
import java.nio.file.Path;

/**
 * Consumes a prefix of its input and produces a value of type A.
 * Implementations must not keep state between invocations: one instance may be shared
 * between unrelated and concurrent parses.
 * @param <A> type of the produced value
 */
public interface Parser<A> {

  /**
   * @return human-readable description of what this parser expects, used in error messages
   */
  String expectedDescription();

  /**
   * Tries to consume a prefix of the input
   * @param source the source being parsed
   * @param input a suffix of the source text to consume from
   * @return a match with the produced value and the remaining input, or a failure description
   */
  Attempt<A> attempt(Source source, String input);

  /**
   * Consumes a prefix of the input
   * @param source the source being parsed
   * @param input a suffix of the source text to consume from
   * @return produced value and the remaining input
   * @throws ParseError if the input does not start with what this parser expects
   */
  default Result<A> eat(Source source, String input) throws ParseError {
    return attempt(source, input).orThrow();
  }

  /**
   * Parses the whole string
   * @param text string to parse
   * @return parsed value
   * @throws ParseError
   */
  default A parse(String text) throws ParseError {
    return parseSource(Source.inline(text));
  }

  /**
   * Parses named string
   * @param name name of the source that will be reported in errors
   * @param text contents to parse
   * @return parsed value
   * @throws ParseError
   */
  default A parse(String name, String text) throws ParseError {
    return parseSource(new Source(text, name));
  }

  /**
   * Reads everything from the reader and parses it
   * @param name name of the source
   * @param reader reader to get contents from
   * @return parsed value
   * @throws ParseError
   */
  default A parse(String name, Reader reader) throws ParseError {
    return parseSource(Sources.read(name, reader));
  }

  default A parseFile(Path path) throws ParseError {
    return parseSource(Sources.read(path));
  }

  default A parseFile(File file) throws ParseError {
    return parseFile(file.toPath());
  }

  /**
   * Main entrance: parses the source and requires all of its text to be consumed
   * @param source source to parse
   * @return parsed value
   * @throws ParseError if the parser fails or leaves trailing input
   */
  default A parseSource(Source source) throws ParseError {
    return Sources.consumeAll(this, source);
  }
}
