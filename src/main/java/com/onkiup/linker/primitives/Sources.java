package com.onkiup.linker.primitives;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.onkiup.linker.primitives.util.TextUtils;

/**
 * Builds {@link Source} instances from external inputs and runs top-level parses over them
 */
public final class Sources {
  private static final Logger logger = LoggerFactory.getLogger("PARSER");

  public static final String EOF = "<EOF>";

  private Sources() {

  }

  /**
   * Reads the whole file using the platform's default charset
   * @param path file to read
   * @return source named after the absolute path of the file
   */
  public static Source read(Path path) {
    Path absolute = path.toAbsolutePath();
    try {
      String text = new String(Files.readAllBytes(absolute), Charset.defaultCharset());
      logger.debug("Read {} chars from {}", text.length(), absolute);
      return new Source(text, absolute.toString());
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read source " + absolute, e);
    }
  }

  public static Source read(String name, Reader reader) {
    StringBuilder text = new StringBuilder();
    char[] chunk = new char[4096];
    try {
      for (int read = reader.read(chunk); read > -1; read = reader.read(chunk)) {
        text.append(chunk, 0, read);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read source " + name, e);
    }
    logger.debug("Read {} chars from {}", text.length(), name);
    return new Source(text.toString(), name);
  }

  /**
   * Runs the parser over the whole text of the source.
   * This is the only place where trailing input is treated as an error.
   */
  static <A> A consumeAll(Parser<A> parser, Source source) throws ParseError {
    String text = source.text();
    logger.debug("Parsing {} with {}", source, parser);
    Attempt<A> attempt = parser.attempt(source, text);
    if (attempt.isFailed()) {
      logger.debug("Failed to parse {}: expected {} at {}", source.fileName(), attempt.expected(), attempt.location());
      throw attempt.error();
    }

    String remainder = attempt.remainder();
    if (!remainder.isEmpty()) {
      ParserLocation location = source.locationOf(remainder);
      logger.debug("Unmatched trailing symbols at {}: '{}'", location, TextUtils.sanitize(TextUtils.preview(remainder)));
      throw new UnexpectedTokenError(TextUtils.preview(remainder), EOF, location, source);
    }

    logger.debug("Successfully parsed {}", source.fileName());
    return attempt.value();
  }
}
