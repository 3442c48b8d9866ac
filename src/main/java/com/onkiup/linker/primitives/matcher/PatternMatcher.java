package com.onkiup.linker.primitives.matcher;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.onkiup.linker.primitives.Attempt;
import com.onkiup.linker.primitives.Parser;
import com.onkiup.linker.primitives.Source;
import com.onkiup.linker.primitives.Verdict;

/**
 * Consumes the prefix of the input matched by a regular expression and returns it.
 * Requires at least one character of input; an expression that matches an empty prefix
 * succeeds without consuming anything.
 */
public class PatternMatcher implements Parser<String> {
  private static final Logger logger = LoggerFactory.getLogger(PatternMatcher.class);

  private final Pattern pattern;

  public PatternMatcher(String regex) {
    this(Pattern.compile(regex));
  }

  public PatternMatcher(Pattern pattern) {
    if (pattern == null) {
      throw new IllegalArgumentException("Pattern cannot be null");
    }
    this.pattern = pattern;
    logger.debug("Created matcher for pattern /{}/", pattern);
  }

  public Pattern pattern() {
    return pattern;
  }

  @Override
  public String expectedDescription() {
    return "text matching /" + pattern.pattern() + "/";
  }

  @Override
  public Attempt<String> attempt(Source source, String input) {
    if (input.isEmpty()) {
      return Verdict.endOfInput(expectedDescription(), source);
    }

    // matchers are not thread-safe, so every attempt gets its own
    Matcher matcher = pattern.matcher(input);
    if (!matcher.lookingAt()) {
      return Verdict.unexpected(expectedDescription(), source, input);
    }

    return Verdict.match(matcher.group(), input.substring(matcher.end()));
  }

  @Override
  public String toString() {
    return expectedDescription();
  }
}
