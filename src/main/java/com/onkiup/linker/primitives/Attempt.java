package com.onkiup.linker.primitives;

import java.util.Optional;
import java.util.function.Function;

/**
 * Explicit outcome of {@link Parser#attempt(Source, String)}: either a {@link Result} or the description of a failure.
 * Failed attempts are plain values, so callers that want to try something else can inspect and drop them
 * without paying for an exception.
 * @param <A> type of the value on success
 */
public class Attempt<A> {
  private final Verdict verdict;
  private final Result<A> result;
  private final String found;
  private final String expected;
  private final Source source;
  private final int offset;

  protected Attempt(Verdict verdict, Result<A> result, String found, String expected, Source source, int offset) {
    this.verdict = verdict;
    this.result = result;
    this.found = found;
    this.expected = expected;
    this.source = source;
    this.offset = offset;
  }

  public Verdict verdict() {
    return verdict;
  }

  public boolean isMatch() {
    return verdict == Verdict.MATCH;
  }

  public boolean isFailed() {
    return verdict != Verdict.MATCH;
  }

  /**
   * @return match result
   * @throws IllegalStateException if this attempt failed
   */
  public Result<A> result() {
    if (isFailed()) {
      throw new IllegalStateException("Failed attempt has no result: " + this);
    }
    return result;
  }

  public A value() {
    return result().value();
  }

  public String remainder() {
    return result().remainder();
  }

  /**
   * @return bounded preview of the offending input, empty for matches and end-of-input failures
   */
  public Optional<String> found() {
    return Optional.ofNullable(found);
  }

  public String expected() {
    return expected;
  }

  public Source source() {
    return source;
  }

  /**
   * @return offset of the failure in the source text, or -1 for matches
   */
  public int offset() {
    return offset;
  }

  public ParserLocation location() {
    if (isMatch()) {
      throw new IllegalStateException("Matches carry no failure location");
    }
    return source.location(offset);
  }

  /**
   * Transforms the value of a successful attempt, failures pass through untouched
   */
  public <B> Attempt<B> map(Function<? super A, ? extends B> mapper) {
    if (isFailed()) {
      return asFailure();
    }
    return Verdict.match(mapper.apply(result.value()), result.remainder());
  }

  /**
   * Replaces the expectation reported by a failed attempt, matches are returned as is
   * @param description new description of the expected input
   */
  public Attempt<A> describedAs(String description) {
    if (isMatch()) {
      return this;
    }
    return new Attempt<>(verdict, null, found, description, source, offset);
  }

  /**
   * Retypes a failed attempt so it can be returned by a parser of another value type
   */
  public <B> Attempt<B> asFailure() {
    if (isMatch()) {
      throw new IllegalStateException("Successful attempt cannot be retyped: " + this);
    }
    return new Attempt<>(verdict, null, found, expected, source, offset);
  }

  /**
   * @return exception describing this failure
   */
  public ParseError error() {
    switch (verdict) {
      case UNEXPECTED_EOF:
        return new UnexpectedEofError(expected, location(), source);
      case UNEXPECTED_TOKEN:
        return new UnexpectedTokenError(found, expected, location(), source);
      default:
        throw new IllegalStateException("Successful attempt has no error");
    }
  }

  public Result<A> orThrow() throws ParseError {
    if (isFailed()) {
      throw error();
    }
    return result;
  }

  @Override
  public String toString() {
    if (isMatch()) {
      return "Attempt: " + verdict + " " + result;
    }
    return "Attempt: " + verdict + " (expected " + expected + " at offset " + offset + ")";
  }
}
