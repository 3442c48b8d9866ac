package com.onkiup.linker.primitives;

import org.junit.Test;

import static org.junit.Assert.*;

public class AttemptTest {

  private final Source source = new Source("first\nsecond", "test");

  @Test
  public void testMatch() {
    Attempt<String> attempt = Verdict.match("first", "\nsecond");
    assertTrue(attempt.isMatch());
    assertFalse(attempt.isFailed());
    assertEquals(Verdict.MATCH, attempt.verdict());
    assertEquals("first", attempt.value());
    assertEquals("\nsecond", attempt.remainder());
    assertFalse(attempt.found().isPresent());
    assertEquals(new Result<>("first", "\nsecond"), attempt.orThrow());
  }

  @Test
  public void testEndOfInput() {
    Attempt<String> attempt = Verdict.endOfInput("\"third\"", source);
    assertTrue(attempt.isFailed());
    assertEquals(Verdict.UNEXPECTED_EOF, attempt.verdict());
    assertEquals(source.length(), attempt.offset());
    assertEquals(2, attempt.location().line());
    assertEquals(7, attempt.location().column());
    assertFalse(attempt.found().isPresent());

    ParseError error = attempt.error();
    assertTrue(error instanceof UnexpectedEofError);
    assertEquals("\"third\"", error.expected());
    assertEquals(attempt.location(), error.location());
    assertSame(source, error.source());
    assertEquals("Unexpected end of input at test - 2:7, expected \"third\"", error.getMessage());
  }

  @Test
  public void testUnexpectedToken() {
    Attempt<Character> attempt = Verdict.unexpected("'x'", source, "second");
    assertEquals(Verdict.UNEXPECTED_TOKEN, attempt.verdict());
    assertEquals(6, attempt.offset());
    assertEquals("second", attempt.found().get());

    try {
      attempt.orThrow();
      fail("Failed attempt returned a result");
    } catch (UnexpectedTokenError e) {
      assertEquals("second", e.found().get());
      assertEquals("'x'", e.expected());
      assertEquals(2, e.location().line());
      assertEquals(1, e.location().column());
      assertEquals("Unexpected token 'second' at test - 2:1, expected 'x'", e.getMessage());
    }
  }

  @Test
  public void testPreviewIsBounded() {
    String input = "abcdefghijklmnopqrstuvwxyz";
    Attempt<String> attempt = Verdict.unexpected("something else", Source.inline(input), input);
    assertEquals("abcdefghijklmnopqrst", attempt.found().get());
    assertEquals("abcdefghijklmnopqrst", attempt.error().found().get());
  }

  @Test
  public void testMessageIsSanitized() {
    Attempt<String> attempt = Verdict.unexpected("'x'", source, "first\nsecond");
    ParseError error = attempt.error();
    assertEquals("first\nsecond", error.found().get());
    assertTrue(error.getMessage().contains("'first\\nsecond'"));
  }

  @Test
  public void testMap() {
    Attempt<Integer> mapped = Verdict.match("12", "").map(Integer::parseInt);
    assertEquals(Integer.valueOf(12), mapped.value());

    Attempt<String> failed = Verdict.endOfInput("digits", source);
    Attempt<Integer> mappedFailure = failed.map(Integer::parseInt);
    assertTrue(mappedFailure.isFailed());
    assertEquals(failed.verdict(), mappedFailure.verdict());
    assertEquals(failed.expected(), mappedFailure.expected());
    assertEquals(failed.offset(), mappedFailure.offset());
    assertSame(source, mappedFailure.source());
  }

  @Test
  public void testDescribedAs() {
    Attempt<String> failed = Verdict.unexpected("'a'", source, "second");
    Attempt<String> relabeled = failed.describedAs("\"a\"");
    assertEquals("\"a\"", relabeled.expected());
    assertEquals(failed.offset(), relabeled.offset());
    assertEquals(failed.found(), relabeled.found());
    assertEquals(failed.verdict(), relabeled.verdict());

    Attempt<String> match = Verdict.match("a", "");
    assertSame(match, match.describedAs("anything"));
  }

  @Test
  public void testAsFailureKeepsFailureData() {
    Attempt<Character> failed = Verdict.unexpected("'x'", source, "second");
    Attempt<String> retyped = failed.asFailure();
    assertEquals(Verdict.UNEXPECTED_TOKEN, retyped.verdict());
    assertEquals("second", retyped.found().get());
    assertEquals("'x'", retyped.expected());
    assertEquals(failed.location(), retyped.location());
  }

  @Test(expected = IllegalStateException.class)
  public void testMatchCannotBeRetyped() {
    Verdict.match("x", "").asFailure();
  }

  @Test(expected = IllegalStateException.class)
  public void testFailureHasNoResult() {
    Verdict.endOfInput("x", source).result();
  }

  @Test(expected = IllegalStateException.class)
  public void testMatchHasNoError() {
    Verdict.match("x", "").error();
  }
}
