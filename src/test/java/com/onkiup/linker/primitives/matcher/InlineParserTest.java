package com.onkiup.linker.primitives.matcher;

import org.junit.Test;

import com.onkiup.linker.primitives.Attempt;
import com.onkiup.linker.primitives.Parser;
import com.onkiup.linker.primitives.Parsers;
import com.onkiup.linker.primitives.Source;
import com.onkiup.linker.primitives.UnexpectedTokenError;
import com.onkiup.linker.primitives.Verdict;

import static org.junit.Assert.*;

public class InlineParserTest {

  private static final Parser<Character> DIGIT = Parsers.anyOf('0', '1', '2', '3', '4', '5', '6', '7', '8', '9');

  @Test
  public void testDispatch() {
    Parser<Integer> digit = Parsers.inline("digit", (source, input) ->
        DIGIT.attempt(source, input).describedAs("digit").map(c -> c - '0'));

    assertEquals("digit", digit.expectedDescription());
    assertEquals("digit", digit.toString());
    assertEquals(Integer.valueOf(7), digit.parse("7"));

    try {
      digit.parse("x");
      fail();
    } catch (UnexpectedTokenError e) {
      assertEquals("digit", e.expected());
    }
  }

  @Test
  public void testSequence() {
    // two digits, written without any combinator library
    Parser<Integer> number = Parsers.inline("two digits", (source, input) -> {
      Attempt<Character> first = DIGIT.attempt(source, input);
      if (first.isFailed()) {
        return first.asFailure();
      }
      Attempt<Character> second = DIGIT.attempt(source, first.remainder());
      if (second.isFailed()) {
        return second.asFailure();
      }
      int value = (first.value() - '0') * 10 + second.value() - '0';
      return Verdict.match(value, second.remainder());
    });

    assertEquals(Integer.valueOf(42), number.parse("42"));

    try {
      number.parse("4x");
      fail();
    } catch (UnexpectedTokenError e) {
      assertEquals(1, e.location().position());
      assertEquals(DIGIT.expectedDescription(), e.expected());
    }
  }
}
