package com.onkiup.linker.primitives.matcher;

import org.junit.Test;

import com.onkiup.linker.primitives.Attempt;
import com.onkiup.linker.primitives.Source;

import static org.junit.Assert.*;

public class NullMatcherTest {

  @Test
  public void testConsumesNothing() {
    NullMatcher<String> matcher = new NullMatcher<>();
    Attempt<String> result = matcher.attempt(Source.inline("abc"), "bc");
    assertTrue(result.isMatch());
    assertNull(result.value());
    assertEquals("bc", result.remainder());

    // succeeds at the end of input too
    assertTrue(matcher.attempt(Source.inline("abc"), "").isMatch());
    assertEquals("empty string", matcher.toString());
  }
}
