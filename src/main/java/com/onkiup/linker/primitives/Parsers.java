package com.onkiup.linker.primitives;

import java.util.function.BiFunction;
import java.util.function.Supplier;
import java.util.regex.Pattern;

import com.google.common.primitives.Chars;
import com.onkiup.linker.primitives.matcher.AnyCharMatcher;
import com.onkiup.linker.primitives.matcher.CharacterMatcher;
import com.onkiup.linker.primitives.matcher.ExcludedCharsMatcher;
import com.onkiup.linker.primitives.matcher.IncludedCharsMatcher;
import com.onkiup.linker.primitives.matcher.InlineParser;
import com.onkiup.linker.primitives.matcher.NullMatcher;
import com.onkiup.linker.primitives.matcher.PatternMatcher;
import com.onkiup.linker.primitives.matcher.ReferenceParser;
import com.onkiup.linker.primitives.matcher.TerminalMatcher;

/**
 * Factory methods for the primitive parsers.
 * Meant to be statically imported by grammar definitions.
 */
public final class Parsers {

  private static final AnyCharMatcher ANY_CHAR = new AnyCharMatcher();

  private Parsers() {

  }

  /**
   * Creates a parser from a description and a function that does the actual matching
   * @param expectedDescription description for error messages
   * @param attempt matching function
   */
  public static <A> Parser<A> inline(String expectedDescription, BiFunction<Source, String, Attempt<A>> attempt) {
    return new InlineParser<>(expectedDescription, attempt);
  }

  /**
   * @return parser that consumes nothing and returns null
   */
  public static <A> Parser<A> empty() {
    return new NullMatcher<>();
  }

  /**
   * @return parser that consumes nothing and returns an empty string
   */
  public static Parser<String> emptyString() {
    Parser<Object> empty = empty();
    return inline(empty.expectedDescription(), (source, input) -> empty.attempt(source, input).map(nothing -> ""));
  }

  /**
   * Creates a parser that expects, consumes and returns given string
   * @param expected expected string
   */
  public static Parser<String> string(String expected) {
    switch (expected.length()) {
      case 0:
        return emptyString();
      case 1:
        CharacterMatcher matcher = new CharacterMatcher(expected.charAt(0));
        String description = TerminalMatcher.describe(expected);
        return inline(description, (source, input) -> matcher.attempt(source, input)
            .describedAs(description)
            .map(String::valueOf));
      default:
        return new TerminalMatcher(expected);
    }
  }

  /** @see #string(String) */
  public static Parser<String> str(String expected) {
    return string(expected);
  }

  /**
   * Creates a parser that consumes given string ignoring case of its characters
   * and returns the consumed text as it appears in the input
   */
  public static Parser<String> stringIgnoreCase(String expected) {
    if (expected.isEmpty()) {
      return emptyString();
    }
    return new TerminalMatcher(expected, true);
  }

  public static Parser<Character> character(char expected) {
    return new CharacterMatcher(expected);
  }

  /** @see #character(char) */
  public static Parser<Character> chr(char expected) {
    return character(expected);
  }

  /**
   * @param included characters that can be consumed
   * @return parser that consumes one of the given characters
   */
  public static Parser<Character> anyOf(char... included) {
    return new IncludedCharsMatcher(Chars.asList(included));
  }

  public static Parser<Character> anyOf(Iterable<Character> included) {
    return new IncludedCharsMatcher(included);
  }

  /**
   * @param excluded characters that can not be consumed
   * @return parser that consumes any character except the given ones
   */
  public static Parser<Character> except(char... excluded) {
    return new ExcludedCharsMatcher(Chars.asList(excluded));
  }

  public static Parser<Character> except(Iterable<Character> excluded) {
    return new ExcludedCharsMatcher(excluded);
  }

  public static Parser<Character> anyChar() {
    return ANY_CHAR;
  }

  public static Parser<String> pattern(String regex) {
    return new PatternMatcher(regex);
  }

  public static Parser<String> pattern(Pattern pattern) {
    return new PatternMatcher(pattern);
  }

  /**
   * Creates a reference to a parser that may not exist yet.
   * Useful when rules are held in fields and refer to each other:
   * <pre>
   *   private final Parser&lt;Object&gt; exprRef = ref(() -&gt; this.expr); // expr is declared below
   *   private final Parser&lt;Object&gt; expr = ...;
   * </pre>
   * @param target supplier of the referenced parser, invoked on every use
   */
  public static <A> Parser<A> ref(Supplier<? extends Parser<A>> target) {
    return new ReferenceParser<>(target);
  }
}
