package com.onkiup.linker.primitives.matcher;

import java.util.function.Supplier;

import com.onkiup.linker.primitives.Attempt;
import com.onkiup.linker.primitives.Parser;
import com.onkiup.linker.primitives.Source;

/**
 * Delegates to a parser obtained from a supplier on every call.
 * Lets grammar rules refer to rules that are defined later or refer to themselves:
 * <pre>
 *   private final Parser&lt;String&gt; valueRef = Parsers.ref(() -&gt; this.value);
 *   private final Parser&lt;String&gt; value = ...; // may use valueRef
 * </pre>
 * The resolved parser is never cached.
 */
public class ReferenceParser<A> implements Parser<A> {

  private final Supplier<? extends Parser<A>> target;

  public ReferenceParser(Supplier<? extends Parser<A>> target) {
    if (target == null) {
      throw new IllegalArgumentException("Reference target supplier cannot be null");
    }
    this.target = target;
  }

  /**
   * @return the parser this reference currently points to
   * @throws IllegalStateException if the supplier returns null
   */
  public Parser<A> resolve() {
    Parser<A> parser = target.get();
    if (parser == null) {
      throw new IllegalStateException("Parser reference resolved to null; was the referenced rule defined?");
    }
    return parser;
  }

  @Override
  public String expectedDescription() {
    return resolve().expectedDescription();
  }

  @Override
  public Attempt<A> attempt(Source source, String input) {
    return resolve().attempt(source, input);
  }

  @Override
  public String toString() {
    return resolve().toString();
  }
}
