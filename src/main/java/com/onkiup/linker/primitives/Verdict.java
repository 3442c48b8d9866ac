package com.onkiup.linker.primitives;

import com.onkiup.linker.primitives.util.TextUtils;

/**
 * Outcome kinds of a single matcher invocation
 */
public enum Verdict {
  MATCH, UNEXPECTED_EOF, UNEXPECTED_TOKEN;

  public static <A> Attempt<A> match(A value, String remainder) {
    return new Attempt<>(MATCH, new Result<>(value, remainder), null, null, null, -1);
  }

  /**
   * Reports that the input ended while the matcher still required characters.
   * EOF is a property of the whole source, so the failure is placed at its very end.
   */
  public static <A> Attempt<A> endOfInput(String expected, Source source) {
    return new Attempt<>(UNEXPECTED_EOF, null, null, expected, source, source.length());
  }

  /**
   * Reports a mismatch at the head of the input
   * @param expected description of what the matcher wanted
   * @param source parsed source
   * @param input the input the matcher received, a suffix of the source text
   */
  public static <A> Attempt<A> unexpected(String expected, Source source, String input) {
    return new Attempt<>(UNEXPECTED_TOKEN, null, TextUtils.preview(input), expected, source,
        source.length() - input.length());
  }
}
