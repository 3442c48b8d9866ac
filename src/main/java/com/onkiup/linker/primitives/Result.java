package com.onkiup.linker.primitives;

import java.util.Objects;

/**
 * Value produced by a successful match and the input left after it.
 * @param <A> value type
 */
public final class Result<A> {
  private final A value;
  private final String remainder;

  public Result(A value, String remainder) {
    if (remainder == null) {
      throw new IllegalArgumentException("Remainder cannot be null");
    }
    this.value = value;
    this.remainder = remainder;
  }

  public A value() {
    return value;
  }

  public String remainder() {
    return remainder;
  }

  /**
   * @param input the input this result was produced from
   * @return number of characters consumed from the input
   */
  public int consumed(String input) {
    return input.length() - remainder.length();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Result)) {
      return false;
    }
    Result<?> other = (Result<?>) o;
    return Objects.equals(value, other.value) && remainder.equals(other.remainder);
  }

  @Override
  public int hashCode() {
    return Objects.hash(value, remainder);
  }

  @Override
  public String toString() {
    return "Result(" + value + ", '" + remainder + "')";
  }
}
