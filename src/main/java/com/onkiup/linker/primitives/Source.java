package com.onkiup.linker.primitives;

import java.util.Objects;

/**
 * Text being parsed together with the name of its origin.
 * Used only to build diagnostics, never mutated.
 */
public final class Source {

  public static final String INLINE = "<inline>";

  private final String text;
  private final String fileName;

  public static Source inline(String text) {
    return new Source(text, INLINE);
  }

  public Source(String text, String fileName) {
    if (text == null) {
      throw new IllegalArgumentException("Source text cannot be null");
    }
    if (fileName == null) {
      throw new IllegalArgumentException("Source name cannot be null");
    }
    this.text = text;
    this.fileName = fileName;
  }

  public String text() {
    return text;
  }

  public String fileName() {
    return fileName;
  }

  public int length() {
    return text.length();
  }

  /**
   * @param offset character offset in this source's text
   * @return line and column of the character at the given offset
   */
  public ParserLocation location(int offset) {
    return ParserLocation.of(fileName, text, offset);
  }

  /**
   * @param remainder a suffix of this source's text
   * @return location of the first character of the remainder
   */
  public ParserLocation locationOf(String remainder) {
    return location(text.length() - remainder.length());
  }

  /**
   * @return location right after the last character of the text
   */
  public ParserLocation end() {
    return location(text.length());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Source)) {
      return false;
    }
    Source other = (Source) o;
    return text.equals(other.text) && fileName.equals(other.fileName);
  }

  @Override
  public int hashCode() {
    return Objects.hash(text, fileName);
  }

  @Override
  public String toString() {
    return "Source[" + fileName + ", " + text.length() + " chars]";
  }
}
