package com.onkiup.linker.primitives;

import java.util.Objects;

/**
 * A point in a named text. Lines and columns start at 1.
 */
public class ParserLocation {

  private final int line, column, position;
  private final String name;

  /**
   * Computes the location of a character offset in the given text
   * @param name the name of the text's origin
   * @param text full text
   * @param offset character offset, may be equal to the text's length to point at its end
   * @return computed location
   */
  public static ParserLocation of(String name, CharSequence text, int offset) {
    if (offset < 0 || offset > text.length()) {
      throw new IllegalArgumentException("Offset " + offset + " is out of text bounds [0, " + text.length() + "]");
    }

    int line = 1;
    int column = 1;
    for (int i = 0; i < offset; i++) {
      if (text.charAt(i) == '\n') {
        line++;
        column = 1;
      } else {
        column++;
      }
    }

    return new ParserLocation(name, offset, line, column);
  }

  public ParserLocation(String name, int position, int line, int column) {
    if (position < 0) {
      throw new IllegalArgumentException("Position cannot be negative");
    }

    if (line < 1) {
      throw new IllegalArgumentException("Line must be positive");
    }

    if (column < 1) {
      throw new IllegalArgumentException("Column must be positive");
    }

    this.name = name;
    this.position = position;
    this.line = line;
    this.column = column;
  }

  public String name() {
    return name;
  }

  public int position() {
    return position;
  }

  public int line() {
    return line;
  }

  public int column() {
    return column;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ParserLocation)) {
      return false;
    }
    ParserLocation other = (ParserLocation) o;
    return position == other.position && line == other.line && column == other.column
        && Objects.equals(name, other.name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, position, line, column);
  }

  @Override
  public String toString() {
    return new StringBuilder()
      .append(name)
      .append(" - ")
      .append(line)
      .append(':')
      .append(column)
      .toString();
  }
}
