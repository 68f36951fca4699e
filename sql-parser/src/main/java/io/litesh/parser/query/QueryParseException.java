package io.litesh.parser.query;

/** Thrown when a tree query pattern is malformed. */
public class QueryParseException extends RuntimeException {
  private final int position;

  public QueryParseException(String message, int position) {
    super(message + " at position " + position);
    this.position = position;
  }

  /** Offset into the pattern where the problem was detected. */
  public int position() {
    return position;
  }
}
