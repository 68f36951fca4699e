package io.litesh.parser;

import java.util.Locale;

/**
 * A single token of SQL source text.
 *
 * @param type the type of this token
 * @param text the exact source text of this token
 * @param start offset in the source where the token starts (inclusive)
 * @param end offset in the source where the token ends (exclusive)
 */
public record Token(TokenType type, String text, int start, int end) {

  /** Returns the length of this token in characters. */
  public int length() {
    return end - start;
  }

  /**
   * Checks whether this token is the given keyword.
   *
   * @param keyword upper-case keyword
   * @return true if this is a keyword token spelling {@code keyword} in any case
   */
  public boolean isKeyword(String keyword) {
    return type == TokenType.KEYWORD && text.equalsIgnoreCase(keyword);
  }

  /** Returns the upper-cased text, used as the kind of anonymous keyword nodes. */
  public String upperText() {
    return text.toUpperCase(Locale.ROOT);
  }

  @Override
  public String toString() {
    return String.format("%s['%s']@%d-%d", type, text, start, end);
  }
}
