package io.litesh.parser;

/**
 * Token types produced by {@link SqlTokenizer}.
 *
 * <p>Whitespace and comments are kept as tokens so that highlighting can cover the whole line; the
 * parser skips them.
 */
public enum TokenType {
  /** A reserved or non-reserved SQLite keyword, matched case-insensitively. */
  KEYWORD,

  /** Bare or quoted identifier: name, "name", `name`, [name] */
  IDENTIFIER,

  /** Integer, decimal, exponent or hexadecimal literal */
  NUMBER,

  /** Single-quoted string literal */
  STRING,

  /** Blob literal: X'0a0b' */
  BLOB,

  /** Bind parameter: ?, ?1, :name, @name, $name */
  PARAMETER,

  /** Arithmetic, comparison, bitwise and concatenation operators, including * */
  OPERATOR,

  /** Opening parenthesis: ( */
  LPAREN,

  /** Closing parenthesis: ) */
  RPAREN,

  /** Comma: , */
  COMMA,

  /** Statement separator: ; */
  SEMICOLON,

  /** Qualifier separator: . */
  DOT,

  /** Line comment (--) or block comment */
  COMMENT,

  /** Spaces, tabs and line breaks */
  WHITESPACE,

  /** Character that starts no valid token */
  UNKNOWN,

  /** End of input marker, always the last token */
  EOF;

  /** Whether the parser ignores tokens of this type. */
  public boolean isTrivia() {
    return this == WHITESPACE || this == COMMENT;
  }
}
