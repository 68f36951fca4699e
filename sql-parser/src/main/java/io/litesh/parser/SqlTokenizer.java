package io.litesh.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizer for SQLite SQL text.
 *
 * <p>Performs a single-pass scan of the input and preserves exact offsets, so every character of
 * the input belongs to exactly one token. It never fails: unterminated strings, quoted identifiers
 * and block comments extend to the end of the input, and characters that start no token become
 * {@link TokenType#UNKNOWN} tokens.
 *
 * <p>The token list always ends with an {@link TokenType#EOF} token positioned at the input length.
 */
public final class SqlTokenizer {

  private static final String[] THREE_CHAR_OPERATORS = {"->>"};
  private static final String[] TWO_CHAR_OPERATORS = {
    "||", "<<", ">>", "<=", ">=", "==", "!=", "<>", "->"
  };
  private static final String SINGLE_CHAR_OPERATORS = "+-*/%&|<>=~";

  /**
   * Tokenizes SQL text.
   *
   * @param sql the input text, may be null
   * @return tokens in order, ending with EOF
   */
  public List<Token> tokenize(String sql) {
    if (sql == null || sql.isEmpty()) {
      return List.of(new Token(TokenType.EOF, "", 0, 0));
    }

    List<Token> tokens = new ArrayList<>();
    int pos = 0;
    int len = sql.length();

    while (pos < len) {
      char c = sql.charAt(pos);
      int end;
      TokenType type;

      if (Character.isWhitespace(c)) {
        end = pos + 1;
        while (end < len && Character.isWhitespace(sql.charAt(end))) end++;
        type = TokenType.WHITESPACE;
      } else if (c == '-' && pos + 1 < len && sql.charAt(pos + 1) == '-') {
        end = sql.indexOf('\n', pos);
        end = end < 0 ? len : end;
        type = TokenType.COMMENT;
      } else if (c == '/' && pos + 1 < len && sql.charAt(pos + 1) == '*') {
        end = sql.indexOf("*/", pos + 2);
        end = end < 0 ? len : end + 2;
        type = TokenType.COMMENT;
      } else if ((c == 'x' || c == 'X') && pos + 1 < len && sql.charAt(pos + 1) == '\'') {
        end = scanQuoted(sql, pos + 1, '\'');
        type = TokenType.BLOB;
      } else if (c == '\'') {
        end = scanQuoted(sql, pos, '\'');
        type = TokenType.STRING;
      } else if (c == '"' || c == '`') {
        end = scanQuoted(sql, pos, c);
        type = TokenType.IDENTIFIER;
      } else if (c == '[') {
        end = sql.indexOf(']', pos + 1);
        end = end < 0 ? len : end + 1;
        type = TokenType.IDENTIFIER;
      } else if (Character.isDigit(c)
          || (c == '.' && pos + 1 < len && Character.isDigit(sql.charAt(pos + 1)))) {
        end = scanNumber(sql, pos);
        type = TokenType.NUMBER;
      } else if (c == '?') {
        end = pos + 1;
        while (end < len && Character.isDigit(sql.charAt(end))) end++;
        type = TokenType.PARAMETER;
      } else if ((c == ':' || c == '@' || c == '$')
          && pos + 1 < len
          && isWordChar(sql.charAt(pos + 1))) {
        end = scanWord(sql, pos + 1);
        type = TokenType.PARAMETER;
      } else if (isWordStart(c)) {
        end = scanWord(sql, pos);
        type =
            SqlKeywords.isKeyword(sql.substring(pos, end))
                ? TokenType.KEYWORD
                : TokenType.IDENTIFIER;
      } else {
        end = matchOperator(sql, pos);
        if (end > pos) {
          type = TokenType.OPERATOR;
        } else {
          end = pos + 1;
          type = punctuation(c);
        }
      }

      tokens.add(new Token(type, sql.substring(pos, end), pos, end));
      pos = end;
    }

    tokens.add(new Token(TokenType.EOF, "", len, len));
    return tokens;
  }

  // Private helper methods

  private static TokenType punctuation(char c) {
    return switch (c) {
      case '(' -> TokenType.LPAREN;
      case ')' -> TokenType.RPAREN;
      case ',' -> TokenType.COMMA;
      case ';' -> TokenType.SEMICOLON;
      case '.' -> TokenType.DOT;
      default -> TokenType.UNKNOWN;
    };
  }

  private static int matchOperator(String sql, int pos) {
    for (String op : THREE_CHAR_OPERATORS) {
      if (sql.startsWith(op, pos)) return pos + op.length();
    }
    for (String op : TWO_CHAR_OPERATORS) {
      if (sql.startsWith(op, pos)) return pos + op.length();
    }
    if (SINGLE_CHAR_OPERATORS.indexOf(sql.charAt(pos)) >= 0) return pos + 1;
    return pos;
  }

  /** Scans a quoted run starting at the opening quote; a doubled quote is an escaped quote. */
  private static int scanQuoted(String sql, int quotePos, char quote) {
    int len = sql.length();
    int pos = quotePos + 1;
    while (pos < len) {
      if (sql.charAt(pos) == quote) {
        if (pos + 1 < len && sql.charAt(pos + 1) == quote) {
          pos += 2;
          continue;
        }
        return pos + 1;
      }
      pos++;
    }
    return len;
  }

  private static int scanNumber(String sql, int start) {
    int len = sql.length();
    int pos = start;
    if (sql.charAt(pos) == '0'
        && pos + 1 < len
        && (sql.charAt(pos + 1) == 'x' || sql.charAt(pos + 1) == 'X')) {
      pos += 2;
      while (pos < len && Character.digit(sql.charAt(pos), 16) >= 0) pos++;
      return pos;
    }
    while (pos < len && Character.isDigit(sql.charAt(pos))) pos++;
    if (pos < len && sql.charAt(pos) == '.') {
      pos++;
      while (pos < len && Character.isDigit(sql.charAt(pos))) pos++;
    }
    if (pos < len && (sql.charAt(pos) == 'e' || sql.charAt(pos) == 'E')) {
      int exp = pos + 1;
      if (exp < len && (sql.charAt(exp) == '+' || sql.charAt(exp) == '-')) exp++;
      if (exp < len && Character.isDigit(sql.charAt(exp))) {
        pos = exp;
        while (pos < len && Character.isDigit(sql.charAt(pos))) pos++;
      }
    }
    return pos;
  }

  private static int scanWord(String sql, int start) {
    int pos = start;
    while (pos < sql.length() && isWordChar(sql.charAt(pos))) pos++;
    return pos;
  }

  private static boolean isWordStart(char c) {
    return Character.isLetter(c) || c == '_' || c > 0x7f;
  }

  private static boolean isWordChar(char c) {
    return isWordStart(c) || Character.isDigit(c) || c == '$';
  }
}
