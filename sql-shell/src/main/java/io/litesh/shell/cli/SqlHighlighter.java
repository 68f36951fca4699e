package io.litesh.shell.cli;

import io.litesh.parser.SqlTokenizer;
import io.litesh.parser.Token;
import org.jline.reader.LineReader;
import org.jline.reader.impl.DefaultHighlighter;
import org.jline.utils.AttributedString;
import org.jline.utils.AttributedStringBuilder;
import org.jline.utils.AttributedStyle;

/** Colors SQL keywords, literals, parameters and comments. Dot-commands are left plain. */
public final class SqlHighlighter extends DefaultHighlighter {
  private static final AttributedStyle KEYWORD =
      AttributedStyle.BOLD.foreground(AttributedStyle.BLUE);
  private static final AttributedStyle NUMBER =
      AttributedStyle.BOLD.foreground(AttributedStyle.YELLOW);
  private static final AttributedStyle STRING =
      AttributedStyle.BOLD.foreground(AttributedStyle.MAGENTA);
  private static final AttributedStyle COMMENT =
      AttributedStyle.BOLD.foreground(AttributedStyle.GREEN);

  @Override
  public AttributedString highlight(LineReader reader, String buffer) {
    if (buffer.startsWith(".")) {
      return new AttributedString(buffer);
    }
    return highlight(buffer);
  }

  /** Highlights a piece of SQL. */
  public static AttributedString highlight(String sql) {
    AttributedStringBuilder sb = new AttributedStringBuilder(sql.length());
    for (Token token : new SqlTokenizer().tokenize(sql)) {
      AttributedStyle style =
          switch (token.type()) {
            case KEYWORD -> KEYWORD;
            case NUMBER -> NUMBER;
            case STRING, BLOB, PARAMETER -> STRING;
            case COMMENT -> COMMENT;
            default -> AttributedStyle.DEFAULT;
          };
      sb.styled(style, token.text());
    }
    return sb.toAttributedString();
  }
}
