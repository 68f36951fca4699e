package io.litesh.shell.cli;

import static org.junit.jupiter.api.Assertions.*;

import org.jline.utils.AttributedString;
import org.jline.utils.AttributedStyle;
import org.junit.jupiter.api.Test;

class SqlHighlighterTest {

  @Test
  void keepsTextIntact() {
    String sql = "SELECT 'x', 42 -- note\nFROM t WHERE id = ?";

    assertEquals(sql, SqlHighlighter.highlight(sql).toString());
  }

  @Test
  void stylesKeywordsAndLiterals() {
    AttributedString text = SqlHighlighter.highlight("SELECT 42, name");

    assertEquals(AttributedStyle.BOLD.foreground(AttributedStyle.BLUE), text.styleAt(0));
    assertEquals(AttributedStyle.BOLD.foreground(AttributedStyle.YELLOW), text.styleAt(7));
    assertEquals(AttributedStyle.DEFAULT, text.styleAt(11));
  }

  @Test
  void dotCommandsArePlain() {
    AttributedString text = new SqlHighlighter().highlight(null, ".schema SELECT");

    assertEquals(AttributedStyle.DEFAULT, text.styleAt(8));
  }
}
