package io.litesh.shell.cli.completion;

import static org.junit.jupiter.api.Assertions.*;

import io.litesh.parser.SqlParser;
import io.litesh.shell.core.completion.CompletionContext;
import io.litesh.shell.core.completion.CompletionContextType;
import org.junit.jupiter.api.Test;

class SqlContextAnalyzerTest {

  private final SqlContextAnalyzer analyzer = new SqlContextAnalyzer();

  private CompletionContext analyze(String source, int cursor) {
    return analyzer.analyze(SqlParser.parse(source), cursor);
  }

  @Test
  void detectsStatementStart() {
    CompletionContext ctx = analyze("SEL", 3);

    assertEquals(CompletionContextType.STATEMENT_START, ctx.type());
    assertEquals("SEL", ctx.partialInput());
    assertEquals(0, ctx.replaceFrom());
    assertTrue(ctx.statement().isEmpty());
  }

  @Test
  void partialInputIsTheWholeNodeText() {
    CompletionContext ctx = analyze("SELECT * FROM users", 16);

    assertEquals(CompletionContextType.TABLE_REFERENCE, ctx.type());
    assertEquals("users", ctx.partialInput());
    assertEquals(14, ctx.replaceFrom());
    assertEquals(16, ctx.cursor());
  }

  @Test
  void detectsMissingTableName() {
    CompletionContext ctx = analyze("SELECT 1; SELECT * FROM ", 24);

    assertEquals(CompletionContextType.TABLE_REFERENCE, ctx.type());
    assertEquals("", ctx.partialInput());
    assertEquals(24, ctx.replaceFrom());
    assertTrue(ctx.statement().isPresent());
    assertEquals(10, ctx.statement().get().start());
  }

  @Test
  void aliasIsNotATablePosition() {
    CompletionContext ctx = analyze("SELECT * FROM users AS us", 25);

    assertEquals(CompletionContextType.UNKNOWN, ctx.type());
    assertEquals("identifier", ctx.node().kind());
  }

  @Test
  void nothingToAnchorOnAtStart() {
    CompletionContext ctx = analyze("SELECT", 0);

    assertEquals(CompletionContextType.UNKNOWN, ctx.type());
    assertNull(ctx.node());
  }
}
