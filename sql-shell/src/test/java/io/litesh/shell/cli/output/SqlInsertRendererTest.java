package io.litesh.shell.cli.output;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import org.junit.jupiter.api.Test;

class SqlInsertRendererTest {

  @Test
  void literals() {
    assertEquals("NULL", SqlInsertRenderer.literal(null));
    assertEquals("42", SqlInsertRenderer.literal(42L));
    assertEquals("1.5", SqlInsertRenderer.literal(1.5));
    assertEquals("'O''Brien'", SqlInsertRenderer.literal("O'Brien"));
    assertEquals("X'00ff'", SqlInsertRenderer.literal(new byte[] {0, (byte) 0xff}));
  }

  @Test
  void insertStatement() {
    assertEquals(
        "INSERT INTO tbl VALUES(1, 'a', NULL);",
        SqlInsertRenderer.insert(SqlInsertRenderer.DEFAULT_TABLE, Arrays.asList(1, "a", null)));
  }
}
