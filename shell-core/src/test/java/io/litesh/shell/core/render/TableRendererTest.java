package io.litesh.shell.core.render;

import static org.junit.jupiter.api.Assertions.*;

import io.litesh.shell.core.OutputWriter;
import java.io.ByteArrayInputStream;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TableRendererTest {

  private final List<String> lines = new ArrayList<>();
  private PagedPrinter pager;

  @BeforeEach
  void setup() {
    OutputWriter out =
        new OutputWriter() {
          @Override
          public void println(String s) {
            lines.add(s);
          }

          @Override
          public void printf(String fmt, Object... args) {
            lines.add(String.format(fmt, args));
          }

          @Override
          public void error(String s) {
            lines.add("ERR " + s);
          }
        };
    pager = PagedPrinter.create(out, false, 24, new ByteArrayInputStream(new byte[0]));
  }

  @Test
  void rendersBorderedTable() {
    TableRenderer.render(
        List.of("id", "name"), List.of(List.of("1", "alice"), List.of("22", "bob")), pager);

    assertEquals(
        List.of(
            "+----+-------+",
            "| id | name  |",
            "+----+-------+",
            "| 1  | alice |",
            "| 22 | bob   |",
            "+----+-------+"),
        lines);
  }

  @Test
  void rendersHeaderOnlyForEmptyResult() {
    TableRenderer.render(List.of("a"), List.of(), pager);

    assertEquals(List.of("+---+", "| a |", "+---+", "+---+"), lines);
  }

  @Test
  void truncatesLongSingleLineCells() {
    String longText = "x".repeat(50);

    TableRenderer.render(List.of("v"), List.of(List.of(longText)), pager);

    String row = lines.get(3);
    assertEquals("| " + "x".repeat(39) + "… |", row);
  }

  @Test
  void keepsMultiLineCellsWhole() {
    String json = "{\n  \"key\": \"" + "y".repeat(45) + "\"\n}";

    TableRenderer.render(List.of("doc", "n"), List.of(List.of(json, "1")), pager);

    assertEquals(3 + 3 + 1, lines.size());
    assertTrue(lines.get(4).contains("\"key\": \"" + "y".repeat(45) + "\""));
    assertTrue(lines.get(3).endsWith("| 1 |"));
    assertTrue(lines.get(5).endsWith("|   |"));
  }

  @Test
  void truncateHandlesTinyWidths() {
    assertEquals("abc", TableRenderer.truncate("abc", 3));
    assertEquals("a", TableRenderer.truncate("abc", 1));
    assertEquals("a…", TableRenderer.truncate("abc", 2));
  }
}
