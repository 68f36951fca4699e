package io.litesh.shell.core.completion;

import static io.litesh.shell.core.completion.ContextCompleter.matchCase;
import static io.litesh.shell.core.completion.ContextCompleter.startsWithIgnoreAsciiCase;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Locale;
import net.jqwik.api.*;
import net.jqwik.api.constraints.*;
import org.junit.jupiter.api.Test;

class ContextCompleterTest {

  @Test
  void prefixFilterIgnoresAsciiCase() {
    assertTrue(startsWithIgnoreAsciiCase("SELECT", "sel"));
    assertTrue(startsWithIgnoreAsciiCase("users", "USE"));
    assertTrue(startsWithIgnoreAsciiCase("users", ""));
    assertTrue(startsWithIgnoreAsciiCase("users", "users"));
    assertFalse(startsWithIgnoreAsciiCase("users", "users2"));
    assertFalse(startsWithIgnoreAsciiCase("accounts", "u"));
  }

  @Test
  void prefixFilterFoldsAsciiOnly() {
    assertFalse(startsWithIgnoreAsciiCase("ÉTÉ", "é"));
    assertTrue(startsWithIgnoreAsciiCase("été", "é"));
  }

  @Test
  void lowerCaseInputSelectsLowerCaseKeyword() {
    assertEquals("select", matchCase("SELECT", "sel"));
    assertEquals("SELECT", matchCase("SELECT", "Sel"));
    assertEquals("SELECT", matchCase("SELECT", "SEL"));
    assertEquals("SELECT", matchCase("SELECT", "s1"));
    assertEquals("select", matchCase("SELECT", ""));
  }

  @Test
  void candidateUsesContextStartAndTrailingSpace() {
    ContextCompleter<Void> completer =
        new ContextCompleter<>() {
          @Override
          public boolean canHandle(CompletionContext ctx) {
            return true;
          }

          @Override
          public void complete(
              CompletionContext ctx, Void metadata, List<CompletionCandidate> candidates) {}
        };
    CompletionContext ctx = CompletionContext.builder().replaceFrom(7).cursor(9).build();

    assertEquals(new CompletionCandidate(7, "users "), completer.candidate(ctx, "users"));
    assertEquals(CompletionContextType.UNKNOWN, ctx.type());
    assertTrue(ctx.statement().isEmpty());
  }

  @Test
  void rejectsInvalidCandidates() {
    assertThrows(IllegalArgumentException.class, () -> new CompletionCandidate(-1, "x"));
    assertThrows(IllegalArgumentException.class, () -> new CompletionCandidate(0, null));
  }

  @Property(tries = 500)
  void everyPrefixOfAnItemMatches(
      @ForAll @StringLength(max = 20) String item, @ForAll @IntRange(max = 20) int cut) {
    String typed = item.substring(0, Math.min(cut, item.length()));

    assertTrue(startsWithIgnoreAsciiCase(item, typed));
    if (typed.chars().allMatch(c -> c < 128)) {
      assertTrue(startsWithIgnoreAsciiCase(item, typed.toUpperCase(Locale.ROOT)));
    }
  }

  @Property(tries = 500)
  void matchesImplyLengthAndCaseInsensitivePrefix(
      @ForAll @AlphaChars @StringLength(max = 12) String item,
      @ForAll @AlphaChars @StringLength(max = 12) String typed) {
    if (startsWithIgnoreAsciiCase(item, typed)) {
      assertTrue(item.length() >= typed.length());
      assertTrue(item.substring(0, typed.length()).equalsIgnoreCase(typed));
    }
  }
}
