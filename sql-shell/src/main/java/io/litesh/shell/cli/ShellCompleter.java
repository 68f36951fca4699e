package io.litesh.shell.cli;

import io.litesh.shell.cli.completion.CompletionEngine;
import io.litesh.shell.core.completion.CompletionCandidate;
import java.util.List;
import org.jline.reader.Candidate;
import org.jline.reader.Completer;
import org.jline.reader.LineReader;
import org.jline.reader.ParsedLine;

/**
 * JLine completer backed by the {@link CompletionEngine}.
 *
 * <p>JLine replaces whole words (split at whitespace), while the engine replaces the syntax node
 * under the cursor, so every candidate is rewritten into a value for the current word.
 */
public final class ShellCompleter implements Completer {

  private static final boolean DEBUG = Boolean.getBoolean("litesh.completion.debug");

  private final CompletionEngine engine;

  public ShellCompleter(CompletionEngine engine) {
    this.engine = engine;
  }

  @Override
  public void complete(LineReader reader, ParsedLine line, List<Candidate> candidates) {
    String buffer = line.line();
    int cursor = line.cursor();
    if (buffer.startsWith(".")) return;

    int wordStart = cursor - line.wordCursor();
    if (DEBUG) {
      System.err.println("=== SHELL COMPLETION DEBUG ===");
      System.err.println("  line():       '" + buffer + "'");
      System.err.println("  cursor():     " + cursor);
      System.err.println("  word():       '" + line.word() + "'");
      System.err.println("  wordStart:    " + wordStart);
    }

    for (CompletionCandidate c : engine.complete(buffer, cursor)) {
      String value = toWordValue(buffer, wordStart, c);
      if (value == null) continue;
      // complete=false: the replacement already carries its trailing space
      candidates.add(new Candidate(value, c.replacement().trim(), null, null, null, null, false));
    }
  }

  static String toWordValue(String buffer, int wordStart, CompletionCandidate c) {
    int from = c.replaceFrom();
    if (from >= wordStart) {
      return buffer.substring(wordStart, from) + c.replacement();
    }
    int overlap = wordStart - from;
    String typed = buffer.substring(from, wordStart);
    if (overlap > c.replacement().length()
        || !c.replacement().regionMatches(true, 0, typed, 0, overlap)) {
      return null;
    }
    return c.replacement().substring(overlap);
  }
}
