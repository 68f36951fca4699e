package io.litesh.shell.cli.completion.completers;

import io.litesh.shell.cli.completion.SqlMetadataService;
import io.litesh.shell.core.completion.CompletionCandidate;
import io.litesh.shell.core.completion.CompletionContext;
import io.litesh.shell.core.completion.CompletionContextType;
import io.litesh.shell.core.completion.ContextCompleter;
import java.util.List;

/** Completer for the keyword that starts a statement. */
public final class StatementKeywordCompleter implements ContextCompleter<SqlMetadataService> {

  static final List<String> INITIAL_KEYWORDS =
      List.of(
          "SELECT", "DELETE", "CREATE", "DROP", "ATTACH", "DETACH", "EXPLAIN", "PRAGMA", "WITH",
          "UPDATE", "ALTER", "BEGIN", "END", "COMMIT", "ROLLBACK");

  @Override
  public boolean canHandle(CompletionContext ctx) {
    return ctx.type() == CompletionContextType.STATEMENT_START;
  }

  @Override
  public void complete(
      CompletionContext ctx, SqlMetadataService metadata, List<CompletionCandidate> candidates) {
    String typed = ctx.partialInput();
    for (String keyword : INITIAL_KEYWORDS) {
      if (ContextCompleter.startsWithIgnoreAsciiCase(keyword, typed)) {
        candidates.add(candidate(ctx, ContextCompleter.matchCase(keyword, typed)));
      }
    }
  }
}
