package io.litesh.shell.cli.completion;

import io.litesh.parser.SqlParser;
import io.litesh.parser.SyntaxTree;
import io.litesh.shell.catalog.CatalogAccessor;
import io.litesh.shell.cli.completion.completers.StatementKeywordCompleter;
import io.litesh.shell.cli.completion.completers.TableReferenceCompleter;
import io.litesh.shell.core.completion.CompletionCandidate;
import io.litesh.shell.core.completion.CompletionContext;
import io.litesh.shell.core.completion.ContextCompleter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Context-sensitive SQL completion. Every request parses the whole source again and resolves names
 * only for the statement under the cursor.
 */
public final class CompletionEngine {
  private static final Logger LOG = LoggerFactory.getLogger(CompletionEngine.class);
  private static final boolean DEBUG = Boolean.getBoolean("litesh.completion.debug");

  private final SqlContextAnalyzer analyzer;
  private final SqlMetadataService metadata;
  private final List<ContextCompleter<SqlMetadataService>> completers;

  public CompletionEngine(CatalogAccessor catalog) {
    this.analyzer = new SqlContextAnalyzer();
    this.metadata = new SqlMetadataService(catalog);
    this.completers = List.of(new StatementKeywordCompleter(), new TableReferenceCompleter());
  }

  /**
   * Computes the candidates for the token at {@code cursor}.
   *
   * @param source the whole buffer
   * @param cursor char offset into {@code source}
   * @return candidates in presentation order, possibly empty
   */
  public List<CompletionCandidate> complete(String source, int cursor) {
    List<CompletionCandidate> candidates = new ArrayList<>();
    if (source == null || cursor < 0 || cursor > source.length()) {
      return candidates;
    }
    try {
      SyntaxTree tree = SqlParser.parse(source);
      CompletionContext ctx = analyzer.analyze(tree, cursor);

      if (DEBUG) {
        System.err.println("=== SQL COMPLETION DEBUG ===");
        System.err.println("  source:       '" + source + "'");
        System.err.println("  cursor:       " + cursor);
        System.err.println("  detected:     " + ctx.type());
        System.err.println("  node:         " + (ctx.node() != null ? ctx.node() : "(none)"));
        System.err.println("  partial:      '" + ctx.partialInput() + "'");
      }

      for (ContextCompleter<SqlMetadataService> completer : completers) {
        if (completer.canHandle(ctx)) {
          completer.complete(ctx, metadata, candidates);
          if (DEBUG) {
            System.err.println("  Completer:    " + completer.getClass().getSimpleName());
            System.err.println("  Candidates:   " + candidates.size());
          }
          return candidates;
        }
      }
      if (DEBUG) {
        System.err.println("  No completer found for context: " + ctx.type());
      }
    } catch (RuntimeException e) {
      LOG.debug("Completion failed at {}: {}", cursor, e.toString());
      candidates.clear();
    }
    return candidates;
  }

  /**
   * Returns the not yet typed remainder of the first candidate, suitable as ghost text after the
   * cursor.
   */
  public Optional<String> hint(String source, int cursor) {
    List<CompletionCandidate> candidates = complete(source, cursor);
    if (candidates.isEmpty()) {
      return Optional.empty();
    }
    CompletionCandidate first = candidates.get(0);
    int typed = cursor - first.replaceFrom();
    if (typed < 0 || typed > first.replacement().length()) {
      return Optional.empty();
    }
    return Optional.of(first.replacement().substring(typed));
  }
}
