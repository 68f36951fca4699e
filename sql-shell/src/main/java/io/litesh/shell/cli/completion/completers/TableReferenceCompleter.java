package io.litesh.shell.cli.completion.completers;

import io.litesh.shell.catalog.CatalogException;
import io.litesh.shell.cli.completion.SqlMetadataService;
import io.litesh.shell.core.completion.CompletionCandidate;
import io.litesh.shell.core.completion.CompletionContext;
import io.litesh.shell.core.completion.CompletionContextType;
import io.litesh.shell.core.completion.ContextCompleter;
import io.litesh.shell.sql.QueryNames;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Completer for table positions (after FROM, JOIN, INTO, UPDATE). Offers catalog tables, then the
 * CTE names and aliases of the enclosing statement.
 */
public final class TableReferenceCompleter implements ContextCompleter<SqlMetadataService> {
  private static final Logger LOG = LoggerFactory.getLogger(TableReferenceCompleter.class);

  @Override
  public boolean canHandle(CompletionContext ctx) {
    return ctx.type() == CompletionContextType.TABLE_REFERENCE;
  }

  @Override
  public void complete(
      CompletionContext ctx, SqlMetadataService metadata, List<CompletionCandidate> candidates) {
    Set<String> names = new LinkedHashSet<>();
    try {
      names.addAll(metadata.tableNames());
    } catch (CatalogException e) {
      LOG.debug("Table list unavailable: {}", e.getMessage());
      return;
    }
    QueryNames local =
        ctx.statement()
            .map(statement -> metadata.namesFor(ctx.tree(), statement))
            .orElseGet(QueryNames::empty);
    names.addAll(local.ctes().keySet());
    names.addAll(local.aliases().keySet());

    String typed = ctx.partialInput();
    for (String name : names) {
      if (ContextCompleter.startsWithIgnoreAsciiCase(name, typed)) {
        candidates.add(candidate(ctx, name));
      }
    }
  }
}
