package io.litesh.shell.cli.completion;

import io.litesh.parser.SyntaxNode;
import io.litesh.parser.SyntaxTree;
import io.litesh.shell.catalog.CatalogAccessor;
import io.litesh.shell.catalog.CatalogException;
import io.litesh.shell.sql.NameResolver;
import io.litesh.shell.sql.QueryNames;
import java.util.List;

/** Names available to completers: catalog tables and the names a statement defines. */
public final class SqlMetadataService {
  private final CatalogAccessor catalog;
  private final NameResolver resolver;

  public SqlMetadataService(CatalogAccessor catalog) {
    this.catalog = catalog;
    this.resolver = new NameResolver(catalog);
  }

  /** Tables currently in the database, read live. */
  public List<String> tableNames() throws CatalogException {
    return catalog.listTables();
  }

  /** CTEs and aliases of {@code statement}, resolved on demand. */
  public QueryNames namesFor(SyntaxTree tree, SyntaxNode statement) {
    return resolver.resolve(tree, statement);
  }
}
