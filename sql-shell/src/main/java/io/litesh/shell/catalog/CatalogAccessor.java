package io.litesh.shell.catalog;

import java.util.List;

/** Read-only view of the database catalog used by completion and name resolution. */
public interface CatalogAccessor {

  /**
   * Lists the names of the persisted tables, sorted ascending, read live on every call.
   *
   * @throws CatalogException if the catalog is unavailable
   */
  List<String> listTables() throws CatalogException;

  /**
   * Compiles {@code sql} without executing it and reports the names of its result columns.
   *
   * @param sql a single query
   * @return column labels in order
   * @throws PlanException if the engine rejects the fragment
   */
  List<String> planColumns(String sql) throws PlanException;
}
