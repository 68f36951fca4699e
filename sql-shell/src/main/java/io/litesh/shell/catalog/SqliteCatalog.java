package io.litesh.shell.catalog;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** {@link CatalogAccessor} over the shell's SQLite connection. */
public final class SqliteCatalog implements CatalogAccessor {
  private static final String LIST_TABLES =
      "SELECT name FROM sqlite_schema WHERE type = 'table' ORDER BY name ASC";
  private static final String TABLE_SQL =
      "SELECT sql FROM sqlite_schema WHERE type = 'table' AND name = ?";

  private final Connection connection;

  public SqliteCatalog(Connection connection) {
    this.connection = connection;
  }

  @Override
  public List<String> listTables() throws CatalogException {
    try (PreparedStatement ps = connection.prepareStatement(LIST_TABLES);
        ResultSet rs = ps.executeQuery()) {
      List<String> tables = new ArrayList<>();
      while (rs.next()) tables.add(rs.getString(1));
      return tables;
    } catch (SQLException e) {
      throw new CatalogException("Cannot list tables: " + e.getMessage(), e);
    }
  }

  @Override
  public List<String> planColumns(String sql) throws PlanException {
    // Preparing compiles the statement; it is closed without ever being stepped
    try (PreparedStatement ps = connection.prepareStatement(sql)) {
      ResultSetMetaData meta = ps.getMetaData();
      if (meta == null) return List.of();
      int count = meta.getColumnCount();
      List<String> columns = new ArrayList<>(count);
      for (int i = 1; i <= count; i++) columns.add(meta.getColumnLabel(i));
      return columns;
    } catch (SQLException e) {
      throw new PlanException(sql, e);
    }
  }

  /**
   * Looks up the {@code CREATE TABLE} statement of a table.
   *
   * @return the statement text, or empty when no such table exists
   */
  public Optional<String> tableSql(String table) throws CatalogException {
    try (PreparedStatement ps = connection.prepareStatement(TABLE_SQL)) {
      ps.setString(1, table);
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next() ? Optional.ofNullable(rs.getString(1)) : Optional.empty();
      }
    } catch (SQLException e) {
      throw new CatalogException("Cannot read schema of " + table + ": " + e.getMessage(), e);
    }
  }
}
