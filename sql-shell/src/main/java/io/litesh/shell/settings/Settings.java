package io.litesh.shell.settings;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shell settings kept in their own SQLite database: display hints per column, keyed by the {@code
 * application_id} of the database the column lives in. A hint is stored as its integer {@link
 * DataTypeHint#code()}.
 */
public final class Settings implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(Settings.class);

  static final int APPLICATION_ID = 0xe170e644;

  private static final String[] MIGRATIONS = {
    "PRAGMA application_id = " + APPLICATION_ID,
    "CREATE TABLE IF NOT EXISTS datatypes ("
        + " application_id INT NOT NULL,"
        + " name TEXT UNIQUE NOT NULL,"
        + " type TEXT NOT NULL)"
  };

  private static final String SELECT_TYPE =
      "SELECT type FROM datatypes WHERE application_id = ? AND name = ?";
  private static final String UPSERT_TYPE =
      "INSERT INTO datatypes (application_id, name, type) VALUES (?, ?, ?)"
          + " ON CONFLICT(name) DO UPDATE SET application_id = excluded.application_id,"
          + " type = excluded.type";
  private static final String DELETE_TYPE =
      "DELETE FROM datatypes WHERE application_id = ? AND name = ?";

  private final Connection connection;

  private Settings(Connection connection) throws SQLException {
    this.connection = connection;
    migrate();
  }

  /** Opens (creating if needed) the settings database at {@code path}. */
  public static Settings open(Path path) throws SQLException {
    try {
      if (path.getParent() != null) Files.createDirectories(path.getParent());
    } catch (IOException e) {
      throw new SQLException("Cannot create settings directory: " + e.getMessage(), e);
    }
    return open("jdbc:sqlite:" + path.toAbsolutePath());
  }

  /** Settings that live only as long as the process. */
  public static Settings inMemory() throws SQLException {
    return open("jdbc:sqlite::memory:");
  }

  private static Settings open(String url) throws SQLException {
    Connection connection = DriverManager.getConnection(url);
    try {
      return new Settings(connection);
    } catch (SQLException e) {
      connection.close();
      throw e;
    }
  }

  private void migrate() throws SQLException {
    try (Statement st = connection.createStatement()) {
      int current;
      try (ResultSet rs = st.executeQuery("PRAGMA application_id")) {
        current = rs.next() ? rs.getInt(1) : 0;
      }
      if (current == APPLICATION_ID) return;
      if (current != 0) {
        throw new SQLException(
            String.format("Not a settings database (application_id 0x%08x)", current));
      }
      LOG.debug("Migrating settings database");
      for (String migration : MIGRATIONS) {
        st.execute(migration);
      }
    }
  }

  /** Returns the display hint of {@code column} for the database identified by {@code appId}. */
  public Optional<DataTypeHint> dataType(int appId, String column) {
    try (PreparedStatement ps = connection.prepareStatement(SELECT_TYPE)) {
      ps.setInt(1, appId);
      ps.setString(2, column);
      try (ResultSet rs = ps.executeQuery()) {
        if (!rs.next()) return Optional.empty();
        String stored = rs.getString(1);
        Optional<DataTypeHint> hint = decode(stored);
        if (hint.isEmpty()) LOG.warn("Ignoring unknown data type '{}' for {}", stored, column);
        return hint;
      }
    } catch (SQLException e) {
      LOG.warn("Cannot read data type of {}: {}", column, e.getMessage());
      return Optional.empty();
    }
  }

  /** Stores {@code hint} for {@code column}; an empty hint removes it. */
  public void setDataType(int appId, String column, Optional<DataTypeHint> hint)
      throws SQLException {
    if (hint.isPresent()) {
      try (PreparedStatement ps = connection.prepareStatement(UPSERT_TYPE)) {
        ps.setInt(1, appId);
        ps.setString(2, column);
        ps.setInt(3, hint.get().code());
        ps.executeUpdate();
      }
    } else {
      try (PreparedStatement ps = connection.prepareStatement(DELETE_TYPE)) {
        ps.setInt(1, appId);
        ps.setString(2, column);
        ps.executeUpdate();
      }
    }
  }

  private static Optional<DataTypeHint> decode(String stored) {
    if (stored == null) return Optional.empty();
    try {
      return DataTypeHint.fromCode(Long.parseLong(stored.trim()));
    } catch (NumberFormatException e) {
      return Optional.empty();
    }
  }

  @Override
  public void close() throws SQLException {
    connection.close();
  }
}
