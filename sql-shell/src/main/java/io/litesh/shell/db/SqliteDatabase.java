package io.litesh.shell.db;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

/** Opens SQLite connections for the shell. */
public final class SqliteDatabase {
  private static final Logger LOG = LoggerFactory.getLogger(SqliteDatabase.class);

  /** Name accepted in place of a path for a transient database. */
  public static final String MEMORY = ":memory:";

  private static final int BUSY_TIMEOUT_MS = 15000;

  private SqliteDatabase() {}

  /**
   * Opens the database at {@code file} (created when absent, or {@value #MEMORY}) and installs the
   * shell's SQL functions on the connection.
   */
  public static Connection open(String file) throws SQLException {
    String target = MEMORY.equals(file) ? MEMORY : Path.of(file).toAbsolutePath().toString();
    Connection connection = connect(target);
    try {
      ByteSizeFunction.install(connection);
    } catch (SQLException e) {
      connection.close();
      throw e;
    }
    LOG.debug("Opened database {}", target);
    return connection;
  }

  static Connection connect(String target) throws SQLException {
    SQLiteConfig config = new SQLiteConfig();
    config.setBusyTimeout(BUSY_TIMEOUT_MS);
    return DriverManager.getConnection("jdbc:sqlite:" + target, config.toProperties());
  }

  /** Reads {@code PRAGMA application_id} of the main database. */
  public static int applicationId(Connection connection) throws SQLException {
    try (Statement st = connection.createStatement();
        ResultSet rs = st.executeQuery("PRAGMA application_id")) {
      return rs.next() ? rs.getInt(1) : 0;
    }
  }
}
