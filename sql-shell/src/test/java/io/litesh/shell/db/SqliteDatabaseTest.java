package io.litesh.shell.db;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.Statement;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SqliteDatabaseTest {

  @TempDir Path dir;

  @Test
  void createsFileOnFirstWrite() throws Exception {
    Path file = dir.resolve("data.db");

    try (Connection connection = SqliteDatabase.open(file.toString());
        Statement st = connection.createStatement()) {
      st.execute("CREATE TABLE t (a)");
    }

    assertTrue(Files.exists(file));
  }

  @Test
  void readsApplicationId() throws Exception {
    try (Connection connection = SqliteDatabase.open(SqliteDatabase.MEMORY);
        Statement st = connection.createStatement()) {
      assertEquals(0, SqliteDatabase.applicationId(connection));

      st.execute("PRAGMA application_id = 1234");

      assertEquals(1234, SqliteDatabase.applicationId(connection));
    }
  }
}
