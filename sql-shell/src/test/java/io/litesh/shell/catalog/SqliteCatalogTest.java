package io.litesh.shell.catalog;

import static org.junit.jupiter.api.Assertions.*;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SqliteCatalogTest {

  private Connection connection;
  private SqliteCatalog catalog;

  @BeforeEach
  void setup() throws Exception {
    connection = DriverManager.getConnection("jdbc:sqlite::memory:");
    try (Statement st = connection.createStatement()) {
      st.execute("CREATE TABLE users (id INTEGER, name TEXT)");
      st.execute("CREATE TABLE events (id INTEGER, payload TEXT)");
      st.execute("CREATE VIEW user_names AS SELECT name FROM users");
      st.execute("CREATE INDEX users_name ON users(name)");
    }
    catalog = new SqliteCatalog(connection);
  }

  @AfterEach
  void tearDown() throws Exception {
    connection.close();
  }

  @Test
  void listsOnlyTablesSortedByName() throws Exception {
    assertEquals(List.of("events", "users"), catalog.listTables());
  }

  @Test
  void listIsReadLive() throws Exception {
    try (Statement st = connection.createStatement()) {
      st.execute("CREATE TABLE accounts (id INTEGER)");
    }

    assertEquals(List.of("accounts", "events", "users"), catalog.listTables());
  }

  @Test
  void closedConnectionFailsWithCatalogException() throws Exception {
    connection.close();

    assertThrows(CatalogException.class, () -> catalog.listTables());
  }

  @Test
  void plansColumnLabels() throws Exception {
    assertEquals(
        List.of("id", "label"), catalog.planColumns("SELECT id, name AS label FROM users"));
    assertEquals(List.of("x"), catalog.planColumns("SELECT 1 AS x"));
  }

  @Test
  void planningDoesNotExecute() throws Exception {
    List<String> columns = catalog.planColumns("INSERT INTO users VALUES (1, 'a') RETURNING name");

    assertEquals(List.of("name"), columns);
    try (Statement st = connection.createStatement();
        ResultSet rs = st.executeQuery("SELECT count(*) FROM users")) {
      assertTrue(rs.next());
      assertEquals(0, rs.getInt(1));
    }
  }

  @Test
  void invalidFragmentFailsWithPlanException() {
    PlanException e =
        assertThrows(PlanException.class, () -> catalog.planColumns("SELECT * FROM missing"));

    assertEquals("SELECT * FROM missing", e.sql());
    assertTrue(e.getMessage().contains("missing"));
  }

  @Test
  void readsTableSql() throws Exception {
    assertEquals(
        Optional.of("CREATE TABLE users (id INTEGER, name TEXT)"), catalog.tableSql("users"));
    assertEquals(Optional.empty(), catalog.tableSql("user_names"));
    assertEquals(Optional.empty(), catalog.tableSql("nope"));
  }
}
