package io.litesh.parser;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class SqlParserTest {

  private static SyntaxNode covering(SyntaxTree tree, int pos) {
    return tree.root().smallestCovering(pos).orElseThrow();
  }

  // Statement list

  @Test
  void emptySourceYieldsEmptyStatementList() {
    SyntaxTree tree = SqlParser.parse("");

    assertEquals("statement_list", tree.root().kind());
    assertEquals(0, tree.root().start());
    assertEquals(0, tree.root().end());
    assertTrue(tree.root().children().isEmpty());
  }

  @Test
  void rootSpansTrailingWhitespace() {
    SyntaxTree tree = SqlParser.parse("SELECT 1   ");

    assertEquals(11, tree.root().end());
    assertEquals(8, tree.root().children().get(0).end());
  }

  @Test
  void incompleteKeywordBecomesTopLevelError() {
    SyntaxTree tree = SqlParser.parse("SEL");

    assertEquals("(statement_list (error))", tree.root().toSexp());
    SyntaxNode error = tree.root().children().get(0);
    assertEquals(0, error.start());
    assertEquals(3, error.end());
    assertTrue(error.children().isEmpty());
  }

  @Test
  void errorRunStopsAtSemicolon() {
    SyntaxTree tree = SqlParser.parse("foo bar; SELECT 1");

    List<SyntaxNode> children = tree.root().children();
    assertEquals("error", children.get(0).kind());
    assertEquals("foo bar", tree.text(children.get(0)));
    assertEquals(";", children.get(1).kind());
    assertFalse(children.get(1).isNamed());
    assertEquals("statement", children.get(2).kind());
  }

  @Test
  void separatesStatements() {
    SyntaxTree tree = SqlParser.parse("SELECT 1; SELECT 2");

    List<SyntaxNode> named = tree.root().namedChildren();
    assertEquals(2, named.size());
    assertEquals("SELECT 1", tree.text(named.get(0)));
    assertEquals("SELECT 2", tree.text(named.get(1)));
  }

  // Queries

  @Test
  void parsesSimpleSelect() {
    SyntaxTree tree = SqlParser.parse("SELECT * FROM u");

    assertEquals(
        "(statement_list (statement (select (select_core (result_columns (expr))"
            + " (from_clause (table_reference (identifier)))))))",
        tree.root().toSexp());
  }

  @Test
  void insertsMissingIdentifierAfterFrom() {
    SyntaxTree tree = SqlParser.parse("SELECT * FROM ");

    SyntaxNode node = covering(tree, 14);
    assertEquals("identifier", node.kind());
    assertTrue(node.isMissing());
    assertEquals(14, node.start());
    assertEquals(14, node.end());
    assertEquals("table_reference", node.parent().orElseThrow().kind());
  }

  @Test
  void insertsMissingIdentifierBeforeNextClause() {
    SyntaxTree tree = SqlParser.parse("SELECT * FROM WHERE x = 1");

    SyntaxNode node = covering(tree, 14);
    assertEquals("identifier", node.kind());
    assertTrue(node.isMissing());
    assertTrue(
        tree.root().toSexp().contains("(where_clause (expr (identifier) (numeric_literal)))"));
  }

  @Test
  void parsesAliasesWithAndWithoutAs() {
    SyntaxTree tree = SqlParser.parse("SELECT * FROM users AS u, orders o, u");

    assertTrue(
        tree.root()
            .toSexp()
            .contains(
                "(from_clause (table_reference (identifier) (alias (identifier)))"
                    + " (table_reference (identifier) (alias (identifier)))"
                    + " (table_reference (identifier)))"));
  }

  @Test
  void nonReservedKeywordIsAcceptedAsTableName() {
    SyntaxTree tree = SqlParser.parse("SELECT * FROM key");

    SyntaxNode node = covering(tree, 17);
    assertEquals("identifier", node.kind());
    assertFalse(node.isMissing());
  }

  @Test
  void parsesSchemaQualifiedTable() {
    SyntaxTree tree = SqlParser.parse("SELECT * FROM main.users");

    assertTrue(tree.root().toSexp().contains("(table_reference (identifier) (identifier))"));
  }

  @Test
  void parsesJoins() {
    SyntaxTree tree =
        SqlParser.parse("SELECT * FROM a LEFT JOIN b ON a.id = b.id JOIN c USING (id)");

    String sexp = tree.root().toSexp();
    assertTrue(
        sexp.contains(
            "(join_clause (table_reference (identifier)) (join_constraint (expr (identifier)"
                + " (identifier) (identifier) (identifier))))"),
        sexp);
    assertTrue(
        sexp.contains(
            "(join_clause (table_reference (identifier)) (join_constraint (column_list"
                + " (identifier))))"),
        sexp);
  }

  @Test
  void parsesSubqueryInFrom() {
    SyntaxTree tree = SqlParser.parse("SELECT * FROM (SELECT 1) AS s");

    assertTrue(
        tree.root().toSexp().contains("(from_clause (subquery (select"), tree.root().toSexp());
  }

  @Test
  void parsesCommonTableExpressions() {
    SyntaxTree tree =
        SqlParser.parse("WITH a AS (SELECT 1 AS x), b(y) AS (SELECT x FROM a) SELECT * FROM b");

    SyntaxNode select = tree.root().children().get(0).children().get(0);
    assertEquals("select", select.kind());
    SyntaxNode with = select.children().get(0);
    assertEquals("with_clause", with.kind());
    List<SyntaxNode> ctes = with.namedChildren();
    assertEquals(2, ctes.size());
    assertEquals("a AS (SELECT 1 AS x)", tree.text(ctes.get(0)));
    assertEquals(
        "(cte (identifier) (column_list (identifier)) (select (select_core (result_columns"
            + " (expr (identifier))) (from_clause (table_reference (identifier))))))",
        ctes.get(1).toSexp());
  }

  @Test
  void parsesCompoundSelectWithOrderAndLimit() {
    SyntaxTree tree =
        SqlParser.parse(
            "SELECT a FROM t UNION ALL SELECT b FROM u ORDER BY 1 LIMIT 5 OFFSET 2");

    SyntaxNode select = tree.root().children().get(0).children().get(0);
    List<String> kinds = select.namedChildren().stream().map(SyntaxNode::kind).toList();
    assertEquals(List.of("select_core", "select_core", "order_by_clause", "limit_clause"), kinds);
  }

  @Test
  void parsesSubqueryInExpression() {
    SyntaxTree tree = SqlParser.parse("SELECT * FROM t WHERE id IN (SELECT id FROM u)");

    assertTrue(tree.root().toSexp().contains("(subquery (select (select_core"));
  }

  // Other statements

  @Test
  void parsesInsert() {
    SyntaxTree tree = SqlParser.parse("INSERT INTO t (a, b) VALUES (1, 2)");

    assertEquals(
        "(statement_list (statement (insert (table_reference (identifier)) (column_list"
            + " (identifier) (identifier)) (select (values_clause (expr (expr (numeric_literal))"
            + " (expr (numeric_literal))))))))",
        tree.root().toSexp());
  }

  @Test
  void insertIntoWithoutTableGetsMissingIdentifier() {
    SyntaxTree tree = SqlParser.parse("INSERT INTO ");

    SyntaxNode node = covering(tree, 12);
    assertTrue(node.isMissing());
    assertEquals("table_reference", node.parent().orElseThrow().kind());
  }

  @Test
  void parsesUpdateAndDeleteTargetsAsTableReferences() {
    SyntaxTree update = SqlParser.parse("UPDATE users AS u SET name = 'x' WHERE id = 1");
    SyntaxTree delete = SqlParser.parse("DELETE FROM users WHERE id = 1");

    assertTrue(
        update.root().toSexp().startsWith(
            "(statement_list (statement (update (table_reference (identifier)"
                + " (alias (identifier)))"));
    assertTrue(
        delete.root().toSexp().startsWith(
            "(statement_list (statement (delete (table_reference (identifier)) (where_clause"));
  }

  @Test
  void parsesExplainQueryPlan() {
    SyntaxTree tree = SqlParser.parse("EXPLAIN QUERY PLAN SELECT 1");

    assertEquals(
        "(statement_list (statement (explain (select (select_core (result_columns (expr"
            + " (numeric_literal))))))))",
        tree.root().toSexp());
  }

  @Test
  void otherStatementsAreGeneric() {
    SyntaxTree tree = SqlParser.parse("CREATE TABLE t (a INTEGER, b TEXT)");

    SyntaxNode statement = tree.root().children().get(0);
    assertEquals("generic_statement", statement.children().get(0).kind());
    assertEquals(tree.source(), tree.text(statement));
  }

  @Test
  void triggerBodyKeepsInnerSemicolons() {
    SyntaxTree tree =
        SqlParser.parse(
            "CREATE TRIGGER tr AFTER INSERT ON t BEGIN SELECT CASE WHEN 1 THEN 2 END;"
                + " SELECT 2; END;"
                + " SELECT 3");

    List<SyntaxNode> statements = tree.root().namedChildren();
    assertEquals(2, statements.size());
    assertTrue(tree.text(statements.get(0)).endsWith("SELECT 2; END"));
    assertEquals("SELECT 3", tree.text(statements.get(1)));
  }

  @Test
  void trailingGarbageBecomesErrorInsideStatement() {
    SyntaxTree tree = SqlParser.parse("SELECT 1)");

    SyntaxNode statement = tree.root().children().get(0);
    SyntaxNode last = statement.children().get(statement.children().size() - 1);
    assertEquals("error", last.kind());
    assertEquals(")", tree.text(last));
  }

  // Navigation

  @Test
  void smallestCoveringPrefersLeftNodeAtBoundary() {
    SyntaxTree tree = SqlParser.parse("SELECT * FROM users AS u, u");

    SyntaxNode node = covering(tree, 27);
    assertEquals("identifier", node.kind());
    assertEquals(26, node.start());
    assertTrue(node.previousSibling().isEmpty());

    SyntaxNode comma = covering(tree, 25);
    assertEquals(",", comma.kind());
  }

  @Test
  void smallestCoveringOutsideRangeIsEmpty() {
    SyntaxTree tree = SqlParser.parse("SELECT 1");

    assertTrue(tree.root().smallestCovering(9).isEmpty());
    assertTrue(tree.root().smallestCovering(-1).isEmpty());
  }

  @Test
  void siblingNavigation() {
    SyntaxTree tree = SqlParser.parse("SELECT 1; SEL");

    SyntaxNode error = tree.root().children().get(2);
    assertEquals("error", error.kind());
    assertEquals(";", error.previousSibling().orElseThrow().kind());
    assertTrue(error.nextSibling().isEmpty());
    assertEquals("statement_list", error.parent().orElseThrow().kind());
  }

  @Test
  void findsAncestorByKind() {
    SyntaxTree tree = SqlParser.parse("SELECT 1; SELECT * FROM t");

    SyntaxNode node = covering(tree, 25);
    SyntaxNode statement = node.ancestor("statement").orElseThrow();
    assertEquals("SELECT * FROM t", tree.text(statement));
  }

  // Recovery inside parentheses

  @Test
  void cteBodyThatIsNotAQueryStaysInsideTheCte() {
    SyntaxTree tree = SqlParser.parse("WITH a AS (SEL) SELECT * FROM ");

    assertEquals(
        "(statement_list (statement (select (with_clause (cte (identifier) (error)))"
            + " (select_core (result_columns (expr)) (from_clause (table_reference"
            + " (MISSING identifier)))))))",
        tree.root().toSexp());
    SyntaxNode cte = covering(tree, 11).parent().orElseThrow();
    assertEquals("a AS (SEL)", tree.text(cte));
  }

  @Test
  void trailingTokensAfterCteQueryAreAnError() {
    SyntaxTree tree = SqlParser.parse("WITH a AS (SELECT 1 FROM t x y) SELECT 2");

    SyntaxNode statement = tree.root().children().get(0);
    assertEquals(1, tree.root().children().size());
    assertEquals("statement", statement.kind());
    assertTrue(statement.toSexp().contains("(error)"), statement.toSexp());
  }

  @Test
  void deepNestingIsCutOffInsteadOfRecursing() {
    String sql = "SELECT " + "(".repeat(5000);

    SyntaxTree tree = SqlParser.parse(sql);

    assertEquals(sql.length(), tree.root().end());
    SyntaxNode deepest = covering(tree, sql.length());
    assertEquals("error", deepest.kind());
    assertEquals(7 + SqlParser.MAX_NESTING, deepest.start());
  }

  @Test
  void balancedDeepNestingKeepsTheRestOfTheStatement() {
    String sql = "SELECT " + "(".repeat(3000) + "1" + ")".repeat(3000) + " FROM t";

    SyntaxTree tree = SqlParser.parse(sql);

    assertEquals(1, tree.root().children().size());
    SyntaxNode name = covering(tree, sql.length());
    assertEquals("identifier", name.kind());
    assertEquals("table_reference", name.parent().orElseThrow().kind());
  }

  @Test
  void deeplyNestedSubqueriesAndCtes() {
    String subqueries = "SELECT * FROM " + "(SELECT * FROM ".repeat(2000);
    String ctes = "WITH a AS (".repeat(2000);

    assertEquals(subqueries.length(), SqlParser.parse(subqueries).root().end());
    assertEquals(ctes.length(), SqlParser.parse(ctes).root().end());
  }
}
