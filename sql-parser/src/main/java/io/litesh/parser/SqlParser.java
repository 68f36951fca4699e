package io.litesh.parser;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Tolerant recursive-descent parser producing a concrete syntax tree for SQLite SQL.
 *
 * <p>The parser never throws. Text that cannot start a statement becomes an {@code error} node
 * directly under {@code statement_list}; unexpected tokens after a statement become an {@code
 * error} node inside it. Where a table name is required but absent, a zero-width missing {@code
 * identifier} is inserted at the start of the next token, so an unfinished {@code FROM } still
 * yields a {@code table_reference} under the cursor.
 *
 * <p>Queries, {@code INSERT}, {@code UPDATE} and {@code DELETE} (optionally behind {@code WITH} or
 * {@code EXPLAIN}) are parsed structurally. Other statements are kept as flat {@code
 * generic_statement} nodes. Parenthesized runs nested more than {@value #MAX_NESTING} levels deep
 * are not descended into.
 */
public final class SqlParser {

  private static final Set<String> CLAUSE_STOP =
      Set.of(
          "FROM", "WHERE", "GROUP", "HAVING", "WINDOW", "ORDER", "LIMIT", "OFFSET", "UNION",
          "INTERSECT", "EXCEPT", "RETURNING", "JOIN", "LEFT", "RIGHT", "FULL", "INNER", "CROSS",
          "NATURAL", "ON", "USING");

  private static final Set<String> RESULT_STOP = union(CLAUSE_STOP, Set.of("AS"));

  private static final Set<String> JOIN_OPERATORS =
      Set.of("NATURAL", "LEFT", "RIGHT", "FULL", "INNER", "CROSS", "OUTER");

  /** Parentheses nested deeper than this are kept as a single error node. */
  static final int MAX_NESTING = 256;

  private final String source;
  private final List<Token> tokens;
  private int pos = 0;
  private int nesting = 0;

  private SqlParser(String source) {
    this.source = source;
    List<Token> significant = new ArrayList<>();
    for (Token t : new SqlTokenizer().tokenize(source)) {
      if (!t.type().isTrivia()) significant.add(t);
    }
    this.tokens = significant;
  }

  /**
   * Parses SQL text into a syntax tree.
   *
   * @param sql the source text, may be null (treated as empty)
   * @return the tree; its root is a {@code statement_list} spanning the whole source
   */
  public static SyntaxTree parse(String sql) {
    String source = sql == null ? "" : sql;
    return new SqlParser(source).parseTree();
  }

  private SyntaxTree parseTree() {
    List<SyntaxNode> children = new ArrayList<>();
    while (peek().type() != TokenType.EOF) {
      Token t = peek();
      if (t.type() == TokenType.SEMICOLON) {
        children.add(anonymous());
      } else if (isStatementStart(t)) {
        children.add(parseStatement());
      } else {
        children.add(errorRun());
      }
    }
    SyntaxNode root =
        SyntaxNode.branch(NodeKind.STATEMENT_LIST, 0, source.length(), children);
    return new SyntaxTree(source, root);
  }

  private SyntaxNode parseStatement() {
    List<SyntaxNode> kids = new ArrayList<>();
    kids.add(parseStatementBody());
    if (!atStatementEnd()) kids.add(errorRun());
    return SyntaxNode.branch(NodeKind.STATEMENT, kids);
  }

  private SyntaxNode parseStatementBody() {
    Token t = peek();
    return switch (t.upperText()) {
      case "EXPLAIN" -> parseExplain();
      case "WITH" -> {
        SyntaxNode with = parseWithClause();
        Token next = peek();
        if (next.isKeyword("INSERT") || next.isKeyword("REPLACE")) yield parseInsert(with);
        if (next.isKeyword("UPDATE")) yield parseUpdate(with);
        if (next.isKeyword("DELETE")) yield parseDelete(with);
        yield parseSelect(with);
      }
      case "SELECT", "VALUES" -> parseSelect(null);
      case "INSERT", "REPLACE" -> parseInsert(null);
      case "UPDATE" -> parseUpdate(null);
      case "DELETE" -> parseDelete(null);
      default -> parseGeneric();
    };
  }

  private SyntaxNode parseExplain() {
    List<SyntaxNode> kids = new ArrayList<>();
    kids.add(anonymous()); // EXPLAIN
    acceptKeyword(kids, "QUERY");
    acceptKeyword(kids, "PLAN");
    if (isStatementStart(peek()) && !peek().isKeyword("EXPLAIN")) {
      kids.add(parseStatementBody());
    }
    return SyntaxNode.branch(NodeKind.EXPLAIN, kids);
  }

  // WITH clause

  private SyntaxNode parseWithClause() {
    List<SyntaxNode> kids = new ArrayList<>();
    kids.add(anonymous()); // WITH
    acceptKeyword(kids, "RECURSIVE");
    while (true) {
      kids.add(parseCte());
      if (peek().type() != TokenType.COMMA) break;
      kids.add(anonymous());
    }
    return SyntaxNode.branch(NodeKind.WITH_CLAUSE, kids);
  }

  private SyntaxNode parseCte() {
    List<SyntaxNode> kids = new ArrayList<>();
    kids.add(nameOrMissing());
    if (peek().type() == TokenType.LPAREN) kids.add(parseColumnList());
    acceptKeyword(kids, "AS");
    acceptKeyword(kids, "NOT");
    acceptKeyword(kids, "MATERIALIZED");
    if (peek().type() == TokenType.LPAREN) {
      if (nesting >= MAX_NESTING) {
        kids.add(nestedRun());
      } else {
        nesting++;
        kids.add(anonymous());
        if (isQueryStart(peek())) kids.add(parseQuery());
        // a body that is not (yet) a query, or trailing garbage after it
        addIfPresent(kids, errorUntilClose());
        accept(kids, TokenType.RPAREN);
        nesting--;
      }
    }
    return SyntaxNode.branch(NodeKind.CTE, kids);
  }

  private SyntaxNode parseColumnList() {
    List<SyntaxNode> kids = new ArrayList<>();
    kids.add(anonymous()); // (
    while (true) {
      Token t = peek();
      if (isNameToken(t)) {
        kids.add(identifier(next()));
      } else if (t.type() == TokenType.COMMA) {
        kids.add(anonymous());
      } else {
        break;
      }
    }
    accept(kids, TokenType.RPAREN);
    return SyntaxNode.branch(NodeKind.COLUMN_LIST, kids);
  }

  // Queries

  private SyntaxNode parseQuery() {
    SyntaxNode with = peek().isKeyword("WITH") ? parseWithClause() : null;
    return parseSelect(with);
  }

  private SyntaxNode parseSelect(SyntaxNode with) {
    List<SyntaxNode> kids = new ArrayList<>();
    if (with != null) kids.add(with);
    parseSelectCore(kids);
    while (peek().isKeyword("UNION")
        || peek().isKeyword("INTERSECT")
        || peek().isKeyword("EXCEPT")) {
      kids.add(anonymous());
      acceptKeyword(kids, "ALL");
      parseSelectCore(kids);
    }
    if (peek().isKeyword("ORDER")) kids.add(parseOrderBy());
    if (peek().isKeyword("LIMIT")) kids.add(parseLimit());
    if (kids.isEmpty()) return SyntaxNode.missing(NodeKind.SELECT, peek().start());
    return SyntaxNode.branch(NodeKind.SELECT, kids);
  }

  private void parseSelectCore(List<SyntaxNode> out) {
    if (peek().isKeyword("VALUES")) {
      out.add(parseValues());
      return;
    }
    if (!peek().isKeyword("SELECT")) return;

    List<SyntaxNode> kids = new ArrayList<>();
    kids.add(anonymous()); // SELECT
    if (!acceptKeyword(kids, "DISTINCT")) acceptKeyword(kids, "ALL");
    SyntaxNode columns = parseResultColumns();
    if (columns != null) kids.add(columns);
    if (peek().isKeyword("FROM")) kids.add(parseFrom());
    if (peek().isKeyword("WHERE")) kids.add(clause(NodeKind.WHERE_CLAUSE, CLAUSE_STOP));
    if (peek().isKeyword("GROUP")) {
      List<SyntaxNode> group = new ArrayList<>();
      group.add(anonymous());
      acceptKeyword(group, "BY");
      parseExprList(group, CLAUSE_STOP);
      kids.add(SyntaxNode.branch(NodeKind.GROUP_BY_CLAUSE, group));
      if (peek().isKeyword("HAVING")) kids.add(clause(NodeKind.HAVING_CLAUSE, CLAUSE_STOP));
    }
    if (peek().isKeyword("WINDOW")) {
      kids.add(anonymous());
      parseExprList(kids, CLAUSE_STOP);
    }
    out.add(SyntaxNode.branch(NodeKind.SELECT_CORE, kids));
  }

  private SyntaxNode parseResultColumns() {
    List<SyntaxNode> kids = new ArrayList<>();
    while (true) {
      SyntaxNode expr = parseExpr(RESULT_STOP);
      if (expr != null) kids.add(expr);
      parseAlias(kids, false);
      if (peek().type() != TokenType.COMMA) break;
      kids.add(anonymous());
    }
    return kids.isEmpty() ? null : SyntaxNode.branch(NodeKind.RESULT_COLUMNS, kids);
  }

  private SyntaxNode parseValues() {
    List<SyntaxNode> kids = new ArrayList<>();
    kids.add(anonymous()); // VALUES
    while (peek().type() == TokenType.LPAREN) {
      kids.add(parseParenthesized());
      if (peek().type() != TokenType.COMMA) break;
      kids.add(anonymous());
    }
    return SyntaxNode.branch(NodeKind.VALUES_CLAUSE, kids);
  }

  private SyntaxNode parseOrderBy() {
    List<SyntaxNode> kids = new ArrayList<>();
    kids.add(anonymous()); // ORDER
    acceptKeyword(kids, "BY");
    parseExprList(kids, CLAUSE_STOP);
    return SyntaxNode.branch(NodeKind.ORDER_BY_CLAUSE, kids);
  }

  private SyntaxNode parseLimit() {
    List<SyntaxNode> kids = new ArrayList<>();
    kids.add(anonymous()); // LIMIT
    addIfPresent(kids, parseExpr(CLAUSE_STOP));
    if (peek().isKeyword("OFFSET") || peek().type() == TokenType.COMMA) {
      kids.add(anonymous());
      addIfPresent(kids, parseExpr(CLAUSE_STOP));
    }
    return SyntaxNode.branch(NodeKind.LIMIT_CLAUSE, kids);
  }

  // FROM clause and table references

  private SyntaxNode parseFrom() {
    List<SyntaxNode> kids = new ArrayList<>();
    kids.add(anonymous()); // FROM
    parseFromItems(kids);
    return SyntaxNode.branch(NodeKind.FROM_CLAUSE, kids);
  }

  private void parseFromItems(List<SyntaxNode> kids) {
    kids.add(parseTableOrSubquery());
    while (true) {
      Token t = peek();
      if (t.type() == TokenType.COMMA) {
        kids.add(anonymous());
        kids.add(parseTableOrSubquery());
      } else if (t.isKeyword("JOIN") || isJoinOperator(t)) {
        kids.add(parseJoin());
      } else {
        break;
      }
    }
  }

  private SyntaxNode parseJoin() {
    List<SyntaxNode> kids = new ArrayList<>();
    while (isJoinOperator(peek())) kids.add(anonymous());
    acceptKeyword(kids, "JOIN");
    kids.add(parseTableOrSubquery());
    if (peek().isKeyword("ON")) {
      List<SyntaxNode> constraint = new ArrayList<>();
      constraint.add(anonymous());
      addIfPresent(constraint, parseExpr(CLAUSE_STOP));
      kids.add(SyntaxNode.branch(NodeKind.JOIN_CONSTRAINT, constraint));
    } else if (peek().isKeyword("USING")) {
      List<SyntaxNode> constraint = new ArrayList<>();
      constraint.add(anonymous());
      if (peek().type() == TokenType.LPAREN) constraint.add(parseColumnList());
      kids.add(SyntaxNode.branch(NodeKind.JOIN_CONSTRAINT, constraint));
    }
    return SyntaxNode.branch(NodeKind.JOIN_CLAUSE, kids);
  }

  private SyntaxNode parseTableOrSubquery() {
    if (peek().type() != TokenType.LPAREN) return parseTableReference(true, true);
    if (nesting >= MAX_NESTING) return nestedRun();

    nesting++;
    try {
      List<SyntaxNode> kids = new ArrayList<>();
      kids.add(anonymous()); // (
      if (isQueryStart(peek())) {
        kids.add(parseQuery());
        accept(kids, TokenType.RPAREN);
        parseAlias(kids, true);
        return SyntaxNode.branch(NodeKind.SUBQUERY, kids);
      }
      // Parenthesized join: (a JOIN b)
      parseFromItems(kids);
      accept(kids, TokenType.RPAREN);
      return SyntaxNode.branch(NodeKind.JOIN_CLAUSE, kids);
    } finally {
      nesting--;
    }
  }

  /**
   * Parses {@code [schema.]name [args] [[AS] alias]}.
   *
   * @param bareAlias whether an alias may follow without {@code AS}
   * @param tableFunction whether a parenthesized argument list may follow the name
   */
  private SyntaxNode parseTableReference(boolean bareAlias, boolean tableFunction) {
    List<SyntaxNode> kids = new ArrayList<>();
    kids.add(nameOrMissing());
    if (peek().type() == TokenType.DOT) {
      kids.add(anonymous());
      kids.add(nameOrMissing());
    }
    if (tableFunction && peek().type() == TokenType.LPAREN) kids.add(parseParenthesized());
    parseAlias(kids, bareAlias);
    if (peek().isKeyword("INDEXED")) {
      kids.add(anonymous());
      acceptKeyword(kids, "BY");
      kids.add(nameOrMissing());
    } else if (peek().isKeyword("NOT") && peekAt(1).isKeyword("INDEXED")) {
      kids.add(anonymous());
      kids.add(anonymous());
    }
    return SyntaxNode.branch(NodeKind.TABLE_REFERENCE, kids);
  }

  private void parseAlias(List<SyntaxNode> kids, boolean bareAlias) {
    if (peek().isKeyword("AS")) {
      kids.add(anonymous());
      SyntaxNode name =
          isNameToken(peek()) || peek().type() == TokenType.STRING
              ? identifier(next())
              : SyntaxNode.missing(NodeKind.IDENTIFIER, peek().start());
      kids.add(SyntaxNode.branch(NodeKind.ALIAS, List.of(name)));
    } else if (bareAlias && isNameToken(peek())) {
      kids.add(SyntaxNode.branch(NodeKind.ALIAS, List.of(identifier(next()))));
    }
  }

  // INSERT, UPDATE, DELETE

  private SyntaxNode parseInsert(SyntaxNode with) {
    List<SyntaxNode> kids = new ArrayList<>();
    if (with != null) kids.add(with);
    kids.add(anonymous()); // INSERT or REPLACE
    parseConflictClause(kids);
    acceptKeyword(kids, "INTO");
    kids.add(parseTableReference(false, false));
    if (peek().type() == TokenType.LPAREN) kids.add(parseColumnList());
    if (isQueryStart(peek())) {
      kids.add(parseQuery());
    } else if (peek().isKeyword("DEFAULT")) {
      kids.add(anonymous());
      acceptKeyword(kids, "VALUES");
    }
    // Upsert clauses stay a flat run of expressions
    while (peek().isKeyword("ON") || peek().isKeyword("DO")) {
      kids.add(anonymous());
      parseExprList(kids, Set.of("RETURNING", "ON", "DO"));
    }
    parseReturning(kids);
    return SyntaxNode.branch(NodeKind.INSERT, kids);
  }

  private SyntaxNode parseUpdate(SyntaxNode with) {
    List<SyntaxNode> kids = new ArrayList<>();
    if (with != null) kids.add(with);
    kids.add(anonymous()); // UPDATE
    parseConflictClause(kids);
    kids.add(parseTableReference(false, false));
    if (acceptKeyword(kids, "SET")) parseExprList(kids, CLAUSE_STOP);
    if (peek().isKeyword("FROM")) kids.add(parseFrom());
    if (peek().isKeyword("WHERE")) kids.add(clause(NodeKind.WHERE_CLAUSE, CLAUSE_STOP));
    parseReturning(kids);
    if (peek().isKeyword("ORDER")) kids.add(parseOrderBy());
    if (peek().isKeyword("LIMIT")) kids.add(parseLimit());
    return SyntaxNode.branch(NodeKind.UPDATE, kids);
  }

  private SyntaxNode parseDelete(SyntaxNode with) {
    List<SyntaxNode> kids = new ArrayList<>();
    if (with != null) kids.add(with);
    kids.add(anonymous()); // DELETE
    acceptKeyword(kids, "FROM");
    kids.add(parseTableReference(false, false));
    if (peek().isKeyword("WHERE")) kids.add(clause(NodeKind.WHERE_CLAUSE, CLAUSE_STOP));
    parseReturning(kids);
    if (peek().isKeyword("ORDER")) kids.add(parseOrderBy());
    if (peek().isKeyword("LIMIT")) kids.add(parseLimit());
    return SyntaxNode.branch(NodeKind.DELETE, kids);
  }

  private void parseConflictClause(List<SyntaxNode> kids) {
    if (acceptKeyword(kids, "OR") && peek().type() == TokenType.KEYWORD) {
      kids.add(anonymous()); // ROLLBACK, ABORT, REPLACE, FAIL or IGNORE
    }
  }

  private void parseReturning(List<SyntaxNode> kids) {
    if (!acceptKeyword(kids, "RETURNING")) return;
    SyntaxNode columns = parseResultColumns();
    if (columns != null) kids.add(columns);
  }

  // Other statements

  private SyntaxNode parseGeneric() {
    List<SyntaxNode> kids = new ArrayList<>();
    boolean trigger = false;
    int depth = 0;
    while (peek().type() != TokenType.EOF) {
      Token t = peek();
      if (t.type() == TokenType.SEMICOLON && depth == 0) break;
      if (trigger && t.isKeyword("BEGIN")) {
        parseTriggerBody(kids);
        continue;
      }
      if (t.isKeyword("TRIGGER")) trigger = true;
      if (t.type() == TokenType.LPAREN) depth++;
      if (t.type() == TokenType.RPAREN) depth = Math.max(0, depth - 1);
      kids.add(leaf(next()));
    }
    return SyntaxNode.branch(NodeKind.GENERIC_STATEMENT, kids);
  }

  /** Consumes {@code BEGIN ... END} of a trigger, where semicolons do not end the statement. */
  private void parseTriggerBody(List<SyntaxNode> kids) {
    kids.add(anonymous()); // BEGIN
    int caseDepth = 0;
    while (peek().type() != TokenType.EOF) {
      Token t = next();
      kids.add(leaf(t));
      if (t.isKeyword("CASE")) {
        caseDepth++;
      } else if (t.isKeyword("END")) {
        if (caseDepth == 0) return;
        caseDepth--;
      }
    }
  }

  // Expressions

  private SyntaxNode clause(String kind, Set<String> stops) {
    List<SyntaxNode> kids = new ArrayList<>();
    kids.add(anonymous());
    addIfPresent(kids, parseExpr(stops));
    return SyntaxNode.branch(kind, kids);
  }

  private void parseExprList(List<SyntaxNode> kids, Set<String> stops) {
    while (true) {
      addIfPresent(kids, parseExpr(stops));
      if (peek().type() != TokenType.COMMA) return;
      kids.add(anonymous());
    }
  }

  /**
   * Parses a run of expression tokens up to a comma, a closing parenthesis, the end of the
   * statement or one of {@code stops} at nesting depth zero.
   *
   * @return the expression node, or null when no token was consumed
   */
  private SyntaxNode parseExpr(Set<String> stops) {
    List<SyntaxNode> kids = new ArrayList<>();
    while (true) {
      Token t = peek();
      TokenType type = t.type();
      if (type == TokenType.EOF
          || type == TokenType.SEMICOLON
          || type == TokenType.RPAREN
          || type == TokenType.COMMA) {
        break;
      }
      if (type == TokenType.KEYWORD && stops.contains(t.upperText())) break;
      if (type == TokenType.LPAREN) {
        kids.add(parseParenthesized());
      } else {
        kids.add(leaf(next()));
      }
    }
    return kids.isEmpty() ? null : SyntaxNode.branch(NodeKind.EXPR, kids);
  }

  private SyntaxNode parseParenthesized() {
    if (nesting >= MAX_NESTING) return nestedRun();

    nesting++;
    try {
      List<SyntaxNode> kids = new ArrayList<>();
      kids.add(anonymous()); // (
      if (isQueryStart(peek())) {
        kids.add(parseQuery());
        accept(kids, TokenType.RPAREN);
        return SyntaxNode.branch(NodeKind.SUBQUERY, kids);
      }
      parseExprList(kids, Set.of());
      accept(kids, TokenType.RPAREN);
      return SyntaxNode.branch(NodeKind.EXPR, kids);
    } finally {
      nesting--;
    }
  }

  // Error recovery

  /** Consumes tokens up to the next semicolon outside parentheses into one error node. */
  private SyntaxNode errorRun() {
    Token first = next();
    Token last = first;
    int depth = first.type() == TokenType.LPAREN ? 1 : 0;
    while (peek().type() != TokenType.EOF) {
      Token t = peek();
      if (t.type() == TokenType.SEMICOLON && depth == 0) break;
      if (t.type() == TokenType.LPAREN) depth++;
      if (t.type() == TokenType.RPAREN) depth = Math.max(0, depth - 1);
      last = next();
    }
    return SyntaxNode.leaf(NodeKind.ERROR, first.start(), last.end());
  }

  /**
   * Consumes an opening parenthesis and everything up to its matching close into one error node.
   * Stops early at a semicolon or the end of input.
   */
  private SyntaxNode nestedRun() {
    Token first = next(); // (
    Token last = first;
    int open = 1;
    while (open > 0 && !atStatementEnd()) {
      Token t = next();
      if (t.type() == TokenType.LPAREN) open++;
      if (t.type() == TokenType.RPAREN) open--;
      last = t;
    }
    return SyntaxNode.leaf(NodeKind.ERROR, first.start(), last.end());
  }

  /**
   * Consumes tokens up to, not including, the closing parenthesis of the current level into one
   * error node.
   *
   * @return the error node, or null when already at the closing parenthesis or statement end
   */
  private SyntaxNode errorUntilClose() {
    if (peek().type() == TokenType.RPAREN || atStatementEnd()) return null;
    Token first = peek();
    Token last = first;
    int open = 0;
    while (!atStatementEnd()) {
      Token t = peek();
      if (t.type() == TokenType.RPAREN && open == 0) break;
      if (t.type() == TokenType.LPAREN) open++;
      if (t.type() == TokenType.RPAREN) open--;
      last = next();
    }
    return SyntaxNode.leaf(NodeKind.ERROR, first.start(), last.end());
  }

  // Token helpers

  private Token peek() {
    return tokens.get(pos);
  }

  private Token peekAt(int ahead) {
    return tokens.get(Math.min(pos + ahead, tokens.size() - 1));
  }

  private Token next() {
    Token t = tokens.get(pos);
    if (t.type() != TokenType.EOF) pos++;
    return t;
  }

  private boolean atStatementEnd() {
    TokenType type = peek().type();
    return type == TokenType.EOF || type == TokenType.SEMICOLON;
  }

  private SyntaxNode anonymous() {
    return SyntaxNode.anonymous(next());
  }

  private boolean acceptKeyword(List<SyntaxNode> kids, String keyword) {
    if (!peek().isKeyword(keyword)) return false;
    kids.add(anonymous());
    return true;
  }

  private void accept(List<SyntaxNode> kids, TokenType type) {
    if (peek().type() == type) kids.add(anonymous());
  }

  private SyntaxNode nameOrMissing() {
    if (isNameToken(peek())) return identifier(next());
    return SyntaxNode.missing(NodeKind.IDENTIFIER, peek().start());
  }

  private static SyntaxNode identifier(Token t) {
    return SyntaxNode.leaf(NodeKind.IDENTIFIER, t.start(), t.end());
  }

  private static SyntaxNode leaf(Token t) {
    return switch (t.type()) {
      case IDENTIFIER -> identifier(t);
      case NUMBER -> SyntaxNode.leaf(NodeKind.NUMERIC_LITERAL, t.start(), t.end());
      case STRING -> SyntaxNode.leaf(NodeKind.STRING_LITERAL, t.start(), t.end());
      case BLOB -> SyntaxNode.leaf(NodeKind.BLOB_LITERAL, t.start(), t.end());
      case PARAMETER -> SyntaxNode.leaf(NodeKind.BIND_PARAMETER, t.start(), t.end());
      default -> SyntaxNode.anonymous(t);
    };
  }

  /** Identifiers, plus keywords SQLite accepts as names where a name is expected. */
  private static boolean isNameToken(Token t) {
    return t.type() == TokenType.IDENTIFIER
        || (t.type() == TokenType.KEYWORD && !SqlKeywords.RESERVED.contains(t.upperText()));
  }

  private static boolean isStatementStart(Token t) {
    return t.type() == TokenType.KEYWORD && SqlKeywords.STATEMENT_START.contains(t.upperText());
  }

  private static boolean isQueryStart(Token t) {
    return t.isKeyword("SELECT") || t.isKeyword("VALUES") || t.isKeyword("WITH");
  }

  private static boolean isJoinOperator(Token t) {
    return t.type() == TokenType.KEYWORD && JOIN_OPERATORS.contains(t.upperText());
  }

  private static void addIfPresent(List<SyntaxNode> kids, SyntaxNode node) {
    if (node != null) kids.add(node);
  }

  private static Set<String> union(Set<String> a, Set<String> b) {
    Set<String> result = new HashSet<>(a);
    result.addAll(b);
    return Set.copyOf(result);
  }
}
