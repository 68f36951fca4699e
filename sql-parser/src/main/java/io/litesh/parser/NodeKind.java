package io.litesh.parser;

/**
 * Kinds of named syntax nodes produced by {@link SqlParser}.
 *
 * <p>Anonymous nodes (keywords and punctuation) use the upper-cased keyword or the punctuation
 * text as their kind, e.g. {@code "AS"} or {@code ";"}.
 */
public final class NodeKind {
  private NodeKind() {}

  public static final String STATEMENT_LIST = "statement_list";
  public static final String STATEMENT = "statement";
  public static final String ERROR = "error";

  public static final String IDENTIFIER = "identifier";
  public static final String TABLE_REFERENCE = "table_reference";
  public static final String ALIAS = "alias";

  public static final String WITH_CLAUSE = "with_clause";
  public static final String CTE = "cte";
  public static final String COLUMN_LIST = "column_list";

  public static final String SELECT = "select";
  public static final String SELECT_CORE = "select_core";
  public static final String RESULT_COLUMNS = "result_columns";
  public static final String FROM_CLAUSE = "from_clause";
  public static final String JOIN_CLAUSE = "join_clause";
  public static final String JOIN_CONSTRAINT = "join_constraint";
  public static final String SUBQUERY = "subquery";
  public static final String WHERE_CLAUSE = "where_clause";
  public static final String GROUP_BY_CLAUSE = "group_by_clause";
  public static final String HAVING_CLAUSE = "having_clause";
  public static final String ORDER_BY_CLAUSE = "order_by_clause";
  public static final String LIMIT_CLAUSE = "limit_clause";
  public static final String VALUES_CLAUSE = "values_clause";
  public static final String EXPR = "expr";

  public static final String INSERT = "insert";
  public static final String UPDATE = "update";
  public static final String DELETE = "delete";
  public static final String EXPLAIN = "explain";
  public static final String GENERIC_STATEMENT = "generic_statement";

  // Literals
  public static final String NUMERIC_LITERAL = "numeric_literal";
  public static final String STRING_LITERAL = "string_literal";
  public static final String BLOB_LITERAL = "blob_literal";
  public static final String BIND_PARAMETER = "bind_parameter";
}
