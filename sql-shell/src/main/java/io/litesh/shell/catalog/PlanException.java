package io.litesh.shell.catalog;

/** A SQL fragment could not be compiled by the database engine. */
public class PlanException extends Exception {
  private final String sql;

  public PlanException(String sql, Throwable cause) {
    super("Cannot plan '" + sql + "': " + cause.getMessage(), cause);
    this.sql = sql;
  }

  /** The fragment that failed to plan. */
  public String sql() {
    return sql;
  }
}
