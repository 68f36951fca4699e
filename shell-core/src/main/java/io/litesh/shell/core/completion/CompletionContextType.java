package io.litesh.shell.core.completion;

/**
 * Identifies what the user is typing at the cursor. Each type corresponds to a distinct completion
 * behavior.
 */
public enum CompletionContextType {
  /** First token of a new statement - suggests statement keywords */
  STATEMENT_START,

  /** Table name after FROM, JOIN, INTO, UPDATE - suggests tables, CTEs and aliases */
  TABLE_REFERENCE,

  /** Fallback when context cannot be determined or is not handled */
  UNKNOWN
}
