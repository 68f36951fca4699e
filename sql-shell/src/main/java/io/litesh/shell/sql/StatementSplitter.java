package io.litesh.shell.sql;

import io.litesh.parser.NodeKind;
import io.litesh.parser.SyntaxNode;
import io.litesh.parser.SyntaxTree;
import io.litesh.parser.query.QueryMatch;
import io.litesh.parser.query.TreeQuery;
import java.util.ArrayList;
import java.util.List;

/** Finds the top-level statements of a parsed input. */
public final class StatementSplitter {
  private static final TreeQuery STATEMENTS =
      TreeQuery.compile("(statement_list (statement) @stmt)");

  private StatementSplitter() {}

  /**
   * Returns every top-level statement in source order, including statements that contain errors.
   */
  public static List<SyntaxNode> statements(SyntaxTree tree) {
    List<SyntaxNode> result = new ArrayList<>();
    for (QueryMatch match : STATEMENTS.matches(tree.root())) {
      match.capture("stmt").ifPresent(result::add);
    }
    return result;
  }

  /**
   * Returns the statements plus the unparseable top-level runs between them, in source order. The
   * engine gets to report the real error for the latter when they are executed.
   */
  public static List<SyntaxNode> executionUnits(SyntaxTree tree) {
    List<SyntaxNode> units = new ArrayList<>();
    for (SyntaxNode child : tree.root().children()) {
      if (child.kind().equals(NodeKind.STATEMENT) || child.kind().equals(NodeKind.ERROR)) {
        units.add(child);
      }
    }
    return units;
  }
}
