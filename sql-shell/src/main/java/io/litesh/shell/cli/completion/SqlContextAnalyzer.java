package io.litesh.shell.cli.completion;

import io.litesh.parser.NodeKind;
import io.litesh.parser.SyntaxNode;
import io.litesh.parser.SyntaxTree;
import io.litesh.shell.core.completion.CompletionContext;
import io.litesh.shell.core.completion.CompletionContextType;
import java.util.Optional;

/**
 * Analyzes a parsed buffer and the cursor position to determine what kind of token is being typed.
 *
 * <p>The node under the cursor is looked up at the cursor and, when that only hits the statement
 * list, at up to four positions before it. Classification only looks at the node's kind, its
 * parent's kind and whether it has a previous sibling.
 */
public final class SqlContextAnalyzer {
  private static final int LOOKBEHIND = 5;

  public CompletionContext analyze(SyntaxTree tree, int cursor) {
    Optional<SyntaxNode> located = locate(tree, cursor);
    if (located.isEmpty()) {
      return CompletionContext.builder().tree(tree).cursor(cursor).replaceFrom(cursor).build();
    }
    SyntaxNode node = located.get();
    return CompletionContext.builder()
        .type(classify(node))
        .tree(tree)
        .node(node)
        .partialInput(tree.text(node))
        .replaceFrom(node.start())
        .cursor(cursor)
        .build();
  }

  private static Optional<SyntaxNode> locate(SyntaxTree tree, int cursor) {
    for (int offset = 0; offset < Math.min(LOOKBEHIND, cursor); offset++) {
      Optional<SyntaxNode> node = tree.root().smallestCovering(cursor - offset);
      if (node.isPresent() && !node.get().kind().equals(NodeKind.STATEMENT_LIST)) {
        return node;
      }
    }
    return Optional.empty();
  }

  private static CompletionContextType classify(SyntaxNode node) {
    Optional<SyntaxNode> parent = node.parent();
    if (parent.isEmpty() || node.previousSibling().isPresent()) {
      return CompletionContextType.UNKNOWN;
    }
    String parentKind = parent.get().kind();
    if (node.kind().equals(NodeKind.ERROR) && parentKind.equals(NodeKind.STATEMENT_LIST)) {
      return CompletionContextType.STATEMENT_START;
    }
    if (node.kind().equals(NodeKind.IDENTIFIER) && parentKind.equals(NodeKind.TABLE_REFERENCE)) {
      return CompletionContextType.TABLE_REFERENCE;
    }
    return CompletionContextType.UNKNOWN;
  }
}
