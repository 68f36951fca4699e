package io.litesh.shell.core.completion;

import io.litesh.parser.NodeKind;
import io.litesh.parser.SyntaxNode;
import io.litesh.parser.SyntaxTree;
import java.util.Optional;

/**
 * Immutable context extracted from the parsed input for completion. Contains all information
 * needed by context-specific completers.
 */
public record CompletionContext(
    /** The type of completion context */
    CompletionContextType type,

    /** The parsed input */
    SyntaxTree tree,

    /** The node being typed - null when no node anchors the cursor */
    SyntaxNode node,

    /** Full text of the context node, used as the prefix filter */
    String partialInput,

    /** Offset where the context node starts; candidates replace from here */
    int replaceFrom,

    /** Cursor position in the input */
    int cursor) {

  /** Canonical constructor with validation */
  public CompletionContext {
    if (type == null) {
      type = CompletionContextType.UNKNOWN;
    }
    if (partialInput == null) {
      partialInput = "";
    }
  }

  /** Returns the statement enclosing the context node, if any. */
  public Optional<SyntaxNode> statement() {
    return node == null ? Optional.empty() : node.ancestor(NodeKind.STATEMENT);
  }

  /** Builder for convenient construction */
  public static Builder builder() {
    return new Builder();
  }

  public static class Builder {
    private CompletionContextType type = CompletionContextType.UNKNOWN;
    private SyntaxTree tree;
    private SyntaxNode node;
    private String partialInput = "";
    private int replaceFrom = 0;
    private int cursor = 0;

    public Builder type(CompletionContextType type) {
      this.type = type;
      return this;
    }

    public Builder tree(SyntaxTree tree) {
      this.tree = tree;
      return this;
    }

    public Builder node(SyntaxNode node) {
      this.node = node;
      return this;
    }

    public Builder partialInput(String partialInput) {
      this.partialInput = partialInput;
      return this;
    }

    public Builder replaceFrom(int replaceFrom) {
      this.replaceFrom = replaceFrom;
      return this;
    }

    public Builder cursor(int cursor) {
      this.cursor = cursor;
      return this;
    }

    public CompletionContext build() {
      return new CompletionContext(type, tree, node, partialInput, replaceFrom, cursor);
    }
  }
}
