package io.litesh.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A node of a concrete syntax tree.
 *
 * <p>Every node carries a kind tag and a half-open {@code [start, end)} range of char offsets into
 * the parsed source. Named nodes are grammar constructs; anonymous nodes are keywords and
 * punctuation. A missing node is a zero-width placeholder inserted where a required construct was
 * absent.
 *
 * <p>Nodes are immutable once the parser has linked them into a tree; all navigation is a pure
 * lookup.
 */
public final class SyntaxNode {
  private final String kind;
  private final int start;
  private final int end;
  private final boolean named;
  private final boolean missing;
  private final List<SyntaxNode> children;
  private SyntaxNode parent;
  private int index;

  private SyntaxNode(
      String kind, int start, int end, boolean named, boolean missing, List<SyntaxNode> children) {
    this.kind = kind;
    this.start = start;
    this.end = end;
    this.named = named;
    this.missing = missing;
    this.children = Collections.unmodifiableList(new ArrayList<>(children));
    for (int i = 0; i < this.children.size(); i++) {
      SyntaxNode child = this.children.get(i);
      child.parent = this;
      child.index = i;
    }
  }

  /** Creates a childless named node. */
  static SyntaxNode leaf(String kind, int start, int end) {
    return new SyntaxNode(kind, start, end, true, false, List.of());
  }

  /** Creates an anonymous node for a keyword or punctuation token. */
  static SyntaxNode anonymous(Token token) {
    String kind = token.type() == TokenType.KEYWORD ? token.upperText() : token.text();
    return new SyntaxNode(kind, token.start(), token.end(), false, false, List.of());
  }

  /** Creates a zero-width missing node at {@code pos}. */
  static SyntaxNode missing(String kind, int pos) {
    return new SyntaxNode(kind, pos, pos, true, true, List.of());
  }

  /** Creates a named node spanning its children, which must not be empty. */
  static SyntaxNode branch(String kind, List<SyntaxNode> children) {
    if (children.isEmpty()) {
      throw new IllegalArgumentException("Branch node '" + kind + "' needs children");
    }
    return new SyntaxNode(
        kind,
        children.get(0).start,
        children.get(children.size() - 1).end,
        true,
        false,
        children);
  }

  /** Creates a named node with an explicit range, used for the root. */
  static SyntaxNode branch(String kind, int start, int end, List<SyntaxNode> children) {
    return new SyntaxNode(kind, start, end, true, false, children);
  }

  public String kind() {
    return kind;
  }

  public int start() {
    return start;
  }

  public int end() {
    return end;
  }

  public boolean isNamed() {
    return named;
  }

  public boolean isMissing() {
    return missing;
  }

  public Optional<SyntaxNode> parent() {
    return Optional.ofNullable(parent);
  }

  public List<SyntaxNode> children() {
    return children;
  }

  /** Returns the named children in order, skipping keywords and punctuation. */
  public List<SyntaxNode> namedChildren() {
    List<SyntaxNode> result = new ArrayList<>();
    for (SyntaxNode child : children) {
      if (child.named) result.add(child);
    }
    return result;
  }

  public Optional<SyntaxNode> previousSibling() {
    if (parent == null || index == 0) return Optional.empty();
    return Optional.of(parent.children.get(index - 1));
  }

  public Optional<SyntaxNode> nextSibling() {
    if (parent == null || index + 1 >= parent.children.size()) return Optional.empty();
    return Optional.of(parent.children.get(index + 1));
  }

  /** Returns the closest ancestor of the given kind, excluding this node. */
  public Optional<SyntaxNode> ancestor(String ancestorKind) {
    for (SyntaxNode n = parent; n != null; n = n.parent) {
      if (n.kind.equals(ancestorKind)) return Optional.of(n);
    }
    return Optional.empty();
  }

  /**
   * Finds the deepest node covering {@code pos}.
   *
   * <p>Descends from this node, at each level taking the first child whose range contains {@code
   * pos} with both ends inclusive, so a position between two adjacent nodes resolves to the left
   * one.
   *
   * @param pos char offset into the source
   * @return the deepest covering node, or empty when this node itself does not cover {@code pos}
   */
  public Optional<SyntaxNode> smallestCovering(int pos) {
    if (pos < start || pos > end) return Optional.empty();
    SyntaxNode current = this;
    descend:
    while (true) {
      for (SyntaxNode child : current.children) {
        if (child.start <= pos && pos <= child.end) {
          current = child;
          continue descend;
        }
      }
      return Optional.of(current);
    }
  }

  /** Returns this node and all its descendants in pre-order. */
  public List<SyntaxNode> preOrder() {
    List<SyntaxNode> out = new ArrayList<>();
    collect(this, out);
    return out;
  }

  /** Returns the source text covered by this node. */
  public String text(String source) {
    return source.substring(start, end);
  }

  /**
   * Renders the named structure of this subtree as an S-expression, e.g. {@code (statement
   * (select (select_core ...)))}. Missing nodes render as {@code (MISSING kind)}.
   */
  public String toSexp() {
    StringBuilder sb = new StringBuilder();
    appendSexp(sb);
    return sb.toString();
  }

  @Override
  public String toString() {
    return (named ? kind : "\"" + kind + "\"") + "@" + start + "-" + end;
  }

  // Private helper methods

  private static void collect(SyntaxNode node, List<SyntaxNode> out) {
    out.add(node);
    for (SyntaxNode child : node.children) {
      collect(child, out);
    }
  }

  private void appendSexp(StringBuilder sb) {
    if (missing) {
      sb.append("(MISSING ").append(kind).append(')');
      return;
    }
    sb.append('(').append(kind);
    for (SyntaxNode child : children) {
      if (child.named) {
        sb.append(' ');
        child.appendSexp(sb);
      }
    }
    sb.append(')');
  }
}
