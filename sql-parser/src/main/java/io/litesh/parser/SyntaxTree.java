package io.litesh.parser;

/**
 * A parsed SQL source together with the root of its syntax tree.
 *
 * @param source the exact text that was parsed
 * @param root the {@code statement_list} node spanning the whole source
 */
public record SyntaxTree(String source, SyntaxNode root) {

  /** Returns the source text covered by {@code node}. */
  public String text(SyntaxNode node) {
    return node.text(source);
  }
}
