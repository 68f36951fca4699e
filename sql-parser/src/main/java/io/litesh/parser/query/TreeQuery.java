package io.litesh.parser.query;

import io.litesh.parser.SyntaxNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural pattern query over syntax trees, written as S-expressions.
 *
 * <p>Supported syntax:
 *
 * <ul>
 *   <li>{@code (kind child...)} matches a named node of the given kind; {@code (_)} matches any
 *       named node
 *   <li>{@code "AS"} matches an anonymous node (keyword or punctuation) of that kind
 *   <li>{@code @name} after a pattern captures the matched node
 *   <li>{@code .} between two child patterns requires the matched nodes to be adjacent named
 *       siblings; before the first or after the last child pattern it requires the first or last
 *       named child
 * </ul>
 *
 * <p>Child patterns match an ordered subsequence of the node's children. Example: {@code
 * (table_reference (identifier) @table . (alias (identifier) @alias))}.
 */
public final class TreeQuery {
  private record ChildPattern(Pattern pattern, boolean anchored) {}

  private record Pattern(
      String kind,
      boolean named,
      String capture,
      List<ChildPattern> children,
      boolean anchoredAtEnd) {

    boolean matchesKind(SyntaxNode node) {
      if (named) return node.isNamed() && ("_".equals(kind) || kind.equals(node.kind()));
      return !node.isNamed() && kind.equalsIgnoreCase(node.kind());
    }
  }

  private final String source;
  private final Pattern root;

  private TreeQuery(String source, Pattern root) {
    this.source = source;
    this.root = root;
  }

  /**
   * Compiles a pattern.
   *
   * @param pattern the S-expression pattern
   * @return the compiled query
   * @throws QueryParseException if the pattern is malformed
   */
  public static TreeQuery compile(String pattern) {
    if (pattern == null) throw new QueryParseException("Pattern is null", 0);
    Compiler compiler = new Compiler(pattern);
    Pattern root = compiler.parsePattern();
    compiler.skipWs();
    if (!compiler.eof()) {
      throw new QueryParseException("Trailing characters in pattern", compiler.pos);
    }
    return new TreeQuery(pattern, root);
  }

  /**
   * Evaluates this query against {@code node} and all its descendants.
   *
   * @return every match, ordered by the pre-order position of the node the pattern root matched
   */
  public List<QueryMatch> matches(SyntaxNode node) {
    List<QueryMatch> out = new ArrayList<>();
    for (SyntaxNode candidate : node.preOrder()) {
      for (Map<String, SyntaxNode> captures : matchAt(root, candidate)) {
        out.add(new QueryMatch(candidate, captures));
      }
    }
    return out;
  }

  public String pattern() {
    return source;
  }

  @Override
  public String toString() {
    return "TreeQuery" + source;
  }

  // Matching

  private static List<Map<String, SyntaxNode>> matchAt(Pattern pattern, SyntaxNode node) {
    if (!pattern.matchesKind(node)) return List.of();
    Map<String, SyntaxNode> base = new LinkedHashMap<>();
    if (pattern.capture() != null) base.put(pattern.capture(), node);
    if (pattern.children().isEmpty() && !pattern.anchoredAtEnd()) return List.of(base);

    Set<Map<String, SyntaxNode>> results = new LinkedHashSet<>();
    matchChildren(pattern, node.children(), 0, 0, -1, base, results);
    return new ArrayList<>(results);
  }

  private static void matchChildren(
      Pattern pattern,
      List<SyntaxNode> children,
      int patternIndex,
      int childIndex,
      int previous,
      Map<String, SyntaxNode> acc,
      Set<Map<String, SyntaxNode>> results) {
    if (patternIndex == pattern.children().size()) {
      if (pattern.anchoredAtEnd() && hasNamedBetween(children, previous + 1, children.size())) {
        return;
      }
      results.add(acc);
      return;
    }
    ChildPattern child = pattern.children().get(patternIndex);
    for (int i = childIndex; i < children.size(); i++) {
      if (child.anchored() && hasNamedBetween(children, previous + 1, i)) break;
      for (Map<String, SyntaxNode> sub : matchAt(child.pattern(), children.get(i))) {
        Map<String, SyntaxNode> next = new LinkedHashMap<>(acc);
        next.putAll(sub);
        matchChildren(pattern, children, patternIndex + 1, i + 1, i, next, results);
      }
    }
  }

  private static boolean hasNamedBetween(List<SyntaxNode> children, int from, int to) {
    for (int i = from; i < to; i++) {
      if (children.get(i).isNamed()) return true;
    }
    return false;
  }

  // Pattern compiler

  private static final class Compiler {
    private final String input;
    private int pos = 0;

    Compiler(String input) {
      this.input = input;
    }

    Pattern parsePattern() {
      skipWs();
      if (eof()) throw new QueryParseException("Expected pattern", pos);
      char c = input.charAt(pos);
      if (c == '"') {
        int start = ++pos;
        while (!eof() && input.charAt(pos) != '"') pos++;
        if (eof()) throw new QueryParseException("Unterminated string", start - 1);
        String text = input.substring(start, pos++);
        if (text.isEmpty()) throw new QueryParseException("Empty anonymous node", start);
        return new Pattern(text, false, parseCapture(), List.of(), false);
      }
      if (c != '(') throw new QueryParseException("Expected '(' or '\"'", pos);

      pos++;
      skipWs();
      String kind = readName();
      if (kind.isEmpty()) throw new QueryParseException("Expected node kind", pos);
      List<ChildPattern> children = new ArrayList<>();
      boolean anchor = false;
      while (true) {
        skipWs();
        if (eof()) throw new QueryParseException("Unclosed pattern", pos);
        char ch = input.charAt(pos);
        if (ch == ')') break;
        if (ch == '.') {
          if (anchor) throw new QueryParseException("Repeated anchor", pos);
          anchor = true;
          pos++;
          continue;
        }
        if (ch != '(' && ch != '"') throw new QueryParseException("Unexpected character", pos);
        children.add(new ChildPattern(parsePattern(), anchor));
        anchor = false;
      }
      pos++; // )
      if (anchor && children.isEmpty()) {
        throw new QueryParseException("Anchor without child pattern", pos - 1);
      }
      return new Pattern(kind, true, parseCapture(), List.copyOf(children), anchor);
    }

    private String parseCapture() {
      skipWs();
      if (eof() || input.charAt(pos) != '@') return null;
      pos++;
      String name = readName();
      if (name.isEmpty()) throw new QueryParseException("Expected capture name", pos);
      return name;
    }

    private String readName() {
      int start = pos;
      while (!eof()) {
        char c = input.charAt(pos);
        if (!Character.isLetterOrDigit(c) && c != '_' && c != '-') break;
        pos++;
      }
      return input.substring(start, pos);
    }

    void skipWs() {
      while (!eof() && Character.isWhitespace(input.charAt(pos))) pos++;
    }

    boolean eof() {
      return pos >= input.length();
    }
  }
}
