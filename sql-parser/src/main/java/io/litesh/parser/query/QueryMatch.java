package io.litesh.parser.query;

import io.litesh.parser.SyntaxNode;
import java.util.Map;
import java.util.Optional;

/**
 * One match of a {@link TreeQuery}.
 *
 * @param node the node the pattern root matched
 * @param captures captured nodes by capture name
 */
public record QueryMatch(SyntaxNode node, Map<String, SyntaxNode> captures) {

  public QueryMatch {
    captures = Map.copyOf(captures);
  }

  public Optional<SyntaxNode> capture(String name) {
    return Optional.ofNullable(captures.get(name));
  }
}
