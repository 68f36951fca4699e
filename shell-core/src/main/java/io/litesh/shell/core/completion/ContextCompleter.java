package io.litesh.shell.core.completion;

import java.util.List;

/**
 * Strategy interface for context-specific completion providers. Each implementation handles one
 * type of completion context.
 *
 * @param <M> the type of metadata service used by this completer
 */
public interface ContextCompleter<M> {

  /**
   * Checks if this completer can handle the given context.
   *
   * @param ctx the completion context
   * @return true if this completer should handle the context
   */
  boolean canHandle(CompletionContext ctx);

  /**
   * Generates completion candidates for the given context.
   *
   * @param ctx the completion context with all necessary data
   * @param metadata the metadata service for accessing catalog and name information
   * @param candidates list to add candidates to
   */
  void complete(CompletionContext ctx, M metadata, List<CompletionCandidate> candidates);

  /** Creates a candidate replacing the context node with {@code value} and one trailing space. */
  default CompletionCandidate candidate(CompletionContext ctx, String value) {
    return new CompletionCandidate(ctx.replaceFrom(), value + " ");
  }

  /**
   * Prefix filter: {@code item} matches {@code typed} when it is at least as long and its first
   * characters equal {@code typed} under ASCII case folding. Non-ASCII characters must match
   * exactly.
   */
  static boolean startsWithIgnoreAsciiCase(String item, String typed) {
    if (typed.length() > item.length()) return false;
    for (int i = 0; i < typed.length(); i++) {
      if (asciiLower(item.charAt(i)) != asciiLower(typed.charAt(i))) return false;
    }
    return true;
  }

  /**
   * Chooses the letter case of a keyword: lower case when every typed character is an ASCII lower
   * case letter, otherwise the keyword as given.
   */
  static String matchCase(String keyword, String typed) {
    for (int i = 0; i < typed.length(); i++) {
      char c = typed.charAt(i);
      if (c < 'a' || c > 'z') return keyword;
    }
    StringBuilder sb = new StringBuilder(keyword.length());
    for (int i = 0; i < keyword.length(); i++) sb.append(asciiLower(keyword.charAt(i)));
    return sb.toString();
  }

  private static char asciiLower(char c) {
    return c >= 'A' && c <= 'Z' ? (char) (c + ('a' - 'A')) : c;
  }
}
