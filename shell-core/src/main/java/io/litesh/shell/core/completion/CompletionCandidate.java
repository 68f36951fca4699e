package io.litesh.shell.core.completion;

/**
 * A completion proposal: replace the source from {@code replaceFrom} up to the cursor with {@code
 * replacement}.
 *
 * @param replaceFrom offset where the partially typed token starts, never after the cursor
 * @param replacement the text to insert, including its trailing space
 */
public record CompletionCandidate(int replaceFrom, String replacement) {

  public CompletionCandidate {
    if (replaceFrom < 0) {
      throw new IllegalArgumentException("replaceFrom must not be negative: " + replaceFrom);
    }
    if (replacement == null) {
      throw new IllegalArgumentException("replacement must not be null");
    }
  }
}
