package io.litesh.shell.cli;

import io.litesh.shell.cli.completion.CompletionEngine;
import org.jline.reader.Buffer;
import org.jline.reader.LineReader;
import org.jline.widget.Widgets;

/**
 * Shows the remainder of the first completion candidate as a tail tip while typing. Wraps the
 * self-insert and backward-delete-char widgets so the tip follows every edit.
 */
public final class SqlHintWidgets extends Widgets {
  private static final String HINT_INSERT = "_litesh-hint-insert";
  private static final String HINT_BACKWARD_DELETE = "_litesh-hint-backward-delete-char";

  private final CompletionEngine engine;

  public SqlHintWidgets(LineReader reader, CompletionEngine engine) {
    super(reader);
    this.engine = engine;
    addWidget(HINT_INSERT, this::hintInsert);
    addWidget(HINT_BACKWARD_DELETE, this::hintBackwardDelete);
    aliasWidget(HINT_INSERT, LineReader.SELF_INSERT);
    aliasWidget(HINT_BACKWARD_DELETE, LineReader.BACKWARD_DELETE_CHAR);
    setSuggestionType(LineReader.SuggestionType.TAIL_TIP);
  }

  boolean hintInsert() {
    callWidget(LineReader.SELF_INSERT);
    refresh();
    return true;
  }

  boolean hintBackwardDelete() {
    callWidget(LineReader.BACKWARD_DELETE_CHAR);
    refresh();
    return true;
  }

  void refresh() {
    Buffer buffer = buffer();
    String text = buffer.toString();
    if (text.startsWith(".") || buffer.cursor() != text.length()) {
      setTailTip("");
      return;
    }
    setTailTip(engine.hint(text, buffer.cursor()).orElse("").stripTrailing());
  }
}
