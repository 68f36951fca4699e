package io.litesh.shell.cli;

/** A shell input could not be carried out; the message is shown to the user as is. */
public class ShellException extends Exception {
  public ShellException(String message) {
    super(message);
  }

  public ShellException(String message, Throwable cause) {
    super(message, cause);
  }
}
