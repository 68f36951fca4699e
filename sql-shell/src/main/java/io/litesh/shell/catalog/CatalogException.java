package io.litesh.shell.catalog;

/** The database catalog could not be read, e.g. because the connection is closed. */
public class CatalogException extends Exception {
  public CatalogException(String message, Throwable cause) {
    super(message, cause);
  }
}
