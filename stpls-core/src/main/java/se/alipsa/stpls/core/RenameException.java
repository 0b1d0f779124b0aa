package se.alipsa.stpls.core;

/** A rename request that cannot be carried out; the message is meant for the user. */
public class RenameException extends Exception {

  public RenameException(String message) {
    super(message);
  }

  public RenameException(String message, Throwable cause) {
    super(message, cause);
  }
}
