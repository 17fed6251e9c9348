package com.gentoro.cppindexer.exception;

/** Errors raised by an index store; the enclosing transaction has been rolled back. */
public class StoreException extends CppIndexerException {
  public StoreException(String message) {
    super(ErrorCode.STORE_ERROR, message);
  }

  public StoreException(String message, Throwable cause) {
    super(ErrorCode.STORE_ERROR, message, cause);
  }
}
