package com.gentoro.cppindexer.exception;

public class StateException extends CppIndexerException {
  public StateException(String message) {
    super(ErrorCode.STATE_ERROR, message);
  }
}
