package com.gentoro.cppindexer.exception;

public class ConfigurationException extends CppIndexerException {
  public ConfigurationException(String message) {
    super(ErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(ErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
