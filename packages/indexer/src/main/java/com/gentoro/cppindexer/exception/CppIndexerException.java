package com.gentoro.cppindexer.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Root of the indexer's unchecked exception hierarchy. */
public class CppIndexerException extends RuntimeException {
  private final ErrorCode code;
  private final Map<String, Object> context = new LinkedHashMap<>();

  public CppIndexerException(ErrorCode code, String message) {
    super(message);
    this.code = code == null ? ErrorCode.UNKNOWN : code;
  }

  public CppIndexerException(ErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code == null ? ErrorCode.UNKNOWN : code;
  }

  public ErrorCode getCode() {
    return code;
  }

  /** Attach a diagnostic key/value, e.g. the path or command that failed. */
  public CppIndexerException withContext(String key, Object value) {
    context.put(key, value);
    return this;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }
}
