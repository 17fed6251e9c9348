package com.gentoro.cppindexer.exception;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ExceptionUtilTest {

  @Test
  @DisplayName("toErrorDetails keeps code and context of indexer exceptions")
  void errorDetails() {
    CppIndexerException ex =
        new StoreException("write failed").withContext("path", "/tmp/index.json");
    ErrorDetails details = ExceptionUtil.toErrorDetails(ex);
    assertEquals("StoreException", details.type());
    assertEquals(ErrorCode.STORE_ERROR, details.code());
    assertEquals("/tmp/index.json", details.context().get("path"));

    ErrorDetails plain = ExceptionUtil.toErrorDetails(new IllegalStateException());
    assertEquals(ErrorCode.UNKNOWN, plain.code());
    assertEquals("", plain.message());
    assertTrue(plain.context().isEmpty());
  }

  @Test
  @DisplayName("extractErrorMessage reports the innermost cause with a message")
  void innermostMessage() {
    Exception nested =
        new CompilationDatabaseException("outer", new RuntimeException(new IOException("disk")));
    assertEquals("IOException: disk", ExceptionUtil.extractErrorMessage(nested));
    assertEquals("Unknown error", ExceptionUtil.extractErrorMessage(null));
    assertEquals(
        "IllegalStateException", ExceptionUtil.extractErrorMessage(new IllegalStateException()));
  }

  @Test
  @DisplayName("Compact stack traces honour the frame limit")
  void compactStackTrace() {
    Exception ex = new Exception("x");
    String one = ExceptionUtil.formatCompactStackTrace(ex, 1);
    assertFalse(one.contains(" > "));
    assertTrue(one.startsWith(ExceptionUtilTest.class.getName() + ".compactStackTrace"));
    assertTrue(ExceptionUtil.formatCompactStackTrace(ex, 3).split(" > ").length <= 3);
    assertEquals("", ExceptionUtil.formatCompactStackTrace(null));
  }

  @Test
  @DisplayName("rethrowIfUnchecked passes indexer exceptions through and wraps others")
  void rethrow() {
    StoreException store = new StoreException("s");
    assertSame(store, ExceptionUtil.rethrowIfUnchecked(store, t -> new StoreException("w", t)));
    CppIndexerException wrapped =
        ExceptionUtil.rethrowIfUnchecked(
            new IllegalArgumentException("a"), t -> new StoreException("w", t));
    assertInstanceOf(IllegalArgumentException.class, wrapped.getCause());
  }
}
