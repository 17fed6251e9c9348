package com.gentoro.cppindexer.utility;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class FileUtilityTest {

  @Test
  @DisplayName("extension is lower-cased and includes the dot")
  void extension() {
    assertEquals(".cpp", FileUtility.extension("/src/A.CPP"));
    assertEquals(".o", FileUtility.extension("obj/a.o"));
    assertEquals("", FileUtility.extension("/src/Makefile"));
    assertEquals("", FileUtility.extension("/src/.hidden"));
    assertEquals("", FileUtility.extension("/some.dir/file"));
  }

  @Test
  @DisplayName("replaceExtension swaps only the last segment's extension")
  void replaceExtension() {
    assertEquals("/src/a.o", FileUtility.replaceExtension("/src/a.cpp", ".o"));
    assertEquals("/src.d/a.o", FileUtility.replaceExtension("/src.d/a", ".o"));
    assertEquals("/src/a.tar.o", FileUtility.replaceExtension("/src/a.tar.gz", ".o"));
  }

  @Test
  @DisplayName("absolute resolves relative paths against the base and normalizes")
  void absolute() {
    String base = Path.of("/work/build").toAbsolutePath().toString();
    assertEquals(
        Path.of("/work/src/a.cpp").toAbsolutePath().toString(),
        FileUtility.absolute("../src/a.cpp", base));
    assertEquals(
        Path.of("/abs/x.c").toAbsolutePath().toString(),
        FileUtility.absolute("/abs/./x.c", base));
  }
}
