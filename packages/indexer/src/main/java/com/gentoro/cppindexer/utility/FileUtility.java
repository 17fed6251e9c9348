package com.gentoro.cppindexer.utility;

import java.nio.file.Path;
import java.util.Locale;

public final class FileUtility {
  private FileUtility() {}

  /** Lower-cased extension including the dot, or an empty string when there is none. */
  public static String extension(String path) {
    if (path == null) return "";
    String name = fileName(path);
    int dot = name.lastIndexOf('.');
    if (dot <= 0) return "";
    return name.substring(dot).toLowerCase(Locale.ROOT);
  }

  /** Replaces the extension of the last path segment, appending when there is none. */
  public static String replaceExtension(String path, String newExtension) {
    String name = fileName(path);
    int dot = name.lastIndexOf('.');
    if (dot <= 0) return path + newExtension;
    int cut = path.length() - (name.length() - dot);
    return path.substring(0, cut) + newExtension;
  }

  /** Resolves {@code path} against {@code base} unless already absolute, then normalizes. */
  public static String absolute(String path, String base) {
    Path p = Path.of(path);
    if (!p.isAbsolute()) {
      p = (base == null || base.isEmpty() ? Path.of("") : Path.of(base)).resolve(p);
    }
    return p.toAbsolutePath().normalize().toString();
  }

  private static String fileName(String path) {
    int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
    return slash < 0 ? path : path.substring(slash + 1);
  }
}
