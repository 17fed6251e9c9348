package com.gentoro.cppindexer.utility;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Hashing primitives used by the index.
 *
 * <ul>
 *   <li>SHA-256 (lowercase hex) for file contents, compared by the incremental change detector.
 *   <li>64-bit FNV-1a for compile command lines, held by the command deduplicator.
 * </ul>
 */
public final class HashUtility {
  private static final long FNV_OFFSET_BASIS = 0xcbf29ce484222325L;
  private static final long FNV_PRIME = 0x100000001b3L;

  private HashUtility() {}

  public static String sha256Hex(byte[] content) {
    MessageDigest md = newSha256();
    md.update(content);
    return toHex(md.digest());
  }

  public static String sha256Hex(String content) {
    return sha256Hex(content.getBytes(StandardCharsets.UTF_8));
  }

  /** Streams the file through the digest. */
  public static String sha256Hex(Path file) {
    try (InputStream in = Files.newInputStream(file)) {
      MessageDigest md = newSha256();
      byte[] buf = new byte[8192];

      int n;
      while ((n = in.read(buf)) != -1) md.update(buf, 0, n);
      return toHex(md.digest());
    } catch (IOException e) {
      throw new UncheckedIOException("Failed hashing file: " + file, e);
    }
  }

  /** 64-bit FNV-1a over the UTF-8 bytes of {@code value}. */
  public static long fnv1a64(String value) {
    long hash = FNV_OFFSET_BASIS;
    for (byte b : value.getBytes(StandardCharsets.UTF_8)) {
      hash ^= (b & 0xff);
      hash *= FNV_PRIME;
    }
    return hash;
  }

  private static MessageDigest newSha256() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  private static String toHex(byte[] digest) {
    StringBuilder sb = new StringBuilder(digest.length * 2);
    for (byte b : digest) sb.append(String.format("%02x", b));
    return sb.toString();
  }
}
