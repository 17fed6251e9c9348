package com.gentoro.cppindexer.compdb;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a {@code command} string the way a POSIX shell would: whitespace separates arguments,
 * single quotes are literal, double quotes allow backslash escapes of {@code " \ $ `}, and a
 * backslash outside quotes escapes the next character. An unterminated quote ends at the end of
 * the input.
 */
public final class CommandLineTokenizer {
  private CommandLineTokenizer() {}

  public static List<String> tokenize(String command) {
    List<String> args = new ArrayList<>();
    if (command == null) return args;

    StringBuilder current = new StringBuilder();
    boolean inToken = false;
    int i = 0;
    int n = command.length();
    while (i < n) {
      char c = command.charAt(i);
      if (Character.isWhitespace(c)) {
        if (inToken) {
          args.add(current.toString());
          current.setLength(0);
          inToken = false;
        }
        i++;
      } else if (c == '\'') {
        inToken = true;
        i++;
        while (i < n && command.charAt(i) != '\'') {
          current.append(command.charAt(i++));
        }
        i++;
      } else if (c == '"') {
        inToken = true;
        i++;
        while (i < n && command.charAt(i) != '"') {
          char d = command.charAt(i);
          if (d == '\\' && i + 1 < n && "\"\\$`".indexOf(command.charAt(i + 1)) >= 0) {
            current.append(command.charAt(i + 1));
            i += 2;
          } else {
            current.append(d);
            i++;
          }
        }
        i++;
      } else if (c == '\\') {
        inToken = true;
        if (i + 1 < n) {
          current.append(command.charAt(i + 1));
        }
        i += 2;
      } else {
        inToken = true;
        current.append(c);
        i++;
      }
    }
    if (inToken) {
      args.add(current.toString());
    }
    return args;
  }
}
