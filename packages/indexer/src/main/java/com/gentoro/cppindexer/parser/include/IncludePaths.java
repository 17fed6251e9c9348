package com.gentoro.cppindexer.parser.include;

import com.gentoro.cppindexer.parser.TranslationUnit;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Header search directories declared on a compiler command line. */
final class IncludePaths {
  private final List<Path> quote = new ArrayList<>();
  private final List<Path> user = new ArrayList<>();
  private final List<Path> system = new ArrayList<>();

  private IncludePaths() {}

  static IncludePaths of(TranslationUnit unit) {
    IncludePaths paths = new IncludePaths();
    List<String> args = unit.arguments();
    for (int i = 0; i < args.size(); i++) {
      String arg = args.get(i);
      for (String flag : new String[] {"-iquote", "-isystem", "-idirafter", "-I"}) {
        if (!arg.startsWith(flag)) continue;
        String value;
        if (arg.length() > flag.length()) {
          value = arg.substring(flag.length());
        } else if (i + 1 < args.size()) {
          value = args.get(++i);
        } else {
          break;
        }
        Path dir = unit.workingDirectory().resolve(value).toAbsolutePath().normalize();
        switch (flag) {
          case "-iquote" -> paths.quote.add(dir);
          case "-I" -> paths.user.add(dir);
          default -> paths.system.add(dir);
        }
        break;
      }
    }
    return paths;
  }

  /** Search order of {@code #include "..."} after the including file's own directory. */
  List<Path> quoted() {
    List<Path> all = new ArrayList<>(quote);
    all.addAll(user);
    all.addAll(system);
    return Collections.unmodifiableList(all);
  }

  /** Search order of {@code #include <...>}. */
  List<Path> angled() {
    List<Path> all = new ArrayList<>(user);
    all.addAll(system);
    return Collections.unmodifiableList(all);
  }
}
