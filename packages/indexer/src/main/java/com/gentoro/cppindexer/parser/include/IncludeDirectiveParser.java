package com.gentoro.cppindexer.parser.include;

import com.gentoro.cppindexer.model.FileRecord;
import com.gentoro.cppindexer.model.HeaderInclusion;
import com.gentoro.cppindexer.parser.ParseContext;
import com.gentoro.cppindexer.parser.TranslationUnit;
import com.gentoro.cppindexer.parser.TranslationUnitParser;
import com.gentoro.cppindexer.store.IndexStore;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Preprocessor-level parser: follows {@code #include} directives from the main file and records
 * every header it reaches together with a {@link HeaderInclusion} edge in the context of the
 * translation unit.
 *
 * <p>Conditional compilation is not evaluated, so headers behind inactive {@code #if} branches are
 * recorded as well. Angled includes that cannot be resolved are assumed to be system headers and
 * ignored; an unresolved quoted include makes the parse partial.
 */
public class IncludeDirectiveParser implements TranslationUnitParser {
  private static final org.slf4j.Logger log =
      com.gentoro.cppindexer.logging.LoggingService.getLogger(IncludeDirectiveParser.class);

  public static final String NAME = "include-scanner";

  private static final Pattern INCLUDE =
      Pattern.compile("^\\s*#\\s*include\\s*([<\"])([^>\"]+)[>\"]", Pattern.MULTILINE);

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public boolean parse(TranslationUnit unit, ParseContext context) throws IOException {
    Path main = unit.mainFile();
    if (!Files.isRegularFile(main)) {
      log.warn("Main file {} does not exist", main);
      return false;
    }
    IncludePaths paths = IncludePaths.of(unit);
    FileRecord mainRecord = context.sourceManager().getFile(main.toString(), true);

    boolean complete = true;
    Set<Path> visited = new HashSet<>();
    Deque<Path> work = new ArrayDeque<>();
    visited.add(main);
    work.add(main);
    while (!work.isEmpty()) {
      Path file = work.poll();
      FileRecord includer = context.sourceManager().getFile(file.toString(), true);
      for (Directive directive : scan(file)) {
        Optional<Path> resolved = resolve(directive, file.getParent(), paths);
        if (resolved.isEmpty()) {
          if (directive.quoted()) {
            log.warn("Cannot resolve #include \"{}\" in {}", directive.name(), file);
            complete = false;
          }
          continue;
        }
        FileRecord included = context.sourceManager().getFile(resolved.get().toString(), true);
        recordInclusion(context.store(), includer.getId(), included.getId(), mainRecord.getId());
        if (visited.add(resolved.get())) {
          work.add(resolved.get());
        }
      }
    }
    log.debug("Scanned {}: {} files reached", main, visited.size());
    return complete;
  }

  static List<Directive> scan(Path file) throws IOException {
    String text = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    List<Directive> directives = new ArrayList<>();
    Matcher m = INCLUDE.matcher(text);
    while (m.find()) {
      directives.add(new Directive(m.group(2).trim(), "\"".equals(m.group(1))));
    }
    return directives;
  }

  private static Optional<Path> resolve(Directive directive, Path currentDir, IncludePaths paths) {
    List<Path> candidates = new ArrayList<>();
    if (directive.quoted()) {
      if (currentDir != null) candidates.add(currentDir);
      candidates.addAll(paths.quoted());
    } else {
      candidates.addAll(paths.angled());
    }
    for (Path dir : candidates) {
      Path candidate = dir.resolve(directive.name()).normalize();
      if (Files.isRegularFile(candidate)) {
        return Optional.of(candidate);
      }
    }
    return Optional.empty();
  }

  private static void recordInclusion(IndexStore store, long includer, long included, long ctx) {
    store.runInTransaction(
        () -> {
          boolean known =
              store
                  .queryOne(
                      HeaderInclusion.class,
                      h ->
                          h.getIncluderId() == includer
                              && h.getIncludedId() == included
                              && h.getContextId() == ctx)
                  .isPresent();
          if (!known) {
            store.persist(new HeaderInclusion(includer, included, ctx));
          }
        });
  }

  record Directive(String name, boolean quoted) {}
}
