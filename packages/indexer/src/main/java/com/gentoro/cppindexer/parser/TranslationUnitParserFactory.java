package com.gentoro.cppindexer.parser;

import com.gentoro.cppindexer.CppIndexer;
import com.gentoro.cppindexer.parser.include.IncludeDirectiveParser;
import com.gentoro.cppindexer.parser.spi.TranslationUnitParserProvider;
import java.util.ServiceLoader;

public final class TranslationUnitParserFactory {
  private static final org.slf4j.Logger log =
      com.gentoro.cppindexer.logging.LoggingService.getLogger(TranslationUnitParserFactory.class);

  private TranslationUnitParserFactory() {}

  public static TranslationUnitParser create(CppIndexer indexer) {
    String desired =
        indexer.configuration().getString("parser.provider", IncludeDirectiveParser.NAME);
    for (TranslationUnitParserProvider provider :
        ServiceLoader.load(TranslationUnitParserProvider.class)) {
      if (provider.id().equalsIgnoreCase(desired) && provider.isAvailable(indexer)) {
        log.info("Using translation unit parser '{}'", provider.id());
        return provider.create(indexer);
      }
    }
    log.warn(
        "Parser provider '{}' not found, falling back to '{}'",
        desired,
        IncludeDirectiveParser.NAME);
    return new IncludeDirectiveParser();
  }
}
