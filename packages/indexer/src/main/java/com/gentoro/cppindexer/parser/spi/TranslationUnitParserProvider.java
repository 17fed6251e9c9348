package com.gentoro.cppindexer.parser.spi;

import com.gentoro.cppindexer.CppIndexer;
import com.gentoro.cppindexer.parser.TranslationUnitParser;

/** ServiceLoader SPI for translation unit parsers, selected by {@code parser.provider}. */
public interface TranslationUnitParserProvider {
  String id();

  default boolean isAvailable(CppIndexer indexer) {
    return true;
  }

  TranslationUnitParser create(CppIndexer indexer);
}
