package com.gentoro.cppindexer.parser.include;

import com.gentoro.cppindexer.CppIndexer;
import com.gentoro.cppindexer.parser.TranslationUnitParser;
import com.gentoro.cppindexer.parser.spi.TranslationUnitParserProvider;

public class IncludeDirectiveParserProvider implements TranslationUnitParserProvider {
  @Override
  public String id() {
    return IncludeDirectiveParser.NAME;
  }

  @Override
  public TranslationUnitParser create(CppIndexer indexer) {
    return new IncludeDirectiveParser();
  }
}
