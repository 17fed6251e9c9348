package com.gentoro.cppindexer.parser;

/**
 * Parses one translation unit and stores what it finds: files, header inclusions, AST nodes,
 * entities and their relations. Called concurrently from several worker threads.
 */
public interface TranslationUnitParser {

  String name();

  /**
   * @return true when the unit was parsed completely; false when it was parsed partially or not
   *     at all
   */
  boolean parse(TranslationUnit unit, ParseContext context) throws Exception;
}
