package com.gentoro.cppindexer.orchestrator;

/**
 * Counters of one run.
 *
 * @param parsed commands handed to the parser
 * @param failed parses that were partial or threw
 * @param skipped commands dropped as already parsed
 * @param rejected commands that could not be turned into a compiler invocation
 */
public record ParseStatistics(int parsed, int failed, int skipped, int rejected) {}
