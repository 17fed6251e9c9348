package com.gentoro.cppindexer.parser;

import com.gentoro.cppindexer.graph.GraphRepository;
import com.gentoro.cppindexer.source.SourceManager;
import com.gentoro.cppindexer.store.IndexStore;

/** What a parser may write to while handling one translation unit. */
public record ParseContext(
    IndexStore store, SourceManager sourceManager, GraphRepository graphRepository) {}
