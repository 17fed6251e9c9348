package com.gentoro.cppindexer.model;

/** Kind of domain object a {@link GraphNode} stands for. */
public enum NodeDomain {
  AST_NODE,
  FILE
}
