package com.gentoro.cppindexer.model;

public enum AstType {
  DEFINITION,
  DECLARATION,
  USAGE,
  STATEMENT
}
