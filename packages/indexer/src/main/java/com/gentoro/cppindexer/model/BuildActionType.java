package com.gentoro.cppindexer.model;

public enum BuildActionType {
  COMPILE,
  LINK
}
