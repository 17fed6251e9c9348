package com.gentoro.cppindexer.model;

/** Outcome of the latest compile attempt that used a file as input. */
public enum ParseStatus {
  NOT_PARSED,
  PARTIALLY_PARSED,
  FULLY_PARSED
}
