package com.gentoro.cppindexer.orchestrator;

import com.gentoro.cppindexer.compdb.CompileCommand;

/**
 * One compile command waiting for a worker.
 *
 * @param index 1-based position of the command in its database, for progress logs
 * @param total number of commands in the database
 */
public record ParseJob(CompileCommand command, int index, int total) {
  @Override
  public String toString() {
    return "(" + index + "/" + total + ") " + command.filename();
  }
}
