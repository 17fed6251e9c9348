package com.gentoro.cppindexer.model;

/**
 * One executed compile or link command. The command is the argument list joined by single
 * spaces, the same string the command deduplicator hashes.
 */
public class BuildAction implements IndexRecord<BuildAction> {
  private long id;
  private String command;
  private BuildActionType type = BuildActionType.COMPILE;

  public BuildAction() {}

  public BuildAction(String command, BuildActionType type) {
    this.command = command;
    this.type = type;
  }

  @Override
  public long getId() {
    return id;
  }

  @Override
  public BuildAction setId(long id) {
    this.id = id;
    return this;
  }

  public String getCommand() {
    return command;
  }

  public BuildAction setCommand(String command) {
    this.command = command;
    return this;
  }

  public BuildActionType getType() {
    return type;
  }

  public BuildAction setType(BuildActionType type) {
    this.type = type;
    return this;
  }

  @Override
  public BuildAction copy() {
    return new BuildAction(command, type).setId(id);
  }
}
