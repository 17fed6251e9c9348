package com.gentoro.cppindexer.model;

/** Output file of a build action. */
public class BuildTarget implements IndexRecord<BuildTarget> {
  private long id;
  private long fileId;
  private long actionId;

  public BuildTarget() {}

  public BuildTarget(long fileId, long actionId) {
    this.fileId = fileId;
    this.actionId = actionId;
  }

  @Override
  public long getId() {
    return id;
  }

  @Override
  public BuildTarget setId(long id) {
    this.id = id;
    return this;
  }

  public long getFileId() {
    return fileId;
  }

  public long getActionId() {
    return actionId;
  }

  @Override
  public BuildTarget copy() {
    return new BuildTarget(fileId, actionId).setId(id);
  }
}
