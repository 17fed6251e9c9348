package com.gentoro.cppindexer.model;

/** Input file of a build action, with the parse status the action left it in. */
public class BuildSource implements IndexRecord<BuildSource> {
  private long id;
  private long fileId;
  private long actionId;
  private ParseStatus parseStatus = ParseStatus.NOT_PARSED;

  public BuildSource() {}

  public BuildSource(long fileId, long actionId, ParseStatus parseStatus) {
    this.fileId = fileId;
    this.actionId = actionId;
    this.parseStatus = parseStatus;
  }

  @Override
  public long getId() {
    return id;
  }

  @Override
  public BuildSource setId(long id) {
    this.id = id;
    return this;
  }

  public long getFileId() {
    return fileId;
  }

  public long getActionId() {
    return actionId;
  }

  public ParseStatus getParseStatus() {
    return parseStatus;
  }

  @Override
  public BuildSource copy() {
    return new BuildSource(fileId, actionId, parseStatus).setId(id);
  }
}
