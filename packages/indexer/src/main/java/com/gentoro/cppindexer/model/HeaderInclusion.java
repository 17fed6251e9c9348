package com.gentoro.cppindexer.model;

/**
 * {@code includer} contains an {@code #include} of {@code included}, seen while parsing the
 * translation unit whose main file is {@code context}.
 */
public class HeaderInclusion implements IndexRecord<HeaderInclusion> {
  private long id;
  private long includerId;
  private long includedId;
  private long contextId;

  public HeaderInclusion() {}

  public HeaderInclusion(long includerId, long includedId, long contextId) {
    this.includerId = includerId;
    this.includedId = includedId;
    this.contextId = contextId;
  }

  @Override
  public long getId() {
    return id;
  }

  @Override
  public HeaderInclusion setId(long id) {
    this.id = id;
    return this;
  }

  public long getIncluderId() {
    return includerId;
  }

  public long getIncludedId() {
    return includedId;
  }

  public long getContextId() {
    return contextId;
  }

  @Override
  public HeaderInclusion copy() {
    return new HeaderInclusion(includerId, includedId, contextId).setId(id);
  }
}
