package com.gentoro.cppindexer.model;

/**
 * Derived relationship between two graph nodes. Stored with a direction, traversed in both
 * directions when collecting connected components.
 */
public class GraphEdge implements IndexRecord<GraphEdge> {
  private long id;
  private long fromId;
  private long toId;
  private String type;

  public GraphEdge() {}

  public GraphEdge(long fromId, long toId, String type) {
    this.fromId = fromId;
    this.toId = toId;
    this.type = type;
  }

  @Override
  public long getId() {
    return id;
  }

  @Override
  public GraphEdge setId(long id) {
    this.id = id;
    return this;
  }

  public long getFromId() {
    return fromId;
  }

  public long getToId() {
    return toId;
  }

  public String getType() {
    return type;
  }

  public boolean touches(long nodeId) {
    return fromId == nodeId || toId == nodeId;
  }

  @Override
  public GraphEdge copy() {
    return new GraphEdge(fromId, toId, type).setId(id);
  }
}
