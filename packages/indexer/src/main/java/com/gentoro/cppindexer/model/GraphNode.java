package com.gentoro.cppindexer.model;

/** Node of the generic relationship graph, wrapping the domain object {@code (domain, domainId)}. */
public class GraphNode implements IndexRecord<GraphNode> {
  private long id;
  private NodeDomain domain;
  private long domainId;

  public GraphNode() {}

  public GraphNode(NodeDomain domain, long domainId) {
    this.domain = domain;
    this.domainId = domainId;
  }

  @Override
  public long getId() {
    return id;
  }

  @Override
  public GraphNode setId(long id) {
    this.id = id;
    return this;
  }

  public NodeDomain getDomain() {
    return domain;
  }

  public long getDomainId() {
    return domainId;
  }

  public boolean wraps(NodeDomain domain, long domainId) {
    return this.domain == domain && this.domainId == domainId;
  }

  @Override
  public GraphNode copy() {
    return new GraphNode(domain, domainId).setId(id);
  }
}
