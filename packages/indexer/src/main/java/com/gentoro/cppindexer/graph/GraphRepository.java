package com.gentoro.cppindexer.graph;

import com.gentoro.cppindexer.exception.StoreException;
import com.gentoro.cppindexer.model.GraphEdge;
import com.gentoro.cppindexer.model.GraphNode;
import com.gentoro.cppindexer.model.NodeDomain;
import com.gentoro.cppindexer.store.IndexStore;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Relationship graph over index objects. A {@link GraphNode} wraps one AST node or file; edges
 * are stored directed but traversed in both directions, so removing a node removes its whole
 * connected component.
 */
public class GraphRepository {
  private static final org.slf4j.Logger log =
      com.gentoro.cppindexer.logging.LoggingService.getLogger(GraphRepository.class);

  private final IndexStore store;

  public GraphRepository(IndexStore store) {
    this.store = store;
  }

  public GraphNode addNode(NodeDomain domain, long domainId) {
    return store.persist(new GraphNode(domain, domainId));
  }

  /** Returns the first node wrapping {@code (domain, domainId)}, adding one when there is none. */
  public GraphNode nodeFor(NodeDomain domain, long domainId) {
    return store.callInTransaction(
        () ->
            store
                .queryOne(GraphNode.class, n -> n.wraps(domain, domainId))
                .orElseGet(() -> addNode(domain, domainId)));
  }

  public List<GraphNode> findNodes(NodeDomain domain, long domainId) {
    return store.query(GraphNode.class, n -> n.wraps(domain, domainId));
  }

  /** Adds an edge; both ends must exist. */
  public GraphEdge connect(long fromId, long toId, String type) {
    return store.callInTransaction(
        () -> {
          for (long id : new long[] {fromId, toId}) {
            if (store.find(GraphNode.class, id).isEmpty()) {
              throw new StoreException("Cannot connect missing graph node " + id);
            }
          }
          return store.persist(new GraphEdge(fromId, toId, type));
        });
  }

  public List<GraphEdge> edgesOf(long nodeId) {
    return store.query(GraphEdge.class, e -> e.touches(nodeId));
  }

  /** Ids of every node reachable from {@code startId} through edges in either direction. */
  public Set<Long> collectComponent(long startId) {
    return store.callInTransaction(() -> traverse(List.of(startId), incidentEdges()));
  }

  /**
   * Erases the connected component of {@code startId}: first every edge touching it, then its
   * nodes. Joins the caller's transaction when there is one.
   *
   * @return number of nodes removed
   */
  public int deleteComponent(long startId) {
    return store.callInTransaction(() -> erase(List.of(startId), incidentEdges()));
  }

  /** Deletes the components of every node wrapping {@code (domain, domainId)}. */
  public int deleteNodesOf(NodeDomain domain, long domainId) {
    return deleteNodesOf(domain, List.of(domainId));
  }

  /**
   * Deletes the components of every node wrapping one of {@code domainIds}. The nodes are looked
   * up and the edges indexed once for the whole batch.
   */
  public int deleteNodesOf(NodeDomain domain, Collection<Long> domainIds) {
    if (domainIds.isEmpty()) return 0;
    Set<Long> wanted = new HashSet<>(domainIds);
    return store.callInTransaction(
        () -> {
          List<Long> starts = new ArrayList<>();
          for (GraphNode node :
              store.query(
                  GraphNode.class,
                  n -> n.getDomain() == domain && wanted.contains(n.getDomainId()))) {
            starts.add(node.getId());
          }
          if (starts.isEmpty()) return 0;
          return erase(starts, incidentEdges());
        });
  }

  /** Edges by node id; an edge is listed under both of its ends. */
  private Map<Long, List<GraphEdge>> incidentEdges() {
    Map<Long, List<GraphEdge>> incident = new HashMap<>();
    for (GraphEdge edge : store.queryAll(GraphEdge.class)) {
      incident.computeIfAbsent(edge.getFromId(), k -> new ArrayList<>()).add(edge);
      if (edge.getToId() != edge.getFromId()) {
        incident.computeIfAbsent(edge.getToId(), k -> new ArrayList<>()).add(edge);
      }
    }
    return incident;
  }

  private static Set<Long> traverse(
      Collection<Long> startIds, Map<Long, List<GraphEdge>> incident) {
    Set<Long> visited = new LinkedHashSet<>();
    Deque<Long> queue = new ArrayDeque<>();
    for (long start : startIds) {
      if (visited.add(start)) {
        queue.add(start);
      }
    }
    while (!queue.isEmpty()) {
      long current = queue.poll();
      for (GraphEdge edge : incident.getOrDefault(current, List.of())) {
        long next = edge.getFromId() == current ? edge.getToId() : edge.getFromId();
        if (visited.add(next)) {
          queue.add(next);
        }
      }
    }
    return visited;
  }

  private int erase(Collection<Long> startIds, Map<Long, List<GraphEdge>> incident) {
    Set<Long> component = traverse(startIds, incident);
    Set<Long> erasedEdges = new HashSet<>();
    for (long id : component) {
      for (GraphEdge edge : incident.getOrDefault(id, List.of())) {
        if (erasedEdges.add(edge.getId())) {
          store.erase(GraphEdge.class, edge.getId());
        }
      }
    }
    int removed = 0;
    for (long id : component) {
      if (store.erase(GraphNode.class, id)) {
        removed++;
      }
    }
    log.debug("Deleted graph component of nodes {} ({} nodes)", startIds, removed);
    return removed;
  }
}
