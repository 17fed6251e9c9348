package com.gentoro.cppindexer.model;

/** A named C++ symbol (type, function, variable...), keyed by its mangled-name hash. */
public class Entity implements IndexRecord<Entity> {
  private long id;
  private long astNodeId;
  private long mangledNameHash;
  private String name;
  private String qualifiedName;

  public Entity() {}

  public Entity(long astNodeId, long mangledNameHash, String name, String qualifiedName) {
    this.astNodeId = astNodeId;
    this.mangledNameHash = mangledNameHash;
    this.name = name;
    this.qualifiedName = qualifiedName;
  }

  @Override
  public long getId() {
    return id;
  }

  @Override
  public Entity setId(long id) {
    this.id = id;
    return this;
  }

  public long getAstNodeId() {
    return astNodeId;
  }

  public long getMangledNameHash() {
    return mangledNameHash;
  }

  public String getName() {
    return name;
  }

  public String getQualifiedName() {
    return qualifiedName;
  }

  @Override
  public Entity copy() {
    return new Entity(astNodeId, mangledNameHash, name, qualifiedName).setId(id);
  }
}
