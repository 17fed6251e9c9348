package com.gentoro.cppindexer.model;

/** Derived/base edge between two entities, by mangled-name hash. */
public class Inheritance implements IndexRecord<Inheritance> {
  private long id;
  private long derived;
  private long base;
  private boolean virtualBase;

  public Inheritance() {}

  public Inheritance(long derived, long base, boolean virtualBase) {
    this.derived = derived;
    this.base = base;
    this.virtualBase = virtualBase;
  }

  @Override
  public long getId() {
    return id;
  }

  @Override
  public Inheritance setId(long id) {
    this.id = id;
    return this;
  }

  public long getDerived() {
    return derived;
  }

  public long getBase() {
    return base;
  }

  public boolean isVirtualBase() {
    return virtualBase;
  }

  @Override
  public Inheritance copy() {
    return new Inheritance(derived, base, virtualBase).setId(id);
  }
}
