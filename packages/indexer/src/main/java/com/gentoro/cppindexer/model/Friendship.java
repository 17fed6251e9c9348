package com.gentoro.cppindexer.model;

/** {@code theFriend} is declared friend of {@code target}; both are mangled-name hashes. */
public class Friendship implements IndexRecord<Friendship> {
  private long id;
  private long target;
  private long theFriend;

  public Friendship() {}

  public Friendship(long target, long theFriend) {
    this.target = target;
    this.theFriend = theFriend;
  }

  @Override
  public long getId() {
    return id;
  }

  @Override
  public Friendship setId(long id) {
    this.id = id;
    return this;
  }

  public long getTarget() {
    return target;
  }

  public long getTheFriend() {
    return theFriend;
  }

  @Override
  public Friendship copy() {
    return new Friendship(target, theFriend).setId(id);
  }
}
