package com.gentoro.cppindexer.model;

/** Text of a file plus its SHA-256 hash. Shared by every {@link FileRecord} with equal content. */
public class FileContent implements IndexRecord<FileContent> {
  private long id;
  private String hash;
  private String content;

  public FileContent() {}

  public FileContent(String hash, String content) {
    this.hash = hash;
    this.content = content;
  }

  @Override
  public long getId() {
    return id;
  }

  @Override
  public FileContent setId(long id) {
    this.id = id;
    return this;
  }

  public String getHash() {
    return hash;
  }

  public FileContent setHash(String hash) {
    this.hash = hash;
    return this;
  }

  public String getContent() {
    return content;
  }

  public FileContent setContent(String content) {
    this.content = content;
    return this;
  }

  @Override
  public FileContent copy() {
    return new FileContent(hash, content).setId(id);
  }
}
