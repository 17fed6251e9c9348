package com.gentoro.cppindexer.model;

import java.util.Objects;

/** A file or directory known to the index, identified by its normalized absolute path. */
public class FileRecord implements IndexRecord<FileRecord> {
  private long id;
  private String path;
  private FileType type = FileType.OTHER;
  private ParseStatus parseStatus = ParseStatus.NOT_PARSED;
  private long contentId; // 0 when no content has been recorded
  private long parentId; // 0 for a filesystem root
  private long timestamp; // last modified millis when recorded

  public FileRecord() {}

  public FileRecord(String path, FileType type) {
    this.path = Objects.requireNonNull(path, "path");
    this.type = Objects.requireNonNull(type, "type");
  }

  @Override
  public long getId() {
    return id;
  }

  @Override
  public FileRecord setId(long id) {
    this.id = id;
    return this;
  }

  public String getPath() {
    return path;
  }

  public FileRecord setPath(String path) {
    this.path = path;
    return this;
  }

  public FileType getType() {
    return type;
  }

  public FileRecord setType(FileType type) {
    this.type = type;
    return this;
  }

  public ParseStatus getParseStatus() {
    return parseStatus;
  }

  public FileRecord setParseStatus(ParseStatus parseStatus) {
    this.parseStatus = parseStatus;
    return this;
  }

  public long getContentId() {
    return contentId;
  }

  public FileRecord setContentId(long contentId) {
    this.contentId = contentId;
    return this;
  }

  public boolean hasContent() {
    return contentId != 0;
  }

  public long getParentId() {
    return parentId;
  }

  public FileRecord setParentId(long parentId) {
    this.parentId = parentId;
    return this;
  }

  public long getTimestamp() {
    return timestamp;
  }

  public FileRecord setTimestamp(long timestamp) {
    this.timestamp = timestamp;
    return this;
  }

  @Override
  public FileRecord copy() {
    return new FileRecord()
        .setId(id)
        .setPath(path)
        .setType(type)
        .setParseStatus(parseStatus)
        .setContentId(contentId)
        .setParentId(parentId)
        .setTimestamp(timestamp);
  }

  @Override
  public String toString() {
    return "FileRecord{id=" + id + ", path='" + path + "', type=" + type + ", parseStatus="
        + parseStatus + '}';
  }
}
