package com.gentoro.cppindexer.model;

/**
 * A syntax tree node emitted by the translation unit collaborator. Links to {@link Entity} rows
 * through {@code mangledNameHash}, so every declaration of a symbol converges on the same
 * entities.
 */
public class AstNode implements IndexRecord<AstNode> {
  private long id;
  private long fileId;
  private int line;
  private int column;
  private AstType astType = AstType.USAGE;
  private String astValue;
  private long mangledNameHash;

  public AstNode() {}

  public AstNode(long fileId, AstType astType, long mangledNameHash) {
    this.fileId = fileId;
    this.astType = astType;
    this.mangledNameHash = mangledNameHash;
  }

  @Override
  public long getId() {
    return id;
  }

  @Override
  public AstNode setId(long id) {
    this.id = id;
    return this;
  }

  public long getFileId() {
    return fileId;
  }

  public AstNode setFileId(long fileId) {
    this.fileId = fileId;
    return this;
  }

  public int getLine() {
    return line;
  }

  public int getColumn() {
    return column;
  }

  public AstNode setLocation(int line, int column) {
    this.line = line;
    this.column = column;
    return this;
  }

  public AstType getAstType() {
    return astType;
  }

  public AstNode setAstType(AstType astType) {
    this.astType = astType;
    return this;
  }

  public String getAstValue() {
    return astValue;
  }

  public AstNode setAstValue(String astValue) {
    this.astValue = astValue;
    return this;
  }

  public long getMangledNameHash() {
    return mangledNameHash;
  }

  public AstNode setMangledNameHash(long mangledNameHash) {
    this.mangledNameHash = mangledNameHash;
    return this;
  }

  @Override
  public AstNode copy() {
    return new AstNode(fileId, astType, mangledNameHash)
        .setId(id)
        .setLocation(line, column)
        .setAstValue(astValue);
  }
}
