package io.intellixity.vista.error;

/** Unknown pipeline, entity, data source or run id. */
public final class NotFoundException extends VistaException {
  private final String kind;
  private final String id;

  public NotFoundException(String kind, String id) {
    super(kind + " not found: " + id);
    this.kind = kind;
    this.id = id;
  }

  public String kind() { return kind; }
  public String id() { return id; }
}
