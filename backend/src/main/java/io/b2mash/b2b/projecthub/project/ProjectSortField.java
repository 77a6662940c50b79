package io.b2mash.b2b.projecthub.project;

/** Sortable project attributes, mapped to entity property names. */
public enum ProjectSortField {
  NAME("name"),
  STATUS("status"),
  DUE_DATE("dueDate"),
  CREATED_AT("createdAt"),
  UPDATED_AT("updatedAt");

  private final String property;

  ProjectSortField(String property) {
    this.property = property;
  }

  public String property() {
    return property;
  }
}
