package io.b2mash.b2b.projecthub.task;

public enum TaskSortField {
  TITLE("title"),
  STATUS("status"),
  DUE_DATE("dueDate"),
  CREATED_AT("createdAt"),
  UPDATED_AT("updatedAt");

  private final String property;

  TaskSortField(String property) {
    this.property = property;
  }

  public String property() {
    return property;
  }
}
