package io.b2mash.b2b.projecthub.task;

public enum TaskStatus {
  TODO,
  IN_PROGRESS,
  DONE
}
