package io.b2mash.b2b.projecthub.task;

import io.b2mash.b2b.projecthub.security.Owned;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "tasks")
public class Task implements Owned {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "project_id", nullable = false, updatable = false)
  private UUID projectId;

  @Column(name = "title", nullable = false, length = 200)
  private String title;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private TaskStatus status;

  @Column(name = "assignee_email", length = 254)
  private String assigneeEmail;

  @Column(name = "due_date")
  private Instant dueDate;

  @Column(name = "completed_at")
  private Instant completedAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Task() {}

  public Task(
      UUID projectId, String title, String description, String assigneeEmail, Instant dueDate) {
    this.projectId = projectId;
    this.title = title;
    this.description = description;
    this.assigneeEmail = assigneeEmail;
    this.dueDate = dueDate;
    this.status = TaskStatus.TODO;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getProjectId() {
    return projectId;
  }

  public String getTitle() {
    return title;
  }

  public String getDescription() {
    return description;
  }

  public TaskStatus getStatus() {
    return status;
  }

  public String getAssigneeEmail() {
    return assigneeEmail;
  }

  /** The assignee owns the task. */
  @Override
  public String getOwnerEmail() {
    return assigneeEmail;
  }

  public Instant getDueDate() {
    return dueDate;
  }

  public Instant getCompletedAt() {
    return completedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  /**
   * Applies a partial update; null arguments leave the field unchanged and a blank assignee clears
   * the assignment.
   */
  public void update(String title, String description, String assigneeEmail, Instant dueDate) {
    this.title = title != null ? title : this.title;
    this.description = description != null ? description : this.description;
    if (assigneeEmail != null) {
      this.assigneeEmail = assigneeEmail.isBlank() ? null : assigneeEmail;
    }
    this.dueDate = dueDate != null ? dueDate : this.dueDate;
    this.updatedAt = Instant.now();
  }

  /**
   * Moves the task to {@code target}. Entering DONE stamps {@code completedAt} once; leaving DONE
   * clears it.
   *
   * @return true if the task entered DONE with this call
   */
  public boolean changeStatus(TaskStatus target) {
    if (target == null || target == this.status) {
      return false;
    }
    boolean completing = target == TaskStatus.DONE;
    this.status = target;
    this.completedAt = completing ? Instant.now() : null;
    this.updatedAt = Instant.now();
    return completing;
  }

  public boolean isOverdue(Instant now) {
    return dueDate != null && dueDate.isBefore(now) && status != TaskStatus.DONE;
  }
}
