package io.b2mash.b2b.projecthub.comment;

import io.b2mash.b2b.projecthub.security.Owned;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "task_comments")
public class TaskComment implements Owned {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "task_id", nullable = false, updatable = false)
  private UUID taskId;

  @Column(name = "content", nullable = false, columnDefinition = "TEXT")
  private String content;

  @Column(name = "author_email", nullable = false, length = 254)
  private String authorEmail;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected TaskComment() {}

  public TaskComment(UUID taskId, String content, String authorEmail) {
    this.taskId = taskId;
    this.content = content;
    this.authorEmail = authorEmail;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getTaskId() {
    return taskId;
  }

  public String getContent() {
    return content;
  }

  public String getAuthorEmail() {
    return authorEmail;
  }

  @Override
  public String getOwnerEmail() {
    return authorEmail;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public void updateContent(String content) {
    this.content = content;
    this.updatedAt = Instant.now();
  }
}
