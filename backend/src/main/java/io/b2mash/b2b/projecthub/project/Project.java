package io.b2mash.b2b.projecthub.project;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(name = "projects")
public class Project {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "organization_id", nullable = false, updatable = false)
  private UUID organizationId;

  @Column(name = "name", nullable = false, length = 200)
  private String name;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private ProjectStatus status;

  @Column(name = "due_date")
  private LocalDate dueDate;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Project() {}

  public Project(UUID organizationId, String name, String description, LocalDate dueDate) {
    this.organizationId = organizationId;
    this.name = name;
    this.description = description;
    this.dueDate = dueDate;
    this.status = ProjectStatus.PLANNING;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getOrganizationId() {
    return organizationId;
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  public ProjectStatus getStatus() {
    return status;
  }

  public LocalDate getDueDate() {
    return dueDate;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  /** Applies a partial update; null arguments leave the field unchanged. */
  public void update(String name, String description, ProjectStatus status, LocalDate dueDate) {
    this.name = name != null ? name : this.name;
    this.description = description != null ? description : this.description;
    this.status = status != null ? status : this.status;
    this.dueDate = dueDate != null ? dueDate : this.dueDate;
    this.updatedAt = Instant.now();
  }

  public boolean isOverdue(LocalDate today) {
    return dueDate != null && dueDate.isBefore(today) && status != ProjectStatus.COMPLETED;
  }
}
