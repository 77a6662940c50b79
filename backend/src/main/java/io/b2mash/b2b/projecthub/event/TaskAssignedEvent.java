package io.b2mash.b2b.projecthub.event;

import java.time.Instant;
import java.util.UUID;

public record TaskAssignedEvent(
    UUID entityId,
    UUID projectId,
    UUID organizationId,
    UUID actorUserId,
    String assigneeEmail,
    String taskTitle,
    Instant occurredAt)
    implements DomainEvent {

  @Override
  public String eventType() {
    return "task.assigned";
  }
}
