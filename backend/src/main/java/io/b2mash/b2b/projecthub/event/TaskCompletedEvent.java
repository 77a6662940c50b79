package io.b2mash.b2b.projecthub.event;

import java.time.Instant;
import java.util.UUID;

public record TaskCompletedEvent(
    UUID entityId,
    UUID projectId,
    UUID organizationId,
    UUID actorUserId,
    String taskTitle,
    Instant occurredAt)
    implements DomainEvent {

  @Override
  public String eventType() {
    return "task.completed";
  }
}
