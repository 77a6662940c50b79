package io.b2mash.b2b.projecthub.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Domain events published via Spring's ApplicationEventPublisher. Implementations are records with
 * plain values only, never entity references, so they stay valid after the publishing transaction
 * commits.
 */
public sealed interface DomainEvent permits TaskAssignedEvent, TaskCompletedEvent {

  String eventType();

  UUID entityId();

  UUID organizationId();

  UUID actorUserId();

  Instant occurredAt();
}
