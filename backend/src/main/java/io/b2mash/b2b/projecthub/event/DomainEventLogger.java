package io.b2mash.b2b.projecthub.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/** Records committed domain events. Runs after commit, so rolled-back changes never show up. */
@Component
public class DomainEventLogger {

  private static final Logger log = LoggerFactory.getLogger(DomainEventLogger.class);

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onTaskAssigned(TaskAssignedEvent event) {
    log.info(
        "{}: task {} in organization {} assigned to {} by user {}",
        event.eventType(),
        event.entityId(),
        event.organizationId(),
        event.assigneeEmail(),
        event.actorUserId());
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onTaskCompleted(TaskCompletedEvent event) {
    log.info(
        "{}: task {} in organization {} completed by user {}",
        event.eventType(),
        event.entityId(),
        event.organizationId(),
        event.actorUserId());
  }
}
