package com.rolebridge.service.sync;

import com.rolebridge.identity.IdentityEvent;
import com.rolebridge.sync.IdentitySynchronizer;
import com.rolebridge.sync.SyncOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Synchronizes identity events once the identity store's transaction has committed.
 *
 * <p>Events published outside a transaction are handled immediately. A rolled-back transaction
 * never reaches the database roles.
 */
@Component
public class IdentityEventListener {

    private static final Logger log = LoggerFactory.getLogger(IdentityEventListener.class);

    private final IdentitySynchronizer synchronizer;

    public IdentityEventListener(IdentitySynchronizer synchronizer) {
        this.synchronizer = synchronizer;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onIdentityEvent(IdentityEvent event) {
        SyncOutcome outcome = synchronizer.handle(event);
        if (outcome.status().isSettled()) {
            log.debug("Identity event {} settled as {}", outcome.eventId(), outcome.status().value());
        } else {
            log.info(
                    "Identity event {} for {} ended as {}: {}",
                    outcome.eventId(),
                    outcome.identityKey(),
                    outcome.status().value(),
                    outcome.message());
        }
    }
}
