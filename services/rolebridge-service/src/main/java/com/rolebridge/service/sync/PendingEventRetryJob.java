package com.rolebridge.service.sync;

import com.rolebridge.sync.IdentitySynchronizer;
import com.rolebridge.sync.SyncOutcome;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Replays deferred identity events: blocked removals, missing members, transient failures. */
@Component
public class PendingEventRetryJob {

    private static final Logger log = LoggerFactory.getLogger(PendingEventRetryJob.class);

    private final IdentitySynchronizer synchronizer;

    public PendingEventRetryJob(IdentitySynchronizer synchronizer) {
        this.synchronizer = synchronizer;
    }

    @Scheduled(
            fixedDelayString = "${rolebridge.sync.retry-interval:PT30S}",
            initialDelayString = "${rolebridge.sync.retry-interval:PT30S}")
    public void retryPending() {
        List<SyncOutcome> outcomes = synchronizer.retryPending();
        if (outcomes.isEmpty()) {
            return;
        }
        long settled = outcomes.stream().filter(o -> o.status().isSettled()).count();
        log.info(
                "Retried {} pending identity events: {} settled, {} still pending",
                outcomes.size(),
                settled,
                synchronizer.pendingCount());
    }
}
