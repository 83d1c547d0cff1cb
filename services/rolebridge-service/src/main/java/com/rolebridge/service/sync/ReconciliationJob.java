package com.rolebridge.service.sync;

import com.rolebridge.sync.IdentitySynchronizer;
import com.rolebridge.sync.ReconciliationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically converges database roles to a full snapshot of the identity store. Catches anything
 * an event missed, including orphaned roles left by a stale create.
 */
@Component
public class ReconciliationJob {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationJob.class);

    private final IdentitySynchronizer synchronizer;
    private final ObjectProvider<IdentityDirectory> directory;

    public ReconciliationJob(
            IdentitySynchronizer synchronizer, ObjectProvider<IdentityDirectory> directory) {
        this.synchronizer = synchronizer;
        this.directory = directory;
    }

    @Scheduled(
            fixedDelayString = "${rolebridge.sync.reconcile-interval:PT15M}",
            initialDelayString = "${rolebridge.sync.reconcile-interval:PT15M}")
    public void reconcile() {
        IdentityDirectory source = directory.getIfAvailable();
        if (source == null) {
            log.debug("No identity directory configured; skipping reconciliation");
            return;
        }
        ReconciliationReport report = synchronizer.reconcile(source.users(), source.groups());
        if (!report.isClean()) {
            log.warn(
                    "Reconciliation left work outstanding: {} removals pending, {} members missing,"
                            + " {} conflicts, {} failures",
                    report.removalsPending(),
                    report.membersMissing(),
                    report.conflicts(),
                    report.failures());
        }
    }
}
