package com.thisthat.wagering.job;

import com.thisthat.wagering.config.SchedulerConfig;
import com.thisthat.wagering.config.WageringProperties;
import com.thisthat.wagering.service.LedgerAuditService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * Periodic ledger replay; divergent accounts are logged by {@link LedgerAuditService}.
 */
@Component
public class LedgerAuditJob extends SingleFlightJob {

    private final LedgerAuditService ledgerAuditService;

    public LedgerAuditJob(LedgerAuditService ledgerAuditService,
                          @Qualifier(SchedulerConfig.JOB_SCHEDULER) TaskScheduler scheduler,
                          WageringProperties properties) {
        super("ledger-audit", scheduler, properties.getJobs().getLedgerAudit());
        this.ledgerAuditService = ledgerAuditService;
    }

    @Override
    protected void runCycle() {
        ledgerAuditService.auditAll();
    }
}
