package com.bothsides.rostersync.processor;

import com.bothsides.rostersync.model.SyncStrategy;
import com.bothsides.rostersync.provider.ProviderRegistry;
import com.bothsides.rostersync.service.SyncAuditService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Operator-triggered full resynchronization, reported under the manual strategy.
 * A failed provider result is reported with the full sync failure message.
 */
@Component
public class ManualSyncProcessor extends FullSyncProcessor {

    @Autowired
    public ManualSyncProcessor(ProviderRegistry providerRegistry, SyncAuditService auditService, Clock clock) {
        super(providerRegistry, auditService, clock);
    }

    @Override
    public SyncStrategy getStrategy() {
        return SyncStrategy.MANUAL;
    }
}
