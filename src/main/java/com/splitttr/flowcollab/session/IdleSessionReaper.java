package com.splitttr.flowcollab.session;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically ends sessions that have had no participants for the idle timeout.
 */
@ApplicationScoped
public class IdleSessionReaper {

    private static final Logger LOG = LoggerFactory.getLogger(IdleSessionReaper.class);

    @Inject
    SessionRegistry registry;

    @Scheduled(every = "{collab.session.sweep-interval}", concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void sweep() {
        int expired = registry.expireIdle();
        if (expired > 0) {
            LOG.info("Idle sweep ended {} session(s)", expired);
        }
    }
}
