package com.landingzone.orchestrator.engine;

import com.landingzone.orchestrator.pipeline.SenseCondition;
import com.landingzone.orchestrator.storage.ObjectStore;
import com.landingzone.orchestrator.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Poke-style sensor: checks for an object prefix at a fixed interval until
 * it shows up or the timeout elapses.
 *
 * The wait before each re-check is capped at the time left, and so is each
 * check itself, so a run that never sees the object ends exactly at the
 * deadline. A failing check (network error, 5xx, check timeout) counts as
 * "not there yet" and only uses up budget.
 */
@Component
public class ConditionPoller {

    private static final Logger log = LoggerFactory.getLogger(ConditionPoller.class);

    private final ObjectStore store;
    private final Clock       clock;
    private final Sleeper     sleeper;

    public ConditionPoller(ObjectStore store, Clock clock, Sleeper sleeper) {
        this.store   = store;
        this.clock   = clock;
        this.sleeper = sleeper;
    }

    public ExecutionResult await(SenseCondition condition) {
        Instant deadline = clock.instant().plus(condition.timeout());
        int checks = 0;

        log.info("Waiting for {} (every {}, timeout {})",
                condition.describe(), condition.pollInterval(), condition.timeout());

        while (true) {
            Instant now = clock.instant();
            if (!now.isBefore(deadline)) {
                return timedOut(condition, checks);
            }

            checks++;
            if (isSatisfied(condition, Duration.between(now, deadline))) {
                log.info("Found {} after {} check(s)", condition.describe(), checks);
                return ExecutionResult.ok("Found " + condition.describe() + " after " + checks + " check(s)");
            }

            // The check itself may have used up the rest of the budget.
            now = clock.instant();
            if (!now.isBefore(deadline)) {
                return timedOut(condition, checks);
            }

            Duration remaining = Duration.between(now, deadline);
            Duration wait = remaining.compareTo(condition.pollInterval()) < 0
                    ? remaining
                    : condition.pollInterval();
            try {
                sleeper.sleep(wait);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return ExecutionResult.failed(ErrorKind.SENSE_FAILED,
                        "Interrupted while waiting for " + condition.describe());
            }
        }
    }

    private static ExecutionResult timedOut(SenseCondition condition, int checks) {
        log.warn("Gave up on {} after {} check(s)", condition.describe(), checks);
        return ExecutionResult.timedOut("No object under " + condition.describe()
                + " within " + condition.timeout() + " (" + checks + " checks)");
    }

    private boolean isSatisfied(SenseCondition condition, Duration budget) {
        try {
            return store.exists(condition.bucket(), condition.prefix(), budget);
        } catch (StorageException e) {
            log.warn("Existence check for {} failed, treating as not yet present: {}",
                    condition.describe(), e.getMessage());
            return false;
        }
    }
}
