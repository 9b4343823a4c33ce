package com.bbthechange.tripplanner.util;

import com.bbthechange.tripplanner.exception.VersionConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Re-runs a read-modify-write of a trip when its versioned write loses a race.
 * Each attempt must re-read the trip so validation runs against the current state.
 */
public final class OptimisticRetry {

    private static final Logger logger = LoggerFactory.getLogger(OptimisticRetry.class);
    public static final int MAX_RETRIES = 5;

    private OptimisticRetry() {
    }

    public static <T> T run(String operation, Supplier<T> attempt) {
        for (int i = 1; i <= MAX_RETRIES; i++) {
            try {
                return attempt.get();
            } catch (VersionConflictException e) {
                if (i < MAX_RETRIES) {
                    logger.debug("Retrying {} due to version conflict (attempt {}/{})", operation, i, MAX_RETRIES);
                    continue;
                }
                logger.warn("Max retries exceeded for {} after {} attempts", operation, MAX_RETRIES);
                throw new VersionConflictException(
                    "Failed to " + operation + " after " + MAX_RETRIES + " attempts due to concurrent modifications", e);
            }
        }
        throw new IllegalStateException("Unreachable retry state for " + operation);
    }
}
