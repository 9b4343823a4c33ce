package com.bbthechange.tripplanner.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process request throttling for the public token endpoints.
 */
@Service
public class RateLimitingService {

    private static final Logger logger = LoggerFactory.getLogger(RateLimitingService.class);

    static final int MAX_SHARE_PASSWORD_FAILURES = 10;
    static final int MAX_INVITE_DETAIL_LOOKUPS = 60;

    // Failed share-link passwords per token + client: 10 per 15 minutes
    private final Cache<String, AtomicInteger> sharePasswordFailureCache;

    // Invitation detail lookups per client: 60 per minute
    private final Cache<String, AtomicInteger> inviteDetailsPerMinuteCache;

    public RateLimitingService() {
        this.sharePasswordFailureCache = Caffeine.newBuilder()
                .expireAfterWrite(Duration.ofMinutes(15))
                .maximumSize(10000)
                .build();

        this.inviteDetailsPerMinuteCache = Caffeine.newBuilder()
                .expireAfterWrite(Duration.ofMinutes(1))
                .maximumSize(10000)
                .build();
    }

    /**
     * Whether another password attempt on a protected share link is allowed.
     * Only failures count towards the limit.
     */
    public boolean isSharePasswordAttemptAllowed(String shareToken, String clientIp) {
        AtomicInteger failures = sharePasswordFailureCache.getIfPresent(sharePasswordKey(shareToken, clientIp));
        if (failures != null && failures.get() >= MAX_SHARE_PASSWORD_FAILURES) {
            logger.info("Rate limit exceeded for share password attempts from {}", clientIp);
            return false;
        }
        return true;
    }

    public void recordSharePasswordFailure(String shareToken, String clientIp) {
        sharePasswordFailureCache.get(sharePasswordKey(shareToken, clientIp), k -> new AtomicInteger(0))
                .incrementAndGet();
    }

    public boolean isInviteDetailsLookupAllowed(String clientIp) {
        String key = "invite_details_" + clientIp;
        AtomicInteger count = inviteDetailsPerMinuteCache.get(key, k -> new AtomicInteger(0));
        if (count.get() >= MAX_INVITE_DETAIL_LOOKUPS) {
            logger.info("Rate limit exceeded for invitation details (60/minute limit): {}", clientIp);
            return false;
        }
        count.incrementAndGet();
        return true;
    }

    private static String sharePasswordKey(String shareToken, String clientIp) {
        return "share_pw_" + shareToken + "_" + clientIp;
    }
}
