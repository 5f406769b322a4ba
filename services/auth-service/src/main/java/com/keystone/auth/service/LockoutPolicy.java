package com.keystone.auth.service;

import com.keystone.auth.config.AuthProperties;
import com.keystone.auth.domain.User;
import com.keystone.auth.exception.AuthException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Account lock check shared by login, password reset and token refresh.
 */
@Component
@RequiredArgsConstructor
public class LockoutPolicy {

    private final AuthProperties properties;

    /**
     * @throws AuthException AccountLocked while {@code now} is not past the lock expiry
     */
    public void assertNotLocked(User user, Instant now) {
        if (user.isLockActive(now)) {
            Duration remaining = Duration.between(now, user.getLockDuration());
            throw AuthException.accountLocked(
                    "Account is locked. Please try again after " + describe(remaining) + ".");
        }
    }

    public Duration lockDuration() {
        return Duration.ofHours(properties.getLockout().getLockDurationHours());
    }

    public String lockNotice() {
        long hours = properties.getLockout().getLockDurationHours();
        return "Account locked due to too many failed login attempts. Please try again in "
                + plural(hours, "hour") + ".";
    }

    /**
     * Rounds up to whole minutes, e.g. "1 hour 5 minutes".
     */
    static String describe(Duration remaining) {
        long minutes = Math.max(1, (remaining.getSeconds() + 59) / 60);
        long hours = minutes / 60;
        long rest = minutes % 60;
        if (hours == 0) {
            return plural(rest, "minute");
        }
        return rest == 0 ? plural(hours, "hour") : plural(hours, "hour") + " " + plural(rest, "minute");
    }

    static String plural(long count, String unit) {
        return count + " " + (count == 1 ? unit : unit + "s");
    }
}
