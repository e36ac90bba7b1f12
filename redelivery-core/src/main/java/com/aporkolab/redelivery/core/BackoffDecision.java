package com.aporkolab.redelivery.core;

import java.time.Duration;

/**
 * Result of {@link BackoffPolicy#nextDelay(int)}.
 *
 * @param delay     how long to wait before the next attempt
 * @param exhausted true when no further attempt is allowed
 */
public record BackoffDecision(Duration delay, boolean exhausted) {
}
