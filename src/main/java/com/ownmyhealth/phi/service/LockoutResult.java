package com.ownmyhealth.phi.service;

import java.time.Instant;

public record LockoutResult(boolean locked, int remainingAttempts, Instant lockedUntil) {
}
