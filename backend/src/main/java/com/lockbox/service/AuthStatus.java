package com.lockbox.service;

import java.time.Instant;

public record AuthStatus(
        boolean vaultExists,
        boolean authenticated,
        boolean lockedOut,
        Instant lockedUntil     // null unless locked out
) {}
