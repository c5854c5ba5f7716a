package com.myfinancehub.ledger.model;

import java.time.Instant;

public record UserProfile(String username, String email, Instant createdAt) {
}
