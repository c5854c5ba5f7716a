package com.myfinancehub.ledger.controller.dto;

import java.time.Instant;
import java.util.List;

public record ProfileResponseDto(String username, String email, Instant createdAt, List<Instant> recentLogins) {
}
