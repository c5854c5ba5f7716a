package com.myfinancehub.ledger.controller.dto;

import jakarta.validation.constraints.Size;

public record EmailUpdateRequestDto(@Size(max = 255) String email) {
}
