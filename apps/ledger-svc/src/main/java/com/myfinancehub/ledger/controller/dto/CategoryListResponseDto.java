package com.myfinancehub.ledger.controller.dto;

import java.util.List;

/**
 * When {@code restricted} is false the list is a suggestion only.
 */
public record CategoryListResponseDto(boolean restricted, List<String> categories) {
}
