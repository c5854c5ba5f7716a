package com.myfinancehub.ledger.model;

import java.math.BigDecimal;

public record CategoryTotal(String category, BigDecimal total) {
}
