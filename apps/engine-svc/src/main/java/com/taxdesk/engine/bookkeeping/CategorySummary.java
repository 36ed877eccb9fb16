package com.taxdesk.engine.bookkeeping;

import java.math.BigDecimal;

public record CategorySummary(String category, int count, BigDecimal total) {
}
