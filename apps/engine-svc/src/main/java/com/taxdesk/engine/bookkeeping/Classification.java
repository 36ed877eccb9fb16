package com.taxdesk.engine.bookkeeping;

import java.math.BigDecimal;

public record Classification(String category, String subcategory, BigDecimal confidence) {
}
