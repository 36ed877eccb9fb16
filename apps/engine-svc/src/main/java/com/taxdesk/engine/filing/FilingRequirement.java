package com.taxdesk.engine.filing;

import java.math.BigDecimal;
import java.time.LocalDate;

public record FilingRequirement(String period, FilingFrequency frequency, LocalDate dueDate, BigDecimal taxDue) {
}
