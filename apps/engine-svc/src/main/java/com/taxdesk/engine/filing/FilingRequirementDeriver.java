package com.taxdesk.engine.filing;

import com.taxdesk.engine.error.CalculationException;
import com.taxdesk.engine.model.Money;
import com.taxdesk.engine.model.Periods;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Optional;
import org.springframework.stereotype.Component;

@Component
public class FilingRequirementDeriver {

    private static final int DUE_DAY = 20;

    public Optional<FilingRequirement> deriveFiling(BigDecimal taxDue, String period, FilingThresholds thresholds) {
        if (taxDue == null) {
            throw CalculationException.invalidInput("tax due must be provided");
        }
        YearMonth month = Periods.parseMonth(period);
        if (taxDue.signum() <= 0) {
            return Optional.empty();
        }
        FilingFrequency frequency;
        LocalDate dueDate;
        if (taxDue.compareTo(thresholds.monthly()) > 0) {
            frequency = FilingFrequency.MONTHLY;
            dueDate = month.plusMonths(1).atDay(DUE_DAY);
        } else if (taxDue.compareTo(thresholds.quarterly()) > 0) {
            frequency = FilingFrequency.QUARTERLY;
            dueDate = quarterEnd(month).plusMonths(1).atDay(DUE_DAY);
        } else {
            frequency = FilingFrequency.ANNUAL;
            dueDate = LocalDate.of(month.getYear() + 1, 1, 31);
        }
        return Optional.of(new FilingRequirement(month.toString(), frequency, dueDate, Money.round(taxDue)));
    }

    // first quarter-end month (3, 6, 9, 12) on or after the period month
    static YearMonth quarterEnd(YearMonth month) {
        int endMonth = ((month.getMonthValue() + 2) / 3) * 3;
        return YearMonth.of(month.getYear(), endMonth);
    }
}
