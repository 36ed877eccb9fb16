package com.taxdesk.engine.payroll;

import com.taxdesk.engine.model.Money;
import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalDate;

/**
 * Picks the deposit schedule from the run's total taxes and dates the deposit from the pay date.
 */
public class DepositScheduleCalculator {

    private static final BigDecimal NEXT_DAY_THRESHOLD = new BigDecimal("100000");
    private static final BigDecimal SEMI_WEEKLY_THRESHOLD = new BigDecimal("50000");
    private static final BigDecimal FEDERAL_SHARE = new BigDecimal("0.9");
    private static final BigDecimal STATE_SHARE = new BigDecimal("0.1");

    public DepositRequirement depositFor(BigDecimal totalTaxes, LocalDate payDate) {
        DepositSchedule schedule;
        LocalDate depositDate;
        if (totalTaxes.compareTo(NEXT_DAY_THRESHOLD) >= 0) {
            schedule = DepositSchedule.NEXT_BUSINESS_DAY;
            depositDate = payDate.plusDays(1);
        } else if (totalTaxes.compareTo(SEMI_WEEKLY_THRESHOLD) >= 0) {
            schedule = DepositSchedule.SEMI_WEEKLY;
            depositDate = semiWeeklyDate(payDate);
        } else {
            schedule = DepositSchedule.MONTHLY;
            depositDate = payDate.withDayOfMonth(1).plusMonths(1).withDayOfMonth(15);
        }
        return new DepositRequirement(
                Money.round(totalTaxes),
                schedule,
                depositDate,
                Money.round(totalTaxes.multiply(FEDERAL_SHARE)),
                Money.round(totalTaxes.multiply(STATE_SHARE))
        );
    }

    // Wed-Fri paydays deposit the following Wednesday, Sat-Tue paydays the following Friday
    static LocalDate semiWeeklyDate(LocalDate payDate) {
        DayOfWeek day = payDate.getDayOfWeek();
        int offset = day.getValue() - 1;
        if (day == DayOfWeek.WEDNESDAY || day == DayOfWeek.THURSDAY || day == DayOfWeek.FRIDAY) {
            return payDate.plusDays(9 - offset);
        }
        return payDate.plusDays((11 - offset) % 7);
    }
}
