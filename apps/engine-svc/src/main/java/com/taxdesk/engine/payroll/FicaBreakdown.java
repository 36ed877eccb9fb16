package com.taxdesk.engine.payroll;

import java.math.BigDecimal;

public record FicaBreakdown(BigDecimal socialSecurity, BigDecimal medicare, BigDecimal additionalMedicare) {

    public BigDecimal total() {
        return socialSecurity.add(medicare).add(additionalMedicare);
    }
}
