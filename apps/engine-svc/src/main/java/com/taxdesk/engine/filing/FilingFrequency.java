package com.taxdesk.engine.filing;

public enum FilingFrequency {
    MONTHLY,
    QUARTERLY,
    ANNUAL
}
