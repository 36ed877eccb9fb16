package com.taxdesk.engine.model;

public enum Severity {
    HIGH,
    MEDIUM,
    LOW
}
