package com.taxdesk.engine.error;

public enum ErrorKind {
    INVALID_INPUT,
    UNSUPPORTED_ENTITY_TYPE,
    UNSUPPORTED_JURISDICTION,
    CONFIGURATION_ERROR
}
