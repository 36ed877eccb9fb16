package com.taxdesk.engine.controller.dto;

import java.util.Map;

public record ErrorResponseDto(String errorKind, String message, Map<String, Object> details, String traceId) {
}
