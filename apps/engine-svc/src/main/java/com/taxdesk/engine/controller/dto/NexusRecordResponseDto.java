package com.taxdesk.engine.controller.dto;

import com.taxdesk.engine.salestax.NexusAlert;
import com.taxdesk.engine.salestax.NexusRecord;

/**
 * {@code tracked=false} means the state has no sales tax regime, so nothing was stored.
 */
public record NexusRecordResponseDto(boolean tracked, NexusRecord record, NexusAlert alert, String traceId) {
}
