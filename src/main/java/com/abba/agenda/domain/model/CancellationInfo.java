package com.abba.agenda.domain.model;

import lombok.Data;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

@Data
public class CancellationInfo {

    private String cancelledBy;
    private String reason;
    private OffsetDateTime cancelledAt;
    private BigDecimal refundAmount;
    private RefundStatus refundStatus = RefundStatus.NONE;
}
