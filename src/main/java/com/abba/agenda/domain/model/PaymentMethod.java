package com.abba.agenda.domain.model;

public enum PaymentMethod {
    CARD,
    BANK_TRANSFER,
    CASH,
    INSURANCE
}
