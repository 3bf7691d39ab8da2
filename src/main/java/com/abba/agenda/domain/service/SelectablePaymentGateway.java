package com.abba.agenda.domain.service;

public interface SelectablePaymentGateway extends PaymentGateway {

    String key();
}
