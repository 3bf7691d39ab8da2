package com.abba.agenda.domain.service;

import com.abba.agenda.domain.model.Appointment;
import com.abba.agenda.domain.model.BookingType;
import com.abba.agenda.domain.model.PaymentMethod;
import com.abba.agenda.domain.model.User;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

public interface PaymentGateway {

    default String gatewayCode() {
        return "UNKNOWN";
    }

    BigDecimal calculateFee(User doctor, BookingType bookingType);

    PaymentInitiation initiatePayment(Appointment appointment, PaymentMethod method);

    PaymentConfirmation confirmPayment(Appointment appointment, String transactionId);

    RefundData processRefund(Appointment appointment, BigDecimal amount);

    record PaymentInitiation(
            boolean success,
            String transactionId,
            String paymentUrl,
            OffsetDateTime expiresAt
    ) {
    }

    record PaymentConfirmation(
            boolean paid,
            String transactionId,
            OffsetDateTime paidAt
    ) {
    }

    record RefundData(
            boolean success,
            String refundId,
            BigDecimal amount
    ) {
    }
}
