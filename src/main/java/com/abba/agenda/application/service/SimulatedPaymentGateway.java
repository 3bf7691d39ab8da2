package com.abba.agenda.application.service;

import com.abba.agenda.domain.model.Appointment;
import com.abba.agenda.domain.model.BookingType;
import com.abba.agenda.domain.model.PaymentMethod;
import com.abba.agenda.domain.model.User;
import com.abba.agenda.domain.service.SelectablePaymentGateway;
import com.abba.agenda.infrastructure.config.PaymentProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Locale;
import java.util.UUID;

/**
 * Gateway that approves everything locally. Used in development and as the default.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SimulatedPaymentGateway implements SelectablePaymentGateway {

    private final ConsultationFeePolicy feePolicy;
    private final PaymentProperties paymentProperties;
    private final Clock clock;

    @Override
    public BigDecimal calculateFee(User doctor, BookingType bookingType) {
        return feePolicy.feeFor(doctor, bookingType);
    }

    @Override
    public PaymentInitiation initiatePayment(Appointment appointment, PaymentMethod method) {
        String transactionId = "TXN-" + shortId();
        OffsetDateTime expiresAt = OffsetDateTime.now(clock).plusMinutes(paymentProperties.getPaymentLinkTtlMinutes());
        log.info("Simulated payment initiated appointmentId={} transactionId={} amount={} method={}",
                appointment.getAppointmentId(), transactionId, appointment.getPayment().getAmount(), method);
        return new PaymentInitiation(true, transactionId,
                paymentProperties.getCheckoutBaseUrl() + "/" + transactionId, expiresAt);
    }

    @Override
    public PaymentConfirmation confirmPayment(Appointment appointment, String transactionId) {
        return new PaymentConfirmation(true, transactionId, OffsetDateTime.now(clock));
    }

    @Override
    public RefundData processRefund(Appointment appointment, BigDecimal amount) {
        String refundId = "REF-" + shortId();
        log.info("Simulated refund appointmentId={} refundId={} amount={}", appointment.getAppointmentId(), refundId, amount);
        return new RefundData(true, refundId, amount);
    }

    @Override
    public String gatewayCode() {
        return "SIMULATED";
    }

    @Override
    public String key() {
        return "simulated";
    }

    private String shortId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 12).toUpperCase(Locale.ROOT);
    }
}
