package com.abba.agenda.application.service;

import com.abba.agenda.domain.model.Appointment;
import com.abba.agenda.domain.model.BookingType;
import com.abba.agenda.domain.model.PaymentMethod;
import com.abba.agenda.domain.model.User;
import com.abba.agenda.domain.service.PaymentGateway;
import com.abba.agenda.domain.service.SelectablePaymentGateway;
import com.abba.agenda.infrastructure.config.PaymentProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Delegates to the gateway named by {@code agenda.payment.gateway}. The name is resolved once, so an
 * unknown gateway fails the application context instead of the first booking.
 */
@Service
@Primary
@Slf4j
public class RoutingPaymentGateway implements PaymentGateway {

    private final SelectablePaymentGateway selected;

    public RoutingPaymentGateway(List<SelectablePaymentGateway> gateways, PaymentProperties paymentProperties) {
        Map<String, SelectablePaymentGateway> gatewaysByKey = gateways.stream()
                .collect(Collectors.toMap(gateway -> normalize(gateway.key()), Function.identity()));
        this.selected = gatewaysByKey.get(normalize(paymentProperties.getGateway()));
        if (selected == null) {
            throw new IllegalStateException("Unsupported payment gateway '" + paymentProperties.getGateway()
                    + "'. Available: " + String.join(", ", new TreeSet<>(gatewaysByKey.keySet())));
        }
        log.info("Payment gateway selected key={} code={}", selected.key(), selected.gatewayCode());
    }

    @Override
    public String gatewayCode() {
        return selected.gatewayCode();
    }

    @Override
    public BigDecimal calculateFee(User doctor, BookingType bookingType) {
        return selected.calculateFee(doctor, bookingType);
    }

    @Override
    public PaymentInitiation initiatePayment(Appointment appointment, PaymentMethod method) {
        return selected.initiatePayment(appointment, method);
    }

    @Override
    public PaymentConfirmation confirmPayment(Appointment appointment, String transactionId) {
        return selected.confirmPayment(appointment, transactionId);
    }

    @Override
    public RefundData processRefund(Appointment appointment, BigDecimal amount) {
        return selected.processRefund(appointment, amount);
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
