package com.abba.agenda.application.service;

import com.abba.agenda.domain.model.Appointment;
import com.abba.agenda.domain.model.PaymentMethod;
import com.abba.agenda.domain.service.PaymentGateway;
import com.abba.agenda.infrastructure.config.PaymentProperties;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static com.abba.agenda.support.TestFixtures.CLOCK;
import static org.junit.jupiter.api.Assertions.*;

class SimulatedPaymentGatewayTest {

    private final PaymentProperties properties = new PaymentProperties();
    private final SimulatedPaymentGateway gateway =
            new SimulatedPaymentGateway(new ConsultationFeePolicy(properties), properties, CLOCK);

    @Test
    void issuesCheckoutLinkPerTransaction() {
        Appointment appointment = new Appointment();
        appointment.setAppointmentId("APT-1");

        PaymentGateway.PaymentInitiation initiation = gateway.initiatePayment(appointment, PaymentMethod.CARD);

        assertTrue(initiation.success());
        assertTrue(initiation.transactionId().matches("TXN-[0-9A-F]{12}"));
        assertEquals("https://payments.example.com/pay/" + initiation.transactionId(), initiation.paymentUrl());
        assertNotNull(initiation.expiresAt());
    }

    @Test
    void confirmsAndRefundsEverything() {
        Appointment appointment = new Appointment();

        assertTrue(gateway.confirmPayment(appointment, "TXN-ABC").paid());
        PaymentGateway.RefundData refund = gateway.processRefund(appointment, new BigDecimal("40"));
        assertTrue(refund.success());
        assertTrue(refund.refundId().startsWith("REF-"));
        assertEquals(0, new BigDecimal("40").compareTo(refund.amount()));
    }
}
