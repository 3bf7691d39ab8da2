package com.abba.agenda.application.service;

import com.abba.agenda.domain.exception.CollaboratorException;
import com.abba.agenda.domain.exception.FailureKind;
import com.abba.agenda.domain.model.Appointment;
import com.abba.agenda.domain.model.BookingType;
import com.abba.agenda.domain.model.PaymentMethod;
import com.abba.agenda.domain.model.User;
import com.abba.agenda.domain.service.SelectablePaymentGateway;
import com.abba.agenda.infrastructure.config.PaymentProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Gateway for a remote payment provider speaking JSON over HTTP. Transport failures and 5xx
 * responses are tagged retryable; 4xx responses are business rejections and never retried.
 */
@Service
@RequiredArgsConstructor
public class HttpPaymentGateway implements SelectablePaymentGateway {

    private static final Logger log = LoggerFactory.getLogger(HttpPaymentGateway.class);
    private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");
    private final PaymentProperties paymentProperties;
    private final ConsultationFeePolicy feePolicy;
    private final ObjectMapper objectMapper;
    private final OkHttpClient httpClient = new OkHttpClient();

    @Override
    public BigDecimal calculateFee(User doctor, BookingType bookingType) {
        return feePolicy.feeFor(doctor, bookingType);
    }

    @Override
    public PaymentInitiation initiatePayment(Appointment appointment, PaymentMethod method) {
        ensureConfigured();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("reference", appointment.getAppointmentId());
        payload.put("amount", appointment.getPayment().getAmount());
        payload.put("currency", appointment.getPayment().getCurrency());
        payload.put("payment_method", method == null ? null : method.name().toLowerCase(Locale.ROOT));
        payload.put("expires_in_minutes", paymentProperties.getPaymentLinkTtlMinutes());

        JsonNode root = execute("POST", "/payments", payload);
        return new PaymentInitiation(
                !"failed".equalsIgnoreCase(root.path("status").asText("")),
                root.path("id").asText(null),
                root.path("payment_url").asText(null),
                parseOffsetDateTime(root.path("expires_at").asText(null))
        );
    }

    @Override
    public PaymentConfirmation confirmPayment(Appointment appointment, String transactionId) {
        ensureConfigured();
        JsonNode root = execute("GET", "/payments/" + transactionId, null);
        return new PaymentConfirmation(
                "paid".equalsIgnoreCase(root.path("status").asText("")),
                root.path("id").asText(transactionId),
                parseOffsetDateTime(root.path("paid_at").asText(null))
        );
    }

    @Override
    public RefundData processRefund(Appointment appointment, BigDecimal amount) {
        ensureConfigured();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("payment_id", appointment.getPayment().getTransactionId());
        payload.put("amount", amount);
        payload.put("currency", appointment.getPayment().getCurrency());
        payload.put("reason", "appointment_cancelled");

        JsonNode root = execute("POST", "/refunds", payload);
        String status = root.path("status").asText("");
        return new RefundData(
                "succeeded".equalsIgnoreCase(status) || "processed".equalsIgnoreCase(status),
                root.path("id").asText(null),
                amount
        );
    }

    @Override
    public String gatewayCode() {
        return "HTTP";
    }

    @Override
    public String key() {
        return "http";
    }

    private JsonNode execute(String method, String path, Map<String, Object> payload) {
        try {
            Request.Builder builder = new Request.Builder()
                    .url(baseUrl() + path)
                    .addHeader("Authorization", "Bearer " + paymentProperties.getApiKey())
                    .addHeader("Content-Type", "application/json");
            if ("POST".equalsIgnoreCase(method)) {
                String body = payload == null ? "{}" : objectMapper.writeValueAsString(payload);
                builder.post(RequestBody.create(body, JSON));
            } else {
                builder.get();
            }
            try (Response response = httpClient.newCall(builder.build()).execute()) {
                String responseBody = response.body() != null ? response.body().string() : "";
                if (!response.isSuccessful()) {
                    log.warn("Payment provider request failed status={} path={} body={}", response.code(), path, responseBody);
                    FailureKind kind = response.code() >= 500 ? FailureKind.UPSTREAM_5XX : FailureKind.BUSINESS_REJECTION;
                    throw new CollaboratorException(kind, "Payment provider request failed with status " + response.code());
                }
                return objectMapper.readTree(responseBody.isBlank() ? "{}" : responseBody);
            }
        } catch (InterruptedIOException e) {
            throw new CollaboratorException(FailureKind.TIMEOUT, "Payment provider timed out on " + path, e);
        } catch (IOException e) {
            throw new CollaboratorException(FailureKind.NETWORK, "Payment provider unreachable on " + path, e);
        }
    }

    private void ensureConfigured() {
        if (paymentProperties.getApiBaseUrl() == null || paymentProperties.getApiBaseUrl().isBlank()) {
            throw new IllegalStateException("Payment provider base URL is not configured");
        }
    }

    private String baseUrl() {
        String baseUrl = paymentProperties.getApiBaseUrl();
        return baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    private OffsetDateTime parseOffsetDateTime(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value);
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable timestamp value={}", value);
            return null;
        }
    }
}
