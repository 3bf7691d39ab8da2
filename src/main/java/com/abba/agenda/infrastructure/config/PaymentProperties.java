package com.abba.agenda.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "agenda.payment")
@Data
public class PaymentProperties {

    private String gateway = "simulated";
    private String currency = "USD";
    private String apiBaseUrl;
    private String apiKey;
    private String checkoutBaseUrl = "https://payments.example.com/pay";
    private int paymentLinkTtlMinutes = 15;

    private BigDecimal baseFee = new BigDecimal("100");
    private BigDecimal seniorSurcharge = new BigDecimal("50");
    private int seniorYears = 10;
    private BigDecimal midLevelSurcharge = new BigDecimal("25");
    private int midLevelYears = 5;
    private BigDecimal premiumSpecializationSurcharge = new BigDecimal("30");
    private List<String> premiumSpecializations = new ArrayList<>(List.of("cardiology", "neurology", "oncology"));
    private BigDecimal walkInSurcharge = new BigDecimal("20");
}
