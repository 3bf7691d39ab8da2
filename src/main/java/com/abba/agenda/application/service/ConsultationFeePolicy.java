package com.abba.agenda.application.service;

import com.abba.agenda.domain.model.BookingType;
import com.abba.agenda.domain.model.User;
import com.abba.agenda.infrastructure.config.PaymentProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Locale;

@Component
@RequiredArgsConstructor
public class ConsultationFeePolicy {

    private final PaymentProperties paymentProperties;

    public BigDecimal feeFor(User doctor, BookingType bookingType) {
        BigDecimal fee = paymentProperties.getBaseFee();
        int experience = doctor == null ? 0 : doctor.yearsOfExperience();
        if (experience > paymentProperties.getSeniorYears()) {
            fee = fee.add(paymentProperties.getSeniorSurcharge());
        } else if (experience > paymentProperties.getMidLevelYears()) {
            fee = fee.add(paymentProperties.getMidLevelSurcharge());
        }
        if (isPremium(doctor == null ? null : doctor.specialization())) {
            fee = fee.add(paymentProperties.getPremiumSpecializationSurcharge());
        }
        if (bookingType == BookingType.WALK_IN) {
            fee = fee.add(paymentProperties.getWalkInSurcharge());
        }
        return fee;
    }

    private boolean isPremium(String specialization) {
        if (specialization == null || specialization.isBlank()) {
            return false;
        }
        String normalized = specialization.trim().toLowerCase(Locale.ROOT);
        return paymentProperties.getPremiumSpecializations().stream()
                .anyMatch(premium -> premium.equalsIgnoreCase(normalized));
    }
}
