package uk.gegc.costcentre.features.billing.api.dto;

import uk.gegc.costcentre.features.billing.domain.model.PaymentMethod;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

public record PaymentDto(
        UUID id,
        BigDecimal amountPaid,
        String currency,
        LocalDateTime paymentDate,
        PaymentMethod paymentMethod,
        String providerPaymentIntent
) {}
