package uk.gegc.costcentre.features.billing.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.costcentre.features.billing.api.dto.OverageDto;
import uk.gegc.costcentre.features.billing.api.dto.PriceQuote;
import uk.gegc.costcentre.features.billing.domain.exception.BillingValidationException;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Overage and seat pricing. Stateless: every result depends only on its arguments and configuration.
 *
 * <p>Amounts are rounded to cents with {@link RoundingMode#HALF_EVEN}.
 */
@Component
@RequiredArgsConstructor
public class OverageCalculator {

    private static final int SCALE = 2;
    private static final RoundingMode ROUNDING = RoundingMode.HALF_EVEN;

    private static final BigDecimal VOLUME_TIER_200 = new BigDecimal("0.25");
    private static final BigDecimal VOLUME_TIER_51 = new BigDecimal("0.20");
    private static final BigDecimal VOLUME_TIER_11 = new BigDecimal("0.10");
    private static final BigDecimal ANNUAL_PREPAY = new BigDecimal("0.15");

    private final BillingProperties properties;
    private final PlanCatalog planCatalog;

    /**
     * Zero for plans whose tokens are disabled or unlimited.
     */
    public BigDecimal tokensOverage(PlanEntitlement plan, long usedTokens) {
        if (plan.tokensDisabled() || plan.tokensUnlimited()) {
            return zero();
        }
        long over = Math.max(0L, usedTokens - plan.tokensIncluded());
        BigDecimal millions = BigDecimal.valueOf(over).movePointLeft(6);
        return money(millions.multiply(properties.getOverage().getTokensPerMillion()));
    }

    public BigDecimal pagesOverage(PlanEntitlement plan, long usedPages) {
        long over = Math.max(0L, usedPages - plan.pagesIncluded());
        BigDecimal thousands = BigDecimal.valueOf(over).movePointLeft(3);
        return money(thousands.multiply(properties.getOverage().getPagesPerThousand()));
    }

    public BigDecimal storageOverage(PlanEntitlement plan, BigDecimal usedGb) {
        BigDecimal over = usedGb.subtract(BigDecimal.valueOf(plan.storageGbIncluded()));
        if (over.signum() <= 0) {
            return zero();
        }
        return money(over.multiply(properties.getOverage().getStoragePerGbMonth()));
    }

    public OverageDto overage(PlanEntitlement plan, long usedTokens, long usedPages, BigDecimal usedStorageGb) {
        BigDecimal tokens = tokensOverage(plan, usedTokens);
        BigDecimal pages = pagesOverage(plan, usedPages);
        BigDecimal storage = storageOverage(plan, usedStorageGb);
        return new OverageDto(tokens, pages, storage, tokens.add(pages).add(storage), properties.getCurrency());
    }

    public static BigDecimal volumeDiscount(int seatCount) {
        if (seatCount >= 200) {
            return VOLUME_TIER_200;
        }
        if (seatCount >= 51) {
            return VOLUME_TIER_51;
        }
        if (seatCount >= 11) {
            return VOLUME_TIER_11;
        }
        return BigDecimal.ZERO;
    }

    public static BigDecimal termDiscount(boolean annualPrepay) {
        return annualPrepay ? ANNUAL_PREPAY : BigDecimal.ZERO;
    }

    /**
     * List price after volume and term discounts, applied multiplicatively.
     */
    public BigDecimal seatPrice(PlanEntitlement plan, int seatCount, boolean annualPrepay) {
        requireSeats(seatCount);
        BigDecimal price = plan.pricePerSeat()
                .multiply(BigDecimal.ONE.subtract(volumeDiscount(seatCount)))
                .multiply(BigDecimal.ONE.subtract(termDiscount(annualPrepay)));
        return money(price);
    }

    public BigDecimal monthlyAmount(PlanEntitlement plan, int seatCount, boolean annualPrepay) {
        return seatPrice(plan, seatCount, annualPrepay).multiply(BigDecimal.valueOf(seatCount));
    }

    public PriceQuote quote(String planCode, int seatCount, boolean annualPrepay) {
        PlanEntitlement plan = planCatalog.require(planCode);
        BigDecimal seatPrice = seatPrice(plan, seatCount, annualPrepay);
        return new PriceQuote(
                plan.code(),
                plan.name(),
                seatCount,
                seatPrice,
                seatPrice.multiply(BigDecimal.valueOf(seatCount)),
                percent(volumeDiscount(seatCount)),
                percent(termDiscount(annualPrepay)),
                properties.getCurrency()
        );
    }

    private static void requireSeats(int seatCount) {
        if (seatCount < 1) {
            throw new BillingValidationException("seatCount must be at least 1");
        }
    }

    private static int percent(BigDecimal fraction) {
        return fraction.movePointRight(2).intValue();
    }

    private static BigDecimal money(BigDecimal amount) {
        return amount.setScale(SCALE, ROUNDING);
    }

    private static BigDecimal zero() {
        return BigDecimal.ZERO.setScale(SCALE);
    }
}
