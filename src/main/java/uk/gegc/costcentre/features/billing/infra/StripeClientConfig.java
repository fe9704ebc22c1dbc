package uk.gegc.costcentre.features.billing.infra;

import com.stripe.Stripe;
import com.stripe.StripeClient;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import uk.gegc.costcentre.features.billing.application.StripeProperties;

/**
 * Initializes the global Stripe API key and exposes a typed client when a secret key is configured.
 * Without a key, usage reporting and status sync are disabled.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class StripeClientConfig {

    private final StripeProperties stripe;

    @PostConstruct
    void init() {
        if (StringUtils.hasText(stripe.getSecretKey())) {
            Stripe.apiKey = stripe.getSecretKey();
        } else {
            log.info("stripe.secret-key not set, usage will be recorded locally only");
        }
    }

    @Bean
    @ConditionalOnProperty(name = "stripe.secret-key")
    public StripeClient stripeClient() {
        return new StripeClient(stripe.getSecretKey());
    }
}
