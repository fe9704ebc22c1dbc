package uk.gegc.costcentre.features.billing.application;

import org.springframework.stereotype.Component;
import uk.gegc.costcentre.features.billing.domain.exception.UnknownServiceException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable view of the configured services, built once at startup.
 */
@Component
public class ServiceRegistry {

    private final Map<String, ServiceDefinition> services;

    public ServiceRegistry(BillingProperties properties) {
        Map<String, ServiceDefinition> byCode = new LinkedHashMap<>();
        properties.getServices().forEach((code, service) -> {
            if (code.length() > IdempotencyKeys.MAX_PREFIX_LENGTH) {
                throw new IllegalStateException("Service code '" + code + "' exceeds "
                        + IdempotencyKeys.MAX_PREFIX_LENGTH + " characters");
            }
            byCode.put(code, new ServiceDefinition(
                    code,
                    service.getName(),
                    service.isPayable(),
                    service.getMeteredItem()
            ));
        });
        this.services = Collections.unmodifiableMap(byCode);
    }

    public ServiceDefinition require(String serviceCode) {
        ServiceDefinition definition = serviceCode == null ? null : services.get(serviceCode);
        if (definition == null) {
            throw new UnknownServiceException(serviceCode);
        }
        return definition;
    }

    public Collection<ServiceDefinition> all() {
        return services.values();
    }
}
