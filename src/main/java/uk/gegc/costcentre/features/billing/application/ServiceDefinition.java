package uk.gegc.costcentre.features.billing.application;

import uk.gegc.costcentre.features.billing.domain.model.MeteredItem;
import uk.gegc.costcentre.features.billing.domain.model.ServiceType;

public record ServiceDefinition(String code, String name, boolean payable, MeteredItem meteredItem) {

    public ServiceType serviceType() {
        return payable ? ServiceType.PAYABLE : ServiceType.NON_PAYABLE;
    }
}
