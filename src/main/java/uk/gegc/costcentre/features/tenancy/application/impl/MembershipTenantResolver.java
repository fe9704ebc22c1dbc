package uk.gegc.costcentre.features.tenancy.application.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.costcentre.features.tenancy.application.TenantResolver;
import uk.gegc.costcentre.features.tenancy.domain.exception.TenantNotResolvedException;
import uk.gegc.costcentre.features.tenancy.domain.model.TenantMembership;
import uk.gegc.costcentre.features.tenancy.infra.repository.TenantMembershipRepository;

import java.util.UUID;

@Service
@RequiredArgsConstructor
public class MembershipTenantResolver implements TenantResolver {

    private final TenantMembershipRepository membershipRepository;

    @Override
    @Transactional(readOnly = true)
    public UUID tenantFor(UUID userId) {
        if (userId == null) {
            throw new IllegalArgumentException("userId must not be null");
        }
        return membershipRepository.findByUserId(userId)
                .map(TenantMembership::getTenantId)
                .orElseThrow(() -> new TenantNotResolvedException(userId));
    }
}
