package uk.gegc.costcentre.features.billing.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.costcentre.features.billing.api.dto.BudgetDto;
import uk.gegc.costcentre.features.billing.api.dto.UpdateBudgetRequest;
import uk.gegc.costcentre.features.billing.application.BudgetService;
import uk.gegc.costcentre.features.billing.domain.exception.BillingValidationException;
import uk.gegc.costcentre.features.billing.domain.model.Budget;
import uk.gegc.costcentre.features.billing.infra.mapping.BudgetMapper;
import uk.gegc.costcentre.features.billing.infra.repository.BudgetRepository;
import uk.gegc.costcentre.features.tenancy.application.TenantResolver;

import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class BudgetServiceImpl implements BudgetService {

    private final TenantResolver tenantResolver;
    private final BudgetRepository budgetRepository;
    private final BudgetMapper budgetMapper;

    @Override
    @Transactional
    public BudgetDto getOrCreate(UUID userId) {
        return budgetMapper.toDto(load(userId));
    }

    @Override
    @Transactional
    public BudgetDto update(UUID userId, UpdateBudgetRequest request) {
        Budget budget = load(userId);
        if (request.tokenLimit() != null) {
            if (request.tokenLimit() < 0) {
                throw new BillingValidationException("tokenLimit must be >= 0");
            }
            budget.setTokenLimit(request.tokenLimit());
        }
        if (request.financialLimit() != null) {
            if (request.financialLimit().signum() < 0) {
                throw new BillingValidationException("financialLimit must be >= 0");
            }
            budget.setFinancialLimit(request.financialLimit());
        }
        Budget saved = budgetRepository.saveAndFlush(budget);
        log.info("Budget of user {} updated: tokenLimit={} financialLimit={}",
                userId, saved.getTokenLimit(), saved.getFinancialLimit());
        return budgetMapper.toDto(saved);
    }

    private Budget load(UUID userId) {
        UUID tenantId = tenantResolver.tenantFor(userId);
        return budgetRepository.findByUserIdAndTenantId(userId, tenantId)
                .orElseGet(() -> {
                    Budget budget = new Budget();
                    budget.setUserId(userId);
                    budget.setTenantId(tenantId);
                    return budgetRepository.saveAndFlush(budget);
                });
    }
}
