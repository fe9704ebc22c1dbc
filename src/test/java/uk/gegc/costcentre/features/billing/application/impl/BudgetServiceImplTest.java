package uk.gegc.costcentre.features.billing.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import uk.gegc.costcentre.features.billing.api.dto.UpdateBudgetRequest;
import uk.gegc.costcentre.features.billing.domain.exception.BillingValidationException;
import uk.gegc.costcentre.features.billing.domain.model.Budget;
import uk.gegc.costcentre.features.billing.infra.mapping.BudgetMapper;
import uk.gegc.costcentre.features.billing.infra.repository.BudgetRepository;
import uk.gegc.costcentre.features.tenancy.application.TenantResolver;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class BudgetServiceImplTest {

    @Mock
    private TenantResolver tenantResolver;
    @Mock
    private BudgetRepository budgetRepository;
    @Mock
    private BudgetMapper budgetMapper;

    private BudgetServiceImpl service;

    private final UUID userId = UUID.randomUUID();
    private final UUID tenantId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        service = new BudgetServiceImpl(tenantResolver, budgetRepository, budgetMapper);
        when(tenantResolver.tenantFor(userId)).thenReturn(tenantId);
        when(budgetRepository.saveAndFlush(any(Budget.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    @DisplayName("first read creates an unlimited budget")
    void createsOnFirstRead() {
        when(budgetRepository.findByUserIdAndTenantId(userId, tenantId)).thenReturn(Optional.empty());

        service.getOrCreate(userId);

        ArgumentCaptor<Budget> captor = ArgumentCaptor.forClass(Budget.class);
        verify(budgetRepository).saveAndFlush(captor.capture());
        assertThat(captor.getValue().getTokenLimit()).isZero();
        assertThat(captor.getValue().getFinancialLimit()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(captor.getValue().getTenantId()).isEqualTo(tenantId);
    }

    @Test
    @DisplayName("patch keeps fields that are absent")
    void partialPatch() {
        Budget budget = new Budget();
        budget.setTokenLimit(10_000);
        budget.setFinancialLimit(new BigDecimal("25.00"));
        when(budgetRepository.findByUserIdAndTenantId(userId, tenantId)).thenReturn(Optional.of(budget));

        service.update(userId, new UpdateBudgetRequest(50_000L, null));

        assertThat(budget.getTokenLimit()).isEqualTo(50_000);
        assertThat(budget.getFinancialLimit()).isEqualByComparingTo("25.00");
    }

    @Test
    @DisplayName("negative limits are rejected")
    void negativeLimits() {
        Budget budget = new Budget();
        when(budgetRepository.findByUserIdAndTenantId(userId, tenantId)).thenReturn(Optional.of(budget));

        assertThatThrownBy(() -> service.update(userId, new UpdateBudgetRequest(-1L, null)))
                .isInstanceOf(BillingValidationException.class);
        assertThatThrownBy(() -> service.update(userId, new UpdateBudgetRequest(null, new BigDecimal("-0.01"))))
                .isInstanceOf(BillingValidationException.class);
        verify(budgetRepository, never()).saveAndFlush(budget);
    }
}
