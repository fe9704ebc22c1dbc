package uk.gegc.costcentre.features.billing.application.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.costcentre.features.billing.application.BillingMetricsService;
import uk.gegc.costcentre.features.billing.application.BillingStructuredLogger;
import uk.gegc.costcentre.features.billing.application.IdempotencyKeys;
import uk.gegc.costcentre.features.billing.application.IdempotencyLockRegistry;
import uk.gegc.costcentre.features.billing.application.RecordedUsage;
import uk.gegc.costcentre.features.billing.application.ServiceDefinition;
import uk.gegc.costcentre.features.billing.application.ServiceRegistry;
import uk.gegc.costcentre.features.billing.application.UsageRecorder;
import uk.gegc.costcentre.features.billing.domain.exception.BillingValidationException;
import uk.gegc.costcentre.features.billing.domain.model.UsageEvent;
import uk.gegc.costcentre.features.billing.domain.model.UsageRecord;
import uk.gegc.costcentre.features.billing.infra.repository.UsageEventRepository;
import uk.gegc.costcentre.features.billing.infra.repository.UsageRecordRepository;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Idempotent ledger writer.
 *
 * <p>Each call commits in its own transaction before the per-key lock is released, so a caller
 * that waited on the lock always finds the winner's committed event.
 */
@Slf4j
@Service
public class UsageRecorderImpl implements UsageRecorder {

    private static final Logger ledgerLog = LoggerFactory.getLogger("billing.ledger");

    static final String METADATA_KEY_FIELD = "idempotency_key";

    private final UsageEventRepository usageEventRepository;
    private final UsageRecordRepository usageRecordRepository;
    private final ServiceRegistry serviceRegistry;
    private final IdempotencyLockRegistry lockRegistry;
    private final BillingMetricsService metricsService;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final TransactionTemplate writeTemplate;
    private final TransactionTemplate rereadTemplate;

    public UsageRecorderImpl(UsageEventRepository usageEventRepository,
                             UsageRecordRepository usageRecordRepository,
                             ServiceRegistry serviceRegistry,
                             IdempotencyLockRegistry lockRegistry,
                             BillingMetricsService metricsService,
                             ObjectMapper objectMapper,
                             Clock clock,
                             PlatformTransactionManager transactionManager) {
        this.usageEventRepository = usageEventRepository;
        this.usageRecordRepository = usageRecordRepository;
        this.serviceRegistry = serviceRegistry;
        this.lockRegistry = lockRegistry;
        this.metricsService = metricsService;
        this.objectMapper = objectMapper;
        this.clock = clock;

        this.writeTemplate = new TransactionTemplate(transactionManager);
        this.writeTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.writeTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);

        this.rereadTemplate = new TransactionTemplate(transactionManager);
        this.rereadTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.rereadTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        this.rereadTemplate.setReadOnly(true);
    }

    @Override
    public RecordedUsage record(UUID userId, UUID tenantId, String serviceCode, long tokensUsed, long pagesProcessed,
                                Map<String, Object> metadata, String idempotencyKey) {
        if (userId == null || tenantId == null) {
            throw new BillingValidationException("userId and tenantId are required");
        }
        ServiceDefinition service = serviceRegistry.require(serviceCode);
        long tokens = Math.max(tokensUsed, 0L);
        long pages = Math.max(pagesProcessed, 0L);
        if (tokens > 0 && !service.payable()) {
            throw new BillingValidationException("Token usage cannot be recorded against non-payable service '" + serviceCode + "'");
        }
        if (idempotencyKey != null && idempotencyKey.length() > IdempotencyKeys.MAX_LENGTH) {
            throw new BillingValidationException("Idempotency key must be at most " + IdempotencyKeys.MAX_LENGTH + " characters");
        }

        boolean callerKey = idempotencyKey != null && !idempotencyKey.isBlank();
        String key = callerKey ? idempotencyKey : IdempotencyKeys.generate(serviceCode, clock);
        String metadataJson = toJson(metadata, key);

        RecordedUsage result;
        if (!callerKey) {
            // Freshly generated key: nothing to deduplicate against.
            result = writeTemplate.execute(status -> insert(userId, tenantId, service, tokens, pages, metadataJson, key));
        } else {
            String lockKey = userId + ":" + tenantId + ":" + key;
            result = lockRegistry.withLock(lockKey,
                    () -> recordOnce(userId, tenantId, service, tokens, pages, metadataJson, key));
        }

        emit(result, service);
        return result;
    }

    private RecordedUsage recordOnce(UUID userId, UUID tenantId, ServiceDefinition service,
                                     long tokens, long pages, String metadataJson, String key) {
        try {
            return writeTemplate.execute(status -> {
                Optional<UsageEvent> existing = usageEventRepository.findByIdempotencyKeyForUpdate(userId, tenantId, key);
                if (existing.isPresent()) {
                    return replay(existing.get());
                }
                return insert(userId, tenantId, service, tokens, pages, metadataJson, key);
            });
        } catch (DataIntegrityViolationException ex) {
            // Another process inserted the same key between our lookup and insert
            RecordedUsage winner = rereadTemplate.execute(status ->
                    usageEventRepository.findByUserIdAndTenantIdAndIdempotencyKey(userId, tenantId, key)
                            .map(this::replay)
                            .orElse(null));
            if (winner == null) {
                throw ex;
            }
            log.info("Idempotency race resolved for key={} user={} tenant={}", key, userId, tenantId);
            return winner;
        }
    }

    private RecordedUsage replay(UsageEvent event) {
        UsageRecord record = usageRecordRepository.findFirstByEvent_Id(event.getId()).orElse(null);
        return new RecordedUsage(event, record, true);
    }

    private RecordedUsage insert(UUID userId, UUID tenantId, ServiceDefinition service,
                                 long tokens, long pages, String metadataJson, String key) {
        LocalDateTime now = LocalDateTime.now(clock);

        UsageEvent event = new UsageEvent();
        event.setUserId(userId);
        event.setTenantId(tenantId);
        event.setEventType(service.code());
        event.setServiceType(service.serviceType());
        event.setIdempotencyKey(key);
        event.setMetadata(metadataJson);
        event.setTokensUsed(tokens);
        event.setPagesProcessed(pages);
        event.setCreatedAt(now);
        event = usageEventRepository.saveAndFlush(event);

        UsageRecord record = null;
        if (tokens > 0) {
            record = new UsageRecord();
            record.setUserId(userId);
            record.setTenantId(tenantId);
            record.setTokensUsed(tokens);
            record.setEvent(event);
            record.setCreatedAt(now);
            record = usageRecordRepository.saveAndFlush(record);
        }
        return new RecordedUsage(event, record, false);
    }

    private String toJson(Map<String, Object> metadata, String key) {
        Map<String, Object> mirrored = new LinkedHashMap<>();
        if (metadata != null) {
            mirrored.putAll(metadata);
        }
        mirrored.put(METADATA_KEY_FIELD, key);
        try {
            return objectMapper.writeValueAsString(mirrored);
        } catch (JsonProcessingException e) {
            throw new BillingValidationException("Metadata cannot be serialized to JSON: " + e.getOriginalMessage());
        }
    }

    private void emit(RecordedUsage result, ServiceDefinition service) {
        UsageEvent event = result.event();
        if (result.replayed()) {
            metricsService.incrementEventReplayed(service.code());
            BillingStructuredLogger.logLedgerWrite(ledgerLog, "info",
                    "Usage already recorded, returning existing event {}",
                    event.getUserId(), event.getTenantId(), service.code(), event.getIdempotencyKey(),
                    event.getId(), event.getTokensUsed(), event.getPagesProcessed(), event.getId());
            return;
        }
        metricsService.incrementEventRecorded(service.code());
        if (event.getTokensUsed() > 0) {
            metricsService.incrementTokensRecorded(service.code(), event.getTokensUsed());
        }
        if (event.getPagesProcessed() > 0) {
            metricsService.incrementPagesRecorded(service.code(), event.getPagesProcessed());
        }
        BillingStructuredLogger.logLedgerWrite(ledgerLog, "info",
                "Recorded usage event {} tokens={} pages={}",
                event.getUserId(), event.getTenantId(), service.code(), event.getIdempotencyKey(),
                event.getId(), event.getTokensUsed(), event.getPagesProcessed(),
                event.getId(), event.getTokensUsed(), event.getPagesProcessed());
    }
}
