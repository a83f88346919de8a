package com.rockpoint.payments.compliance;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rockpoint.payments.messaging.PaymentEvent;
import com.rockpoint.payments.messaging.PaymentEventProducer;
import com.rockpoint.payments.persistence.entity.AuditEntryEntity;
import com.rockpoint.payments.persistence.repository.AuditEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Appends to the audit trail ({@code gateway_audit_log}), mirrors every entry
 * to the application log with an {@code [AUDIT]} prefix and publishes
 * lifecycle actions to Kafka.
 * <p>
 * A failed audit write is logged at error level and does not abort the
 * payment flow that produced it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AuditLogger {

    private final AuditEntryRepository repository;
    private final PaymentEventProducer eventProducer;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public void record(AuditRecord record) {
        Instant now = clock.instant();
        log.info("[AUDIT] {} transactionId={} orderId={} gateway={} employeeId={} terminalId={} httpStatus={} responseTimeMs={}",
                record.getAction().getTag(),
                record.getTransactionId(),
                record.getOrderId(),
                record.getGateway(),
                record.getEmployeeId(),
                record.getTerminalId(),
                record.getResponseStatus(),
                record.getResponseTimeMs());
        try {
            repository.save(AuditEntryEntity.builder()
                    .id(UUID.randomUUID().toString())
                    .transactionId(record.getTransactionId())
                    .gateway(record.getGateway())
                    .action(record.getAction().getTag())
                    .details(toJson(record))
                    .employeeId(record.getEmployeeId())
                    .terminalId(record.getTerminalId())
                    .httpMethod(record.getHttpMethod())
                    .endpoint(record.getEndpoint())
                    .responseStatus(record.getResponseStatus())
                    .responseTimeMs(record.getResponseTimeMs())
                    .createdAt(now)
                    .build());
        } catch (RuntimeException e) {
            log.error("Failed to write audit entry action={} transactionId={}",
                    record.getAction().getTag(), record.getTransactionId(), e);
        }
        if (record.getAction().isLifecycleEvent()) {
            eventProducer.publish(toEvent(record, now));
        }
    }

    private String toJson(AuditRecord record) {
        if (record.getDetails() == null || record.getDetails().isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(record.getDetails());
        } catch (JsonProcessingException e) {
            log.warn("Audit details not serializable action={}: {}", record.getAction().getTag(), e.getOriginalMessage());
            return "{\"serialization_error\":\"" + e.getOriginalMessage().replace("\"", "'") + "\"}";
        }
    }

    private static PaymentEvent toEvent(AuditRecord record, Instant now) {
        return PaymentEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .eventType(record.getAction().getTag())
                .gateway(record.getGateway() != null ? record.getGateway().name() : null)
                .transactionId(record.getTransactionId())
                .orderId(record.getOrderId())
                .gatewayPaymentId(record.getGatewayPaymentId())
                .status(record.getStatus() != null ? record.getStatus().name() : null)
                .amount(record.getAmount())
                .errorCode(record.getErrorCode())
                .errorMessage(record.getErrorMessage())
                .employeeId(record.getEmployeeId())
                .terminalId(record.getTerminalId())
                .timestamp(now)
                .build();
    }
}
