package com.rockpoint.payments.core;

import com.rockpoint.payments.domain.GatewayKind;
import com.rockpoint.payments.persistence.repository.GatewayTransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;

/**
 * Merchant order ids of the form {@code <PREFIX>_<epochMillis>_<6 base36 chars>},
 * checked against the store before use. The unique constraint on
 * {@code gateway_transactions.order_id} remains the cross-process guard.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrderIdGenerator {

    static final int MAX_ATTEMPTS = 10;
    private static final int SUFFIX_LENGTH = 6;
    private static final char[] ALPHABET = "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZ".toCharArray();

    private final GatewayTransactionRepository repository;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    /**
     * @throws OrderIdGenerationException when every candidate collided
     */
    public String generateUniqueOrderId(GatewayKind gateway) {
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            String candidate = gateway.getOrderIdPrefix() + "_" + clock.millis() + "_" + randomSuffix();
            if (!repository.existsByOrderId(candidate)) {
                return candidate;
            }
            log.warn("Order id collision gateway={} candidate={} attempt={}", gateway, candidate, attempt);
        }
        throw new OrderIdGenerationException("Failed to generate unique order id after " + MAX_ATTEMPTS + " attempts");
    }

    private String randomSuffix() {
        char[] chars = new char[SUFFIX_LENGTH];
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            chars[i] = ALPHABET[random.nextInt(ALPHABET.length)];
        }
        return new String(chars);
    }
}
