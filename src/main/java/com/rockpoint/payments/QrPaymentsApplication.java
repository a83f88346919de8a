package com.rockpoint.payments;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the RockPoint QR payments service:
 * <ul>
 *   <li>FastPay, Click Pass and Payme QR gateway integrations</li>
 *   <li>Database-backed gateway credentials with a TTL cache</li>
 *   <li>Audit trail in the database and lifecycle events on Kafka</li>
 *   <li>REST API and OpenAPI docs at /swagger-ui/index.html</li>
 * </ul>
 */
@SpringBootApplication
public class QrPaymentsApplication {

    public static void main(String[] args) {
        SpringApplication.run(QrPaymentsApplication.class, args);
    }
}
