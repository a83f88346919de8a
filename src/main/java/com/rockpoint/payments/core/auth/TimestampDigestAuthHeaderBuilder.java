package com.rockpoint.payments.core.auth;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.HexFormat;
import java.util.concurrent.TimeUnit;

/**
 * {@code principal:digest:timestamp} where {@code digest = hex(SHA-1(timestamp + secret))}.
 * <p>
 * Gateways disagree on the timestamp: FastPay expects epoch milliseconds of
 * the UTC+5 wall clock, Click expects plain UTC epoch seconds. The offset is
 * fixed per gateway and never taken from the host time zone.
 */
public class TimestampDigestAuthHeaderBuilder implements AuthHeaderBuilder {

    private static final String DIGEST_ALGORITHM = "SHA-1";

    private final String headerName;
    private final ZoneOffset offset;
    private final TimeUnit precision;
    private final Clock clock;

    public TimestampDigestAuthHeaderBuilder(String headerName, ZoneOffset offset, TimeUnit precision, Clock clock) {
        this.headerName = headerName;
        this.offset = offset;
        this.precision = precision;
        this.clock = clock;
    }

    /** Uzum Bank FastPay: {@code Authorization}, UTC+5 epoch millis. */
    public static TimestampDigestAuthHeaderBuilder fastPay(Clock clock) {
        return new TimestampDigestAuthHeaderBuilder("Authorization", ZoneOffset.ofHours(5), TimeUnit.MILLISECONDS, clock);
    }

    /** Click: {@code Auth}, UTC epoch seconds. */
    public static TimestampDigestAuthHeaderBuilder clickPass(Clock clock) {
        return new TimestampDigestAuthHeaderBuilder("Auth", ZoneOffset.UTC, TimeUnit.SECONDS, clock);
    }

    @Override
    public AuthHeader build(String secret, String principal) {
        long shiftedMillis = clock.millis() + offset.getTotalSeconds() * 1000L;
        long timestamp = precision.convert(shiftedMillis, TimeUnit.MILLISECONDS);
        String digest = sha1Hex(timestamp + secret);
        return AuthHeader.builder()
                .headerName(headerName)
                .value(principal + ":" + digest + ":" + timestamp)
                .timestamp(timestamp)
                .digest(digest)
                .carriesSecret(false)
                .build();
    }

    static String sha1Hex(String input) {
        try {
            MessageDigest md = MessageDigest.getInstance(DIGEST_ALGORITHM);
            return HexFormat.of().formatHex(md.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(DIGEST_ALGORITHM + " not available", e);
        }
    }
}
