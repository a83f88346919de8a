package com.rockpoint.payments.compliance;

/**
 * Safe-to-log forms of OTP payloads, secrets and customer identifiers.
 */
public final class SensitiveDataMasker {

    private static final String MASK = "***";

    private SensitiveDataMasker() {}

    /** First 6 and last 4 characters of a scanned payload, e.g. "ABC123***WXYZ". */
    public static String maskOtp(String otp) {
        if (otp == null || otp.isBlank()) return null;
        if (otp.length() <= 12) return MASK;
        return otp.substring(0, 6) + MASK + otp.substring(otp.length() - 4);
    }

    public static String maskSecret(String secret) {
        if (secret == null || secret.isBlank()) return null;
        return MASK;
    }

    /** Keeps the country prefix and the last two digits. */
    public static String maskPhone(String phone) {
        if (phone == null || phone.isBlank()) return null;
        if (phone.length() <= 6) return MASK;
        return phone.substring(0, 4) + MASK + phone.substring(phone.length() - 2);
    }

    /**
     * Keeps the principal of a {@code principal:digest:timestamp} or
     * {@code principal:secret} header.
     */
    public static String maskAuthHeader(String header) {
        if (header == null || header.isBlank()) return null;
        int sep = header.indexOf(':');
        return sep < 0 ? MASK : header.substring(0, sep + 1) + MASK;
    }
}
