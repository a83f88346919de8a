package com.rockpoint.payments.core.auth;

/**
 * Colon-joined credential pair, e.g. Payme's {@code X-Auth: cashbox_id:key_password}.
 */
public class StaticCredentialAuthHeaderBuilder implements AuthHeaderBuilder {

    private final String headerName;

    public StaticCredentialAuthHeaderBuilder(String headerName) {
        this.headerName = headerName;
    }

    public static StaticCredentialAuthHeaderBuilder paymeQr() {
        return new StaticCredentialAuthHeaderBuilder("X-Auth");
    }

    @Override
    public AuthHeader build(String secret, String principal) {
        return AuthHeader.builder()
                .headerName(headerName)
                .value(principal + ":" + secret)
                .carriesSecret(true)
                .build();
    }
}
