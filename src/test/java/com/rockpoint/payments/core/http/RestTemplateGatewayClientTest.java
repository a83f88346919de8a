package com.rockpoint.payments.core.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rockpoint.payments.core.auth.AuthHeader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class RestTemplateGatewayClientTest {

    private static final String URL = "https://fastpay.test/api/apelsin-pay/merchant/v2/payment";

    private MockRestServiceServer server;
    private RestTemplateGatewayClient client;

    private final AuthHeader header = AuthHeader.builder()
            .headerName("Authorization")
            .value("merchant-1:abc:123")
            .timestamp(123L)
            .digest("abc")
            .build();

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new RestTemplateGatewayClient(new RestTemplateBuilder(), new ObjectMapper()) {
            @Override
            protected RestTemplate restTemplate(int timeoutMs) {
                return restTemplate;
            }
        };
    }

    private static GatewayCall post() {
        return GatewayCall.builder()
                .method(HttpMethod.POST)
                .endpoint(URL)
                .payload(Map.of("amount", 50000L))
                .build();
    }

    @Test
    void sendsJsonBodyWithAuthHeaderAndParsesResponse() {
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "merchant-1:abc:123"))
                .andExpect(content().json("{\"amount\":50000}"))
                .andRespond(withSuccess("{\"error_code\":0,\"payment_id\":\"pay-1\"}", MediaType.APPLICATION_JSON));

        GatewayResponse response = client.call(post(), header, 15000);

        assertThat(response.getHttpStatus()).isEqualTo(200);
        assertThat(response.getBody().get("payment_id").asText()).isEqualTo("pay-1");
        assertThat(response.getRawBody()).contains("pay-1");
        assertThat(response.getResponseTimeMs()).isGreaterThanOrEqualTo(0);
        server.verify();
    }

    @Test
    void errorStatusIsAResponseNotAnException() {
        server.expect(requestTo(URL))
                .andRespond(withStatus(HttpStatus.BAD_REQUEST)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"error_code\":-5,\"error_message\":\"Invalid OTP\"}"));

        GatewayResponse response = client.call(post(), header, 15000);

        assertThat(response.getHttpStatus()).isEqualTo(400);
        assertThat(response.getBody().get("error_code").asInt()).isEqualTo(-5);
    }

    @Test
    void nonJsonBodyBecomesMissingNode() {
        server.expect(requestTo(URL))
                .andRespond(withStatus(HttpStatus.BAD_GATEWAY).contentType(MediaType.TEXT_HTML).body("<html>oops</html>"));

        GatewayResponse response = client.call(post(), header, 15000);

        assertThat(response.getHttpStatus()).isEqualTo(502);
        assertThat(response.getBody().isMissingNode()).isTrue();
        assertThat(response.getRawBody()).isEqualTo("<html>oops</html>");
    }

    @Test
    void readTimeoutIsReportedAsTimeout() {
        server.expect(requestTo(URL)).andRespond(withException(new SocketTimeoutException("Read timed out")));

        assertThatThrownBy(() -> client.call(post(), header, 15000))
                .isInstanceOf(GatewayTimeoutException.class)
                .hasMessage("Request timeout after 15000ms")
                .satisfies(e -> assertThat(((GatewayTransportException) e).isTimeout()).isTrue());
    }

    @Test
    void connectionFailureIsReportedAsNetworkError() {
        IOException refused = new ConnectException("Connection refused");
        server.expect(requestTo(URL)).andRespond(withException(refused));

        assertThatThrownBy(() -> client.call(post(), header, 15000))
                .isInstanceOf(GatewayNetworkException.class)
                .satisfies(e -> assertThat(((GatewayTransportException) e).isTimeout()).isFalse());
    }

    @Test
    void getRequestsCarryNoBody() {
        String statusUrl = "https://click.test/v2/merchant/payment/status/1/pay-1";
        server.expect(requestTo(statusUrl))
                .andExpect(method(HttpMethod.GET))
                .andExpect(content().string(""))
                .andRespond(withSuccess("{\"error_code\":0}", MediaType.APPLICATION_JSON));

        GatewayResponse response = client.call(GatewayCall.builder().method(HttpMethod.GET).endpoint(statusUrl).build(),
                header, 15000);

        assertThat(response.getHttpStatus()).isEqualTo(200);
        server.verify();
    }
}
