package com.alfacon.weather.service;

import com.alfacon.weather.RelayTestProperties;
import com.alfacon.weather.model.DeliveryOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class ThingerDeviceClientTest {

    private static final String CAL251 = RelayTestProperties.SERVER + "/v1/users/Alfacon/devices/CAL251/OutTemp";

    private MockRestServiceServer server;
    private ThingerDeviceClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new ThingerDeviceClient(restTemplate, restTemplate, RelayTestProperties.create());
    }

    // ── probe ────────────────────────────────────────────────────────────────

    @Test
    void probeIsTrueOnlyForOk() {
        server.expect(requestTo(CAL251))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer test-token"))
                .andRespond(withSuccess("{\"out\":21.0}", MediaType.APPLICATION_JSON));

        assertThat(client.probe("CAL251")).isTrue();
        server.verify();
    }

    @Test
    void probeOfUnknownDeviceIsFalseWithoutRetry() {
        server.expect(ExpectedCount.once(), requestTo(CAL251)).andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThat(client.probe("CAL251")).isFalse();
        server.verify();
    }

    @Test
    void probeRetriesServerErrorThenGivesUp() {
        server.expect(ExpectedCount.times(2), requestTo(CAL251)).andRespond(withServerError());

        assertThat(client.probe("CAL251")).isFalse();
        server.verify();
    }

    @Test
    void probeTreatsTransportErrorAsUnreachable() {
        server.expect(ExpectedCount.times(4), requestTo(CAL251)).andRespond(request -> {
            throw new SocketTimeoutException("Read timed out");
        });

        assertThat(client.probe("CAL251")).isFalse();
        assertThat(client.probeStatus("CAL251")).isEqualTo(-1);
        server.verify();
    }

    @Test
    void probeStatusReportsRejectedToken() {
        server.expect(ExpectedCount.once(), requestTo(CAL251)).andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        assertThat(client.probeStatus("CAL251")).isEqualTo(401);
        server.verify();
    }

    // ── push ─────────────────────────────────────────────────────────────────

    @Test
    void pushSendsOutTempPayload() {
        server.expect(requestTo(CAL251))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer test-token"))
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(content().json("{\"exterror\":0,\"webout\":21.5}", true))
                .andRespond(withSuccess());

        assertThat(client.push("CAL251", 21.5)).isEqualTo(DeliveryOutcome.DELIVERED);
        server.verify();
    }

    @Test
    void pushNeverRetriesAfterNotFound() {
        server.expect(ExpectedCount.once(), requestTo(CAL251))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThat(client.push("CAL251", 21.5)).isEqualTo(DeliveryOutcome.NOT_FOUND);
        server.verify();
    }

    @Test
    void pushRetriesTransportFailureUpToMaxAttempts() {
        server.expect(ExpectedCount.times(3), requestTo(CAL251)).andRespond(request -> {
            throw new SocketTimeoutException("Read timed out");
        });

        assertThat(client.push("CAL251", 21.5)).isEqualTo(DeliveryOutcome.FAILED);
        server.verify();
    }

    @Test
    void pushRecoversWhenRetrySucceeds() {
        server.expect(ExpectedCount.once(), requestTo(CAL251)).andRespond(withServerError());
        server.expect(ExpectedCount.once(), requestTo(CAL251)).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));
        server.expect(ExpectedCount.once(), requestTo(CAL251)).andRespond(withSuccess());

        assertThat(client.push("CAL251", 21.5)).isEqualTo(DeliveryOutcome.DELIVERED);
        server.verify();
    }

    @Test
    void pushFailsAfterRepeatedRejections() {
        server.expect(ExpectedCount.times(3), requestTo(CAL251)).andRespond(withStatus(HttpStatus.BAD_GATEWAY));

        assertThat(client.push("CAL251", 21.5)).isEqualTo(DeliveryOutcome.FAILED);
        server.verify();
    }

    @Test
    void resourceUriFollowsPlatformLayout() {
        assertThat(client.resourceUri("CAL300")).hasToString(
                RelayTestProperties.SERVER + "/v1/users/Alfacon/devices/CAL300/OutTemp");
    }
}
