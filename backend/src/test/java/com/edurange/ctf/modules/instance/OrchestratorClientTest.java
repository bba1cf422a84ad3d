package com.edurange.ctf.modules.instance;

import com.edurange.ctf.exception.ProvisionFailedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.net.ConnectException;
import java.net.SocketTimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class OrchestratorClientTest {

    private static final String BASE_URL = "http://orchestrator.test/api";

    private MockRestServiceServer server;
    private OrchestratorClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new OrchestratorClient(restTemplate, BASE_URL + "/");
    }

    @Test
    void test_start_success_parsesSnakeCaseResponse() {
        server.expect(requestTo(BASE_URL + "/start-challenge"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.chal_type").value("fullos"))
                .andExpect(jsonPath("$.challenge_image").value("registry.local/linux:3"))
                .andRespond(withSuccess("""
                        {"deployment_name":"fullos-7f3a","challenge_url":"https://fullos-7f3a.ctf.local",
                         "terminal_url":"https://term-fullos-7f3a.ctf.local","flag_secret_name":"flag-7f3a",
                         "extra":"ignored"}
                        """, MediaType.APPLICATION_JSON));

        OrchestratorClient.StartResponse response = client.start(request());

        assertThat(response.getDeploymentName()).isEqualTo("fullos-7f3a");
        assertThat(response.getTerminalUrl()).isEqualTo("https://term-fullos-7f3a.ctf.local");
        assertThat(response.getFlagSecretName()).isEqualTo("flag-7f3a");
        assertThat(response.getStatus()).isNull();
        server.verify();
    }

    @Test
    void test_start_serverError_throwsRejectedWithBody() {
        server.expect(requestTo(BASE_URL + "/start-challenge"))
                .andRespond(withStatus(HttpStatus.INTERNAL_SERVER_ERROR)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"error\":\"image pull failed\"}"));

        ProvisionFailedException ex = assertThrows(ProvisionFailedException.class, () -> client.start(request()));

        assertThat(ex.getBackendStatus()).isEqualTo(500);
        assertThat(ex.getBackendBody()).contains("image pull failed");
        assertThat(ex.isRetryable()).isFalse();
    }

    @Test
    void test_start_missingDeploymentName_throwsMalformed() {
        server.expect(requestTo(BASE_URL + "/start-challenge"))
                .andRespond(withSuccess("{\"challenge_url\":\"https://x\"}", MediaType.APPLICATION_JSON));

        ProvisionFailedException ex = assertThrows(ProvisionFailedException.class, () -> client.start(request()));

        assertThat(ex.isRetryable()).isFalse();
        assertThat(ex.getBackendBody()).isEqualTo("missing deployment_name");
    }

    @Test
    void test_start_deploymentReportedFailed_removesItAndThrows() {
        // given
        server.expect(requestTo(BASE_URL + "/start-challenge"))
                .andRespond(withSuccess("{\"deployment_name\":\"web-bad\",\"status\":\"error\"}",
                        MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE_URL + "/end-challenge"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.deployment_name").value("web-bad"))
                .andRespond(withSuccess("{\"message\":\"deleted\"}", MediaType.APPLICATION_JSON));

        // when
        ProvisionFailedException ex = assertThrows(ProvisionFailedException.class, () -> client.start(request()));

        // then
        assertThat(ex.isRetryable()).isFalse();
        assertThat(ex.getDeploymentName()).isEqualTo("web-bad");
        assertThat(ex.getBackendBody()).isEqualTo("error");
        server.verify();
    }

    @Test
    void test_start_deploymentReportedFailed_cleanupFailureStillThrowsReportedStatus() {
        server.expect(requestTo(BASE_URL + "/start-challenge"))
                .andRespond(withSuccess("{\"deployment_name\":\"web-bad\",\"status\":\"failed\"}",
                        MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE_URL + "/end-challenge"))
                .andRespond(withStatus(HttpStatus.INTERNAL_SERVER_ERROR));

        ProvisionFailedException ex = assertThrows(ProvisionFailedException.class, () -> client.start(request()));

        assertThat(ex.getOperation()).isEqualTo(OrchestratorClient.OP_START);
        assertThat(ex.getBackendBody()).isEqualTo("failed");
        server.verify();
    }

    @Test
    void test_start_connectionRefused_isRetryable() {
        server.expect(requestTo(BASE_URL + "/start-challenge"))
                .andRespond(withException(new ConnectException("Connection refused")));

        ProvisionFailedException ex = assertThrows(ProvisionFailedException.class, () -> client.start(request()));

        assertThat(ex.isRetryable()).isTrue();
    }

    @Test
    void test_start_readTimeout_isNotRetryable() {
        server.expect(requestTo(BASE_URL + "/start-challenge"))
                .andRespond(withException(new SocketTimeoutException("Read timed out")));

        ProvisionFailedException ex = assertThrows(ProvisionFailedException.class, () -> client.start(request()));

        assertThat(ex.isRetryable()).isFalse();
        assertThat(ex.getMessage()).contains("timed out");
    }

    @Test
    void test_stop_sendsDeploymentName() {
        server.expect(requestTo(BASE_URL + "/end-challenge"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.deployment_name").value("fullos-7f3a"))
                .andRespond(withSuccess("{\"message\":\"deleted\"}", MediaType.APPLICATION_JSON));

        client.stop("fullos-7f3a");

        server.verify();
    }

    @Test
    void test_fetchStatus_mapsActiveToRunning() {
        server.expect(requestTo(BASE_URL + "/get-pod-status?pod_name=fullos-7f3a"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("{\"pod_name\":\"fullos-7f3a\",\"status\":\"active\"}",
                        MediaType.APPLICATION_JSON));

        OrchestratorClient.PodStatus status = client.fetchStatus("fullos-7f3a");

        assertThat(status.getRaw()).isEqualTo("active");
        assertThat(status.getStatus()).isEqualTo(InstanceStatus.RUNNING);
    }

    @Test
    void test_fetchStatus_notFound_meansTerminated() {
        server.expect(requestTo(BASE_URL + "/get-pod-status?pod_name=gone"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThat(client.fetchStatus("gone").getStatus()).isEqualTo(InstanceStatus.TERMINATED);
    }

    @Test
    void test_mapStatus_knownAndUnknownValues() {
        assertThat(OrchestratorClient.mapStatus("creating")).isEqualTo(InstanceStatus.PENDING);
        assertThat(OrchestratorClient.mapStatus("Active")).isEqualTo(InstanceStatus.RUNNING);
        assertThat(OrchestratorClient.mapStatus("error")).isEqualTo(InstanceStatus.FAILED);
        assertThat(OrchestratorClient.mapStatus("deleting")).isEqualTo(InstanceStatus.TERMINATED);
        assertThat(OrchestratorClient.mapStatus("CrashLoopBackOff")).isEqualTo(InstanceStatus.PENDING);
        assertThat(OrchestratorClient.mapStatus(null)).isEqualTo(InstanceStatus.PENDING);
    }

    private OrchestratorClient.StartRequest request() {
        return OrchestratorClient.StartRequest.builder()
                .userId("u-1")
                .challengeId("c-1")
                .challengeImage("registry.local/linux:3")
                .chalType("fullos")
                .competitionId("g-1")
                .build();
    }
}
