package com.edurange.ctf.modules.instance;

import com.edurange.ctf.exception.ProvisionFailedException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.UnknownHostException;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * HTTP client for the orchestration backend that creates and removes challenge
 * deployments. Calls are blocking and never retried here; timeouts come from the
 * injected {@link RestTemplate}.
 */
@Slf4j
@Component
public class OrchestratorClient {

    static final String OP_START = "start-challenge";
    static final String OP_END = "end-challenge";
    static final String OP_STATUS = "get-pod-status";

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public OrchestratorClient(
            @Qualifier("orchestratorRestTemplate") RestTemplate restTemplate,
            @Value("${orchestrator.base-url}") String baseUrl) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    /**
     * Requests a new deployment.
     *
     * @throws ProvisionFailedException on a non-2xx answer, a timeout, a
     *                                  connection failure, a response without a
     *                                  deployment name or a deployment reported as
     *                                  already failed or gone
     */
    public StartResponse start(StartRequest request) {
        String url = baseUrl + "/" + OP_START;
        log.info("Orchestrator start: userId={}, challengeImage={}, chalType={}, competitionId={}",
                request.getUserId(), request.getChallengeImage(), request.getChalType(), request.getCompetitionId());

        StartResponse response = exchange(OP_START, null,
                () -> restTemplate.postForObject(url, request, StartResponse.class));
        if (response == null || response.getDeploymentName() == null || response.getDeploymentName().isBlank()) {
            throw ProvisionFailedException.malformed(OP_START, null, "missing deployment_name");
        }
        if (mapStatus(response.getStatus()).isTerminal()) {
            String deploymentName = response.getDeploymentName();
            log.warn("Orchestrator reported status {} for new deployment {}, removing it",
                    response.getStatus(), deploymentName);
            try {
                stop(deploymentName);
            } catch (ProvisionFailedException e) {
                log.error("Failed deployment {} could not be removed: {}", deploymentName, e.getMessage());
            }
            throw ProvisionFailedException.reportedFailure(OP_START, deploymentName, response.getStatus());
        }

        log.info("Orchestrator started deployment {} (status={})", response.getDeploymentName(), response.getStatus());
        return response;
    }

    public void stop(String deploymentName) {
        String url = baseUrl + "/" + OP_END;
        exchange(OP_END, deploymentName,
                () -> restTemplate.postForObject(url, Map.of("deployment_name", deploymentName), Map.class));
        log.info("Orchestrator accepted termination of {}", deploymentName);
    }

    /**
     * Current backend view of a deployment. A 404 means the deployment is gone.
     */
    public PodStatus fetchStatus(String deploymentName) {
        String url = UriComponentsBuilder.fromHttpUrl(baseUrl + "/" + OP_STATUS)
                .queryParam("pod_name", deploymentName)
                .toUriString();
        try {
            StatusResponse response = exchange(OP_STATUS, deploymentName,
                    () -> restTemplate.getForObject(url, StatusResponse.class));
            String raw = response == null ? null : response.getStatus();
            return new PodStatus(raw, mapStatus(raw));
        } catch (ProvisionFailedException e) {
            if (e.getBackendStatus() != null && e.getBackendStatus() == HttpStatus.NOT_FOUND.value()) {
                return new PodStatus("not_found", InstanceStatus.TERMINATED);
            }
            throw e;
        }
    }

    /**
     * creating → PENDING, active/running → RUNNING, error/failed → FAILED,
     * deleting/deleted/succeeded → TERMINATED. Anything else is treated as PENDING.
     */
    static InstanceStatus mapStatus(String raw) {
        if (raw == null) {
            return InstanceStatus.PENDING;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "active", "running" -> InstanceStatus.RUNNING;
            case "error", "failed" -> InstanceStatus.FAILED;
            case "deleting", "deleted", "succeeded", "terminated" -> InstanceStatus.TERMINATED;
            default -> InstanceStatus.PENDING;
        };
    }

    private <T> T exchange(String operation, String deploymentName, Call<T> call) {
        try {
            return call.execute();
        } catch (HttpStatusCodeException e) {
            String body = e.getResponseBodyAsString();
            log.warn("Orchestrator {} failed: deployment={}, status={}, body={}",
                    operation, deploymentName, e.getStatusCode().value(), body);
            throw ProvisionFailedException.rejected(operation, deploymentName, e.getStatusCode().value(), body);
        } catch (ResourceAccessException e) {
            if (isConnectFailure(e)) {
                log.warn("Orchestrator {} unreachable: deployment={}, error={}", operation, deploymentName,
                        e.getMessage());
                throw ProvisionFailedException.unreachable(operation, deploymentName, e);
            }
            // The request may have reached the backend; repeating it could create a second deployment
            log.warn("Orchestrator {} timed out: deployment={}, error={}", operation, deploymentName, e.getMessage());
            throw ProvisionFailedException.timedOut(operation, deploymentName, e);
        } catch (RestClientException e) {
            log.warn("Orchestrator {} returned an unreadable response: deployment={}, error={}",
                    operation, deploymentName, e.getMessage());
            throw ProvisionFailedException.malformed(operation, deploymentName, e.getMessage());
        }
    }

    private static boolean isConnectFailure(ResourceAccessException e) {
        Throwable cause = e.getCause();
        return cause instanceof ConnectException
                || cause instanceof UnknownHostException
                || cause instanceof NoRouteToHostException;
    }

    @FunctionalInterface
    private interface Call<T> {
        T execute();
    }

    // ── Wire types ───────────────────────────────────────────────────────────

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StartRequest {
        @JsonProperty("user_id")
        private String userId;
        @JsonProperty("challenge_id")
        private String challengeId;
        @JsonProperty("challenge_image")
        private String challengeImage;
        @JsonProperty("apps_config")
        private List<Map<String, Object>> appsConfig;
        @JsonProperty("chal_type")
        private String chalType;
        @JsonProperty("competition_id")
        private String competitionId;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StartResponse {
        @JsonProperty("deployment_name")
        private String deploymentName;
        @JsonProperty("challenge_url")
        private String challengeUrl;
        @JsonProperty("terminal_url")
        private String terminalUrl;
        @JsonProperty("flag_secret_name")
        private String flagSecretName;
        private String status;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StatusResponse {
        private String status;
    }

    @Data
    @AllArgsConstructor
    public static class PodStatus {
        private String raw;
        private InstanceStatus status;
    }
}
