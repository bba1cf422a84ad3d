package com.edurange.ctf.exception;

import lombok.Getter;

/**
 * The orchestration backend rejected a request, could not be reached, or did not
 * answer within the configured timeout.
 *
 * <p>{@code retryable} is only set when the request never reached the backend
 * (connection refused, unknown host), so repeating it cannot create a second
 * deployment. {@code backendBody} keeps the raw error body for diagnostics and
 * is never exposed to API clients.
 */
@Getter
public class ProvisionFailedException extends RuntimeException {

    private final String operation;
    private final String deploymentName;
    private final Integer backendStatus;
    private final String backendBody;
    private final boolean retryable;

    public ProvisionFailedException(String operation, String deploymentName, Integer backendStatus,
            String backendBody, boolean retryable, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
        this.deploymentName = deploymentName;
        this.backendStatus = backendStatus;
        this.backendBody = backendBody;
        this.retryable = retryable;
    }

    public static ProvisionFailedException rejected(String operation, String deploymentName,
            int status, String body) {
        return new ProvisionFailedException(operation, deploymentName, status, body, false,
                "Orchestration backend rejected " + operation + describe(deploymentName)
                        + " with HTTP " + status,
                null);
    }

    public static ProvisionFailedException unreachable(String operation, String deploymentName, Throwable cause) {
        return new ProvisionFailedException(operation, deploymentName, null, null, true,
                "Orchestration backend unreachable during " + operation + describe(deploymentName),
                cause);
    }

    public static ProvisionFailedException timedOut(String operation, String deploymentName, Throwable cause) {
        return new ProvisionFailedException(operation, deploymentName, null, null, false,
                "Orchestration backend timed out during " + operation + describe(deploymentName),
                cause);
    }

    public static ProvisionFailedException malformed(String operation, String deploymentName, String detail) {
        return new ProvisionFailedException(operation, deploymentName, null, detail, false,
                "Orchestration backend returned an unusable response to " + operation
                        + describe(deploymentName),
                null);
    }

    /** The backend answered 2xx but reported the deployment itself as failed or gone. */
    public static ProvisionFailedException reportedFailure(String operation, String deploymentName,
            String reportedStatus) {
        return new ProvisionFailedException(operation, deploymentName, null, reportedStatus, false,
                "Orchestration backend reported status '" + reportedStatus + "' for " + operation
                        + describe(deploymentName),
                null);
    }

    private static String describe(String deploymentName) {
        return deploymentName == null ? "" : " (deployment " + deploymentName + ")";
    }
}
