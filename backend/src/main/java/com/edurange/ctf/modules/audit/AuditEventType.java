package com.edurange.ctf.modules.audit;

public enum AuditEventType {
    GROUP_CREATED(Severity.INFO),
    GROUP_DELETED(Severity.WARNING),
    GROUP_LEFT(Severity.INFO),
    GROUP_MEMBER_REMOVED(Severity.INFO),
    GROUP_PROGRESS_RESET(Severity.WARNING),
    ACCESS_CODE_GENERATED(Severity.INFO),
    ACCESS_CODE_USED(Severity.INFO),
    ACCESS_CODE_INVALID(Severity.WARNING),
    ACCESS_CODE_EXPIRED(Severity.INFO),
    ACCESS_CODE_DELETED(Severity.INFO),
    CHALLENGE_INSTANCE_CREATED(Severity.INFO),
    CHALLENGE_INSTANCE_RUNNING(Severity.INFO),
    CHALLENGE_INSTANCE_DELETED(Severity.INFO),
    CHALLENGE_INSTANCE_FAILED(Severity.ERROR),
    QUESTION_ATTEMPTED(Severity.INFO),
    QUESTION_COMPLETED(Severity.INFO),
    CHALLENGE_COMPLETED(Severity.INFO);

    private final Severity severity;

    AuditEventType(Severity severity) {
        this.severity = severity;
    }

    public Severity severity() {
        return severity;
    }

    /** AMQP routing key this event is published under. */
    public String routingKey() {
        return "audit." + name().toLowerCase();
    }

    public enum Severity {
        INFO, WARNING, ERROR
    }
}
