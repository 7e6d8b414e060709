package com.reelforge.jobs;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states of a {@link Job}. {@code PENDING} is the only entry and
 * re-entry state; {@code COMPLETED}, {@code FAILED} and {@code CANCELLED} are
 * terminal.
 */
public enum JobStatus {
    PENDING("pending"),
    PROCESSING("processing"),
    COMPLETED("completed"),
    FAILED("failed"),
    CANCELLED("cancelled");

    public static final Set<JobStatus> TERMINAL = EnumSet.of(COMPLETED, FAILED, CANCELLED);
    public static final Set<JobStatus> ACTIVE = EnumSet.of(PENDING, PROCESSING);

    private final String code;

    JobStatus(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public static JobStatus fromCode(String code) {
        for (JobStatus status : values()) {
            if (status.code.equalsIgnoreCase(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown job status: " + code);
    }
}
