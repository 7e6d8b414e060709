package com.reelforge.jobs;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Known kinds of generation work. New kinds are added here; anything not
 * listed is rejected at submission time.
 */
public enum JobType {
    IMAGE_GENERATION("image_generation"),
    VIDEO_GENERATION("video_generation"),
    MUSIC_GENERATION("music_generation"),
    STORY_EXPANSION("story_expansion");

    private final String code;

    JobType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Resolves a wire code such as {@code "image_generation"}.
     *
     * @throws JobValidationException if the code is blank or not a known type
     */
    public static JobType fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new JobValidationException("Job type must not be blank");
        }
        String trimmed = code.trim();
        for (JobType type : values()) {
            if (type.code.equalsIgnoreCase(trimmed)) {
                return type;
            }
        }
        throw new JobValidationException("Unknown job type '" + trimmed + "'. Must be one of: "
                + Arrays.stream(values()).map(JobType::getCode).collect(Collectors.joining(", ")));
    }
}
