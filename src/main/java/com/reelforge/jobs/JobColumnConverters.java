package com.reelforge.jobs;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Column mappings for the job enums: type and status are stored as their
 * lowercase codes, priority as its numeric weight.
 */
public final class JobColumnConverters {

    private JobColumnConverters() {
    }

    @Converter
    public static class TypeConverter implements AttributeConverter<JobType, String> {
        @Override
        public String convertToDatabaseColumn(JobType attribute) {
            return attribute == null ? null : attribute.getCode();
        }

        @Override
        public JobType convertToEntityAttribute(String dbData) {
            return dbData == null ? null : JobType.fromCode(dbData);
        }
    }

    @Converter
    public static class StatusConverter implements AttributeConverter<JobStatus, String> {
        @Override
        public String convertToDatabaseColumn(JobStatus attribute) {
            return attribute == null ? null : attribute.getCode();
        }

        @Override
        public JobStatus convertToEntityAttribute(String dbData) {
            return dbData == null ? null : JobStatus.fromCode(dbData);
        }
    }

    @Converter
    public static class PriorityConverter implements AttributeConverter<JobPriority, Integer> {
        @Override
        public Integer convertToDatabaseColumn(JobPriority attribute) {
            return attribute == null ? null : attribute.getWeight();
        }

        @Override
        public JobPriority convertToEntityAttribute(Integer dbData) {
            return dbData == null ? JobPriority.NORMAL : JobPriority.fromWeight(dbData);
        }
    }
}
