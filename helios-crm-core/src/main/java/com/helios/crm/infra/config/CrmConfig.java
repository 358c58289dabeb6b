/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.crm.infra.config;

import java.time.Duration;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Runtime configuration for the CRM core services.
 *
 * <p><b>Environment Variable Override:</b>
 * Every property can be overridden via environment variables using the pattern
 * {@code CRM_<PROPERTY_NAME>}:
 * <pre>
 * CRM_FIELD_CACHE_TTL_SECONDS=300
 * CRM_FIELD_CACHE_MAX_SIZE=10000
 * CRM_FIELD_CACHE_RECORD_STATS=true
 * CRM_PREVIEW_DEFAULT_LIMIT=10
 * CRM_PREVIEW_MAX_LIMIT=100
 * CRM_SEGMENT_LOCK_STRIPES=64
 * </pre>
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * CrmConfig config = CrmConfig.builder()
 *     .fieldCacheTtl(Duration.ofMinutes(1))
 *     .previewMaxLimit(50)
 *     .build();
 * }</pre>
 */
public final class CrmConfig {

    private static final Logger logger = Logger.getLogger(CrmConfig.class.getName());

    // ========================================================================
    // ENVIRONMENT VARIABLE KEYS
    // ========================================================================

    private static final String ENV_FIELD_CACHE_TTL_SECONDS = "CRM_FIELD_CACHE_TTL_SECONDS";
    private static final String ENV_FIELD_CACHE_MAX_SIZE = "CRM_FIELD_CACHE_MAX_SIZE";
    private static final String ENV_FIELD_CACHE_RECORD_STATS = "CRM_FIELD_CACHE_RECORD_STATS";
    private static final String ENV_PREVIEW_DEFAULT_LIMIT = "CRM_PREVIEW_DEFAULT_LIMIT";
    private static final String ENV_PREVIEW_MAX_LIMIT = "CRM_PREVIEW_MAX_LIMIT";
    private static final String ENV_SEGMENT_LOCK_STRIPES = "CRM_SEGMENT_LOCK_STRIPES";

    // ========================================================================
    // CONFIGURATION FIELDS
    // ========================================================================

    private final Duration fieldCacheTtl;
    private final long fieldCacheMaxSize;
    private final boolean fieldCacheRecordStats;
    private final int previewDefaultLimit;
    private final int previewMaxLimit;
    private final int segmentLockStripes;

    private CrmConfig(Builder builder) {
        this.fieldCacheTtl = builder.fieldCacheTtl;
        this.fieldCacheMaxSize = builder.fieldCacheMaxSize;
        this.fieldCacheRecordStats = builder.fieldCacheRecordStats;
        this.previewDefaultLimit = builder.previewDefaultLimit;
        this.previewMaxLimit = builder.previewMaxLimit;
        this.segmentLockStripes = builder.segmentLockStripes;

        validate();
    }

    // ========================================================================
    // FACTORY METHODS
    // ========================================================================

    /**
     * Defaults plus any environment overrides.
     */
    public static CrmConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder(true);
    }

    /**
     * Builder that ignores the environment. Used by tests that need fixed values.
     */
    public static Builder builderWithoutEnvironment() {
        return new Builder(false);
    }

    // ========================================================================
    // BUILDER
    // ========================================================================

    public static final class Builder {

        private Duration fieldCacheTtl = Duration.ofMinutes(5);
        private long fieldCacheMaxSize = 10_000;
        private boolean fieldCacheRecordStats = false;
        private int previewDefaultLimit = 10;
        private int previewMaxLimit = 100;
        private int segmentLockStripes = 64;

        private Builder(boolean loadEnvironment) {
            if (loadEnvironment) {
                applyEnvironmentVariables();
            }
        }

        private void applyEnvironmentVariables() {
            getEnvLong(ENV_FIELD_CACHE_TTL_SECONDS).ifPresent(val -> this.fieldCacheTtl = Duration.ofSeconds(val));
            getEnvLong(ENV_FIELD_CACHE_MAX_SIZE).ifPresent(val -> this.fieldCacheMaxSize = val);
            getEnvBoolean(ENV_FIELD_CACHE_RECORD_STATS).ifPresent(val -> this.fieldCacheRecordStats = val);
            getEnvInt(ENV_PREVIEW_DEFAULT_LIMIT).ifPresent(val -> this.previewDefaultLimit = val);
            getEnvInt(ENV_PREVIEW_MAX_LIMIT).ifPresent(val -> this.previewMaxLimit = val);
            getEnvInt(ENV_SEGMENT_LOCK_STRIPES).ifPresent(val -> this.segmentLockStripes = val);
        }

        public Builder fieldCacheTtl(Duration ttl) {
            this.fieldCacheTtl = ttl;
            return this;
        }

        public Builder fieldCacheMaxSize(long maxSize) {
            this.fieldCacheMaxSize = maxSize;
            return this;
        }

        public Builder fieldCacheRecordStats(boolean recordStats) {
            this.fieldCacheRecordStats = recordStats;
            return this;
        }

        public Builder previewDefaultLimit(int limit) {
            this.previewDefaultLimit = limit;
            return this;
        }

        public Builder previewMaxLimit(int limit) {
            this.previewMaxLimit = limit;
            return this;
        }

        public Builder segmentLockStripes(int stripes) {
            this.segmentLockStripes = stripes;
            return this;
        }

        public CrmConfig build() {
            return new CrmConfig(this);
        }

        // ====================================================================
        // ENVIRONMENT HELPERS
        // ====================================================================

        private static Optional<String> getEnv(String key) {
            String value = System.getenv(key);
            if (value != null && !value.trim().isEmpty()) {
                logger.fine("Loaded env var: " + key + "=" + value);
                return Optional.of(value.trim());
            }
            return Optional.empty();
        }

        private static Optional<Long> getEnvLong(String key) {
            return getEnv(key).map(val -> {
                try {
                    return Long.parseLong(val);
                } catch (NumberFormatException e) {
                    logger.warning("Invalid long value for " + key + ": " + val);
                    return null;
                }
            });
        }

        private static Optional<Integer> getEnvInt(String key) {
            return getEnv(key).map(val -> {
                try {
                    return Integer.parseInt(val);
                } catch (NumberFormatException e) {
                    logger.warning("Invalid int value for " + key + ": " + val);
                    return null;
                }
            });
        }

        private static Optional<Boolean> getEnvBoolean(String key) {
            return getEnv(key).map(val -> {
                String normalized = val.toLowerCase();
                return "true".equals(normalized) || "1".equals(normalized) || "yes".equals(normalized);
            });
        }
    }

    // ========================================================================
    // VALIDATION
    // ========================================================================

    private void validate() {
        if (fieldCacheTtl == null || fieldCacheTtl.isNegative() || fieldCacheTtl.isZero()) {
            throw new IllegalArgumentException("fieldCacheTtl must be positive: " + fieldCacheTtl);
        }
        if (fieldCacheMaxSize <= 0) {
            throw new IllegalArgumentException("fieldCacheMaxSize must be positive: " + fieldCacheMaxSize);
        }
        if (previewMaxLimit <= 0) {
            throw new IllegalArgumentException("previewMaxLimit must be positive: " + previewMaxLimit);
        }
        if (previewDefaultLimit <= 0 || previewDefaultLimit > previewMaxLimit) {
            throw new IllegalArgumentException(
                "previewDefaultLimit must be between 1 and " + previewMaxLimit + ": " + previewDefaultLimit);
        }
        if (segmentLockStripes <= 0) {
            throw new IllegalArgumentException("segmentLockStripes must be positive: " + segmentLockStripes);
        }

        logger.fine("CRM configuration validated: " + this);
    }

    // ========================================================================
    // GETTERS
    // ========================================================================

    public Duration getFieldCacheTtl() { return fieldCacheTtl; }
    public long getFieldCacheMaxSize() { return fieldCacheMaxSize; }
    public boolean isFieldCacheRecordStats() { return fieldCacheRecordStats; }
    public int getPreviewDefaultLimit() { return previewDefaultLimit; }
    public int getPreviewMaxLimit() { return previewMaxLimit; }
    public int getSegmentLockStripes() { return segmentLockStripes; }

    /**
     * Clamps a requested preview size into {@code [1, previewMaxLimit]}; non-positive requests get the default.
     */
    public int clampPreviewLimit(int requested) {
        if (requested <= 0) {
            return previewDefaultLimit;
        }
        return Math.min(requested, previewMaxLimit);
    }

    @Override
    public String toString() {
        return "CrmConfig{" +
            "fieldCacheTtl=" + fieldCacheTtl +
            ", fieldCacheMaxSize=" + fieldCacheMaxSize +
            ", fieldCacheRecordStats=" + fieldCacheRecordStats +
            ", previewDefaultLimit=" + previewDefaultLimit +
            ", previewMaxLimit=" + previewMaxLimit +
            ", segmentLockStripes=" + segmentLockStripes +
            '}';
    }
}
