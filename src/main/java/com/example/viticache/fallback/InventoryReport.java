package com.example.viticache.fallback;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * 정적 소스 점검 결과 (운영 리포트용)
 */
@Value
@Builder
public class InventoryReport {

    public enum Status {
        VALID,
        PARTIAL,
        INVALID;

        public String label() {
            return name().toLowerCase();
        }
    }

    String directory;
    boolean directoryExists;

    @Singular
    List<SourceStatus> sources;

    public long totalSources() {
        return sources.size();
    }

    public long usableSources() {
        return sources.stream().filter(SourceStatus::isUsable).count();
    }

    public Status status() {
        long usable = usableSources();
        if (usable == 0) {
            return Status.INVALID;
        }
        return usable == sources.size() ? Status.VALID : Status.PARTIAL;
    }

    @Value
    public static class SourceStatus {

        String endpoint;
        String option;
        String fileName;
        boolean present;
        boolean parseable;
        long sizeBytes;
        String error;

        public boolean isUsable() {
            return present && parseable;
        }
    }
}
