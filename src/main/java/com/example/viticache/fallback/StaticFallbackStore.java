package com.example.viticache.fallback;

import com.example.viticache.cache.BoundedResultCache;
import com.example.viticache.cache.CacheStatistics;
import com.example.viticache.config.StaticFallbackProperties;
import com.example.viticache.domain.Endpoint;
import com.example.viticache.domain.TableRecord;
import com.example.viticache.fallback.EndpointMapping.SourceRef;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * 마지막 단계의 정적 데이터 저장소 (로컬 CSV)
 * - 디렉터리는 외부에서 채워지는 읽기 전용 자원으로 취급
 * - 파일 누락/손상/빈 파일은 예외 대신 empty (Coordinator 입장에서 단순 미스)
 * - 파싱 결과는 용량 제한 LRU 캐시에 보관, 파일이 더 최근에 수정되면 다시 읽는다
 */
@Slf4j
@Component
public class StaticFallbackStore {

    private static final int MIN_TTL_SECONDS = 60;

    private final Path directory;
    private final EndpointMapping mapping;
    private final CsvTableLoader loader = new CsvTableLoader();
    private final BoundedResultCache<SourceKey, Loaded> cache;

    public StaticFallbackStore(StaticFallbackProperties properties,
                               EndpointMapping mapping,
                               CacheStatistics statistics,
                               Clock clock) {
        this.directory = Paths.get(properties.getDirectory());
        this.mapping = mapping;
        this.cache = properties.isCacheEnabled()
                ? new BoundedResultCache<>(
                        Math.max(1, properties.getMaxEntries()),
                        Duration.ofSeconds(Math.max(MIN_TTL_SECONDS, properties.getTtlSeconds())),
                        clock,
                        statistics)
                : null;
        if (!Files.isDirectory(directory)) {
            log.warn("[정적 저장소] 디렉터리가 없음 - directory={}", directory.toAbsolutePath());
        }
    }

    public Optional<TableRecord> lookup(Endpoint endpoint, String subOption) {
        SourceRef ref = mapping.resolve(endpoint, subOption);
        SourceKey key = new SourceKey(endpoint, ref.getOption());
        Path file = directory.resolve(ref.getFileName());

        FileTime modified;
        try {
            modified = Files.getLastModifiedTime(file);
        } catch (IOException e) {
            log.warn("[정적 저장소 미스] 파일 없음 - endpoint={}, file={}", endpoint, ref.getFileName());
            if (cache != null) {
                cache.remove(key);
            }
            return Optional.empty();
        }

        if (cache != null) {
            Optional<Loaded> cached = cache.get(key);
            if (cached.isPresent() && cached.get().modified().compareTo(modified) >= 0) {
                log.debug("[정적 캐시 히트] endpoint={}, option={}", endpoint, ref.getOption());
                return Optional.of(cached.get().record());
            }
        }

        TableRecord record;
        try {
            record = loader.load(file);
        } catch (IOException e) {
            log.warn("[정적 저장소 미스] 파싱 실패 - endpoint={}, file={}, reason={}",
                    endpoint, ref.getFileName(), e.getMessage());
            return Optional.empty();
        }
        if (record.isEmpty()) {
            log.warn("[정적 저장소 미스] 빈 파일 - endpoint={}, file={}", endpoint, ref.getFileName());
            return Optional.empty();
        }

        if (cache != null) {
            cache.put(key, new Loaded(record, modified));
        }
        log.info("[정적 파일 로드] endpoint={}, option={}, file={}", endpoint, ref.getOption(), ref.getFileName());
        return Optional.of(record);
    }

    /**
     * 매핑된 모든 소스를 점검한다 (요청 경로에서는 호출하지 않음)
     * 점검 결과는 캐시에 넣지 않는다
     */
    public InventoryReport validateInventory() {
        InventoryReport.InventoryReportBuilder report = InventoryReport.builder()
                .directory(directory.toString())
                .directoryExists(Files.isDirectory(directory));

        for (SourceRef ref : mapping.allSources()) {
            Path file = directory.resolve(ref.getFileName());
            boolean present = Files.isRegularFile(file);
            boolean parseable = false;
            long size = 0;
            String error = null;
            if (!present) {
                error = "file not found";
            } else {
                try {
                    size = Files.size(file);
                    if (loader.load(file).isEmpty()) {
                        error = "empty file";
                    } else {
                        parseable = true;
                    }
                } catch (IOException | RuntimeException e) {
                    error = e.getClass().getSimpleName() + ": " + e.getMessage();
                }
            }
            report.source(new InventoryReport.SourceStatus(
                    ref.getEndpoint().path(), ref.getOption(), ref.getFileName(), present, parseable, size, error));
        }
        return report.build();
    }

    public boolean isAvailable() {
        return Files.isDirectory(directory) && Files.isReadable(directory);
    }

    public int clearCache() {
        int cleared = cache == null ? 0 : cache.clear();
        log.info("[정적 캐시 비움] cleared={}", cleared);
        return cleared;
    }

    public int cacheSize() {
        return cache == null ? 0 : cache.size();
    }

    public int cacheCapacity() {
        return cache == null ? 0 : cache.maxEntries();
    }

    public long cacheTtlSeconds() {
        return cache == null ? 0 : cache.ttl().getSeconds();
    }

    public boolean isCacheEnabled() {
        return cache != null;
    }

    public Path directory() {
        return directory;
    }

    private record SourceKey(Endpoint endpoint, String option) {
    }

    private record Loaded(TableRecord record, FileTime modified) {
    }
}
