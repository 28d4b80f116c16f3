package com.example.viticache.controller.dto;

import com.example.viticache.domain.CacheEntry;
import com.example.viticache.domain.Endpoint;
import com.example.viticache.domain.Provenance;
import com.example.viticache.domain.TableRecord;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * 조회 성공 응답
 */
@Value
@Builder
public class DataResponse {

    TableRecord data;
    Provenance cached;
    String endpoint;
    String status;
    String year;
    String subOption;
    String dataSource;
    String freshness;
    Instant storedAt;

    public static DataResponse of(Endpoint endpoint, Integer year, String subOption, CacheEntry entry) {
        Provenance provenance = entry.getProvenance();
        return DataResponse.builder()
                .data(entry.getPayload())
                .cached(provenance)
                .endpoint(endpoint.path())
                .status("success")
                .year(year == null ? "unknown" : String.valueOf(year))
                .subOption(subOption)
                .dataSource(provenance.dataSource())
                .freshness(provenance.freshness())
                .storedAt(entry.getStoredAt())
                .build();
    }
}
