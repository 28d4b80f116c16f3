package com.example.viticache.controller;

import com.example.viticache.controller.dto.DataResponse;
import com.example.viticache.controller.dto.UnavailableResponse;
import com.example.viticache.domain.Endpoint;
import com.example.viticache.domain.Resolution;
import com.example.viticache.service.HealthReportService;
import com.example.viticache.service.ViticultureDataService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 통계 조회 API 컨트롤러
 * 응답의 cached 필드로 데이터 출처를 알려준다 (false | short_term | fallback | csv_fallback)
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class ViticultureController {

    private final ViticultureDataService dataService;
    private final HealthReportService healthReportService;
    private final Clock clock;

    @GetMapping("/{endpoint:producao|processamento|comercializacao|importacao|exportacao}")
    public ResponseEntity<?> getData(@PathVariable String endpoint,
                                     @RequestParam(name = Endpoint.PARAM_YEAR, required = false) String year,
                                     @RequestParam(name = Endpoint.PARAM_SUB_OPTION, required = false) String subOption) {
        Endpoint target = Endpoint.fromPath(endpoint)
                .orElseThrow(() -> new IllegalStateException("unmapped endpoint: " + endpoint));
        Integer parsedYear = parseYear(target, year, subOption);
        String normalizedSubOption = normalizeSubOption(target, year, subOption);

        log.info("[조회 요청] endpoint={}, year={}, subOption={}", target, parsedYear, normalizedSubOption);
        Resolution resolution = dataService.getData(target, parsedYear, normalizedSubOption);

        if (resolution.isResolved()) {
            return ResponseEntity.ok(DataResponse.of(target, parsedYear, normalizedSubOption, resolution.entry()));
        }
        UnavailableResponse body = UnavailableResponse.of(
                resolution.unavailable(), healthReportService.systemStatus(), Instant.now(clock).toString());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    private Integer parseYear(Endpoint endpoint, String year, String subOption) {
        if (year == null || year.isBlank()) {
            return null;
        }
        int value;
        try {
            value = Integer.parseInt(year.trim());
        } catch (NumberFormatException e) {
            throw new InvalidParameterException(endpoint.path(),
                    "Ano deve ser um número inteiro válido.", provided(year, subOption));
        }
        if (value < Endpoint.MIN_YEAR || value > Endpoint.MAX_YEAR) {
            throw new InvalidParameterException(endpoint.path(),
                    "Ano inválido. Deve estar entre " + Endpoint.MIN_YEAR + " e " + Endpoint.MAX_YEAR + ".",
                    provided(year, subOption));
        }
        return value;
    }

    private String normalizeSubOption(Endpoint endpoint, String year, String subOption) {
        if (subOption == null || subOption.isBlank()) {
            return null;
        }
        String trimmed = subOption.trim();
        if (!endpoint.supportsSubOption(trimmed)) {
            throw new InvalidParameterException(endpoint.path(),
                    "Sub-opção inválida para " + endpoint.path() + ". Opções válidas: "
                            + String.join(", ", endpoint.subOptions()),
                    provided(year, subOption));
        }
        return trimmed;
    }

    private Map<String, String> provided(String year, String subOption) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put(Endpoint.PARAM_YEAR, year);
        params.put(Endpoint.PARAM_SUB_OPTION, subOption);
        return params;
    }
}
