package com.example.viticache.source;

import com.example.viticache.domain.Endpoint;
import com.example.viticache.domain.TableRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.net.URI;
import java.util.Optional;

/**
 * 원천 통계 페이지 HTTP 어댑터
 * HTTP 세부사항(RestTemplate, URL, HTML 파싱)은 여기서 끝나고 밖으로는 FetchResult만 나간다
 */
@Slf4j
@Component
public class VitibrasilSourceClient {

    private final RestTemplate restTemplate;
    private final VitibrasilUrlBuilder urlBuilder;
    private final HtmlTableParser parser = new HtmlTableParser();

    public VitibrasilSourceClient(RestTemplate scraperRestTemplate, VitibrasilUrlBuilder urlBuilder) {
        this.restTemplate = scraperRestTemplate;
        this.urlBuilder = urlBuilder;
    }

    public LiveFetch fetcherFor(Endpoint endpoint, Integer year, String subOption) {
        return () -> fetch(endpoint, year, subOption);
    }

    public FetchResult fetch(Endpoint endpoint, Integer year, String subOption) {
        URI uri = urlBuilder.build(endpoint, year, subOption);
        log.debug("[원천 조회] endpoint={}, uri={}", endpoint, uri);

        String html;
        try {
            ResponseEntity<String> response = restTemplate.getForEntity(uri, String.class);
            if (!response.getStatusCode().is2xxSuccessful()) {
                return FetchResult.failure(FetchError.Type.HTTP_STATUS,
                        "status " + response.getStatusCode().value());
            }
            html = response.getBody();
        } catch (HttpStatusCodeException e) {
            return FetchResult.failure(FetchError.Type.HTTP_STATUS, "status " + e.getStatusCode().value());
        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof SocketTimeoutException) {
                return FetchResult.failure(FetchError.Type.TIMEOUT, e.getMessage());
            }
            return FetchResult.failure(FetchError.Type.NETWORK, e.getMessage());
        } catch (RestClientException e) {
            return FetchResult.failure(FetchError.Type.NETWORK, e.getMessage());
        }

        Optional<TableRecord> record = parser.parse(html);
        if (record.isEmpty()) {
            return FetchResult.failure(FetchError.Type.PARSE, "data table not found");
        }
        return FetchResult.success(record.get());
    }
}
