package com.example.viticache.source;

import com.example.viticache.config.ScraperProperties;
import com.example.viticache.domain.Endpoint;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;

/**
 * base-url?opcao=..[&ano=..][&subopcao=..]
 */
@Component
public class VitibrasilUrlBuilder {

    private final String baseUrl;

    public VitibrasilUrlBuilder(ScraperProperties properties) {
        this.baseUrl = properties.getBaseUrl();
    }

    public URI build(Endpoint endpoint, Integer year, String subOption) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .queryParam("opcao", endpoint.opcao());
        if (year != null) {
            builder.queryParam("ano", year);
        }
        if (subOption != null && !subOption.isBlank()) {
            builder.queryParam("subopcao", subOption);
        }
        return builder.encode().build().toUri();
    }
}
