package com.example.viticache.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "scraper")
public class ScraperProperties {

    /**
     * 원천 통계 페이지 주소
     */
    private String baseUrl = "http://vitibrasil.cnpuv.embrapa.br/index.php";

    private int connectTimeoutMs = 5_000;

    private int readTimeoutMs = 25_000;
}
