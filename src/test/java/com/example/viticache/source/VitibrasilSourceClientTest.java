package com.example.viticache.source;

import com.example.viticache.config.ScraperProperties;
import com.example.viticache.domain.Endpoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@DisplayName("VitibrasilSourceClient 테스트")
class VitibrasilSourceClientTest {

    private static final String TABLE = "<table class=\"tb_base tb_dados\"><tbody>"
            + "<tr><td class=\"tb_item\">VINHO DE MESA</td><td class=\"tb_item\">10</td></tr>"
            + "</tbody></table>";

    private MockRestServiceServer server;
    private VitibrasilSourceClient client;
    private VitibrasilUrlBuilder urlBuilder;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        ScraperProperties properties = new ScraperProperties();
        properties.setBaseUrl("http://vitibrasil.test/index.php");
        urlBuilder = new VitibrasilUrlBuilder(properties);
        client = new VitibrasilSourceClient(restTemplate, urlBuilder);
    }

    @Test
    @DisplayName("URL에 opcao/ano/subopcao를 붙인다")
    void buildsUrl() {
        URI uri = urlBuilder.build(Endpoint.PROCESSAMENTO, 2023, "viniferas");
        URI withoutParams = urlBuilder.build(Endpoint.PRODUCAO, null, null);

        assertThat(uri.toString()).isEqualTo("http://vitibrasil.test/index.php?opcao=opt_03&ano=2023&subopcao=viniferas");
        assertThat(withoutParams.toString()).isEqualTo("http://vitibrasil.test/index.php?opcao=opt_02");
    }

    @Test
    @DisplayName("정상 응답이면 표를 파싱해서 성공")
    void success() {
        server.expect(requestTo("http://vitibrasil.test/index.php?opcao=opt_02&ano=2023"))
                .andRespond(withSuccess(TABLE, MediaType.TEXT_HTML));

        FetchResult result = client.fetch(Endpoint.PRODUCAO, 2023, null);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.record().getBody().get(0).getItemData()).containsExactly("VINHO DE MESA", "10");
        server.verify();
    }

    @Test
    @DisplayName("2xx가 아니면 HTTP_STATUS 실패")
    void non2xx_httpStatus() {
        server.expect(requestTo("http://vitibrasil.test/index.php?opcao=opt_02"))
                .andRespond(withStatus(HttpStatus.BAD_GATEWAY));

        FetchResult result = client.fetch(Endpoint.PRODUCAO, null, null);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.error().getType()).isEqualTo(FetchError.Type.HTTP_STATUS);
    }

    @Test
    @DisplayName("소켓 타임아웃은 TIMEOUT 실패")
    void socketTimeout_timeout() {
        server.expect(requestTo("http://vitibrasil.test/index.php?opcao=opt_02"))
                .andRespond(withException(new SocketTimeoutException("Read timed out")));

        FetchResult result = client.fetch(Endpoint.PRODUCAO, null, null);

        assertThat(result.error().getType()).isEqualTo(FetchError.Type.TIMEOUT);
    }

    @Test
    @DisplayName("데이터 표가 없는 페이지는 PARSE 실패")
    void missingTable_parse() {
        server.expect(requestTo("http://vitibrasil.test/index.php?opcao=opt_02"))
                .andRespond(withSuccess("<html><body>manutenção</body></html>", MediaType.TEXT_HTML));

        FetchResult result = client.fetch(Endpoint.PRODUCAO, null, null);

        assertThat(result.error().getType()).isEqualTo(FetchError.Type.PARSE);
    }
}
