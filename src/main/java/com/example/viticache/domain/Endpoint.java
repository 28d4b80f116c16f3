package com.example.viticache.domain;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 외부 통계 사이트에서 제공하는 5개 조회 엔드포인트
 * - opcao: 원천 페이지의 메뉴 코드
 * - subOptions: 엔드포인트별로 허용되는 세부 옵션 (폐쇄 목록)
 */
public enum Endpoint {

    PRODUCAO("producao", "opt_02",
            List.of("VINHO DE MESA", "VINHO FINO DE MESA (VINIFERA)", "SUCO DE UVA", "DERIVADOS")),
    PROCESSAMENTO("processamento", "opt_03",
            List.of("viniferas", "americanas", "mesa", "semclass")),
    COMERCIALIZACAO("comercializacao", "opt_04",
            List.of("VINHO DE MESA", "ESPUMANTES", "UVAS FRESCAS", "SUCO DE UVA")),
    IMPORTACAO("importacao", "opt_05",
            List.of("vinhos", "espumantes", "frescas", "passas", "suco")),
    EXPORTACAO("exportacao", "opt_06",
            List.of("vinho", "uva", "espumantes", "suco"));

    public static final String PARAM_YEAR = "year";
    public static final String PARAM_SUB_OPTION = "sub_option";

    public static final int MIN_YEAR = 1970;
    public static final int MAX_YEAR = 2024;

    // 캐시 키에 반영되는 파라미터 (그 외 파라미터는 키 계산에서 무시)
    private static final Set<String> KEY_PARAMETERS = Set.of(PARAM_YEAR, PARAM_SUB_OPTION);

    private final String path;
    private final String opcao;
    private final List<String> subOptions;

    Endpoint(String path, String opcao, List<String> subOptions) {
        this.path = path;
        this.opcao = opcao;
        this.subOptions = subOptions;
    }

    public String path() {
        return path;
    }

    public String opcao() {
        return opcao;
    }

    public List<String> subOptions() {
        return subOptions;
    }

    public boolean supportsSubOption(String subOption) {
        return subOption != null && subOptions.contains(subOption);
    }

    public Set<String> keyParameters() {
        return KEY_PARAMETERS;
    }

    public static Optional<Endpoint> fromPath(String path) {
        if (path == null) {
            return Optional.empty();
        }
        String normalized = path.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(endpoint -> endpoint.path.equals(normalized))
                .findFirst();
    }

    @Override
    public String toString() {
        return path;
    }
}
