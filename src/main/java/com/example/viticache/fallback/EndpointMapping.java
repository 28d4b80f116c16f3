package com.example.viticache.fallback;

import com.example.viticache.domain.Endpoint;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 엔드포인트(+세부 옵션) -> 정적 CSV 파일 매핑
 * 프로세스 시작 시 한 번 만들어지고 이후 변경되지 않는다
 */
public final class EndpointMapping {

    public static final String DEFAULT_OPTION = "default";

    private final Map<Endpoint, Sources> sources;

    private EndpointMapping(Map<Endpoint, Sources> sources) {
        this.sources = Collections.unmodifiableMap(new EnumMap<>(sources));
    }

    public static EndpointMapping defaults() {
        Map<Endpoint, Sources> map = new EnumMap<>(Endpoint.class);
        map.put(Endpoint.PRODUCAO, sameFileForAll(Endpoint.PRODUCAO, "Producao.csv"));
        map.put(Endpoint.PROCESSAMENTO, new Sources("ProcessaViniferas.csv", ordered(
                "viniferas", "ProcessaViniferas.csv",
                "americanas", "ProcessaAmericanas.csv",
                "mesa", "ProcessaMesa.csv",
                "semclass", "ProcessaSemclass.csv")));
        map.put(Endpoint.COMERCIALIZACAO, sameFileForAll(Endpoint.COMERCIALIZACAO, "Comercio.csv"));
        map.put(Endpoint.IMPORTACAO, new Sources("ImpVinhos.csv", ordered(
                "vinhos", "ImpVinhos.csv",
                "espumantes", "ImpEspumantes.csv",
                "frescas", "ImpFrescas.csv",
                "passas", "ImpPassas.csv",
                "suco", "ImpSuco.csv")));
        map.put(Endpoint.EXPORTACAO, new Sources("ExpVinho.csv", ordered(
                "vinho", "ExpVinho.csv",
                "uva", "ExpUva.csv",
                "espumantes", "ExpEspumantes.csv",
                "suco", "ExpSuco.csv")));
        return new EndpointMapping(map);
    }

    /**
     * 세부 옵션이 없거나 매핑에 없으면 엔드포인트 기본 파일로 대체한다
     */
    public SourceRef resolve(Endpoint endpoint, String subOption) {
        Sources entry = sources.get(endpoint);
        if (subOption != null) {
            String fileName = entry.bySubOption().get(subOption.trim());
            if (fileName != null) {
                return new SourceRef(endpoint, subOption.trim(), fileName);
            }
        }
        return new SourceRef(endpoint, DEFAULT_OPTION, entry.defaultFile());
    }

    /**
     * 모든 (엔드포인트, 세부 옵션|default) 조합, 인벤토리 점검용
     */
    public List<SourceRef> allSources() {
        List<SourceRef> refs = new ArrayList<>();
        sources.forEach((endpoint, entry) -> {
            refs.add(new SourceRef(endpoint, DEFAULT_OPTION, entry.defaultFile()));
            entry.bySubOption().forEach((option, file) -> refs.add(new SourceRef(endpoint, option, file)));
        });
        return refs;
    }

    private static Sources sameFileForAll(Endpoint endpoint, String fileName) {
        Map<String, String> bySubOption = new LinkedHashMap<>();
        endpoint.subOptions().forEach(option -> bySubOption.put(option, fileName));
        return new Sources(fileName, bySubOption);
    }

    private static Map<String, String> ordered(String... pairs) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put(pairs[i], pairs[i + 1]);
        }
        return map;
    }

    private record Sources(String defaultFile, Map<String, String> bySubOption) {

        private Sources {
            bySubOption = Collections.unmodifiableMap(new LinkedHashMap<>(bySubOption));
        }
    }

    /**
     * 해석된 정적 소스
     */
    @Value
    public static class SourceRef {

        Endpoint endpoint;

        /**
         * 실제로 사용된 세부 옵션 (대체되었으면 "default")
         */
        String option;

        String fileName;
    }
}
