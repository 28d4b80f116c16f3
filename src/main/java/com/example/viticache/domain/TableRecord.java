package com.example.viticache.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.io.Serializable;
import java.util.List;

/**
 * 스크래핑/CSV에서 얻은 구조화된 통계 표
 * 캐시에 저장된 뒤에는 변경하지 않는다 (불변)
 */
@Value
@Builder
@Jacksonized
public class TableRecord implements Serializable {

    @Singular("headerRow")
    List<List<String>> header;

    @Singular("bodyGroup")
    List<RowGroup> body;

    @Singular("footerRow")
    List<List<String>> footer;

    public static TableRecord empty() {
        return TableRecord.builder().build();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return header.isEmpty() && body.isEmpty() && footer.isEmpty();
    }
}
