package com.example.viticache.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.io.Serializable;
import java.util.List;

/**
 * 표 본문의 한 그룹
 * - itemData: 그룹 대표 행 (tb_item), 기본 그룹이면 빈 목록
 * - subItems: 대표 행에 딸린 하위 행들 (tb_subitem)
 */
@Value
@Builder
@Jacksonized
public class RowGroup implements Serializable {

    @Singular("itemCell")
    List<String> itemData;

    @Singular
    List<List<String>> subItems;

    public static RowGroup of(List<String> itemData) {
        return RowGroup.builder().itemData(itemData).build();
    }
}
