package com.example.viticache.source;

import com.example.viticache.domain.RowGroup;
import com.example.viticache.domain.TableRecord;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 원천 페이지 HTML -> TableRecord
 * - 대상: class="tb_base tb_dados" 표
 * - tbody 행은 tb_item 행을 기준으로 그룹화, 뒤따르는 tb_subitem 행은 하위 항목
 * - 그룹에 속하지 않는 행은 item_data가 빈 기본 그룹 하나에 모은다
 */
public class HtmlTableParser {

    static final String TABLE_SELECTOR = "table.tb_base.tb_dados";

    /**
     * @return 대상 표가 없으면 empty
     */
    public Optional<TableRecord> parse(String html) {
        if (html == null || html.isBlank()) {
            return Optional.empty();
        }
        Document document = Jsoup.parse(html);
        Element table = document.selectFirst(TABLE_SELECTOR);
        if (table == null) {
            return Optional.empty();
        }

        TableRecord.TableRecordBuilder builder = TableRecord.builder();
        // jsoup은 tbody가 없는 표에도 tbody를 만들어 준다
        for (Element section : table.children()) {
            String name = section.normalName();
            if ("thead".equals(name)) {
                sectionRows(section).forEach(builder::headerRow);
            } else if ("tbody".equals(name)) {
                groupedBody(section).forEach(builder::bodyGroup);
            } else if ("tfoot".equals(name)) {
                sectionRows(section).forEach(builder::footerRow);
            }
        }
        return Optional.of(builder.build());
    }

    private List<List<String>> sectionRows(Element section) {
        List<List<String>> rows = new ArrayList<>();
        for (Element tr : section.select("tr")) {
            List<String> cells = cells(tr);
            if (!cells.isEmpty()) {
                rows.add(cells);
            }
        }
        return rows;
    }

    private List<RowGroup> groupedBody(Element tbody) {
        List<RowGroup> groups = new ArrayList<>();
        RowGroup.RowGroupBuilder current = null;
        RowGroup.RowGroupBuilder defaultGroup = null;
        int defaultIndex = -1;

        for (Element tr : tbody.children()) {
            if (!"tr".equals(tr.normalName())) {
                continue;
            }
            List<String> cells = cells(tr);
            if (cells.isEmpty()) {
                continue;
            }
            Element firstTd = firstTd(tr);
            if (firstTd != null && firstTd.hasClass("tb_item")) {
                if (current != null) {
                    groups.add(current.build());
                }
                current = RowGroup.builder().itemData(cells);
                continue;
            }
            if (current != null && firstTd != null && firstTd.hasClass("tb_subitem")) {
                current.subItem(cells);
                continue;
            }
            if (current != null) {
                groups.add(current.build());
                current = null;
            }
            if (defaultGroup == null) {
                defaultGroup = RowGroup.builder();
                // 기본 그룹은 처음 등장한 위치에 둔다
                defaultIndex = groups.size();
                groups.add(null);
            }
            defaultGroup.subItem(cells);
        }
        if (current != null) {
            groups.add(current.build());
        }
        if (defaultGroup != null) {
            groups.set(defaultIndex, defaultGroup.build());
        }
        return groups;
    }

    private Element firstTd(Element tr) {
        for (Element cell : tr.children()) {
            if ("td".equals(cell.normalName())) {
                return cell;
            }
        }
        return null;
    }

    private List<String> cells(Element tr) {
        List<String> cells = new ArrayList<>();
        for (Element cell : tr.children()) {
            String name = cell.normalName();
            if ("td".equals(name) || "th".equals(name)) {
                cells.add(cell.text().trim());
            }
        }
        return cells;
    }
}
