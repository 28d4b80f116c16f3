package com.example.viticache.fallback;

import com.example.viticache.domain.RowGroup;
import com.example.viticache.domain.TableRecord;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 정적 CSV 파일 -> TableRecord 변환
 * - 구분자: 첫 줄에서 ; , \t | 중 가장 많이 나온 문자 (없으면 ;)
 * - 인코딩: UTF-8, 실패 시 ISO-8859-1
 * - 첫 행은 헤더, 합계류 키워드로 시작하는 행은 footer, 나머지는 body 그룹
 */
@Slf4j
public class CsvTableLoader {

    static final char DEFAULT_DELIMITER = ';';
    private static final char[] CANDIDATE_DELIMITERS = {';', ',', '\t', '|'};
    private static final Set<String> FOOTER_KEYWORDS =
            Set.of("total", "soma", "subtotal", "geral", "consolidado", "média", "media");

    private final CsvMapper csvMapper = new CsvMapper();

    /**
     * @return 변환된 표, 빈 파일이면 빈 TableRecord
     * @throws IOException 파일을 읽을 수 없거나 CSV 형식이 깨진 경우
     */
    public TableRecord load(Path file) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        String text = decode(bytes);
        if (text.isBlank()) {
            return TableRecord.empty();
        }
        char delimiter = detectDelimiter(text);
        List<List<String>> rows = readRows(text, delimiter);
        TableRecord record = toRecord(rows);
        log.debug("[CSV 변환] file={}, delimiter={}, body={}, footer={}",
                file.getFileName(), printable(delimiter), record.getBody().size(), record.getFooter().size());
        return record;
    }

    static String decode(byte[] bytes) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            return new String(bytes, StandardCharsets.ISO_8859_1);
        }
    }

    static char detectDelimiter(String text) {
        int end = text.indexOf('\n');
        String firstLine = end < 0 ? text : text.substring(0, end);
        char best = DEFAULT_DELIMITER;
        int bestCount = 0;
        for (char candidate : CANDIDATE_DELIMITERS) {
            int count = 0;
            for (int i = 0; i < firstLine.length(); i++) {
                if (firstLine.charAt(i) == candidate) {
                    count++;
                }
            }
            if (count > bestCount) {
                best = candidate;
                bestCount = count;
            }
        }
        return best;
    }

    private List<List<String>> readRows(String text, char delimiter) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withColumnSeparator(delimiter);
        List<List<String>> rows = new ArrayList<>();
        try (MappingIterator<String[]> it = csvMapper.readerFor(String[].class)
                .with(CsvParser.Feature.WRAP_AS_ARRAY)
                .with(schema)
                .readValues(stripBom(text))) {
            while (it.hasNextValue()) {
                rows.add(Arrays.asList(it.nextValue()));
            }
        }
        return rows;
    }

    private TableRecord toRecord(List<List<String>> rows) {
        if (rows.isEmpty()) {
            return TableRecord.empty();
        }

        // 이름이 비어 있는 헤더 컬럼은 버린다
        List<Integer> columns = new ArrayList<>();
        List<String> header = new ArrayList<>();
        List<String> headerRow = rows.get(0);
        for (int i = 0; i < headerRow.size(); i++) {
            String name = clean(headerRow.get(i));
            if (!name.isEmpty()) {
                columns.add(i);
                header.add(name);
            }
        }

        TableRecord.TableRecordBuilder builder = TableRecord.builder();
        if (!header.isEmpty()) {
            builder.headerRow(header);
        }

        for (List<String> row : rows.subList(1, rows.size())) {
            if (row.stream().allMatch(value -> clean(value).isEmpty())) {
                continue;
            }
            List<String> values = new ArrayList<>(columns.size());
            for (int column : columns) {
                values.add(column < row.size() ? clean(row.get(column)) : "");
            }
            if (!values.isEmpty() && isFooter(values.get(0))) {
                builder.footerRow(values);
            } else {
                builder.bodyGroup(RowGroup.of(values));
            }
        }
        return builder.build();
    }

    private boolean isFooter(String firstValue) {
        String lower = firstValue.toLowerCase(Locale.ROOT);
        return FOOTER_KEYWORDS.stream().anyMatch(lower::contains);
    }

    private static String clean(String value) {
        return value == null ? "" : value.trim();
    }

    private static String stripBom(String text) {
        return !text.isEmpty() && text.charAt(0) == '\uFEFF' ? text.substring(1) : text;
    }

    private static String printable(char delimiter) {
        return delimiter == '\t' ? "\\t" : String.valueOf(delimiter);
    }
}
