package com.example.viticache.fallback;

import com.example.viticache.domain.RowGroup;
import com.example.viticache.domain.TableRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CsvTableLoader 테스트")
class CsvTableLoaderTest {

    private final CsvTableLoader loader = new CsvTableLoader();

    @TempDir
    Path dir;

    @Test
    @DisplayName("세미콜론 CSV를 header/body/footer로 나눈다")
    void semicolon_splitsSections() throws IOException {
        // given
        Path file = write("Producao.csv",
                "Produto;Quantidade (L.)\nVINHO DE MESA;169.762.429\nSUCO;29.286.255\nTotal;199.048.684\n");

        // when
        TableRecord record = loader.load(file);

        // then
        assertThat(record.getHeader()).containsExactly(List.of("Produto", "Quantidade (L.)"));
        assertThat(record.getBody()).extracting(RowGroup::getItemData).containsExactly(
                List.of("VINHO DE MESA", "169.762.429"),
                List.of("SUCO", "29.286.255"));
        assertThat(record.getBody()).allSatisfy(group -> assertThat(group.getSubItems()).isEmpty());
        assertThat(record.getFooter()).containsExactly(List.of("Total", "199.048.684"));
    }

    @Test
    @DisplayName("첫 줄에서 쉼표/탭/파이프 구분자를 감지한다")
    void detectsDelimiter() {
        assertThat(CsvTableLoader.detectDelimiter("a,b,c\n1;2")).isEqualTo(',');
        assertThat(CsvTableLoader.detectDelimiter("a\tb\tc")).isEqualTo('\t');
        assertThat(CsvTableLoader.detectDelimiter("a|b")).isEqualTo('|');
        assertThat(CsvTableLoader.detectDelimiter("single")).isEqualTo(';');
    }

    @Test
    @DisplayName("UTF-8이 아니면 ISO-8859-1로 읽는다")
    void latin1_fallback() throws IOException {
        Path file = dir.resolve("latin.csv");
        Files.write(file, "Região;Valor\nSão Paulo;10\nMédia;10\n".getBytes(StandardCharsets.ISO_8859_1));

        TableRecord record = loader.load(file);

        assertThat(record.getHeader()).containsExactly(List.of("Região", "Valor"));
        assertThat(record.getBody().get(0).getItemData()).containsExactly("São Paulo", "10");
        assertThat(record.getFooter()).containsExactly(List.of("Média", "10"));
    }

    @Test
    @DisplayName("빈 행과 이름 없는 헤더 컬럼은 버린다")
    void skipsBlankRowsAndColumns() throws IOException {
        Path file = write("trailing.csv", "Produto;Quantidade;\nUVA;10;\n;;\n\nSubtotal geral;10;\n");

        TableRecord record = loader.load(file);

        assertThat(record.getHeader()).containsExactly(List.of("Produto", "Quantidade"));
        assertThat(record.getBody()).hasSize(1);
        assertThat(record.getBody().get(0).getItemData()).containsExactly("UVA", "10");
        assertThat(record.getFooter()).containsExactly(List.of("Subtotal geral", "10"));
    }

    @Test
    @DisplayName("짧은 행은 빈 문자열로 채운다")
    void shortRow_padded() throws IOException {
        Path file = write("short.csv", "a,b,c\n1\n");

        TableRecord record = loader.load(file);

        assertThat(record.getBody().get(0).getItemData()).containsExactly("1", "", "");
    }

    @Test
    @DisplayName("빈 파일은 빈 표")
    void emptyFile_emptyRecord() throws IOException {
        Path file = write("empty.csv", "");

        assertThat(loader.load(file).isEmpty()).isTrue();
    }

    private Path write(String name, String content) throws IOException {
        Path file = dir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}
