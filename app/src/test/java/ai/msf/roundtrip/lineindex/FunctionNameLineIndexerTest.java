package ai.msf.roundtrip.lineindex;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

import ai.msf.roundtrip.Fixtures;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class FunctionNameLineIndexerTest {

    private final LineIndexer indexer = new FunctionNameLineIndexer();

    @Test
    void indexesFunctionNamesOfFixture() {
        LineIndex index = indexer.buildLineIndex(Fixtures.read(Fixtures.FIVE_FUNCTIONS));

        assertThat(index.entries())
                .extracting(LineIndexEntry::name)
                .containsExactly("DC Voltage", "AC Voltage", "Resistance", "DC Current", "Frequency");
        assertThat(index.entries())
                .extracting(LineIndexEntry::lineNumber)
                .containsExactly(41, 190, 257, 378, 445);
        assertThat(index.entries()).allMatch(entry -> entry.columnStart() == 4);
        // trailing newline opens an empty last line
        assertThat(index.totalLines()).isEqualTo(509);
    }

    @Test
    void reportsLineAndColumnDeepInDocument() {
        StringBuilder text = new StringBuilder();
        for (int i = 1; i < 1044; i++) {
            text.append("      <noteidlist></noteidlist>\n");
        }
        text.append("    <functionname>Voltage, DC</functionname>\n");
        text.append("  </function>\n");

        LineIndex index = indexer.buildLineIndex(text.toString());

        assertThat(index.findByLine(1044)).hasValueSatisfying(entry -> {
            assertThat(entry.name()).isEqualTo("Voltage, DC");
            assertThat(entry.columnStart()).isEqualTo(4);
        });
        assertThat(index.isIndexedLine(1043)).isFalse();
        assertThat(index.isIndexedLine(1045)).isFalse();
    }

    @Test
    void indexesLargeDocumentQuickly() {
        String text = Fixtures.read(Fixtures.FIVE_FUNCTIONS).repeat(100);
        indexer.buildLineIndex(text);

        // 50 ms is the interactive target; the bound leaves room for slow build machines
        LineIndex index = assertTimeoutPreemptively(Duration.ofMillis(500), () -> {
            LineIndex built = indexer.buildLineIndex(text);
            assertThat(built.findByLine(41 + 99 * 508)).isPresent();
            return built;
        });

        assertThat(index.totalLines()).isEqualTo(50_801);
        assertThat(index.entries()).hasSize(500);
        assertThat(index.findByLine(50_333)).hasValueSatisfying(entry -> {
            assertThat(entry.name()).isEqualTo("DC Voltage");
            assertThat(entry.columnStart()).isEqualTo(4);
        });
        assertThat(index.isIndexedLine(445 + 50 * 508)).isTrue();
        assertThat(index.isIndexedLine(446 + 50 * 508)).isFalse();
        assertThat(index.searchByName("frequency")).hasSize(100);
    }

    @Test
    void acceptsCrlfAndDecodesEntities() {
        String text = "<instrument>\r\n"
                + "  <function>\r\n"
                + "    <functionname> Volts &amp; Amps </functionname>\r\n"
                + "  </function>\r\n"
                + "<functionname>&lt;Ohms&gt;</functionname>";

        LineIndex index = indexer.buildLineIndex(text);

        assertThat(index.entries()).containsExactly(
                new LineIndexEntry("Volts & Amps", 3, 4),
                new LineIndexEntry("<Ohms>", 5, 0));
        assertThat(index.totalLines()).isEqualTo(5);
    }

    @Test
    void skipsEmptyAndSplitElements() {
        String text = "<functionname></functionname>\n"
                + "<functionname>   </functionname>\n"
                + "<functionname>Split\n"
                + "</functionname>\n"
                + "<functionname>Kept</functionname>\n";

        LineIndex index = indexer.buildLineIndex(text);

        assertThat(index.entries()).containsExactly(new LineIndexEntry("Kept", 5, 0));
    }

    @Test
    void emptyTextYieldsEmptyIndex() {
        assertThat(indexer.buildLineIndex("")).isEqualTo(LineIndex.empty());
        assertThat(indexer.buildLineIndex(null).entries()).isEmpty();
    }

    @Test
    void searchesNamesCaseInsensitively() {
        LineIndex index = indexer.buildLineIndex(Fixtures.read(Fixtures.FIVE_FUNCTIONS));

        assertThat(index.searchByName("voltage"))
                .extracting(LineIndexEntry::lineNumber)
                .containsExactly(41, 190);
        assertThat(index.searchByName("DC "))
                .extracting(LineIndexEntry::name)
                .containsExactly("DC Voltage", "DC Current");
        assertThat(index.searchByName(" ")).hasSize(5);
        assertThat(index.searchByName("capacitance")).isEmpty();
    }
}
