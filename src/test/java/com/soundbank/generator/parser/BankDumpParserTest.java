package com.soundbank.generator.parser;

import static org.assertj.core.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.soundbank.generator.model.LoadedBank;
import com.soundbank.generator.model.SourceNode;

/**
 * Unit tests for BankDumpParser.
 */
class BankDumpParserTest {

    @TempDir
    Path tempDir;

    private final BankDumpParser parser = new BankDumpParser();

    @Test
    void testParseBankWithItems() throws IOException {
        Path dump = write("init.json", """
                {
                  "bankId": 1355168291,
                  "filename": "Init.bnk",
                  "items": [
                    {
                      "name": "CAkSound",
                      "children": [
                        { "name": "ulID", "type": "sid", "value": 100, "attrs": { "hashname": "step_01" } },
                        { "name": "sourceID", "type": "tid", "value": 9001 },
                        { "name": "props", "children": [ { "name": "Volume", "value": -3.5 } ] }
                      ]
                    }
                  ]
                }
                """);

        LoadedBank bank = parser.parse(dump);

        assertThat(bank.getBankId()).isEqualTo(1355168291L);
        assertThat(bank.getFilename()).isEqualTo("Init.bnk");
        assertThat(bank.getItems()).hasSize(1);

        SourceNode sound = bank.getItems().get(0);
        assertThat(sound.getName()).isEqualTo("CAkSound");
        SourceNode sid = sound.findSid().orElseThrow();
        assertThat(sid.longValue()).isEqualTo(100);
        assertThat(sid.getHashName()).contains("step_01");
        assertThat(sound.findChild("sourceID").orElseThrow().getType()).isEqualTo("tid");
        assertThat(sound.findChild("props").orElseThrow().getChildren().get(0).doubleValue()).isEqualTo(-3.5);
    }

    @Test
    void testFilenameDefaultsToDumpName() throws IOException {
        Path dump = write("music.json", """
                { "bankId": 2, "items": [] }
                """);

        LoadedBank bank = parser.parse(dump);

        assertThat(bank.getFilename()).isEqualTo("music.json");
        assertThat(bank.getItems()).isEmpty();
    }

    @Test
    void testParseAllKeepsOrder() throws IOException {
        Path first = write("b.json", "{ \"bankId\": 2, \"filename\": \"B.bnk\" }");
        Path second = write("a.json", "{ \"bankId\": 1, \"filename\": \"A.bnk\" }");

        List<LoadedBank> banks = parser.parseAll(List.of(first, second));

        assertThat(banks).extracting(LoadedBank::getFilename).containsExactly("B.bnk", "A.bnk");
    }

    @Test
    void testMissingBankIdFails() throws IOException {
        Path dump = write("bad.json", "{ \"items\": [] }");

        assertThatThrownBy(() -> parser.parse(dump))
                .isInstanceOf(BankLoadException.class)
                .hasMessageContaining("bankId");
    }

    @Test
    void testInvalidJsonFails() throws IOException {
        Path dump = write("broken.json", "{ \"bankId\": 1, ");

        assertThatThrownBy(() -> parser.parse(dump))
                .isInstanceOf(BankLoadException.class)
                .hasMessageContaining("invalid JSON");
    }

    @Test
    void testNodeWithoutNameFails() throws IOException {
        Path dump = write("noname.json", "{ \"bankId\": 1, \"items\": [ { \"type\": \"sid\" } ] }");

        BankLoadException e = catchThrowableOfType(() -> parser.parse(dump), BankLoadException.class);

        assertThat(e).hasMessageContaining("name");
        assertThat(e.getSource()).isEqualTo(dump);
    }

    @Test
    void testMissingFileFails() {
        assertThatThrownBy(() -> parser.parse(tempDir.resolve("nope.json")))
                .isInstanceOf(BankLoadException.class);
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }
}
