package com.example.datasheet.service;

import com.example.datasheet.util.identify.TokenClassifier;
import com.example.datasheet.util.rule.DesignRule;
import com.example.datasheet.util.rule.dto.DatasheetSnapshot;
import com.example.datasheet.util.table.CanonicalHeaders;
import com.example.datasheet.util.table.feature.HeaderCountBonus;
import com.example.datasheet.util.vocabulary.ExtractionVocabulary;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DatasheetSnapshotServiceTest {

    private final ExtractionVocabulary vocabulary = ExtractionVocabulary.loadDefault();
    private final DatasheetSnapshotService service = new DatasheetSnapshotService(
            new DatasheetIdentifyService(vocabulary, new TokenClassifier(vocabulary), 10, 50),
            new PinTableService(vocabulary, HeaderCountBonus.Mode.FIRST_MATCH, 100));

    @TempDir
    Path dir;

    @Test
    void buildSnapshot_shouldKeyByPrimaryIdentifierAndResolvePins() throws IOException {
        Path file = DatasheetFixtures.write(dir, "datasheet.html", DatasheetFixtures.SCENARIO_HTML);
        List<DesignRule> rules = Arrays.asList(
                new DesignRule("Power", "Decouple  VDD with 100nF", Arrays.asList("1", "gnd", "PA9"), true),
                new DesignRule("power", "decouple vdd with 100nf", Arrays.asList("VDD"), false),
                new DesignRule("Power", "short", Arrays.asList("VDD"), true),
                new DesignRule("Layout", "Keep GND plane unbroken", Collections.<String>emptyList(), null));

        Map<String, DatasheetSnapshot> snapshot = service.buildSnapshot(file, rules);

        assertThat(snapshot).containsOnlyKeys("XYZ1234A-EVK");
        DatasheetSnapshot entry = snapshot.get("XYZ1234A-EVK");
        assertThat(entry.getFilename()).isEqualTo("datasheet.html");
        assertThat(entry.getFootnote()).isEmpty();
        assertThat(entry.getPin()).hasSize(3);
        assertThat(entry.getChecklist()).hasSize(1);
        DesignRule rule = entry.getChecklist().get(0);
        assertThat(rule.getRule()).isEqualTo("Decouple VDD with 100nF");
        assertThat(rule.getPins()).containsExactly("VDD", "GND");
        assertThat(rule.getEssential()).isTrue();
    }

    @Test
    void buildSnapshot_shouldFallBackToFileStemAndSentinelTable() throws IOException {
        Path file = DatasheetFixtures.write(dir, "empty-notes.html", "<p>nothing here</p>");

        Map<String, DatasheetSnapshot> snapshot = service.buildSnapshot(file, null);

        assertThat(snapshot).containsOnlyKeys("empty-notes");
        DatasheetSnapshot entry = snapshot.get("empty-notes");
        assertThat(entry.getPin()).containsExactly(CanonicalHeaders.ALL);
        assertThat(entry.getChecklist()).isEmpty();
    }
}
