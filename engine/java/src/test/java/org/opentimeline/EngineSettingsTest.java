package org.opentimeline;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.opentimeline.model.Tag;
import org.opentimeline.resolve.TagImplications;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EngineSettingsTest {

    @AfterEach
    void clearOverride() {
        System.clearProperty(EngineSettings.PARALLEL_PROPERTY);
    }

    @Test
    void defaultsComeFromClasspath() {
        EngineSettings settings = EngineSettings.defaults();
        assertFalse(settings.parallelComposition());
        assertTrue(settings.tagImplications().rules().contains(
                new TagImplications.Rule(Tag.anonymous("king"), Tag.anonymous("person"))));
        assertEquals(3, settings.tagImplications().rules().size());
    }

    @Test
    void plainHasNoImplications() {
        assertTrue(EngineSettings.plain().tagImplications().isEmpty());
        assertFalse(EngineSettings.plain().parallelComposition());
    }

    @Test
    void loadsFromFile(@TempDir Path tmpDir) throws IOException {
        Path file = tmpDir.resolve("settings.yaml");
        Files.writeString(file, """
                parallel_composition: true
                tag_implications:
                  - when: role=king
                    then: {name: kind, value: person}
                """);
        EngineSettings settings = EngineSettings.load(file);
        assertTrue(settings.parallelComposition());
        assertEquals(List.of(new TagImplications.Rule(Tag.of("role", "king"), Tag.of("kind", "person"))),
                settings.tagImplications().rules());
    }

    @Test
    void systemPropertyOverridesParallelFlag() {
        System.setProperty(EngineSettings.PARALLEL_PROPERTY, "true");
        assertTrue(EngineSettings.fromMap(Map.of("parallel_composition", false)).parallelComposition());
    }

    @Test
    void missingKeysFallBackToPlain() {
        Map<String, Object> data = new HashMap<>();
        data.put("tag_implications", null);
        EngineSettings settings = EngineSettings.fromMap(data);
        assertFalse(settings.parallelComposition());
        assertTrue(settings.tagImplications().isEmpty());
    }

    @Test
    void ruleWithoutThenIsRejected() {
        Map<String, Object> data = Map.of("tag_implications", List.of(Map.of("when", "king")));
        assertThrows(IllegalArgumentException.class, () -> EngineSettings.fromMap(data));
    }
}
