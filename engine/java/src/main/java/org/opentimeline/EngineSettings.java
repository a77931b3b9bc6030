package org.opentimeline;

import org.opentimeline.resolve.TagImplications;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Tunables for {@link TimelineEngine}.
 *
 * <p>Defaults come from {@code opentimeline-defaults.yaml} on the classpath. The system
 * property {@code opentimeline.parallel} overrides {@code parallel_composition} wherever
 * the settings were loaded from.
 *
 * @param parallelComposition Evaluate contributing timelines on a parallel stream.
 * @param tagImplications     Automatic tags applied to every entity before evaluation.
 */
public record EngineSettings(boolean parallelComposition, TagImplications tagImplications) {

    private static final Logger logger = LoggerFactory.getLogger(EngineSettings.class);

    public static final String DEFAULTS_RESOURCE = "opentimeline-defaults.yaml";
    public static final String PARALLEL_PROPERTY = "opentimeline.parallel";

    private static final Yaml YAML = new Yaml(new SafeConstructor(new LoaderOptions()));

    public EngineSettings {
        tagImplications = tagImplications != null ? tagImplications : TagImplications.NONE;
    }

    /** Serial composition, no implications. */
    public static EngineSettings plain() {
        return new EngineSettings(false, TagImplications.NONE);
    }

    public static EngineSettings defaults() {
        try (InputStream is = EngineSettings.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (is == null) {
                throw new IllegalStateException("Missing classpath resource " + DEFAULTS_RESOURCE);
            }
            EngineSettings settings = load(is);
            logger.debug("Loaded default engine settings: {}", settings);
            return settings;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static EngineSettings load(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            EngineSettings settings = load(is);
            logger.info("Loaded engine settings from {}", path);
            return settings;
        }
    }

    public static EngineSettings load(InputStream is) {
        Map<String, Object> data = YAML.load(is);
        return fromMap(data != null ? data : Map.of());
    }

    @SuppressWarnings("unchecked")
    public static EngineSettings fromMap(Map<String, Object> data) {
        boolean parallel = Boolean.parseBoolean(String.valueOf(data.getOrDefault("parallel_composition", false)));
        String override = System.getProperty(PARALLEL_PROPERTY);
        if (override != null) {
            parallel = Boolean.parseBoolean(override);
        }

        List<TagImplications.Rule> rules = new ArrayList<>();
        Object ruleList = data.get("tag_implications");
        List<Map<String, Object>> ruleMaps = ruleList != null ? (List<Map<String, Object>>) ruleList : List.of();
        for (Map<String, Object> r : ruleMaps) {
            rules.add(new TagImplications.Rule(
                    DatasetParser.parseTag(r.get("when"), "tag implication 'when'"),
                    DatasetParser.parseTag(r.get("then"), "tag implication 'then'")));
        }
        return new EngineSettings(parallel, new TagImplications(rules));
    }
}
