package org.opentimeline;

import org.opentimeline.model.Entity;
import org.opentimeline.model.EntityEntry;
import org.opentimeline.model.PartialDate;
import org.opentimeline.model.Tag;
import org.opentimeline.model.Timeline;
import org.opentimeline.model.TimelineDataset;
import org.opentimeline.model.TimelineEntry;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Calendar;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.TimeZone;

/**
 * Parses an OpenTimeline dataset file (YAML) into a {@link TimelineDataset}.
 *
 * <p>Tag expressions are kept as text. They are compiled when a timeline is resolved,
 * so a malformed expression never prevents a dataset from loading.
 */
public class DatasetParser {

    // SafeConstructor: dataset files come from users, never instantiate arbitrary types.
    private static final Yaml YAML = new Yaml(new SafeConstructor(new LoaderOptions()));

    public static TimelineDataset parse(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            return parse(is);
        }
    }

    public static TimelineDataset parse(InputStream is) {
        Map<String, Object> data = YAML.load(is);
        if (data == null) {
            throw new IllegalArgumentException("Dataset is empty");
        }
        return fromMap(data);
    }

    public static TimelineDataset fromMap(Map<String, Object> data) {
        String version = str(data.get("opentimeline_version"));
        String title = str(data.get("title"));

        List<EntityEntry> entities = maps(data.get("entities")).stream()
                .map(DatasetParser::parseEntity).toList();
        List<TimelineEntry> timelines = maps(data.get("timelines")).stream()
                .map(DatasetParser::parseTimeline).toList();

        return new TimelineDataset(version, title, entities, timelines);
    }

    private static EntityEntry parseEntity(Map<String, Object> e) {
        String id = str(e.get("id"));
        Object start = e.get("start");
        if (start == null) {
            throw new IllegalArgumentException("Entity '" + id + "': 'start' is required");
        }
        Entity entity = new Entity(
                id,
                str(e.get("name")),
                parseDate(start, "entity '" + id + "' start"),
                parseDate(e.get("end"), "entity '" + id + "' end")
        );
        return new EntityEntry(entity, parseTags(e.get("tags"), "entity '" + id + "'"));
    }

    private static TimelineEntry parseTimeline(Map<String, Object> t) {
        String id = str(t.get("id"));
        Timeline timeline = new Timeline(id, str(t.get("name")), str(t.get("expression")));
        return new TimelineEntry(
                timeline,
                strings(t.get("entities")),
                strings(t.get("subtimelines")),
                parseTags(t.get("tags"), "timeline '" + id + "'")
        );
    }

    /**
     * Accepts a YAML integer ({@code 1914}), a string ({@code "1914-06"}), a YAML timestamp
     * ({@code 1914-06-28}) or a map with {@code year}, {@code month} and {@code day}.
     * A map whose fields are all empty means no date.
     */
    static PartialDate parseDate(Object value, String context) {
        if (value == null) return null;
        try {
            if (value instanceof Integer year) return PartialDate.ofYear(year);
            if (value instanceof Date d) {
                // SnakeYAML sets these fields on a UTC Calendar, which is Julian before 1582.
                Calendar calendar = Calendar.getInstance(TimeZone.getTimeZone("UTC"));
                calendar.setTime(d);
                return PartialDate.of(calendar.get(Calendar.YEAR), calendar.get(Calendar.MONTH) + 1,
                        calendar.get(Calendar.DAY_OF_MONTH));
            }
            if (value instanceof Map<?, ?> m) {
                Integer year = integer(m.get("year"));
                Integer month = integer(m.get("month"));
                Integer day = integer(m.get("day"));
                if (year == null && month == null && day == null) return null;
                if (year == null) {
                    throw new IllegalArgumentException("month or day set without a year");
                }
                return new PartialDate(year, month, day);
            }
            return PartialDate.parse(value.toString());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(context + ": " + e.getMessage(), e);
        }
    }

    /**
     * Tags are {@code {name, value}} maps or strings: {@code "name=value"} for a named
     * tag, a bare value for an anonymous one.
     */
    static List<Tag> parseTags(Object value, String context) {
        if (value == null) return List.of();
        if (!(value instanceof List<?> list)) {
            throw new IllegalArgumentException(context + ": 'tags' must be a list");
        }
        List<Tag> tags = new ArrayList<>();
        for (Object item : list) {
            tags.add(parseTag(item, context));
        }
        return tags;
    }

    static Tag parseTag(Object item, String context) {
        if (item instanceof Map<?, ?> m) {
            Object tagValue = m.get("value");
            if (tagValue == null) {
                throw new IllegalArgumentException(context + ": tag " + m + " has no 'value'");
            }
            return Tag.of(str(m.get("name")), str(tagValue));
        }
        if (item == null) {
            throw new IllegalArgumentException(context + ": empty tag");
        }
        String text = item.toString();
        int eq = text.indexOf('=');
        if (eq > 0) {
            return Tag.of(text.substring(0, eq).trim(), text.substring(eq + 1).trim());
        }
        return Tag.anonymous(text.trim());
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> maps(Object value) {
        return value != null ? (List<Map<String, Object>>) value : List.of();
    }

    private static List<String> strings(Object value) {
        if (value == null) return List.of();
        if (!(value instanceof List<?> list)) {
            return List.of(str(value));
        }
        return list.stream().map(DatasetParser::str).toList();
    }

    private static Integer integer(Object value) {
        if (value == null) return null;
        if (value instanceof Integer i) return i;
        return Integer.valueOf(value.toString().trim());
    }

    private static String str(Object value) {
        return value != null ? value.toString() : null;
    }
}
