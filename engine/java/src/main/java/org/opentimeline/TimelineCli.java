package org.opentimeline;

import org.opentimeline.model.Entity;
import org.opentimeline.model.TimelineDataset;
import org.opentimeline.resolve.EntityTagCounts;
import org.opentimeline.resolve.ResolutionException;
import org.opentimeline.resolve.TagCounts;
import org.opentimeline.resolve.TimelineCounts;
import org.opentimeline.resolve.TimelineView;
import org.opentimeline.store.InMemoryTimelineStore;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;

/**
 * Command-line interface for validating datasets and rendering timelines.
 * Usage: java -jar opentimeline-engine.jar &lt;dataset.yaml&gt; [timeline-id-or-name] [options]
 */
public class TimelineCli {

    private static final String USAGE =
            "Usage: java -jar opentimeline-engine.jar <dataset.yaml> [timeline-id-or-name]"
                    + " [--settings <file.yaml>] [--by-count] [--short-dates] [--entities]";

    private record Options(Path settingsPath, boolean byCount, boolean shortDates, boolean entities) {}

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        List<String> positional = new ArrayList<>();
        Path settingsPath = null;
        boolean byCount = false;
        boolean shortDates = false;
        boolean entities = false;
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--settings" -> {
                    if (i + 1 >= args.length) {
                        System.err.println(USAGE);
                        return 1;
                    }
                    settingsPath = Path.of(args[++i]);
                }
                case "--by-count" -> byCount = true;
                case "--short-dates" -> shortDates = true;
                case "--entities" -> entities = true;
                default -> {
                    if (args[i].startsWith("--")) {
                        System.err.println("Unknown option: " + args[i]);
                        System.err.println(USAGE);
                        return 1;
                    }
                    positional.add(args[i]);
                }
            }
        }
        if (positional.isEmpty() || positional.size() > 2) {
            System.err.println(USAGE);
            return 1;
        }
        Options options = new Options(settingsPath, byCount, shortDates, entities);

        Path path = Path.of(positional.get(0));
        if (!path.toFile().exists()) {
            System.err.println("Error: file not found: " + path);
            return 1;
        }

        TimelineDataset dataset;
        EngineSettings settings;
        try {
            dataset = DatasetParser.parse(path);
            settings = options.settingsPath() != null
                    ? EngineSettings.load(options.settingsPath())
                    : EngineSettings.defaults();
        } catch (Exception e) {
            System.err.println("Parse error: " + e.getMessage());
            return 1;
        }

        DatasetValidator.ValidationResult result = DatasetValidator.validate(dataset);
        if (result.hasWarnings()) {
            result.warnings().forEach(w -> System.err.println("  ! " + w));
        }
        if (!result.isValid()) {
            System.err.println("Validation failed, " + result.errors().size() + " error(s):");
            result.errors().forEach(e -> System.err.println("  * " + e));
            return 1;
        }

        TimelineEngine engine = new TimelineEngine(InMemoryTimelineStore.of(dataset), settings);
        if (positional.size() == 2) {
            return render(engine, positional.get(1), options);
        }

        System.out.printf("%s is valid: '%s', %d entit%s, %d timeline(s)%n",
                path,
                dataset.title(),
                dataset.entities().size(),
                dataset.entities().size() == 1 ? "y" : "ies",
                dataset.timelines().size());
        if (options.entities()) {
            printEntities(engine.tagCountsPerEntity(), options);
            return 0;
        }

        TimelineCounts counts = engine.entityCounts();
        List<TimelineCounts.TimelineCount> ordered = options.byCount()
                ? counts.sortedByCount(true)
                : counts.sortedByName(true);
        for (TimelineCounts.TimelineCount count : ordered) {
            System.out.printf("  %5d  %s (%s)%n", count.entityCount(), count.timeline().name(), count.timeline().id());
        }
        new TreeMap<>(counts.failures()).forEach((id, message) -> System.out.printf("  error  %s: %s%n", id, message));

        printTags("Entity tags", engine.entityTagCounts(), options);
        printTags("Timeline tags", engine.timelineTagCounts(), options);
        return 0;
    }

    private static int render(TimelineEngine engine, String idOrName, Options options) {
        TimelineView view;
        try {
            view = engine.renderByIdOrName(idOrName);
        } catch (ResolutionException e) {
            System.err.println("Resolution error: " + e.getMessage());
            return 1;
        }
        view.warnings().forEach(w -> System.err.println("  ! " + w));
        System.out.printf("%s (%d entities from %d timeline(s))%n",
                view.timeline().name(), view.entities().size(), view.contributingTimelineIds().size());
        for (Entity entity : view.entities()) {
            System.out.printf("  %-26s %s%n", span(entity, options), entity.name());
        }
        return 0;
    }

    private static void printTags(String heading, TagCounts tags, Options options) {
        if (tags.size() == 0) return;
        System.out.printf("%s (%d distinct):%n", heading, tags.size());
        List<TagCounts.TagCount> ordered = options.byCount() ? tags.sortedByCount(true) : tags.sortedByName(true);
        for (TagCounts.TagCount count : ordered) {
            System.out.printf("  %5d  %s%n", count.count(), count.tag());
        }
    }

    private static void printEntities(EntityTagCounts counts, Options options) {
        List<EntityTagCounts.EntityTagCount> ordered = options.byCount()
                ? counts.sortedByTagCount(true)
                : counts.sortedByStart(true);
        for (EntityTagCounts.EntityTagCount count : ordered) {
            System.out.printf("  %3d tag(s)  %-26s %s%n", count.tagCount(), span(count.entity(), options), count.entity().name());
        }
    }

    private static String span(Entity entity, Options options) {
        return options.shortDates() ? entity.shortSpan() : entity.span();
    }
}
