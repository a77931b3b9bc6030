package org.opentimeline.resolve;

import org.junit.jupiter.api.Test;
import org.opentimeline.model.Entity;
import org.opentimeline.model.PartialDate;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EntityTagCountsTest {

    private final EntityTagCounts counts = new EntityTagCounts(List.of(
            new EntityTagCounts.EntityTagCount(new Entity("somme", "Somme",
                    PartialDate.ofMonth(1916, 7), PartialDate.ofMonth(1916, 11)), 3),
            new EntityTagCounts.EntityTagCount(new Entity("george", "George V",
                    PartialDate.ofYear(1865), PartialDate.ofYear(1936)), 2),
            new EntityTagCounts.EntityTagCount(new Entity("einstein", "Einstein",
                    PartialDate.ofYear(1879), PartialDate.ofYear(1955)), 1),
            new EntityTagCounts.EntityTagCount(new Entity("sarajevo", "Sarajevo",
                    PartialDate.of(1914, 6, 28)), 2)));

    private static List<String> names(List<EntityTagCounts.EntityTagCount> counts) {
        return counts.stream().map(c -> c.entity().name()).toList();
    }

    @Test
    void sortedByName() {
        assertEquals(List.of("Einstein", "George V", "Sarajevo", "Somme"), names(counts.sortedByName(true)));
        assertEquals(List.of("Somme", "Sarajevo", "George V", "Einstein"), names(counts.sortedByName(false)));
    }

    @Test
    void sortedByStart() {
        assertEquals(List.of("George V", "Einstein", "Sarajevo", "Somme"), names(counts.sortedByStart(true)));
        assertEquals(List.of("Somme", "Sarajevo", "Einstein", "George V"), names(counts.sortedByStart(false)));
    }

    @Test
    void sortedByEndKeepsOpenEndedLast() {
        assertEquals(List.of("Somme", "George V", "Einstein", "Sarajevo"), names(counts.sortedByEnd(true)));
        assertEquals(List.of("Einstein", "George V", "Somme", "Sarajevo"), names(counts.sortedByEnd(false)));
    }

    @Test
    void sortedByTagCountBreaksTiesByName() {
        assertEquals(List.of("Somme", "George V", "Sarajevo", "Einstein"), names(counts.sortedByTagCount(true)));
        assertEquals(List.of("Einstein", "George V", "Sarajevo", "Somme"), names(counts.sortedByTagCount(false)));
    }
}
