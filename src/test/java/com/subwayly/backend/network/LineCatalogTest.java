package com.subwayly.backend.network;

import com.subwayly.backend.exception.EmptyDatasetException;
import com.subwayly.backend.model.Line;
import com.subwayly.backend.model.Stop;
import org.junit.jupiter.api.Test;

import java.util.*;
import java.util.stream.Collectors;

import static com.subwayly.backend.network.SampleNetworks.line;
import static org.junit.jupiter.api.Assertions.*;

class LineCatalogTest {

    @Test
    void testOf_EmptyLines_ThrowsEmptyDataset() {
        assertThrows(EmptyDatasetException.class, () -> LineCatalog.of(List.of(), SampleNetworks.STOPS));
        assertThrows(EmptyDatasetException.class, () -> LineCatalog.of(null, SampleNetworks.STOPS));
    }

    @Test
    void testStopCount_CountsDistinctMembers() {
        LineCatalog catalog = LineCatalog.of(List.of(line("Loop", "Loop Line", "a", "b", "a", "c")), List.of());

        assertEquals(3, catalog.stopCount("Loop"));
        assertEquals(List.of("a", "b", "c"), catalog.findLine("Loop").orElseThrow().getStopIds());
    }

    @Test
    void testStopCount_UnknownLine_Throws() {
        LineCatalog catalog = LineCatalog.of(SampleNetworks.downtownLines(), SampleNetworks.STOPS);

        assertThrows(IllegalArgumentException.class, () -> catalog.stopCount("Silver"));
    }

    @Test
    void testExtremes_SingleMaxAndMin() {
        LineCatalog catalog = LineCatalog.of(SampleNetworks.downtownLines(), SampleNetworks.STOPS);

        StopCountExtreme max = catalog.maxStopsLines();
        StopCountExtreme min = catalog.minStopsLines();

        assertEquals(6, max.getStopCount());
        assertEquals(List.of("Red"), ids(max.getLines()));
        assertEquals(3, min.getStopCount());
        assertEquals(List.of("Blue"), ids(min.getLines()));
    }

    @Test
    void testExtremes_TiesReturnEveryLine() {
        LineCatalog catalog = LineCatalog.of(List.of(
                line("A", "A Line", "1", "2", "3"),
                line("B", "B Line", "4", "5"),
                line("C", "C Line", "6", "7", "8"),
                line("D", "D Line", "9", "10")), List.of());

        assertEquals(List.of("A", "C"), ids(catalog.maxStopsLines().getLines()));
        assertEquals(3, catalog.maxStopsLines().getStopCount());
        assertEquals(List.of("B", "D"), ids(catalog.minStopsLines().getLines()));
        assertEquals(2, catalog.minStopsLines().getStopCount());
    }

    @Test
    void testExtremes_SingleLineIsBothMaxAndMin() {
        LineCatalog catalog = LineCatalog.of(List.of(line("Only", "Only Line", "x", "y")), List.of());

        assertEquals(List.of("Only"), ids(catalog.maxStopsLines().getLines()));
        assertEquals(List.of("Only"), ids(catalog.minStopsLines().getLines()));
    }

    @Test
    void testTransferStops_ExactLineSets() {
        LineCatalog catalog = LineCatalog.of(SampleNetworks.downtownLines(), SampleNetworks.STOPS);

        Map<String, Set<String>> transfers = catalog.transferStops();

        assertEquals(4, transfers.size());
        assertEquals(Set.of("Red", "Green-B"), transfers.get("place-pktrm"));
        assertEquals(Set.of("Red", "Orange"), transfers.get("place-dwnxg"));
        assertEquals(Set.of("Green-B", "Blue"), transfers.get("place-gover"));
        assertEquals(Set.of("Orange", "Blue"), transfers.get("place-state"));
    }

    @Test
    void testTransferStops_MatchesMembershipIndex() {
        LineCatalog catalog = LineCatalog.of(SampleNetworks.downtownLines(), SampleNetworks.STOPS);

        Map<String, Set<String>> expected = catalog.getMembershipIndex().entrySet().stream()
                .filter(e -> e.getValue().size() >= 2)
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue));

        assertEquals(expected, catalog.transferStops());
    }

    @Test
    void testOf_MissingStopName_FallsBackToId() {
        LineCatalog catalog = LineCatalog.of(List.of(line("X", "X Line", "known", "unnamed")),
                List.of(new Stop("known", "Known Stop")));

        assertEquals("Known Stop", catalog.findStop("known").orElseThrow().getName());
        assertEquals("unnamed", catalog.findStop("unnamed").orElseThrow().getName());
    }

    @Test
    void testOf_DuplicateLineId_MergesStops() {
        LineCatalog catalog = LineCatalog.of(List.of(
                line("Red", "Red Line", "a", "b"),
                line("Red", "Red Line (Braintree)", "b", "c")), List.of());

        assertEquals(1, catalog.getLines().size());
        assertEquals("Red Line", catalog.getLines().get(0).getName());
        assertEquals(List.of("a", "b", "c"), catalog.getLines().get(0).getStopIds());
    }

    @Test
    void testGetMembershipIndex_IsReadOnly() {
        LineCatalog catalog = LineCatalog.of(SampleNetworks.downtownLines(), SampleNetworks.STOPS);

        assertThrows(UnsupportedOperationException.class,
                () -> catalog.getMembershipIndex().get("place-pktrm").add("Silver"));
    }

    private static List<String> ids(List<Line> lines) {
        return lines.stream().map(Line::getId).collect(Collectors.toList());
    }
}
