package io.github.jbellis.mobilize.stats;

import io.github.jbellis.mobilize.filter.MobileRole;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Counters gathered during one mobilization pass. Not thread-safe: a pass owns
 * its instance until {@link #mergeInto(StatisticsRegistry)} hands the delta to
 * the shared registry.
 */
public final class MobilizeStats {

    public static final String PAGES_MOBILIZED = "pagesMobilized";
    public static final String KEEPER_BLOCKS = "keeperBlocks";
    public static final String HEADER_BLOCKS = "headerBlocks";
    public static final String NAVIGATIONAL_BLOCKS = "navigationalBlocks";
    public static final String CONTENT_BLOCKS = "contentBlocks";
    public static final String MARGINAL_BLOCKS = "marginalBlocks";
    public static final String DELETED_ELEMENTS = "deletedElements";

    public static final List<String> COUNTER_NAMES = List.of(
            PAGES_MOBILIZED, KEEPER_BLOCKS, HEADER_BLOCKS, NAVIGATIONAL_BLOCKS,
            CONTENT_BLOCKS, MARGINAL_BLOCKS, DELETED_ELEMENTS);

    private long pagesMobilized;
    private long keeperBlocks;
    private long headerBlocks;
    private long navigationalBlocks;
    private long contentBlocks;
    private long marginalBlocks;
    private long deletedElements;

    /**
     * Makes every counter visible in {@code registry}, so dashboards see zeros
     * before the first page is rewritten.
     */
    public static void registerAll(StatisticsRegistry registry) {
        COUNTER_NAMES.forEach(registry::register);
    }

    /**
     * Counts one block of the given role. {@link MobileRole#INVALID} is ignored.
     */
    public void recordRole(MobileRole role) {
        switch (role) {
            case KEEPER -> keeperBlocks++;
            case HEADER -> headerBlocks++;
            case NAVIGATIONAL -> navigationalBlocks++;
            case CONTENT -> contentBlocks++;
            case MARGINAL -> marginalBlocks++;
            case INVALID -> { }
        }
    }

    public void recordDeletedElement() {
        deletedElements++;
    }

    public void recordPageMobilized() {
        pagesMobilized++;
    }

    public long pagesMobilized() {
        return pagesMobilized;
    }

    public long keeperBlocks() {
        return keeperBlocks;
    }

    public long headerBlocks() {
        return headerBlocks;
    }

    public long navigationalBlocks() {
        return navigationalBlocks;
    }

    public long contentBlocks() {
        return contentBlocks;
    }

    public long marginalBlocks() {
        return marginalBlocks;
    }

    public long deletedElements() {
        return deletedElements;
    }

    /**
     * Returns the counters keyed by their registry names, in declaration order.
     */
    public Map<String, Long> asMap() {
        var map = new LinkedHashMap<String, Long>();
        map.put(PAGES_MOBILIZED, pagesMobilized);
        map.put(KEEPER_BLOCKS, keeperBlocks);
        map.put(HEADER_BLOCKS, headerBlocks);
        map.put(NAVIGATIONAL_BLOCKS, navigationalBlocks);
        map.put(CONTENT_BLOCKS, contentBlocks);
        map.put(MARGINAL_BLOCKS, marginalBlocks);
        map.put(DELETED_ELEMENTS, deletedElements);
        return map;
    }

    public void mergeInto(StatisticsRegistry registry) {
        asMap().forEach(registry::add);
    }

    @Override
    public String toString() {
        return "MobilizeStats" + asMap();
    }
}
