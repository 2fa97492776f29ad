package com.gridfeed.core.enrich;

import com.gridfeed.core.model.ValueDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Joins decoded series onto base entities by exact name.
 *
 * <p>Each slot has a single source sheet: a matched entity's slot is replaced by the
 * decoded list, never appended to, and entities with no match keep what they had.
 */
public class EnrichmentMerger {
    private static final Logger logger = LoggerFactory.getLogger(EnrichmentMerger.class);

    public <T> List<T> attach(List<T> entities, Map<String, List<ValueDescriptor>> series, SeriesSlot<T> slot) {
        List<T> enriched = new ArrayList<>(entities.size());
        Set<String> matched = new HashSet<>();

        for (T entity : entities) {
            String key = slot.key().apply(entity);
            List<ValueDescriptor> values = series.get(key);
            if (values == null) {
                enriched.add(entity);
            } else {
                enriched.add(slot.replace().apply(entity, values));
                matched.add(key);
            }
        }

        if (matched.size() < series.size()) {
            logger.debug("{}: {} series name(s) matched no entity", slot.name(), series.size() - matched.size());
        }
        logger.debug("{}: attached series to {} of {} entities", slot.name(), matched.size(), entities.size());
        return enriched;
    }
}
