package com.gridfeed.core.parse;

import com.gridfeed.core.PipelineEvents;
import com.gridfeed.core.model.TopologyInput;
import com.gridfeed.core.model.TopologyParams;
import com.gridfeed.core.table.TabularRecord;
import com.gridfeed.core.table.TabularSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import static com.gridfeed.core.parse.Cells.toDouble;

/**
 * Reads the process topology sheet. Each row links a process to one node, which the
 * {@code source_sink} column marks as the flow's source or sink. Rows with any other role
 * are dropped with a warning. {@code conversion_coeff} has no place in the topology input
 * and is not read.
 */
public class TopologyParser extends SheetParser<List<TopologyInput>> {
    static final List<String> REQUIRED = List.of(
            "process",
            "source_sink",
            "node",
            "capacity",
            "vom_cost",
            "ramp_up",
            "ramp_down",
            "initial_load",
            "initial_flow"
    );

    private enum Role {
        SOURCE(Set.of("source", "src", "s", "in", "input")),
        SINK(Set.of("sink", "snk", "d", "out", "output"));

        private final Set<String> synonyms;

        Role(Set<String> synonyms) {
            this.synonyms = synonyms;
        }

        static Role of(String raw) {
            String value = raw.trim().toLowerCase(Locale.ROOT);
            for (Role role : values()) {
                if (role.synonyms.contains(value)) {
                    return role;
                }
            }
            return null;
        }
    }

    public TopologyParser(PipelineEvents events) {
        super(events);
    }

    @Override
    public List<TopologyInput> parse(TabularSource source) {
        if (!usable(source, REQUIRED)) {
            return List.of();
        }

        List<TopologyInput> topologies = new ArrayList<>();
        for (TabularRecord row : source.records()) {
            String process = row.get("process");
            String node = row.get("node");
            if (process.isEmpty() || node.isEmpty()) {
                continue;
            }

            String rawRole = row.get("source_sink");
            Role role = Role.of(rawRole);
            if (role == null) {
                events.rowSkipped(source.name(), row.line(), "unknown source_sink value '" + rawRole + "'");
                continue;
            }

            TopologyParams params = new TopologyParams(
                    toDouble(row.get("capacity"), 0.0),
                    toDouble(row.get("vom_cost"), 0.0),
                    toDouble(row.get("ramp_up"), 0.0),
                    toDouble(row.get("ramp_down"), 0.0),
                    toDouble(row.get("initial_load"), 0.0),
                    toDouble(row.get("initial_flow"), 0.0),
                    List.of()
            );

            topologies.add(new TopologyInput(
                    process,
                    role == Role.SOURCE ? node : null,
                    role == Role.SINK ? node : null,
                    params
            ));
        }

        events.sheetParsed(source.name(), topologies.size());
        return topologies;
    }
}
