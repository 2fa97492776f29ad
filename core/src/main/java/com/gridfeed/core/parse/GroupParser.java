package com.gridfeed.core.parse;

import com.gridfeed.core.PipelineEvents;
import com.gridfeed.core.model.GroupSet;
import com.gridfeed.core.model.NodeMembership;
import com.gridfeed.core.model.ProcessMembership;
import com.gridfeed.core.table.TabularRecord;
import com.gridfeed.core.table.TabularSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Reads groups.csv ({@code group_type, entity, group}). Groups are collected once each and
 * sorted by name, so creation order does not depend on row order.
 */
public class GroupParser extends SheetParser<GroupSet> {
    static final List<String> REQUIRED = List.of("group_type", "entity", "group");

    public GroupParser(PipelineEvents events) {
        super(events);
    }

    @Override
    public GroupSet parse(TabularSource source) {
        if (!usable(source, REQUIRED)) {
            return GroupSet.EMPTY;
        }

        SortedSet<String> nodeGroups = new TreeSet<>();
        SortedSet<String> processGroups = new TreeSet<>();
        List<NodeMembership> nodeMemberships = new ArrayList<>();
        List<ProcessMembership> processMemberships = new ArrayList<>();

        for (TabularRecord row : source.records()) {
            String type = row.get("group_type").toLowerCase(Locale.ROOT);
            String entity = row.get("entity");
            String group = row.get("group");
            if (entity.isEmpty() || group.isEmpty()) {
                continue;
            }

            switch (type) {
                case "node" -> {
                    nodeGroups.add(group);
                    nodeMemberships.add(new NodeMembership(entity, group));
                }
                case "process" -> {
                    processGroups.add(group);
                    processMemberships.add(new ProcessMembership(entity, group));
                }
                default -> events.rowSkipped(source.name(), row.line(), "unknown group_type '" + type + "'");
            }
        }

        GroupSet groups = new GroupSet(
                new ArrayList<>(nodeGroups),
                new ArrayList<>(processGroups),
                nodeMemberships,
                processMemberships
        );
        events.sheetParsed(source.name(), nodeGroups.size() + processGroups.size());
        return groups;
    }
}
