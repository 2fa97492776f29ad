package com.gridfeed.core.model;

import java.util.List;

/**
 * Parsed contents of the groups sheet. Group name lists are deduplicated and sorted;
 * memberships keep sheet row order.
 */
public record GroupSet(
        List<String> nodeGroups,
        List<String> processGroups,
        List<NodeMembership> nodeMemberships,
        List<ProcessMembership> processMemberships
) {
    public static final GroupSet EMPTY = new GroupSet(List.of(), List.of(), List.of(), List.of());

    public GroupSet {
        nodeGroups = List.copyOf(nodeGroups);
        processGroups = List.copyOf(processGroups);
        nodeMemberships = List.copyOf(nodeMemberships);
        processMemberships = List.copyOf(processMemberships);
    }

    public boolean isEmpty() {
        return nodeGroups.isEmpty() && processGroups.isEmpty();
    }
}
