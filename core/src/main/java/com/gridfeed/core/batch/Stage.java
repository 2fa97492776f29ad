package com.gridfeed.core.batch;

/**
 * One entity type's batch of mutations. Declaration order is submission order: later
 * stages refer to entities created by earlier ones by name.
 */
public enum Stage {
    SETUP("setup", "inputdatasetup", null),
    SCENARIOS("scenarios", "scenario", "scenarios"),
    NODES("nodes", "node", "nodes"),
    NODE_STATES("node states", "nodestate", "nodestates"),
    PROCESSES("processes", "process", "processes"),
    NODE_GROUPS("node groups", "nodegroup", "nodegroups"),
    PROCESS_GROUPS("process groups", "processgroup", "processgroups"),
    NODE_MEMBERSHIPS("node group memberships", "nodegroupmember", "nodegroupmembers"),
    PROCESS_MEMBERSHIPS("process group memberships", "processgroupmember", "processgroupmembers"),
    TOPOLOGIES("topologies", "topology", "topologies"),
    MARKETS("markets", "market", "markets"),
    RISKS("risks", "risk", "risks");

    private final String label;
    private final String filePrefix;
    private final String plural;

    Stage(String label, String filePrefix, String plural) {
        this.label = label;
        this.filePrefix = filePrefix;
        this.plural = plural;
    }

    public String label() {
        return label;
    }

    public String filePrefix() {
        return filePrefix;
    }

    /** {@code null} for the setup stage, which is a single document. */
    public String plural() {
        return plural;
    }

    public boolean isSingleton() {
        return plural == null;
    }
}
