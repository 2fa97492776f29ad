package com.gridfeed.core.batch;

import com.gridfeed.core.envelope.PayloadAssembler;
import com.gridfeed.core.model.GroupSet;
import com.gridfeed.core.model.MarketInput;
import com.gridfeed.core.model.ModelInputs;
import com.gridfeed.core.model.NodeInput;
import com.gridfeed.core.model.NodeMembership;
import com.gridfeed.core.model.NodeStateInput;
import com.gridfeed.core.model.ProcessInput;
import com.gridfeed.core.model.ProcessMembership;
import com.gridfeed.core.model.RiskInput;
import com.gridfeed.core.model.ScenarioInput;
import com.gridfeed.core.model.TopologyInput;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Assembled envelopes grouped by {@link Stage}. Within a stage items keep the order the
 * parsers produced them in.
 */
public class BatchPlan {
    private final Map<Stage, List<BatchItem>> batches = new EnumMap<>(Stage.class);

    public BatchPlan add(Stage stage, BatchItem item) {
        batches.computeIfAbsent(stage, s -> new ArrayList<>()).add(item);
        return this;
    }

    public List<BatchItem> items(Stage stage) {
        return List.copyOf(batches.getOrDefault(stage, List.of()));
    }

    public int size() {
        return batches.values().stream().mapToInt(List::size).sum();
    }

    public static BatchPlan from(ModelInputs model, PayloadAssembler assembler) {
        BatchPlan plan = new BatchPlan();

        if (model.setup() != null) {
            plan.add(Stage.SETUP, new BatchItem("setup", assembler.setup(model.setup())));
        }
        for (ScenarioInput scenario : model.scenarios()) {
            plan.add(Stage.SCENARIOS, new BatchItem(scenario.name(), assembler.scenario(scenario)));
        }
        for (NodeInput node : model.nodes()) {
            plan.add(Stage.NODES, new BatchItem(node.name(), assembler.node(node)));
        }
        for (NodeStateInput state : model.nodeStates()) {
            plan.add(Stage.NODE_STATES, new BatchItem(state.nodeName(), assembler.nodeState(state)));
        }
        for (ProcessInput process : model.processes()) {
            plan.add(Stage.PROCESSES, new BatchItem(process.name(), assembler.process(process)));
        }

        GroupSet groups = model.groups();
        for (String group : groups.nodeGroups()) {
            plan.add(Stage.NODE_GROUPS, new BatchItem(group, assembler.nodeGroup(group)));
        }
        for (String group : groups.processGroups()) {
            plan.add(Stage.PROCESS_GROUPS, new BatchItem(group, assembler.processGroup(group)));
        }
        for (NodeMembership membership : groups.nodeMemberships()) {
            plan.add(Stage.NODE_MEMBERSHIPS, new BatchItem(
                    membership.nodeName() + " " + membership.groupName(),
                    assembler.nodeMembership(membership)));
        }
        for (ProcessMembership membership : groups.processMemberships()) {
            plan.add(Stage.PROCESS_MEMBERSHIPS, new BatchItem(
                    membership.processName() + " " + membership.groupName(),
                    assembler.processMembership(membership)));
        }

        for (TopologyInput topology : model.topologies()) {
            plan.add(Stage.TOPOLOGIES, new BatchItem(
                    topology.processName() + " " + topology.nodeName(),
                    assembler.topology(topology)));
        }
        for (MarketInput market : model.markets()) {
            plan.add(Stage.MARKETS, new BatchItem(market.name(), assembler.market(market)));
        }
        for (RiskInput risk : model.risks()) {
            plan.add(Stage.RISKS, new BatchItem(risk.parameter(), assembler.risk(risk)));
        }
        return plan;
    }
}
