package com.gridfeed.core.envelope;

import com.gridfeed.core.model.MarketInput;
import com.gridfeed.core.model.NodeInput;
import com.gridfeed.core.model.NodeMembership;
import com.gridfeed.core.model.NodeStateInput;
import com.gridfeed.core.model.ProcessInput;
import com.gridfeed.core.model.ProcessMembership;
import com.gridfeed.core.model.RiskInput;
import com.gridfeed.core.model.ScenarioInput;
import com.gridfeed.core.model.SetupInput;
import com.gridfeed.core.model.TopologyInput;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wraps records into mutation envelopes.
 */
public class PayloadAssembler {
    private final MutationRenderer renderer;

    public PayloadAssembler(MutationRenderer renderer) {
        this.renderer = renderer;
    }

    public PayloadAssembler() {
        this(new MutationRenderer());
    }

    /**
     * @param variables one value per argument of {@code operation}, keyed by variable name
     * @throws IllegalArgumentException if the variables do not match the operation's arguments
     */
    public Envelope assemble(Operation operation, Map<String, Object> variables) {
        Map<String, Object> ordered = new LinkedHashMap<>();
        for (Argument argument : operation.arguments()) {
            if (!variables.containsKey(argument.variable())) {
                throw new IllegalArgumentException(
                        operation.field() + " requires variable '" + argument.variable() + "'");
            }
            ordered.put(argument.variable(), variables.get(argument.variable()));
        }
        if (ordered.size() != variables.size()) {
            throw new IllegalArgumentException(
                    operation.field() + " takes only " + ordered.keySet() + ", got " + variables.keySet());
        }
        return new Envelope(renderer.render(operation), ordered);
    }

    public Envelope setup(SetupInput setup) {
        return single(Operation.CREATE_INPUT_DATA_SETUP, "setup", setup);
    }

    public Envelope scenario(ScenarioInput scenario) {
        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("name", scenario.name());
        variables.put("weight", scenario.weight());
        return assemble(Operation.CREATE_SCENARIO, variables);
    }

    public Envelope node(NodeInput node) {
        return single(Operation.CREATE_NODE, "node", node);
    }

    public Envelope nodeState(NodeStateInput nodeState) {
        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("nodeName", nodeState.nodeName());
        variables.put("state", nodeState.state());
        return assemble(Operation.SET_NODE_STATE, variables);
    }

    public Envelope process(ProcessInput process) {
        return single(Operation.CREATE_PROCESS, "process", process);
    }

    public Envelope nodeGroup(String name) {
        return single(Operation.CREATE_NODE_GROUP, "name", name);
    }

    public Envelope processGroup(String name) {
        return single(Operation.CREATE_PROCESS_GROUP, "name", name);
    }

    public Envelope nodeMembership(NodeMembership membership) {
        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("nodeName", membership.nodeName());
        variables.put("groupName", membership.groupName());
        return assemble(Operation.ADD_NODE_TO_GROUP, variables);
    }

    public Envelope processMembership(ProcessMembership membership) {
        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("processName", membership.processName());
        variables.put("groupName", membership.groupName());
        return assemble(Operation.ADD_PROCESS_TO_GROUP, variables);
    }

    public Envelope topology(TopologyInput topology) {
        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("topology", topology.topology());
        variables.put("processName", topology.processName());
        variables.put("sourceNodeName", topology.sourceNodeName());
        variables.put("sinkNodeName", topology.sinkNodeName());
        return assemble(Operation.CREATE_TOPOLOGY, variables);
    }

    public Envelope market(MarketInput market) {
        return single(Operation.CREATE_MARKET, "market", market);
    }

    public Envelope risk(RiskInput risk) {
        return single(Operation.CREATE_RISK, "risk", risk);
    }

    private Envelope single(Operation operation, String variable, Object value) {
        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put(variable, value);
        return assemble(operation, variables);
    }
}
