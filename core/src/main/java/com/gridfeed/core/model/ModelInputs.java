package com.gridfeed.core.model;

import java.util.List;

/**
 * Everything parsed and enriched from one workbook, ready to be assembled.
 */
public record ModelInputs(
        SetupInput setup,
        List<ScenarioInput> scenarios,
        List<NodeInput> nodes,
        List<NodeStateInput> nodeStates,
        List<ProcessInput> processes,
        GroupSet groups,
        List<TopologyInput> topologies,
        List<MarketInput> markets,
        List<RiskInput> risks
) {
    public ModelInputs {
        scenarios = List.copyOf(scenarios);
        nodes = List.copyOf(nodes);
        nodeStates = List.copyOf(nodeStates);
        processes = List.copyOf(processes);
        topologies = List.copyOf(topologies);
        markets = List.copyOf(markets);
        risks = List.copyOf(risks);
    }
}
