package com.gridfeed.core.envelope;

import java.util.List;

/**
 * Every mutation the loader submits, with its arguments in declaration order.
 */
public enum Operation {
    CREATE_INPUT_DATA_SETUP("createInputDataSetup",
            new Argument("setup", "setupUpdate", "InputDataSetupInput!")),
    CREATE_SCENARIO("createScenario",
            Argument.of("name", "String!"),
            Argument.of("weight", "Float!")),
    CREATE_NODE("createNode",
            Argument.of("node", "NewNode!")),
    SET_NODE_STATE("setNodeState",
            Argument.of("nodeName", "String!"),
            Argument.of("state", "NewState!")),
    CREATE_PROCESS("createProcess",
            Argument.of("process", "NewProcess!")),
    CREATE_NODE_GROUP("createNodeGroup",
            Argument.of("name", "String!")),
    CREATE_PROCESS_GROUP("createProcessGroup",
            Argument.of("name", "String!")),
    ADD_NODE_TO_GROUP("addNodeToGroup",
            Argument.of("nodeName", "String!"),
            Argument.of("groupName", "String!")),
    ADD_PROCESS_TO_GROUP("addProcessToGroup",
            Argument.of("processName", "String!"),
            Argument.of("groupName", "String!")),
    CREATE_TOPOLOGY("createTopology",
            Argument.of("topology", "NewTopology!"),
            Argument.of("processName", "String!"),
            Argument.of("sourceNodeName", "String"),
            Argument.of("sinkNodeName", "String")),
    CREATE_MARKET("createMarket",
            Argument.of("market", "NewMarket!")),
    CREATE_RISK("createRisk",
            Argument.of("risk", "NewRisk!"));

    private final String field;
    private final List<Argument> arguments;

    Operation(String field, Argument... arguments) {
        this.field = field;
        this.arguments = List.of(arguments);
    }

    /** The mutation field, e.g. {@code createNode}. */
    public String field() {
        return field;
    }

    /** The operation name, e.g. {@code CreateNode}. */
    public String operationName() {
        return Character.toUpperCase(field.charAt(0)) + field.substring(1);
    }

    public List<Argument> arguments() {
        return arguments;
    }
}
