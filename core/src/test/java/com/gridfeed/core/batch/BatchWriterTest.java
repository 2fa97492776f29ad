package com.gridfeed.core.batch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gridfeed.core.CollectingPipelineEvents;
import com.gridfeed.core.envelope.PayloadAssembler;
import com.gridfeed.core.model.GroupSet;
import com.gridfeed.core.model.ModelInputs;
import com.gridfeed.core.model.NodeInput;
import com.gridfeed.core.model.NodeMembership;
import com.gridfeed.core.model.RiskInput;
import com.gridfeed.core.model.SetupInput;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BatchWriterTest {

    @TempDir
    Path dir;

    private final PayloadAssembler assembler = new PayloadAssembler();
    private final ObjectMapper mapper = new ObjectMapper();

    private static NodeInput node(String name) {
        return new NodeInput(name, false, false, false, List.of(), List.of());
    }

    private ModelInputs model() {
        GroupSet groups = new GroupSet(List.of("storages"), List.of(),
                List.of(new NodeMembership("tank 1", "storages")), List.of());
        return new ModelInputs(
                SetupInput.builder().useMarketBids(true).build(),
                List.of(),
                List.of(node("tank 1"), node("tank/1"), node("elc")),
                List.of(),
                List.of(),
                groups,
                List.of(),
                List.of(),
                List.of(new RiskInput("alfa", 0.1)));
    }

    @Test
    void groupsItemsByStageInSubmissionOrder() {
        BatchPlan plan = BatchPlan.from(model(), assembler);

        assertEquals(1, plan.items(Stage.SETUP).size());
        assertEquals(List.of("tank 1", "tank/1", "elc"),
                plan.items(Stage.NODES).stream().map(BatchItem::name).toList());
        assertEquals("tank 1 storages", plan.items(Stage.NODE_MEMBERSHIPS).get(0).name());
        assertTrue(plan.items(Stage.PROCESSES).isEmpty());
        assertEquals(7, plan.size());
    }

    @Test
    void writesOneFilePerItemAndAnAggregatePerStage() throws Exception {
        CollectingPipelineEvents events = new CollectingPipelineEvents();
        new BatchWriter(dir, events).write(BatchPlan.from(model(), assembler));

        assertTrue(Files.exists(dir.resolve("inputdatasetup.json")));
        assertTrue(Files.exists(dir.resolve("node_tank_1.json")));
        assertTrue(Files.exists(dir.resolve("node_tank1.json")));
        assertTrue(Files.exists(dir.resolve("node_elc.json")));
        assertTrue(Files.exists(dir.resolve("nodes_all.json")));
        assertTrue(Files.exists(dir.resolve("nodegroup_storages.json")));
        assertTrue(Files.exists(dir.resolve("nodegroupmember_tank_1_storages.json")));
        assertTrue(Files.exists(dir.resolve("risk_alfa.json")));
        assertFalse(Files.exists(dir.resolve("processes_all.json")));
        assertFalse(Files.exists(dir.resolve("setup_all.json")));

        JsonNode all = mapper.readTree(dir.resolve("nodes_all.json").toFile());
        assertEquals(3, all.size());
        assertEquals("tank/1", all.get(1).get("variables").get("node").get("name").asText());
        assertEquals(events.files().size(), listFiles().size());
    }

    @Test
    void namesThatSanitizeAlikeDoNotCollide() throws Exception {
        BatchPlan plan = new BatchPlan()
                .add(Stage.NODES, new BatchItem("a b", assembler.node(node("a b"))))
                .add(Stage.NODES, new BatchItem("a_b", assembler.node(node("a_b"))));

        List<Path> written = new BatchWriter(dir, new CollectingPipelineEvents()).write(plan);

        assertEquals(List.of(dir.resolve("node_a_b.json"), dir.resolve("node_a_b_2.json"), dir.resolve("nodes_all.json")),
                written);
    }

    @Test
    void rerunIsByteIdentical() throws Exception {
        BatchWriter writer = new BatchWriter(dir, new CollectingPipelineEvents());
        writer.write(BatchPlan.from(model(), assembler));
        Map<Path, byte[]> first = snapshot();

        writer.write(BatchPlan.from(model(), assembler));
        Map<Path, byte[]> second = snapshot();

        assertEquals(first.keySet(), second.keySet());
        for (Path path : first.keySet()) {
            assertArrayEquals(first.get(path), second.get(path), path.toString());
        }
    }

    private List<Path> listFiles() throws Exception {
        try (var stream = Files.list(dir)) {
            return new ArrayList<>(stream.sorted().toList());
        }
    }

    private Map<Path, byte[]> snapshot() throws Exception {
        Map<Path, byte[]> contents = new java.util.TreeMap<>();
        for (Path path : listFiles()) {
            contents.put(path, Files.readAllBytes(path));
        }
        return contents;
    }
}
