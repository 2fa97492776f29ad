package com.gridfeed.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gridfeed.core.CollectingPipelineEvents;
import com.gridfeed.core.batch.BatchItem;
import com.gridfeed.core.batch.BatchPlan;
import com.gridfeed.core.batch.Stage;
import com.gridfeed.core.envelope.Envelope;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OrderedDispatcherTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Mock
    private MutationTransport transport;

    private static Envelope envelope(String name) {
        return new Envelope("mutation { " + name + " }", Map.of("name", name));
    }

    private static MutationResponse ok() throws Exception {
        return new MutationResponse(200, "{\"data\":{}}", MAPPER.readTree("{\"data\":{}}"));
    }

    @Test
    void submitsStagesInDependencyOrder() throws Exception {
        Envelope risk = envelope("risk");
        Envelope node = envelope("node");
        Envelope group = envelope("group");
        Envelope setup = envelope("setup");
        BatchPlan plan = new BatchPlan()
                .add(Stage.RISKS, new BatchItem("alfa", risk))
                .add(Stage.NODE_GROUPS, new BatchItem("storages", group))
                .add(Stage.NODES, new BatchItem("tank1", node))
                .add(Stage.SETUP, new BatchItem("setup", setup));
        when(transport.send(any())).thenReturn(ok());

        DispatchReport report = new OrderedDispatcher(transport, new CollectingPipelineEvents()).dispatch(plan);

        InOrder inOrder = inOrder(transport);
        inOrder.verify(transport).send(setup);
        inOrder.verify(transport).send(node);
        inOrder.verify(transport).send(group);
        inOrder.verify(transport).send(risk);
        assertTrue(report.isClean());
        assertEquals(4, report.sent());
        assertEquals(List.of(Stage.SETUP, Stage.NODES, Stage.NODE_GROUPS, Stage.RISKS),
                report.stages().stream().map(DispatchReport.StageResult::stage).toList());
    }

    @Test
    void continuesPastFailedItems() throws Exception {
        Envelope tank1 = envelope("tank1");
        Envelope tank2 = envelope("tank2");
        Envelope pump = envelope("pump");
        BatchPlan plan = new BatchPlan()
                .add(Stage.NODES, new BatchItem("tank1", tank1))
                .add(Stage.NODES, new BatchItem("tank2", tank2))
                .add(Stage.PROCESSES, new BatchItem("pump", pump));
        when(transport.send(tank1)).thenThrow(new IOException("Connection refused"));
        when(transport.send(tank2)).thenReturn(new MutationResponse(500, "boom", null));
        when(transport.send(pump)).thenReturn(ok());
        CollectingPipelineEvents events = new CollectingPipelineEvents();

        DispatchReport report = new OrderedDispatcher(transport, events).dispatch(plan);

        verify(transport).send(pump);
        assertEquals(1, report.sent());
        assertEquals(2, report.failed());
        assertEquals("tank1", report.failures().get(0).item());
        assertEquals("IOException: Connection refused", report.failures().get(0).reason());
        assertEquals("HTTP 500: boom", report.failures().get(1).reason());
        assertEquals(new DispatchReport.StageResult(Stage.NODES, 0, 2), report.stages().get(0));
        assertEquals(2, events.warnings().size());
    }

    @Test
    void graphqlErrorsCountAsFailures() throws Exception {
        BatchPlan plan = new BatchPlan().add(Stage.MARKETS, new BatchItem("npe", envelope("npe")));
        String body = "{\"data\":{\"createMarket\":{\"errors\":[{\"field\":\"node\",\"message\":\"no such node\"}]}}}";
        when(transport.send(any())).thenReturn(new MutationResponse(200, body, MAPPER.readTree(body)));

        DispatchReport report = new OrderedDispatcher(transport, new CollectingPipelineEvents()).dispatch(plan);

        assertEquals(1, report.failed());
        assertEquals("createMarket: node: no such node", report.failures().get(0).reason());
    }

    @Test
    void emptyPlanSendsNothing() {
        DispatchReport report = new OrderedDispatcher(transport, new CollectingPipelineEvents()).dispatch(new BatchPlan());

        verifyNoInteractions(transport);
        assertTrue(report.stages().isEmpty());
        assertTrue(report.isClean());
    }
}
