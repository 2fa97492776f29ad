package com.gridfeed.client;

import com.gridfeed.core.PipelineEvents;
import com.gridfeed.core.batch.BatchItem;
import com.gridfeed.core.batch.BatchPlan;
import com.gridfeed.core.batch.Stage;

import java.util.ArrayList;
import java.util.List;

/**
 * Submits a {@link BatchPlan} stage by stage, in {@link Stage} order, one item at a time.
 *
 * <p>A failed item is reported and recorded; submission carries on with the next item and
 * the next stage. Nothing is retried or rolled back.
 */
public class OrderedDispatcher {
    private final MutationTransport transport;
    private final PipelineEvents events;

    public OrderedDispatcher(MutationTransport transport, PipelineEvents events) {
        this.transport = transport;
        this.events = events;
    }

    public DispatchReport dispatch(BatchPlan plan) {
        List<DispatchReport.StageResult> stages = new ArrayList<>();
        List<DispatchReport.Failure> failures = new ArrayList<>();

        for (Stage stage : Stage.values()) {
            List<BatchItem> items = plan.items(stage);
            if (items.isEmpty()) {
                continue;
            }
            events.stageStarted(stage.label(), items.size());

            int sent = 0;
            int failed = 0;
            for (BatchItem item : items) {
                String reason = submit(item);
                if (reason == null) {
                    sent++;
                    events.itemSent(stage.label(), item.name());
                } else {
                    failed++;
                    failures.add(new DispatchReport.Failure(stage, item.name(), reason));
                    events.itemFailed(stage.label(), item.name(), reason);
                }
            }
            stages.add(new DispatchReport.StageResult(stage, sent, failed));
        }

        return new DispatchReport(stages, failures);
    }

    /**
     * @return {@code null} on success, otherwise why the item failed
     */
    private String submit(BatchItem item) {
        try {
            MutationResponse response = transport.send(item.envelope());
            return response.succeeded() ? null : response.failureReason();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "interrupted";
        } catch (Exception e) {
            return e.getClass().getSimpleName() + ": " + e.getMessage();
        }
    }
}
