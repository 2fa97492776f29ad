package com.gridfeed.core.batch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.gridfeed.core.PipelineEvents;
import com.gridfeed.core.envelope.Envelope;
import com.gridfeed.core.envelope.FileNames;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Persists a {@link BatchPlan} as pretty-printed JSON. The setup stage is one document;
 * every other stage gets one {@code <prefix>_<name>.json} per item plus a combined
 * {@code <plural>_all.json}. Stages without items write nothing.
 */
public class BatchWriter {
    private final Path outputDir;
    private final ObjectMapper mapper;
    private final PipelineEvents events;

    public BatchWriter(Path outputDir, PipelineEvents events) {
        this.outputDir = outputDir;
        this.events = events;
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public List<Path> write(BatchPlan plan) throws IOException {
        Files.createDirectories(outputDir);
        List<Path> written = new ArrayList<>();

        for (Stage stage : Stage.values()) {
            List<BatchItem> items = plan.items(stage);
            if (items.isEmpty()) {
                continue;
            }

            if (stage.isSingleton()) {
                written.add(save(stage.filePrefix() + ".json", items.get(0).envelope()));
                continue;
            }

            Set<String> used = new HashSet<>();
            List<Envelope> all = new ArrayList<>(items.size());
            for (BatchItem item : items) {
                written.add(save(uniqueName(stage, item, used), item.envelope()));
                all.add(item.envelope());
            }
            written.add(save(stage.plural() + "_all.json", all));
        }
        return written;
    }

    private static String uniqueName(Stage stage, BatchItem item, Set<String> used) {
        String base = stage.filePrefix() + "_" + FileNames.sanitize(item.name());
        String candidate = base;
        // names that sanitize to the same text would overwrite each other
        for (int n = 2; !used.add(candidate); n++) {
            candidate = base + "_" + n;
        }
        return candidate + ".json";
    }

    private Path save(String fileName, Object value) throws IOException {
        Path path = outputDir.resolve(fileName);
        mapper.writeValue(path.toFile(), value);
        events.fileWritten(path);
        return path;
    }
}
