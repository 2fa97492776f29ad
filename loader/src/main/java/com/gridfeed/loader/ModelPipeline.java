package com.gridfeed.loader;

import com.gridfeed.client.DispatchReport;
import com.gridfeed.client.GraphQLClient;
import com.gridfeed.client.MutationTransport;
import com.gridfeed.client.OrderedDispatcher;
import com.gridfeed.core.PipelineEvents;
import com.gridfeed.core.batch.BatchPlan;
import com.gridfeed.core.batch.BatchWriter;
import com.gridfeed.core.enrich.EnrichmentMerger;
import com.gridfeed.core.enrich.SeriesSlot;
import com.gridfeed.core.envelope.PayloadAssembler;
import com.gridfeed.core.model.GroupSet;
import com.gridfeed.core.model.MarketInput;
import com.gridfeed.core.model.ModelInputs;
import com.gridfeed.core.model.NodeInput;
import com.gridfeed.core.model.NodeStateInput;
import com.gridfeed.core.model.ProcessInput;
import com.gridfeed.core.model.RiskInput;
import com.gridfeed.core.model.ScenarioInput;
import com.gridfeed.core.model.SetupInput;
import com.gridfeed.core.model.TopologyInput;
import com.gridfeed.core.parse.GroupParser;
import com.gridfeed.core.parse.MarketParser;
import com.gridfeed.core.parse.NodeParser;
import com.gridfeed.core.parse.NodeStateParser;
import com.gridfeed.core.parse.ProcessParser;
import com.gridfeed.core.parse.RiskParser;
import com.gridfeed.core.parse.ScenarioParser;
import com.gridfeed.core.parse.SetupParser;
import com.gridfeed.core.parse.TopologyParser;
import com.gridfeed.core.series.WideSeriesDecoder;
import com.gridfeed.core.table.TabularReader;
import com.gridfeed.core.table.TabularSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs the whole load: read the sheet CSVs, parse the base entities, attach the time
 * series, assemble envelopes, write them out and, when enabled, dispatch them.
 */
public class ModelPipeline {
    private static final Logger logger = LoggerFactory.getLogger(ModelPipeline.class);

    private final LoaderConfig config;
    private final PipelineEvents events;
    private final MutationTransport transport;
    private final TabularReader reader = new TabularReader();
    private final EnrichmentMerger merger = new EnrichmentMerger();
    private final PayloadAssembler assembler = new PayloadAssembler();

    public ModelPipeline(LoaderConfig config, PipelineEvents events, MutationTransport transport) {
        this.config = config;
        this.events = events;
        this.transport = transport;
    }

    public ModelPipeline(LoaderConfig config, PipelineEvents events) {
        this(config, events, config.dispatch()
                ? new GraphQLClient(config.endpoint(), config.headers(), config.timeout())
                : null);
    }

    public PipelineResult run() throws IOException {
        ModelInputs inputs = load();
        BatchPlan plan = BatchPlan.from(inputs, assembler);
        logger.info("Assembled {} envelopes", plan.size());

        List<Path> files = new BatchWriter(config.graphqlDir(), events).write(plan);
        logger.info("Wrote {} files to {}", files.size(), config.graphqlDir());

        DispatchReport report = null;
        if (config.dispatch()) {
            logger.info("Dispatching to {}", config.endpoint());
            report = new OrderedDispatcher(transport, events).dispatch(plan);
            logger.info("Dispatch finished: {} sent, {} failed", report.sent(), report.failed());
        }
        return new PipelineResult(inputs, plan, files, report);
    }

    /**
     * Reads and parses every sheet and joins the time series onto their entities.
     */
    public ModelInputs load() {
        SheetLayout layout = config.layout();

        SetupInput setup = new SetupParser(events).parse(mandatory(layout.setup()));

        TabularSource nodeSheet = mandatory(layout.nodes());
        List<NodeInput> nodes = new NodeParser(events).parse(nodeSheet);
        List<NodeStateInput> nodeStates = new NodeStateParser(events).parse(nodeSheet);
        List<ProcessInput> processes = new ProcessParser(events).parse(mandatory(layout.processes()));
        List<MarketInput> markets = new MarketParser(events).parse(mandatory(layout.markets()));

        List<TopologyInput> topologies = new TopologyParser(events).parse(optional(layout.topology()));
        GroupSet groups = new GroupParser(events).parse(optional(layout.groups()));
        List<RiskInput> risks = new RiskParser(events).parse(optional(layout.risk()));
        List<ScenarioInput> scenarios = new ScenarioParser(events).parse(optional(layout.scenarios()));

        WideSeriesDecoder decoder = new WideSeriesDecoder(events);
        nodes = merger.attach(nodes, decoder.decode(optional(layout.nodePrice())), SeriesSlot.NODE_COST);
        nodes = merger.attach(nodes, decoder.decode(optional(layout.inflow())), SeriesSlot.NODE_INFLOW);
        processes = merger.attach(processes, decoder.decode(optional(layout.cf())), SeriesSlot.PROCESS_CF);
        markets = merger.attach(markets, decoder.decode(optional(layout.marketPrices())), SeriesSlot.MARKET_PRICE);

        return new ModelInputs(setup, scenarios, nodes, nodeStates, processes, groups, topologies, markets, risks);
    }

    private TabularSource mandatory(String fileName) {
        return reader.read(config.sheet(fileName));
    }

    private TabularSource optional(String fileName) {
        return reader.readOptional(config.sheet(fileName));
    }
}
