package com.gridfeed.loader;

/**
 * CSV file names for each sheet the pipeline reads, relative to the CSV directory.
 */
public record SheetLayout(
        String setup,
        String nodes,
        String processes,
        String topology,
        String groups,
        String markets,
        String risk,
        String scenarios,
        String inflow,
        String nodePrice,
        String cf,
        String marketPrices
) {
    public static final SheetLayout DEFAULT = new SheetLayout(
            "setup.csv",
            "nodes.csv",
            "processes.csv",
            "process_topology.csv",
            "groups.csv",
            "markets.csv",
            "risk.csv",
            "scenarios.csv",
            "inflow.csv",
            "price.csv",
            "cf.csv",
            "market_prices.csv"
    );
}
