package com.gridfeed.loader.cli;

import com.gridfeed.loader.LoaderConfig;
import picocli.CommandLine.Option;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Options for reaching the model service, shared by the commands that can dispatch.
 */
public class ServiceOptions {

    @Option(names = {"--endpoint", "-e"}, defaultValue = "${env:GRIDFEED_ENDPOINT}",
            description = "GraphQL endpoint URL (default: $GRIDFEED_ENDPOINT)")
    String endpoint;

    @Option(names = {"--token"}, defaultValue = "${env:GRIDFEED_TOKEN}",
            description = "Bearer token sent as the Authorization header (default: $GRIDFEED_TOKEN)")
    String token;

    @Option(names = {"--header", "-H"}, description = "Extra request header, e.g. -H X-Tenant=acme")
    Map<String, String> headers = new LinkedHashMap<>();

    @Option(names = {"--dispatch"}, defaultValue = "${env:GRIDFEED_DISPATCH:-false}",
            description = "Send the mutations after writing them (default: $GRIDFEED_DISPATCH or false)")
    boolean dispatch;

    @Option(names = {"--timeout"}, defaultValue = "30", description = "Request timeout in seconds")
    long timeoutSeconds;

    LoaderConfig.Builder applyTo(LoaderConfig.Builder builder) {
        return builder
                .endpoint(endpoint)
                .headers(headers)
                .bearerToken(token)
                .dispatch(dispatch)
                .timeout(Duration.ofSeconds(timeoutSeconds));
    }
}
