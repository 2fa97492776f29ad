package com.gridfeed.loader;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

public record LoaderConfig(
        Path csvDir,
        Path graphqlDir,
        URI endpoint,
        Map<String, String> headers,
        boolean dispatch,
        Duration timeout,
        SheetLayout layout
) {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    public static Builder builder() {
        return new Builder();
    }

    public Path sheet(String fileName) {
        return csvDir.resolve(fileName);
    }

    public static class Builder {
        private Path csvDir = Path.of("output", "csv");
        private Path graphqlDir = Path.of("output", "graphql");
        private URI endpoint;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private boolean dispatch = false;
        private Duration timeout = DEFAULT_TIMEOUT;
        private SheetLayout layout = SheetLayout.DEFAULT;

        public Builder csvDir(Path csvDir) {
            this.csvDir = csvDir;
            return this;
        }

        public Builder graphqlDir(Path graphqlDir) {
            this.graphqlDir = graphqlDir;
            return this;
        }

        /**
         * Sets both directories to the {@code csv} and {@code graphql} children of {@code outputRoot}.
         */
        public Builder outputRoot(Path outputRoot) {
            this.csvDir = outputRoot.resolve("csv");
            this.graphqlDir = outputRoot.resolve("graphql");
            return this;
        }

        public Builder endpoint(URI endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder endpoint(String endpoint) {
            this.endpoint = endpoint == null || endpoint.isBlank() ? null : URI.create(endpoint);
            return this;
        }

        public Builder header(String name, String value) {
            this.headers.put(name, value);
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            this.headers.putAll(headers);
            return this;
        }

        public Builder bearerToken(String token) {
            if (token != null && !token.isBlank()) {
                this.headers.put("Authorization", "Bearer " + token);
            }
            return this;
        }

        public Builder dispatch(boolean dispatch) {
            this.dispatch = dispatch;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder layout(SheetLayout layout) {
            this.layout = layout;
            return this;
        }

        /**
         * @throws IllegalStateException if dispatch is enabled without an endpoint
         */
        public LoaderConfig build() {
            if (dispatch && endpoint == null) {
                throw new IllegalStateException("Dispatch is enabled but no endpoint is configured");
            }
            return new LoaderConfig(
                    csvDir,
                    graphqlDir,
                    endpoint,
                    Map.copyOf(headers),
                    dispatch,
                    timeout,
                    layout
            );
        }
    }
}
