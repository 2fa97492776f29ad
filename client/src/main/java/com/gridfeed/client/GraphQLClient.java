package com.gridfeed.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gridfeed.core.envelope.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Posts mutation envelopes to a single GraphQL endpoint.
 */
public class GraphQLClient implements MutationTransport {
    private static final Logger logger = LoggerFactory.getLogger(GraphQLClient.class);
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final URI endpoint;
    private final Map<String, String> headers;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper mapper;

    public GraphQLClient(URI endpoint, Map<String, String> headers, Duration timeout) {
        this.endpoint = endpoint;
        this.headers = new LinkedHashMap<>(headers);
        this.timeout = timeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        this.mapper = new ObjectMapper();
    }

    public GraphQLClient(URI endpoint) {
        this(endpoint, Map.of(), DEFAULT_TIMEOUT);
    }

    @Override
    public MutationResponse send(Envelope envelope) throws IOException, InterruptedException {
        String body = mapper.writeValueAsString(envelope);

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(endpoint)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body));
        headers.forEach(builder::header);

        logger.debug("POST {} ({} chars)", endpoint, body.length());
        HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        return new MutationResponse(response.statusCode(), response.body(), parse(response.body()));
    }

    private JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return mapper.readTree(body);
        } catch (JsonProcessingException e) {
            logger.debug("Response is not JSON, keeping raw body: {}", e.getOriginalMessage());
            return null;
        }
    }
}
