package com.gridfeed.client;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * An HTTP status and response body. {@code json} is {@code null} when the body was not JSON;
 * the raw body is always kept.
 */
public record MutationResponse(int status, String body, JsonNode json) {

    public boolean isHttpSuccess() {
        return status >= 200 && status < 300;
    }

    /**
     * GraphQL errors from the top-level {@code errors} list and from any {@code errors} list
     * a mutation returned under {@code data}.
     */
    public List<String> errors() {
        List<String> messages = new ArrayList<>();
        if (json == null) {
            return messages;
        }
        collect(json.path("errors"), null, messages);

        JsonNode data = json.path("data");
        if (data.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = data.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                collect(field.getValue().path("errors"), field.getKey(), messages);
            }
        }
        return messages;
    }

    public boolean succeeded() {
        return isHttpSuccess() && errors().isEmpty();
    }

    /**
     * A one-line reason for a failed response.
     */
    public String failureReason() {
        if (!isHttpSuccess()) {
            return "HTTP " + status + ": " + abbreviate(body);
        }
        return String.join("; ", errors());
    }

    private static void collect(JsonNode errors, String mutation, List<String> messages) {
        if (!errors.isArray()) {
            return;
        }
        for (JsonNode error : errors) {
            StringBuilder message = new StringBuilder();
            if (mutation != null) {
                message.append(mutation).append(": ");
            }
            if (error.hasNonNull("field")) {
                message.append(error.get("field").asText()).append(": ");
            }
            message.append(error.path("message").asText(error.toString()));
            messages.add(message.toString());
        }
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        String flat = text.replaceAll("\\s+", " ").trim();
        return flat.length() > 200 ? flat.substring(0, 200) + "..." : flat;
    }
}
