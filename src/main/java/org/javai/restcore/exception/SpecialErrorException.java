package org.javai.restcore.exception;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.javai.restcore.http.Response;

/**
 * Raised for a 415 response. The API uses this status for a family of special conditions
 * described in the JSON body.
 */
public class SpecialErrorException extends ResponseException {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String apiMessage;
    private final String reason;
    private final List<String> specialErrors;

    public SpecialErrorException(Response response) {
        this(response, parse(response));
    }

    private SpecialErrorException(Response response, JsonNode body) {
        super(response, "Special error \"" + body.path("message").asText("") + "\"");
        this.apiMessage = body.path("message").asText("");
        this.reason = body.path("reason").asText("");
        List<String> errors = new ArrayList<>();
        body.path("special_errors").forEach(node -> errors.add(node.asText()));
        this.specialErrors = List.copyOf(errors);
    }

    public String apiMessage() {
        return apiMessage;
    }

    public String reason() {
        return reason;
    }

    public List<String> specialErrors() {
        return specialErrors;
    }

    private static JsonNode parse(Response response) {
        try {
            JsonNode body = MAPPER.readTree(response.body());
            return body == null ? MissingNode.getInstance() : body;
        } catch (IOException e) {
            // the status alone identifies the error
            return MissingNode.getInstance();
        }
    }
}
