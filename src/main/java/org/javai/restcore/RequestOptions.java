package org.javai.restcore;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Optional inputs of a request: body, files, query parameters and timeout.
 *
 * <p>The caller's maps are referenced, never modified: {@link Session} builds its own copies
 * when it prepares the request.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * RequestOptions options = RequestOptions.builder()
 *     .data(Map.of("thing_id", "t3_abc", "text", "hello"))
 *     .params(Map.of("limit", 25))
 *     .timeout(Duration.ofSeconds(5))
 *     .build();
 * JsonNode reply = session.request("POST", "/api/comment", options);
 * }</pre>
 */
public final class RequestOptions {

    private static final RequestOptions NONE = builder().build();

    private final Map<String, ?> formData;
    private final List<FormField> formFields;
    private final byte[] rawData;
    private final Map<String, Path> files;
    private final Object json;
    private final Map<String, ?> params;
    private final Duration timeout;

    private RequestOptions(Builder builder) {
        this.formData = builder.formData;
        this.formFields = builder.formFields;
        this.rawData = builder.rawData;
        this.files = builder.files;
        this.json = builder.json;
        this.params = builder.params;
        this.timeout = builder.timeout;
    }

    public static RequestOptions none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** The form data mapping, or null. */
    public Map<String, ?> formData() {
        return formData;
    }

    /** Pre-built form fields sent as given, or null. */
    public List<FormField> formFields() {
        return formFields;
    }

    /** The raw body bytes, or null. */
    public byte[] rawData() {
        return rawData;
    }

    /** Files for a multipart body, or null. */
    public Map<String, Path> files() {
        return files;
    }

    /** The value to send as JSON, or null. */
    public Object json() {
        return json;
    }

    /** The query parameters, or null. */
    public Map<String, ?> params() {
        return params;
    }

    /** The transport timeout, or null for the requestor default. */
    public Duration timeout() {
        return timeout;
    }

    public static final class Builder {
        private Map<String, ?> formData;
        private List<FormField> formFields;
        private byte[] rawData;
        private Map<String, Path> files;
        private Object json;
        private Map<String, ?> params;
        private Duration timeout;

        private Builder() {}

        /**
         * Sets a form body. The mapping is sent key-sorted with {@code api_type=json} added.
         */
        public Builder data(Map<String, ?> data) {
            this.formData = Objects.requireNonNull(data, "data must not be null");
            return this;
        }

        /**
         * Sets a form body sent exactly as given, without any added field.
         */
        public Builder data(List<FormField> fields) {
            this.formFields = Objects.requireNonNull(fields, "fields must not be null");
            return this;
        }

        /**
         * Sets a raw body sent exactly as given.
         */
        public Builder data(byte[] data) {
            this.rawData = Objects.requireNonNull(data, "data must not be null");
            return this;
        }

        public Builder files(Map<String, Path> files) {
            this.files = Objects.requireNonNull(files, "files must not be null");
            return this;
        }

        /**
         * Sets a JSON body. Objects get {@code api_type=json} added.
         */
        public Builder json(Object json) {
            this.json = Objects.requireNonNull(json, "json must not be null");
            return this;
        }

        public Builder params(Map<String, ?> params) {
            this.params = Objects.requireNonNull(params, "params must not be null");
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
            return this;
        }

        public RequestOptions build() {
            return new RequestOptions(this);
        }
    }
}
