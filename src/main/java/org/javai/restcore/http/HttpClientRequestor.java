package org.javai.restcore.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import org.javai.restcore.FormField;
import org.javai.restcore.PreparedRequest;
import org.javai.restcore.RequestBody;
import org.javai.restcore.SessionConfig;
import org.javai.restcore.exception.ConfigurationException;
import org.javai.restcore.exception.RequestException;

/**
 * A {@link Requestor} backed by {@link HttpClient}.
 *
 * <p>Requests use HTTP/1.1 and redirects are never followed. Every request carries the
 * configured user agent followed by {@code restcore/<version>}.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Requestor requestor = HttpClientRequestor.builder("my-app/1.0 by someone")
 *     .timeout(Duration.ofSeconds(10))
 *     .build();
 * }</pre>
 */
public final class HttpClientRequestor implements Requestor {

    public static final String VERSION = "1.0.0";
    public static final String DEFAULT_OAUTH_URL = "https://oauth.reddit.com";
    public static final String DEFAULT_REDDIT_URL = "https://www.reddit.com";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(16);

    private static final int MIN_USER_AGENT_LENGTH = 7;

    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final String userAgent;
    private final String oauthUrl;
    private final String redditUrl;
    private final Duration timeout;
    private final AtomicBoolean closed = new AtomicBoolean();

    private HttpClientRequestor(Builder builder) {
        this.userAgent = builder.userAgent + " restcore/" + VERSION;
        this.oauthUrl = builder.oauthUrl;
        this.redditUrl = builder.redditUrl;
        this.timeout = builder.timeout;
        this.mapper = builder.mapper;
        this.httpClient = builder.httpClient != null
                ? builder.httpClient
                : HttpClient.newBuilder()
                        .version(HttpClient.Version.HTTP_1_1)
                        .followRedirects(HttpClient.Redirect.NEVER)
                        .connectTimeout(timeout)
                        .build();
    }

    /**
     * Creates a requestor with the default URLs and timeout.
     *
     * @param userAgent a descriptive user agent, at least 7 characters long
     * @throws ConfigurationException if the user agent is not descriptive
     */
    public HttpClientRequestor(String userAgent) {
        this(builder(userAgent));
    }

    public static Builder builder(String userAgent) {
        return new Builder(userAgent);
    }

    /**
     * Creates a requestor from resolved configuration.
     */
    public static HttpClientRequestor fromConfig(SessionConfig config) {
        return builder(config.userAgent())
                .oauthUrl(config.oauthUrl())
                .timeout(config.timeout())
                .build();
    }

    @Override
    public String oauthUrl() {
        return oauthUrl;
    }

    public String redditUrl() {
        return redditUrl;
    }

    public String userAgent() {
        return userAgent;
    }

    public Duration timeout() {
        return timeout;
    }

    @Override
    public Response request(PreparedRequest request, Map<String, String> headers) {
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(headers, "headers must not be null");
        try {
            if (closed.get()) {
                throw new IllegalStateException("requestor is closed");
            }
            HttpRequest httpRequest = toHttpRequest(request, headers);
            HttpResponse<byte[]> response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofByteArray());
            return new Response(response.statusCode(), response.headers().map(), response.body());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RequestException(e, request.method(), request.url());
        } catch (IOException | IllegalArgumentException | IllegalStateException e) {
            throw new RequestException(e, request.method(), request.url());
        }
    }

    /**
     * Marks the requestor closed; later requests fail. The JDK client releases its connection
     * pool once it is no longer referenced.
     */
    @Override
    public void close() {
        closed.set(true);
    }

    private HttpRequest toHttpRequest(PreparedRequest request, Map<String, String> headers) throws IOException {
        HttpRequest.Builder builder = HttpRequest.newBuilder(withQuery(request.url(), request.params()))
                .timeout(request.timeoutOverride().orElse(timeout))
                .header("User-Agent", userAgent);
        headers.forEach(builder::header);

        RequestBody body = request.body();
        HttpRequest.BodyPublisher publisher;
        if (body instanceof RequestBody.Form form) {
            builder.header("Content-Type", "application/x-www-form-urlencoded");
            publisher = HttpRequest.BodyPublishers.ofString(formEncode(form.fields()), StandardCharsets.UTF_8);
        } else if (body instanceof RequestBody.Raw raw) {
            publisher = HttpRequest.BodyPublishers.ofByteArray(raw.content());
        } else if (body instanceof RequestBody.Json json) {
            builder.header("Content-Type", "application/json");
            publisher = HttpRequest.BodyPublishers.ofByteArray(jsonBytes(json));
        } else if (body instanceof RequestBody.Multipart multipart) {
            String boundary = "restcore-" + UUID.randomUUID();
            builder.header("Content-Type", "multipart/form-data; boundary=" + boundary);
            publisher = HttpRequest.BodyPublishers.ofByteArray(multipartBytes(multipart, boundary));
        } else {
            publisher = HttpRequest.BodyPublishers.noBody();
        }
        return builder.method(request.method(), publisher).build();
    }

    static URI withQuery(String url, Map<String, String> params) {
        if (params.isEmpty()) {
            return URI.create(url);
        }
        StringJoiner query = new StringJoiner("&");
        params.forEach((name, value) -> query.add(encode(name) + "=" + encode(value)));
        String separator = url.contains("?") ? "&" : "?";
        return URI.create(url + separator + query);
    }

    static String formEncode(List<FormField> fields) {
        StringJoiner joiner = new StringJoiner("&");
        for (FormField field : fields) {
            joiner.add(encode(field.name()) + "=" + encode(field.value()));
        }
        return joiner.toString();
    }

    private byte[] jsonBytes(RequestBody.Json json) throws JsonProcessingException {
        return mapper.writeValueAsBytes(json.document());
    }

    private static byte[] multipartBytes(RequestBody.Multipart multipart, String boundary) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (FormField field : multipart.fields()) {
            writeAscii(out, "--" + boundary + "\r\n");
            writeAscii(out, "Content-Disposition: form-data; name=\"" + field.name() + "\"\r\n\r\n");
            out.write(field.value().getBytes(StandardCharsets.UTF_8));
            writeAscii(out, "\r\n");
        }
        for (Map.Entry<String, Path> file : multipart.files().entrySet()) {
            Path path = file.getValue();
            writeAscii(out, "--" + boundary + "\r\n");
            writeAscii(out, "Content-Disposition: form-data; name=\"" + file.getKey()
                    + "\"; filename=\"" + path.getFileName() + "\"\r\n");
            writeAscii(out, "Content-Type: application/octet-stream\r\n\r\n");
            out.write(Files.readAllBytes(path));
            writeAscii(out, "\r\n");
        }
        writeAscii(out, "--" + boundary + "--\r\n");
        return out.toByteArray();
    }

    private static void writeAscii(ByteArrayOutputStream out, String text) {
        out.writeBytes(text.getBytes(StandardCharsets.UTF_8));
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    /**
     * Builder for {@link HttpClientRequestor}.
     */
    public static final class Builder {
        private final String userAgent;
        private String oauthUrl = DEFAULT_OAUTH_URL;
        private String redditUrl = DEFAULT_REDDIT_URL;
        private Duration timeout = DEFAULT_TIMEOUT;
        private ObjectMapper mapper = new ObjectMapper();
        private HttpClient httpClient;

        private Builder(String userAgent) {
            if (userAgent == null || userAgent.length() < MIN_USER_AGENT_LENGTH) {
                throw new ConfigurationException("user_agent is not descriptive");
            }
            this.userAgent = userAgent;
        }

        public Builder oauthUrl(String oauthUrl) {
            this.oauthUrl = Objects.requireNonNull(oauthUrl, "oauthUrl must not be null");
            return this;
        }

        public Builder redditUrl(String redditUrl) {
            this.redditUrl = Objects.requireNonNull(redditUrl, "redditUrl must not be null");
            return this;
        }

        /**
         * Sets the default timeout, used for connecting and for calls that do not set their own.
         */
        public Builder timeout(Duration timeout) {
            Objects.requireNonNull(timeout, "timeout must not be null");
            if (timeout.isZero() || timeout.isNegative()) {
                throw new ConfigurationException("timeout must be positive, was: " + timeout);
            }
            this.timeout = timeout;
            return this;
        }

        public Builder objectMapper(ObjectMapper mapper) {
            this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
            return this;
        }

        /**
         * Uses a preconfigured client. It must not follow redirects.
         */
        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
            return this;
        }

        public HttpClientRequestor build() {
            return new HttpClientRequestor(this);
        }
    }
}
