package org.javai.restcore;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.javai.restcore.auth.Authorizer;
import org.javai.restcore.auth.RefreshableAuthorizer;
import org.javai.restcore.classify.AttemptOutcome;
import org.javai.restcore.classify.OutcomeClassifier;
import org.javai.restcore.classify.ResponseClassification;
import org.javai.restcore.classify.StatusTable;
import org.javai.restcore.classify.TransportFailureClassifier;
import org.javai.restcore.exception.ConfigurationException;
import org.javai.restcore.exception.MalformedPayloadException;
import org.javai.restcore.exception.RequestException;
import org.javai.restcore.exception.ResponseException;
import org.javai.restcore.exception.UnexpectedStatusException;
import org.javai.restcore.http.HttpClientRequestor;
import org.javai.restcore.http.Requestor;
import org.javai.restcore.http.Response;
import org.javai.restcore.ops.OpReporter;
import org.javai.restcore.ops.RequestFailure;
import org.javai.restcore.ratelimit.HeaderRateLimiter;
import org.javai.restcore.ratelimit.RateLimiter;
import org.javai.restcore.retry.FiniteRetryStrategy;
import org.javai.restcore.retry.RetryStrategy;
import org.javai.restcore.retry.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The low-level connection to the API: sends authenticated requests, paces them, retries
 * transient failures and turns error statuses into exceptions.
 *
 * <p>A session is safe to share between threads. Each call to {@link #request} runs on the
 * calling thread; its attempts are strictly sequential and the backoff between them blocks.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * try (Session session = Session.builder()
 *         .authorizer(authorizer)
 *         .requestor(new HttpClientRequestor("my-app/1.0 by someone"))
 *         .reporter(new Log4jOpReporter())
 *         .build()) {
 *     JsonNode me = session.request("GET", "/api/v1/me");
 * }
 * }</pre>
 */
public final class Session implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Session.class);

    private final Authorizer authorizer;
    private final Requestor requestor;
    private final RateLimiter rateLimiter;
    private final RetryStrategy retryStrategy;
    private final Sleeper sleeper;
    private final OpReporter reporter;
    private final OutcomeClassifier classifier;
    private final ObjectMapper mapper;
    private final RequestNormalizer normalizer;

    private Session(Builder builder) {
        if (builder.authorizer == null) {
            throw new ConfigurationException("invalid Authorizer: null");
        }
        if (builder.requestor == null) {
            throw new ConfigurationException("invalid Requestor: null");
        }
        this.authorizer = builder.authorizer;
        this.requestor = builder.requestor;
        this.rateLimiter = builder.rateLimiter != null ? builder.rateLimiter : new HeaderRateLimiter();
        this.retryStrategy = builder.retryStrategy;
        this.sleeper = builder.sleeper;
        this.reporter = builder.reporter;
        this.classifier = new OutcomeClassifier(builder.transportClassifier);
        this.mapper = builder.mapper;
        this.normalizer = new RequestNormalizer(mapper);
    }

    /**
     * Creates a session with the default rate limiter and retry strategy.
     *
     * @throws ConfigurationException if either argument is null
     */
    public static Session session(Authorizer authorizer, Requestor requestor) {
        return builder().authorizer(authorizer).requestor(requestor).build();
    }

    /**
     * Creates a session over an {@link HttpClientRequestor} built from the given configuration.
     */
    public static Session fromConfig(SessionConfig config, Authorizer authorizer) {
        Objects.requireNonNull(config, "config must not be null");
        return builder()
                .authorizer(authorizer)
                .requestor(HttpClientRequestor.fromConfig(config))
                .retryStrategy(new FiniteRetryStrategy(config.retries()))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Sends a request without body or extra parameters.
     *
     * @see #request(String, String, RequestOptions)
     */
    public JsonNode request(String method, String path) {
        return request(method, path, RequestOptions.none());
    }

    /**
     * Returns the JSON content of the resource at {@code path}.
     *
     * <p>The access token is refreshed automatically when it has expired and the authorizer
     * can refresh it.
     *
     * @param method the HTTP verb, such as {@code GET} or {@code POST}
     * @param path the path, resolved against the requestor's OAuth URL; characters not allowed in a URI are percent-encoded
     * @param options the body, files, query parameters and timeout
     * @return the decoded JSON body; {@link TextNode} {@code ""} for an empty body;
     *         {@link MissingNode} for a 204 response
     * @throws ResponseException for an error status
     * @throws RequestException for a network fault that could not be retried away
     * @throws ConfigurationException for an invalid invocation
     * @throws UnexpectedStatusException for a status the client has no mapping for
     */
    public JsonNode request(String method, String path, RequestOptions options) {
        PreparedRequest request = prepare(method, path, options);
        return requestWithRetries(request);
    }

    PreparedRequest prepare(String method, String path, RequestOptions options) {
        return normalizer.normalize(method, requestor.oauthUrl(), path, options);
    }

    /**
     * Closes the underlying requestor.
     */
    @Override
    public void close() {
        requestor.close();
    }

    private JsonNode requestWithRetries(PreparedRequest request) {
        RetryStrategy state = retryStrategy;
        int attemptNumber = 1;

        while (true) {
            logRequest(request);
            AttemptOutcome outcome = makeRequest(request);

            boolean refreshable = authorizer instanceof RefreshableAuthorizer;
            if (outcome instanceof AttemptOutcome.Responded responded
                    && responded.response().statusCode() == StatusTable.UNAUTHORIZED) {
                authorizer.clearAccessToken();
            }

            ResponseClassification classification = classifier.classify(outcome, state, refreshable);
            if (!classification.isRetry()) {
                if (classifier.wouldRetry(outcome, refreshable)) {
                    reporter.reportRetryExhausted(RequestFailure.of(request, outcome, classification), attemptNumber);
                }
                return complete(request, outcome, classification);
            }

            logger.warn("Retrying due to {} status: {} {}", outcome.describeCause(), request.method(), request.url());
            Optional<Duration> delay = state.sleepDuration();
            reporter.reportRetryAttempt(RequestFailure.of(request, outcome, classification), attemptNumber,
                    delay.orElse(Duration.ZERO));
            delay.ifPresent(this::sleep);
            state = state.consumeAvailableRetry();
            attemptNumber++;
        }
    }

    private AttemptOutcome makeRequest(PreparedRequest request) {
        try {
            Response response = rateLimiter.call(requestor, this::authorizationHeaders, request);
            logger.debug("Response: {} ({} bytes)", response.statusCode(),
                    response.header("content-length").orElse(null));
            return new AttemptOutcome.Responded(response);
        } catch (RequestException e) {
            return new AttemptOutcome.TransportFailed(e);
        }
    }

    private JsonNode complete(PreparedRequest request, AttemptOutcome outcome, ResponseClassification classification) {
        if (outcome instanceof AttemptOutcome.TransportFailed failed) {
            RequestException exception = failed.exception();
            reporter.report(RequestFailure.of(request, outcome, classification).withException(exception));
            throw exception;
        }

        Response response = ((AttemptOutcome.Responded) outcome).response();
        switch (classification) {
            case TERMINAL_STATUS -> {
                ResponseException exception = StatusTable.exceptionFor(response)
                        .orElseThrow(() -> new UnexpectedStatusException(response));
                reporter.report(RequestFailure.of(request, outcome, classification).withException(exception));
                throw exception;
            }
            case NO_CONTENT -> {
                return MissingNode.getInstance();
            }
            case SUCCESS -> {
                return decode(request, outcome, response);
            }
            default -> {
                UnexpectedStatusException exception = new UnexpectedStatusException(response);
                reporter.report(RequestFailure.of(request, outcome, ResponseClassification.UNEXPECTED_STATUS)
                        .withException(exception));
                throw exception;
            }
        }
    }

    private JsonNode decode(PreparedRequest request, AttemptOutcome outcome, Response response) {
        if ("0".equals(response.header("content-length").orElse(null)) || response.bodyLength() == 0) {
            return TextNode.valueOf("");
        }
        JsonNode document;
        IOException parseFailure = null;
        try {
            document = mapper.reader()
                    .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                    .readTree(response.body());
        } catch (IOException e) {
            document = null;
            parseFailure = e;
        }
        if (document == null || document.isMissingNode()) {
            MalformedPayloadException exception = new MalformedPayloadException(response, parseFailure);
            reporter.report(RequestFailure.of(request, outcome, ResponseClassification.SUCCESS).withException(exception));
            throw exception;
        }
        return document;
    }

    private Map<String, String> authorizationHeaders() {
        if (!authorizer.isValid() && authorizer instanceof RefreshableAuthorizer refreshable) {
            refreshable.refresh();
        }
        String token = authorizer.accessToken();
        if (token == null) {
            throw new ConfigurationException("authorizer holds no access token and cannot refresh one");
        }
        return Map.of("Authorization", "bearer " + token);
    }

    private void sleep(Duration duration) {
        logger.debug("Sleeping: {} seconds prior to retry", String.format("%.2f", duration.toMillis() / 1000.0));
        try {
            sleeper.sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void logRequest(PreparedRequest request) {
        logger.debug("Fetching: {} {}", request.method(), request.url());
        logger.debug("Data: {}", request.body());
        logger.debug("Params: {}", request.params());
    }

    /**
     * Builder for configuring a Session.
     */
    public static final class Builder {
        private Authorizer authorizer;
        private Requestor requestor;
        private RateLimiter rateLimiter;
        private RetryStrategy retryStrategy = new FiniteRetryStrategy();
        private Sleeper sleeper = Sleeper.system();
        private OpReporter reporter = OpReporter.noOp();
        private TransportFailureClassifier transportClassifier = TransportFailureClassifier.defaults();
        private ObjectMapper mapper = new ObjectMapper();

        private Builder() {}

        /**
         * Sets the authorizer (required).
         */
        public Builder authorizer(Authorizer authorizer) {
            this.authorizer = authorizer;
            return this;
        }

        /**
         * Sets the transport (required).
         */
        public Builder requestor(Requestor requestor) {
            this.requestor = requestor;
            return this;
        }

        /**
         * Sets the rate limiter (optional, defaults to a {@link HeaderRateLimiter}).
         */
        public Builder rateLimiter(RateLimiter rateLimiter) {
            this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter must not be null");
            return this;
        }

        /**
         * Sets the retry state every request starts from (optional, defaults to three attempts).
         */
        public Builder retryStrategy(RetryStrategy retryStrategy) {
            this.retryStrategy = Objects.requireNonNull(retryStrategy, "retryStrategy must not be null");
            return this;
        }

        /**
         * Sets the reporter for failures and retries (optional, defaults to no-op).
         */
        public Builder reporter(OpReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        public Builder transportFailureClassifier(TransportFailureClassifier classifier) {
            this.transportClassifier = Objects.requireNonNull(classifier, "classifier must not be null");
            return this;
        }

        public Builder objectMapper(ObjectMapper mapper) {
            this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
            return this;
        }

        /**
         * Sets the sleeper for testing (package-private).
         */
        Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
            return this;
        }

        /**
         * @throws ConfigurationException if the authorizer or the requestor is missing
         */
        public Session build() {
            return new Session(this);
        }
    }
}
