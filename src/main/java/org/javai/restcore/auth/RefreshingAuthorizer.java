package org.javai.restcore.auth;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Consumer;
import org.javai.restcore.exception.TokenRefreshException;

/**
 * A {@link RefreshableAuthorizer} that obtains its tokens from a {@link TokenSource}.
 *
 * <p>Tokens are considered expired ten seconds before the server says they do, so a token is
 * never sent in its last moments. Refreshes are serialized by the instance lock.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * RefreshingAuthorizer authorizer = RefreshingAuthorizer.builder(() -> grant.exchange(refreshToken))
 *     .postRefresh(a -> store.save(a.accessToken()))
 *     .build();
 * }</pre>
 */
public final class RefreshingAuthorizer extends TokenAuthorizer implements RefreshableAuthorizer {

    static final Duration EARLY_EXPIRY = Duration.ofSeconds(10);

    private final TokenSource source;
    private final Consumer<RefreshingAuthorizer> preRefresh;
    private final Consumer<RefreshingAuthorizer> postRefresh;

    private RefreshingAuthorizer(Builder builder) {
        super(builder.clock);
        this.source = builder.source;
        this.preRefresh = builder.preRefresh;
        this.postRefresh = builder.postRefresh;
    }

    public RefreshingAuthorizer(TokenSource source) {
        this(builder(source));
    }

    public static Builder builder(TokenSource source) {
        return new Builder(source);
    }

    @Override
    public synchronized void refresh() {
        preRefresh.accept(this);
        AccessToken token;
        try {
            token = source.obtain();
        } catch (IOException e) {
            throw new TokenRefreshException("could not obtain a new access token: " + e.getMessage(), e);
        }
        if (token == null) {
            throw new TokenRefreshException("token source returned no access token", null);
        }
        store(token, EARLY_EXPIRY);
        postRefresh.accept(this);
    }

    public static final class Builder {
        private final TokenSource source;
        private Clock clock = Clock.systemUTC();
        private Consumer<RefreshingAuthorizer> preRefresh = authorizer -> {};
        private Consumer<RefreshingAuthorizer> postRefresh = authorizer -> {};

        private Builder(TokenSource source) {
            this.source = Objects.requireNonNull(source, "source must not be null");
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        /**
         * Runs before every refresh, for example to load a token shared with another process.
         */
        public Builder preRefresh(Consumer<RefreshingAuthorizer> callback) {
            this.preRefresh = Objects.requireNonNull(callback, "callback must not be null");
            return this;
        }

        /**
         * Runs after every successful refresh.
         */
        public Builder postRefresh(Consumer<RefreshingAuthorizer> callback) {
            this.postRefresh = Objects.requireNonNull(callback, "callback must not be null");
            return this;
        }

        public RefreshingAuthorizer build() {
            return new RefreshingAuthorizer(this);
        }
    }
}
