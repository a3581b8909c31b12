package org.javai.restcore.auth;

import org.javai.restcore.exception.TokenRefreshException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class RefreshingAuthorizerTest {

    private MutableClock clock;
    private AtomicInteger issued;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        issued = new AtomicInteger();
    }

    @Test
    void newAuthorizer_holdsNoToken() {
        RefreshingAuthorizer authorizer = authorizer(Duration.ofHours(1));

        assertThat(authorizer.isValid()).isFalse();
        assertThat(authorizer.accessToken()).isNull();
    }

    @Test
    void refresh_storesIssuedToken() {
        RefreshingAuthorizer authorizer = authorizer(Duration.ofHours(1));

        authorizer.refresh();

        assertThat(authorizer.isValid()).isTrue();
        assertThat(authorizer.accessToken()).isEqualTo("token-1");
        assertThat(authorizer.scopes()).containsExactly("read");
    }

    @Test
    void isValid_expiresTenSecondsEarly() {
        RefreshingAuthorizer authorizer = authorizer(Duration.ofSeconds(60));
        authorizer.refresh();

        clock.advance(Duration.ofSeconds(49));
        assertThat(authorizer.isValid()).isTrue();

        clock.advance(Duration.ofSeconds(1));
        assertThat(authorizer.isValid()).isFalse();
        assertThat(authorizer.accessToken()).isEqualTo("token-1");
    }

    @Test
    void isValid_tokenWithoutExpiry_neverExpires() {
        RefreshingAuthorizer authorizer = authorizer(null);
        authorizer.refresh();

        clock.advance(Duration.ofDays(365));

        assertThat(authorizer.isValid()).isTrue();
    }

    @Test
    void clearAccessToken_invalidatesUntilNextRefresh() {
        RefreshingAuthorizer authorizer = authorizer(Duration.ofHours(1));
        authorizer.refresh();

        authorizer.clearAccessToken();

        assertThat(authorizer.isValid()).isFalse();
        assertThat(authorizer.accessToken()).isNull();
        assertThat(authorizer.scopes()).isEmpty();

        authorizer.refresh();
        assertThat(authorizer.accessToken()).isEqualTo("token-2");
    }

    @Test
    void refresh_sourceFails_throwsTokenRefreshException() {
        IOException failure = new IOException("invalid_grant");
        RefreshingAuthorizer authorizer = RefreshingAuthorizer.builder(() -> { throw failure; })
                .clock(clock)
                .build();

        assertThatThrownBy(authorizer::refresh)
                .isInstanceOf(TokenRefreshException.class)
                .hasMessageContaining("invalid_grant")
                .hasCause(failure);
        assertThat(authorizer.isValid()).isFalse();
    }

    @Test
    void refresh_sourceReturnsNull_throwsTokenRefreshException() {
        RefreshingAuthorizer authorizer = new RefreshingAuthorizer(() -> null);

        assertThatThrownBy(authorizer::refresh).isInstanceOf(TokenRefreshException.class);
    }

    @Test
    void refresh_runsCallbacksAroundTheGrant() {
        List<String> events = new ArrayList<>();
        RefreshingAuthorizer authorizer = RefreshingAuthorizer.builder(() -> {
                    events.add("obtain");
                    return AccessToken.of("t", Duration.ofHours(1));
                })
                .preRefresh(a -> events.add("pre:" + a.accessToken()))
                .postRefresh(a -> events.add("post:" + a.accessToken()))
                .build();

        authorizer.refresh();

        assertThat(events).containsExactly("pre:null", "obtain", "post:t");
    }

    @Test
    void accessToken_blankValue_isRejected() {
        assertThatThrownBy(() -> AccessToken.of(" ", null)).isInstanceOf(IllegalArgumentException.class);
    }

    private RefreshingAuthorizer authorizer(Duration expiresIn) {
        return RefreshingAuthorizer.builder(() ->
                        new AccessToken("token-" + issued.incrementAndGet(), expiresIn, Set.of("read")))
                .clock(clock)
                .build();
    }

    static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
