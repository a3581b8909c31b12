package org.javai.restcore.ratelimit;

import org.javai.restcore.PreparedRequest;
import org.javai.restcore.RequestBody;
import org.javai.restcore.http.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class HeaderRateLimiterTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private List<Duration> sleeps;
    private HeaderRateLimiter limiter;

    @BeforeEach
    void setUp() {
        sleeps = new ArrayList<>();
        limiter = new HeaderRateLimiter(Clock.fixed(NOW, ZoneOffset.UTC), sleeps::add);
    }

    @Test
    void delay_beforeAnyResponse_doesNotSleep() {
        limiter.delay();

        assertThat(sleeps).isEmpty();
        assertThat(limiter.remaining()).isEmpty();
    }

    @Test
    void update_recordsQuotaFromHeaders() {
        limiter.update(rateLimited("60", "540", "100"));

        assertThat(limiter.remaining()).contains(60.0);
        assertThat(limiter.used()).contains(540);
        assertThat(limiter.resetTimestamp()).contains(NOW.plusSeconds(100));
    }

    @Test
    void update_spacesRemainingQuotaOverResetWindow() {
        limiter.update(rateLimited("90", "10", "100"));

        assertThat(limiter.nextRequestTimestamp()).contains(NOW.plusSeconds(5));

        limiter.delay();
        assertThat(sleeps).containsExactly(Duration.ofSeconds(5));
    }

    @Test
    void update_spacingIsCappedAtTenSeconds() {
        limiter.update(rateLimited("10", "590", "500"));

        assertThat(limiter.nextRequestTimestamp()).contains(NOW.plusSeconds(10));
    }

    @Test
    void update_plentyOfQuota_doesNotWait() {
        limiter.update(rateLimited("500", "100", "100"));

        limiter.delay();

        assertThat(limiter.nextRequestTimestamp()).contains(NOW);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void update_quotaExhausted_waitsForReset() {
        limiter.update(rateLimited("0", "600", "42"));

        limiter.delay();

        assertThat(sleeps).containsExactly(Duration.ofSeconds(42));
    }

    @Test
    void update_withoutHeaders_decrementsKnownQuota() {
        limiter.update(rateLimited("60", "540", "100"));

        limiter.update(Response.of(200, Map.of(), "{}"));

        assertThat(limiter.remaining()).contains(59.0);
        assertThat(limiter.used()).contains(541);
    }

    @Test
    void update_withoutHeadersAndNoHistory_keepsNothing() {
        limiter.update(Response.of(200, Map.of(), "{}"));

        assertThat(limiter.remaining()).isEmpty();
        assertThat(limiter.nextRequestTimestamp()).isEmpty();
    }

    @Test
    void update_malformedHeaders_areIgnored() {
        limiter.update(rateLimited("60", "540", "100"));

        limiter.update(rateLimited("lots", "540", "100"));

        assertThat(limiter.remaining()).contains(60.0);
    }

    @Test
    void call_waitsThenSendsHeadersAndUpdates() {
        limiter.update(rateLimited("0", "600", "3"));
        List<Map<String, String>> sent = new ArrayList<>();
        PreparedRequest request = new PreparedRequest("GET", "https://oauth.reddit.com/api/v1/me",
                Map.of("raw_json", "1"), RequestBody.empty(), null);

        Response response = limiter.call(
                (req, headers) -> {
                    sent.add(headers);
                    return rateLimited("599", "1", "600");
                },
                () -> Map.of("Authorization", "bearer t"),
                request);

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(sleeps).containsExactly(Duration.ofSeconds(3));
        assertThat(sent).containsExactly(Map.of("Authorization", "bearer t"));
        assertThat(limiter.remaining()).contains(599.0);
    }

    @Test
    void passThrough_neverWaits() {
        PreparedRequest request = new PreparedRequest("GET", "https://oauth.reddit.com/x",
                Map.of(), RequestBody.empty(), null);

        Response response = RateLimiter.passThrough().call(
                (req, headers) -> Response.of(204, headers, ""), () -> Map.of("a", "b"), request);

        assertThat(response.header("a")).contains("b");
    }

    private static Response rateLimited(String remaining, String used, String reset) {
        Map<String, String> headers = new HashMap<>();
        headers.put("X-Ratelimit-Remaining", remaining);
        headers.put("X-Ratelimit-Used", used);
        headers.put("X-Ratelimit-Reset", reset);
        return Response.of(200, headers, "{}");
    }
}
