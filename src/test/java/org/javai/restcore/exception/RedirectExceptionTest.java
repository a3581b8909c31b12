package org.javai.restcore.exception;

import org.javai.restcore.http.Response;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class RedirectExceptionTest {

    @Test
    void path_stripsHostAndJsonSuffix() {
        RedirectException exception = redirect("https://www.reddit.com/r/subreddit/about.json");

        assertThat(exception.path()).isEqualTo("/r/subreddit/about");
        assertThat(exception).hasMessage("Redirect to /r/subreddit/about");
        assertThat(exception.statusCode()).isEqualTo(302);
    }

    @Test
    void message_loginTarget_hintsAtReadOnlyInstance() {
        RedirectException exception = redirect("https://www.reddit.com/login/");

        assertThat(exception.path()).isEqualTo("/login/");
        assertThat(exception.getMessage())
                .startsWith("Redirect to /login/")
                .contains("read-only");
    }

    @Test
    void path_relativeLocation_isKept() {
        assertThat(redirect("/subreddits/search").path()).isEqualTo("/subreddits/search");
    }

    private static RedirectException redirect(String location) {
        return new RedirectException(Response.of(302, Map.of("location", location), ""));
    }
}
