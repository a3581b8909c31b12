package org.javai.restcore.exception;

import org.javai.restcore.http.Response;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class AuthorizationExceptionTest {

    @Test
    void forResponse_insufficientScopeHeader_isInsufficientScope() {
        Response response = Response.of(403,
                Map.of("www-authenticate", "Bearer realm=\"reddit\", error=\"insufficient_scope\""), "");

        assertThat(AuthorizationException.forResponse(response)).isInstanceOf(InsufficientScopeException.class);
    }

    @Test
    void forResponse_invalidTokenHeader_isInvalidToken() {
        Response response = Response.of(401,
                Map.of("WWW-Authenticate", "Bearer realm=\"reddit\", error=\"invalid_token\""), "");

        assertThat(AuthorizationException.forResponse(response)).isInstanceOf(InvalidTokenException.class);
    }

    @Test
    void forResponse_forbiddenWithoutHeader_isForbidden() {
        Response response = Response.of(403, Map.of(), "");

        AuthorizationException exception = AuthorizationException.forResponse(response);

        assertThat(exception).isInstanceOf(ForbiddenException.class);
        assertThat(exception).hasMessage("received 403 HTTP response");
    }

    @Test
    void forResponse_unauthorizedWithoutHeader_isInvalidToken() {
        assertThat(AuthorizationException.forResponse(Response.of(401, Map.of(), "")))
                .isInstanceOf(InvalidTokenException.class);
    }

    @Test
    void forResponse_unknownHeaderError_fallsBackToStatus() {
        Response response = Response.of(403, Map.of("www-authenticate", "Bearer error=\"something_else\""), "");

        assertThat(AuthorizationException.forResponse(response)).isInstanceOf(ForbiddenException.class);
    }

    @Test
    void forResponse_unknownHeaderErrorOnUnauthorized_isInvalidToken() {
        Response response = Response.of(401, Map.of("www-authenticate", "Bearer error=\"expired_nonce\""), "");

        assertThat(AuthorizationException.forResponse(response)).isInstanceOf(InvalidTokenException.class);
    }
}
