package com.gnovoa.matchfeed.ws;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.http.server.ServletServerHttpResponse;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class MatchHandshakeInterceptorTest {

    private final MatchHandshakeInterceptor interceptor = new MatchHandshakeInterceptor();

    @Test
    void parsesTheLastPathSegment() {
        assertThat(MatchHandshakeInterceptor.parseMatchId("/ws/matches/42")).isEqualTo(42L);
        assertThat(MatchHandshakeInterceptor.parseMatchId("/ws/matches/9000000000")).isEqualTo(9_000_000_000L);
    }

    @Test
    void rejectsNonPositiveOrNonNumericIds() {
        assertThat(MatchHandshakeInterceptor.parseMatchId("/ws/matches/0")).isNull();
        assertThat(MatchHandshakeInterceptor.parseMatchId("/ws/matches/-3")).isNull();
        assertThat(MatchHandshakeInterceptor.parseMatchId("/ws/matches/abc")).isNull();
        assertThat(MatchHandshakeInterceptor.parseMatchId("/ws/matches/")).isNull();
        assertThat(MatchHandshakeInterceptor.parseMatchId(null)).isNull();
    }

    @Test
    void storesMatchIdForTheHandler() {
        var servletRequest = new MockHttpServletRequest("GET", "/ws/matches/42");
        var servletResponse = new MockHttpServletResponse();
        Map<String, Object> attributes = new HashMap<>();

        boolean accepted = interceptor.beforeHandshake(new ServletServerHttpRequest(servletRequest),
                new ServletServerHttpResponse(servletResponse), null, attributes);

        assertThat(accepted).isTrue();
        assertThat(attributes).containsEntry(MatchHandshakeInterceptor.MATCH_ID_ATTR, 42L);
    }

    @Test
    void refusesInvalidIdWithBadRequest() throws Exception {
        var servletRequest = new MockHttpServletRequest("GET", "/ws/matches/nope");
        var servletResponse = new MockHttpServletResponse();
        var response = new ServletServerHttpResponse(servletResponse);
        Map<String, Object> attributes = new HashMap<>();

        boolean accepted = interceptor.beforeHandshake(new ServletServerHttpRequest(servletRequest),
                response, null, attributes);
        response.flush();

        assertThat(accepted).isFalse();
        assertThat(attributes).isEmpty();
        assertThat(servletResponse.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST.value());
    }
}
