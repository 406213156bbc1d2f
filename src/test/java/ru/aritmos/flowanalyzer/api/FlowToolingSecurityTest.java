package ru.aritmos.flowanalyzer.api;

import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.MutableHttpRequest;
import io.micronaut.http.client.HttpClient;
import io.micronaut.http.client.annotation.Client;
import io.micronaut.http.client.exceptions.HttpClientResponseException;
import io.micronaut.security.authentication.Authentication;
import io.micronaut.security.token.generator.TokenGenerator;
import io.micronaut.test.extensions.junit5.annotation.MicronautTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@MicronautTest
class FlowToolingSecurityTest {

    @Inject
    @Client("/")
    HttpClient client;

    @Inject
    TokenGenerator tokenGenerator;

    private String token(String... roles) {
        return tokenGenerator.generateToken(Authentication.build("editor", List.of(roles)), 3600).orElseThrow();
    }

    private HttpResponse<String> post(String path, Object body, String token) {
        MutableHttpRequest<Object> request = HttpRequest.POST("/admin/flow-tooling" + path, body);
        if (token != null) {
            request = request.bearerAuth(token);
        }
        return client.toBlocking().exchange(request, String.class);
    }

    @Test
    void validate_shouldRejectAnonymousCaller() {
        HttpClientResponseException e = assertThrows(HttpClientResponseException.class,
                () -> post("/validate", Map.of("code", "const a = 1;"), null));

        assertEquals(HttpStatus.UNAUTHORIZED, e.getStatus());
    }

    @Test
    void validate_shouldAllowFlowEditor() {
        HttpResponse<String> response = post("/validate", Map.of("code", "const = 1;"), token("FLOW_EDITOR"));

        assertEquals(HttpStatus.OK, response.getStatus());
        assertTrue(response.body().contains("\"valid\":false"), response.body());
    }

    @Test
    void injectCredentials_shouldRequireAdminRole() {
        Map<String, Object> body = Map.of("code", "const a = 1;", "credentials", Map.of("SLACK_CRED", "xoxb-1"));

        HttpClientResponseException e = assertThrows(HttpClientResponseException.class,
                () -> post("/inject-credentials", body, token("FLOW_EDITOR")));

        assertEquals(HttpStatus.FORBIDDEN, e.getStatus());
        assertEquals(HttpStatus.OK, post("/inject-credentials", body, token("FLOW_ADMIN")).getStatus());
    }
}
