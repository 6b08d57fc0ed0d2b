package com.sailfish.cloudrpc.storage;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class AuthorizedHeadersTest {

    @Test
    void addsBearerToken() {
        Map<String, String> headers = new HashMap<>();
        headers.put("Content-Type", "application/json");

        AuthorizedHeaders.inject(headers, new AccessTokenCredentials("ya29.token"));

        assertEquals("Bearer ya29.token", headers.get("Authorization"));
        assertEquals("application/json", headers.get("Content-Type"));
    }

    @Test
    void replacesExistingHeaderWhateverItsCase() {
        Map<String, String> headers = new HashMap<>();
        headers.put("authorization", "Bearer stale");

        Map<String, String> result = AuthorizedHeaders.inject(headers, new AccessTokenCredentials("fresh"));

        assertSame(headers, result);
        assertEquals(1, headers.size());
        assertEquals("Bearer fresh", headers.get(AuthorizedHeaders.AUTHORIZATION));
    }

    @Test
    void rejectsBlankHeaderFromCredentials() {
        Credentials credentials = mock(Credentials.class);
        when(credentials.authorizationHeader()).thenReturn(" ");
        Map<String, String> headers = new HashMap<>();

        assertThrows(IllegalStateException.class, () -> AuthorizedHeaders.inject(headers, credentials));
        assertTrue(headers.isEmpty());
    }

    @Test
    void accessTokenIsValidatedAndRedacted() {
        assertThrows(IllegalArgumentException.class, () -> new AccessTokenCredentials(""));
        AccessTokenCredentials credentials = new AccessTokenCredentials("secret-token");
        assertFalse(credentials.toString().contains("secret-token"));
    }
}
