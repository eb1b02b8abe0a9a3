package eu.virtualparadox.titanshield.util;

import eu.virtualparadox.titanshield.application.config.TitanShieldProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

import static org.junit.jupiter.api.Assertions.*;

class VnptRestClientsTest {

    @Test
    @DisplayName("Configured credentials become auth headers")
    void testCredentials() {
        TitanShieldProperties.Vnpt vnpt = new TitanShieldProperties.Vnpt();
        vnpt.setAuthorization("secret");
        vnpt.setTokenId("id-1");
        vnpt.setTokenKey("key-1");
        HttpHeaders headers = new HttpHeaders();

        VnptRestClients.applyCredentials(headers, vnpt);

        assertEquals("Bearer secret", headers.getFirst(HttpHeaders.AUTHORIZATION));
        assertEquals("id-1", headers.getFirst("Token-id"));
        assertEquals("key-1", headers.getFirst("Token-key"));
    }

    @Test
    @DisplayName("Empty or blank credentials send no headers")
    void testEmptyCredentials() {
        TitanShieldProperties.Vnpt vnpt = new TitanShieldProperties.Vnpt();
        vnpt.setAuthorization("");
        vnpt.setTokenId("  ");
        HttpHeaders headers = new HttpHeaders();

        VnptRestClients.applyCredentials(headers, vnpt);

        assertFalse(headers.containsKey(HttpHeaders.AUTHORIZATION));
        assertFalse(headers.containsKey("Token-id"));
        assertFalse(headers.containsKey("Token-key"));
    }
}
