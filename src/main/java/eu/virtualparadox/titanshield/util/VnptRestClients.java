package eu.virtualparadox.titanshield.util;

import eu.virtualparadox.titanshield.application.config.TitanShieldProperties;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

import java.time.Duration;

/**
 * Builds {@link RestClient}s for the VNPT AI endpoints, which authenticate every request with a bearer token plus a
 * token id/key pair.
 */
public final class VnptRestClients {

    private VnptRestClients() {
        // prevent instantiation
    }

    /**
     * @param vnpt        endpoint and credentials
     * @param readTimeout socket read timeout; the caller's per-call budget is enforced separately
     */
    public static RestClient create(final TitanShieldProperties.Vnpt vnpt, final Duration readTimeout) {
        final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) Duration.ofSeconds(10).toMillis());
        requestFactory.setReadTimeout((int) readTimeout.toMillis());

        return RestClient.builder()
                .baseUrl(vnpt.getBaseUrl())
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeaders(headers -> applyCredentials(headers, vnpt))
                .build();
    }

    /**
     * Sets the credentials that have text. Unset environment placeholders bind as empty strings and are skipped.
     */
    static void applyCredentials(final HttpHeaders headers, final TitanShieldProperties.Vnpt vnpt) {
        if (StringUtils.hasText(vnpt.getAuthorization())) {
            final String token = vnpt.getAuthorization().startsWith("Bearer ")
                    ? vnpt.getAuthorization()
                    : "Bearer " + vnpt.getAuthorization();
            headers.set(HttpHeaders.AUTHORIZATION, token);
        }
        if (StringUtils.hasText(vnpt.getTokenId())) {
            headers.set("Token-id", vnpt.getTokenId());
        }
        if (StringUtils.hasText(vnpt.getTokenKey())) {
            headers.set("Token-key", vnpt.getTokenKey());
        }
    }
}
