package net.papermentat.gateway;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Buffered response of one successful gateway call.
 *
 * @param status      HTTP status code
 * @param contentType response content type, may be {@code null}
 * @param body        raw body bytes, never {@code null}
 */
public record GatewayResponse(int status, String contentType, byte[] body) {

    public GatewayResponse {
        body = body == null ? new byte[0] : body;
    }

    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    public boolean contentTypeContains(String fragment) {
        return contentType != null && contentType.toLowerCase(Locale.ROOT).contains(fragment);
    }
}
