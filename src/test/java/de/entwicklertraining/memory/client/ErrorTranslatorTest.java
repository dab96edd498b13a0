package de.entwicklertraining.memory.client;

import org.json.JSONObject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

class ErrorTranslatorTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private static final String URL = "https://api.example.com/api/v1/memories/k1";

    private final ErrorTranslator translator =
            new ErrorTranslator(Clock.fixed(NOW, ZoneOffset.UTC), ErrorMessagePolicy.STATUS_TEXT);

    @Test
    @DisplayName("401 and 403 become AuthorizationError naming the status text")
    void testAuthorization() {
        ClientError unauthorized = translator.translate(401, "Unauthorized", ResponseHeaders.empty(), null, URL);
        ClientError forbidden = translator.translate(403, "", ResponseHeaders.empty(), null, URL);

        ClientError.AuthorizationError auth = assertInstanceOf(ClientError.AuthorizationError.class, unauthorized);
        assertEquals(401, auth.getStatus());
        assertEquals("Unauthorized: Unauthorized", auth.getReason());
        assertEquals(URL, auth.getUrl().orElseThrow());
        assertEquals("Unauthorized: Forbidden", forbidden.getMessage());
        assertFalse(forbidden.isRetryable());
    }

    @Test
    @DisplayName("Retry-After in delta seconds is converted to milliseconds")
    void testRetryAfterSeconds() {
        ClientError error = translator.translate(429, "Too Many Requests", headers("Retry-After", "2"), null, URL);

        ClientError.RateLimitError rateLimit = assertInstanceOf(ClientError.RateLimitError.class, error);
        assertEquals(OptionalLong.of(2000), rateLimit.getRetryAfterMs());
        assertTrue(rateLimit.isRetryable());
    }

    @Test
    @DisplayName("Retry-After as HTTP-date is measured from the injected clock")
    void testRetryAfterDate() {
        String inTenSeconds = DateTimeFormatter.RFC_1123_DATE_TIME.format(NOW.plusSeconds(10).atZone(ZoneOffset.UTC));
        String past = DateTimeFormatter.RFC_1123_DATE_TIME.format(NOW.minusSeconds(10).atZone(ZoneOffset.UTC));

        assertEquals(OptionalLong.of(10_000), ErrorTranslator.parseRetryAfterMs(inTenSeconds, NOW));
        assertEquals(OptionalLong.of(0), ErrorTranslator.parseRetryAfterMs(past, NOW));
    }

    @Test
    @DisplayName("Retry-After accepts the obsolete RFC 850 and asctime date formats")
    void testRetryAfterObsoleteDates() {
        Instant reference = Instant.parse("1994-11-06T08:49:00Z");

        assertEquals(OptionalLong.of(37_000), ErrorTranslator.parseRetryAfterMs("Sunday, 06-Nov-94 08:49:37 GMT", reference));
        assertEquals(OptionalLong.of(37_000), ErrorTranslator.parseRetryAfterMs("Sun Nov  6 08:49:37 1994", reference));
        assertEquals(OptionalLong.of(10_000), ErrorTranslator.parseRetryAfterMs("Wednesday, 01-May-24 12:00:10 GMT", NOW));
        assertEquals(OptionalLong.of(10_000), ErrorTranslator.parseRetryAfterMs("Wed May  1 12:00:10 2024", NOW));
    }

    @Test
    @DisplayName("A two-digit year more than 50 years ahead belongs to the previous century")
    void testRetryAfterTwoDigitYearPivot() {
        // 94 is 1994 rather than 2094 when measured from 2024
        assertEquals(OptionalLong.of(0), ErrorTranslator.parseRetryAfterMs("Sunday, 06-Nov-94 08:49:37 GMT", NOW));
        assertEquals(OptionalLong.of(Instant.parse("2074-05-01T12:00:00Z").toEpochMilli() - NOW.toEpochMilli()),
                ErrorTranslator.parseRetryAfterMs("Tuesday, 01-May-74 12:00:00 GMT", NOW));
    }

    @Test
    @DisplayName("Unusable Retry-After values give no hint")
    void testRetryAfterInvalid() {
        for (String value : List.of("", "   ", "soon", "-5", "1.5", "99999999999999999999", "9223372036854775807",
                "Wednesday, 01-May-24", "Wed May  1 12:00:10", "Wed, 32-May-24 12:00:10 GMT")) {
            assertEquals(OptionalLong.empty(), ErrorTranslator.parseRetryAfterMs(value, NOW), value);
        }
        assertEquals(OptionalLong.empty(), ErrorTranslator.parseRetryAfterMs(null, NOW));

        ClientError.RateLimitError noHeader = assertInstanceOf(ClientError.RateLimitError.class,
                translator.translate(429, "", ResponseHeaders.empty(), null, URL));
        assertTrue(noHeader.getRetryAfterMs().isEmpty());
    }

    @Test
    @DisplayName("Other statuses become HttpError with status text and body")
    void testHttpError() {
        JSONObject body = new JSONObject().put("message", "boom");

        ClientError error = translator.translate(500, "Internal Server Error", ResponseHeaders.empty(), body, URL);

        ClientError.HttpError http = assertInstanceOf(ClientError.HttpError.class, error);
        assertEquals(500, http.getStatus());
        assertEquals("Internal Server Error", http.getMessage());
        assertSame(body, http.getBody().orElseThrow());
        assertEquals(ClientError.Kind.HTTP, http.kind());
    }

    @Test
    @DisplayName("Body message policies choose between body message and status text")
    void testMessagePolicies() {
        JSONObject withMessage = new JSONObject().put("message", "quota exceeded");
        JSONObject emptyMessage = new JSONObject().put("message", "");
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        ErrorTranslator preferBody = new ErrorTranslator(clock, ErrorMessagePolicy.BODY_MESSAGE_OR_STATUS_TEXT);
        ErrorTranslator verbatim = new ErrorTranslator(clock, ErrorMessagePolicy.BODY_MESSAGE_VERBATIM);

        assertEquals("quota exceeded", preferBody.translate(400, "Bad Request", null, withMessage, URL).getMessage());
        assertEquals("Bad Request", preferBody.translate(400, "Bad Request", null, emptyMessage, URL).getMessage());
        assertEquals("", verbatim.translate(400, "Bad Request", null, emptyMessage, URL).getMessage());
        assertEquals("Bad Request", verbatim.translate(400, "Bad Request", null, "plain text", URL).getMessage());
    }

    @Test
    @DisplayName("Success statuses are rejected")
    void testSuccessStatusRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> translator.translate(200, "OK", ResponseHeaders.empty(), null, URL));
    }

    private static ResponseHeaders headers(String name, String value) {
        return ResponseHeaders.of(Map.of(name, List.of(value)));
    }
}
