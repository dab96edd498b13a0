package de.entwicklertraining.memory.client;

import org.json.JSONObject;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.Locale;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.function.Supplier;

/**
 * Maps a non-2xx response to exactly one {@link ClientError} variant.
 * <p>
 * Priority: 401/403 become {@link ClientError.AuthorizationError}, 429 becomes
 * {@link ClientError.RateLimitError}, every other status an {@link ClientError.HttpError}.
 * The result depends only on the inputs and the injected clock.
 */
public final class ErrorTranslator {

    // weekday is stripped before parsing the obsolete formats
    private static final DateTimeFormatter ASCTIME_DATE =
            DateTimeFormatter.ofPattern("MMM ppd HH:mm:ss uuuu", Locale.US);

    private final Clock clock;
    private final ErrorMessagePolicy messagePolicy;

    public ErrorTranslator(Clock clock, ErrorMessagePolicy messagePolicy) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.messagePolicy = Objects.requireNonNull(messagePolicy, "messagePolicy");
    }

    /**
     * Translates an error response.
     *
     * @param status the HTTP status, outside 200..299
     * @param statusText the reason phrase; empty falls back to the standard phrase
     * @param headers the response headers
     * @param body the parsed body or null
     * @param url the request URL
     * @return the error
     * @throws IllegalArgumentException if the status is a success status
     */
    public ClientError translate(int status, String statusText, ResponseHeaders headers, Object body, String url) {
        if (status >= 200 && status < 300) {
            throw new IllegalArgumentException("Status " + status + " is not an error status");
        }
        String text = statusText == null || statusText.isEmpty() ? HttpStatusText.of(status) : statusText;

        if (status == 401 || status == 403) {
            return new ClientError.AuthorizationError(status, "Unauthorized: " + text, url);
        }
        if (status == 429) {
            OptionalLong retryAfter = headers == null
                    ? OptionalLong.empty()
                    : headers.firstValue("Retry-After")
                            .map(value -> parseRetryAfterMs(value, clock.instant()))
                            .orElse(OptionalLong.empty());
            return new ClientError.RateLimitError(retryAfter, url);
        }
        return new ClientError.HttpError(status, message(text, body), url, body);
    }

    private String message(String statusText, Object body) {
        if (messagePolicy == ErrorMessagePolicy.STATUS_TEXT || !(body instanceof JSONObject object)) {
            return statusText;
        }
        Object message = object.opt("message");
        if (!(message instanceof String text)) {
            return statusText;
        }
        if (messagePolicy == ErrorMessagePolicy.BODY_MESSAGE_OR_STATUS_TEXT && text.isEmpty()) {
            return statusText;
        }
        return text;
    }

    /**
     * Interprets a {@code Retry-After} value.
     * <p>
     * All digits: delay in seconds. Otherwise an HTTP-date in any of the three formats of
     * RFC 7231 section 7.1.1.1 (IMF-fixdate, RFC 850, asctime), measured from {@code now}
     * and floored at zero. A two-digit RFC 850 year more than 50 years ahead of {@code now}
     * belongs to the previous century. Empty, negative, overflowing and unparseable values
     * give no hint.
     *
     * @param value the header value
     * @param now the reference instant
     * @return the delay in milliseconds, or empty
     */
    public static OptionalLong parseRetryAfterMs(String value, Instant now) {
        if (value == null) {
            return OptionalLong.empty();
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return OptionalLong.empty();
        }
        if (isAllDigits(trimmed)) {
            try {
                return OptionalLong.of(Math.multiplyExact(Long.parseLong(trimmed), 1000L));
            } catch (NumberFormatException | ArithmeticException e) {
                return OptionalLong.empty();
            }
        }
        Instant target = parseHttpDate(trimmed, now);
        if (target == null) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Math.max(0L, Math.subtractExact(target.toEpochMilli(), now.toEpochMilli())));
        } catch (ArithmeticException e) {
            return OptionalLong.empty();
        }
    }

    private static Instant parseHttpDate(String value, Instant now) {
        Instant imfFixdate = parseOrNull(() -> ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant());
        if (imfFixdate != null) {
            return imfFixdate;
        }
        int comma = value.indexOf(", ");
        if (comma > 0) {
            return parseOrNull(() -> ZonedDateTime.parse(value.substring(comma + 2), rfc850Date(now)).toInstant());
        }
        int space = value.indexOf(' ');
        if (space > 0) {
            return parseOrNull(() -> LocalDateTime.parse(value.substring(space + 1), ASCTIME_DATE).toInstant(ZoneOffset.UTC));
        }
        return null;
    }

    private static Instant parseOrNull(Supplier<Instant> parse) {
        try {
            return parse.get();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static DateTimeFormatter rfc850Date(Instant now) {
        int pivot = now.atZone(ZoneOffset.UTC).getYear() - 49;
        return new DateTimeFormatterBuilder()
                .appendPattern("dd-MMM-")
                .appendValueReduced(ChronoField.YEAR, 2, 2, pivot)
                .appendPattern(" HH:mm:ss zzz")
                .toFormatter(Locale.US);
    }

    private static boolean isAllDigits(String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }
}
