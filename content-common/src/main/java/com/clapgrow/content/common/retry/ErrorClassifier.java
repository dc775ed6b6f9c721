package com.clapgrow.content.common.retry;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * Classifies failed calls to the generation and publishing APIs.
 *
 * Classification rules (first match wins):
 * - Status: 401/403 → AUTH, 429 → RATE_LIMIT, 400 → CONTENT_POLICY or VALIDATION,
 *   404 → MODEL or VALIDATION, 408 → TIMEOUT, 0 → NETWORK/TIMEOUT, 5xx → SERVER
 * - Vendor code (e.g., "content_policy_violation", "model_not_found")
 * - Message keywords (e.g., "ECONNRESET", "rate limit", "unauthorized")
 * - Anything else → UNKNOWN (retryable, conservative)
 *
 * Stateless and thread-safe. The clock is only used to convert HTTP-date retry-after values.
 */
public class ErrorClassifier {

    /**
     * Longest server-suggested delay honoured. Larger values are clamped to it.
     */
    public static final long MAX_RETRY_AFTER_MS = Duration.ofHours(1).toMillis();

    private static final Pattern DELTA_SECONDS = Pattern.compile("\\d+(\\.\\d+)?");

    private static final Map<String, ErrorCategory> VENDOR_CODES = Map.of(
        "content_policy_violation", ErrorCategory.CONTENT_POLICY,
        "content_filter", ErrorCategory.CONTENT_POLICY,
        "model_not_found", ErrorCategory.MODEL,
        "rate_limit_exceeded", ErrorCategory.RATE_LIMIT,
        "insufficient_quota", ErrorCategory.RATE_LIMIT,
        "invalid_api_key", ErrorCategory.AUTH,
        "context_length_exceeded", ErrorCategory.VALIDATION,
        "econnreset", ErrorCategory.NETWORK,
        "econnrefused", ErrorCategory.NETWORK,
        "etimedout", ErrorCategory.TIMEOUT
    );

    private static final List<String> AUTH_PATTERNS = List.of(
        "unauthorized", "invalid api key", "authentication", "forbidden");
    private static final List<String> RATE_LIMIT_PATTERNS = List.of(
        "rate limit", "rate_limit", "too many requests", "quota exceeded");
    private static final List<String> CONTENT_POLICY_PATTERNS = List.of(
        "content_policy", "content policy", "safety system", "moderation");
    private static final List<String> MODEL_PATTERNS = List.of(
        "model_not_found", "model not found", "model does not exist");
    private static final List<String> TIMEOUT_PATTERNS = List.of(
        "etimedout", "timeout", "timed out");
    private static final List<String> NETWORK_PATTERNS = List.of(
        "econnreset", "econnrefused", "enotfound", "network", "connection");
    private static final List<String> SERVER_PATTERNS = List.of(
        "internal server error", "bad gateway", "service unavailable", "gateway timeout");
    private static final List<String> VALIDATION_PATTERNS = List.of(
        "invalid_request", "validation", "bad request");

    private final Clock clock;

    public ErrorClassifier() {
        this(Clock.systemUTC());
    }

    public ErrorClassifier(Clock clock) {
        this.clock = clock;
    }

    /**
     * Classify a raw failure descriptor.
     *
     * @param failure Raw failure (status, vendor code, message, retry-after)
     * @return Classified error, never null
     */
    public ClassifiedError classify(FailureDescriptor failure) {
        if (failure == null) {
            return ClassifiedError.of(ErrorCategory.UNKNOWN, null);
        }
        ErrorCategory category = resolveCategory(failure);
        Long retryAfterMs = parseRetryAfter(failure.retryAfter());
        return new ClassifiedError(category, failure.httpStatus(), failure.vendorCode(), retryAfterMs, failure.message());
    }

    /**
     * Classify a failure raised by an HTTP client before any response arrived.
     * Walks the cause chain looking for timeout and I/O exceptions.
     */
    public ClassifiedError classify(Throwable throwable) {
        if (throwable == null) {
            return ClassifiedError.of(ErrorCategory.UNKNOWN, null);
        }
        Throwable current = throwable;
        int depth = 0;
        while (current != null && depth < 10) {
            if (current instanceof SocketTimeoutException || current instanceof TimeoutException) {
                return ClassifiedError.of(ErrorCategory.TIMEOUT, throwable.getMessage());
            }
            if (current instanceof ConnectException || current instanceof UnknownHostException) {
                return ClassifiedError.of(ErrorCategory.NETWORK, throwable.getMessage());
            }
            if (current instanceof IOException) {
                return ClassifiedError.of(ErrorCategory.NETWORK, throwable.getMessage());
            }
            current = current.getCause();
            depth++;
        }
        return classify(FailureDescriptor.ofMessage(throwable.getMessage()));
    }

    private ErrorCategory resolveCategory(FailureDescriptor failure) {
        String code = normalize(failure.vendorCode());
        String message = normalize(failure.message());
        Integer status = failure.httpStatus();

        if (status != null) {
            if (status == 401 || status == 403) {
                return ErrorCategory.AUTH;
            }
            if (status == 429) {
                return ErrorCategory.RATE_LIMIT;
            }
            if (status == 400) {
                return isContentPolicy(code, message) ? ErrorCategory.CONTENT_POLICY : ErrorCategory.VALIDATION;
            }
            if (status == 404) {
                return isModelNotFound(code, message) ? ErrorCategory.MODEL : ErrorCategory.VALIDATION;
            }
            if (status == 408) {
                return ErrorCategory.TIMEOUT;
            }
            if (status == 422) {
                return ErrorCategory.VALIDATION;
            }
            if (status == 0) {
                return containsAny(message, TIMEOUT_PATTERNS) || "etimedout".equals(code)
                    ? ErrorCategory.TIMEOUT : ErrorCategory.NETWORK;
            }
            if (status >= 500) {
                return ErrorCategory.SERVER;
            }
        }

        if (code != null) {
            ErrorCategory byCode = VENDOR_CODES.get(code);
            if (byCode != null) {
                return byCode;
            }
        }

        if (message != null) {
            if (containsAny(message, AUTH_PATTERNS)) {
                return ErrorCategory.AUTH;
            }
            if (containsAny(message, RATE_LIMIT_PATTERNS)) {
                return ErrorCategory.RATE_LIMIT;
            }
            if (containsAny(message, CONTENT_POLICY_PATTERNS)) {
                return ErrorCategory.CONTENT_POLICY;
            }
            if (containsAny(message, MODEL_PATTERNS)) {
                return ErrorCategory.MODEL;
            }
            // Timeout before network: "connection timed out" is a timeout
            if (containsAny(message, TIMEOUT_PATTERNS)) {
                return ErrorCategory.TIMEOUT;
            }
            if (containsAny(message, NETWORK_PATTERNS)) {
                return ErrorCategory.NETWORK;
            }
            if (containsAny(message, SERVER_PATTERNS)) {
                return ErrorCategory.SERVER;
            }
            if (containsAny(message, VALIDATION_PATTERNS)) {
                return ErrorCategory.VALIDATION;
            }
        }

        return ErrorCategory.UNKNOWN;
    }

    private boolean isContentPolicy(String code, String message) {
        if (code != null && VENDOR_CODES.get(code) == ErrorCategory.CONTENT_POLICY) {
            return true;
        }
        return containsAny(message, CONTENT_POLICY_PATTERNS);
    }

    private boolean isModelNotFound(String code, String message) {
        if ("model_not_found".equals(code)) {
            return true;
        }
        return message != null && (containsAny(message, MODEL_PATTERNS) || message.contains("model"));
    }

    /**
     * Convert a Retry-After header to milliseconds, capped at {@link #MAX_RETRY_AFTER_MS}.
     * Accepts plain decimal delta-seconds ("30", "1.5") or an RFC 1123 date. Anything else
     * ("Infinity", "1e20", "-5", "soon") is ignored.
     */
    Long parseRetryAfter(String retryAfter) {
        if (retryAfter == null || retryAfter.trim().isEmpty()) {
            return null;
        }
        String value = retryAfter.trim();
        if (DELTA_SECONDS.matcher(value).matches()) {
            double seconds = Double.parseDouble(value);
            if (!(seconds > 0)) {
                return null;
            }
            return Double.isFinite(seconds) ? Math.min(Math.round(seconds * 1000), MAX_RETRY_AFTER_MS) : MAX_RETRY_AFTER_MS;
        }
        try {
            Instant until = ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
            long millis = Duration.between(clock.instant(), until).toMillis();
            return millis > 0 ? Math.min(millis, MAX_RETRY_AFTER_MS) : null;
        } catch (DateTimeParseException | ArithmeticException e) {
            return null;
        }
    }

    private static String normalize(String value) {
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        return value.trim().toLowerCase(Locale.ROOT);
    }

    private static boolean containsAny(String haystack, List<String> needles) {
        if (haystack == null) {
            return false;
        }
        for (String needle : needles) {
            if (haystack.contains(needle)) {
                return true;
            }
        }
        return false;
    }
}
