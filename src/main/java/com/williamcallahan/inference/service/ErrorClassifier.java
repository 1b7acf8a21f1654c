package com.williamcallahan.inference.service;

import com.williamcallahan.inference.client.ProviderCallException;
import com.williamcallahan.inference.domain.failure.ErrorClassification;
import com.williamcallahan.inference.domain.failure.ErrorKind;
import com.williamcallahan.inference.domain.failure.RecoveryPolicy;
import com.williamcallahan.inference.support.AsciiTextNormalizer;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Maps upstream failures onto the {@link ErrorKind} taxonomy.
 *
 * <p>Structured signals win over text: an HTTP status on a {@link ProviderCallException}, then timeout and
 * connection exception types in the cause chain. Otherwise the messages of the whole cause chain are lowercased
 * with {@link AsciiTextNormalizer} and matched against per-kind phrase tables in declaration order of
 * {@link ErrorKind}; the first matching kind wins and nothing matching yields {@link ErrorKind#UNKNOWN}.</p>
 */
@Service
public class ErrorClassifier {

    private static final Map<ErrorKind, List<Pattern>> PHRASES = buildPhraseTable();

    private static final List<Pattern> RETRY_AFTER_PATTERNS = List.of(
            compile("retry.?after\\D{0,3}(\\d+)"),
            compile("wait.?(\\d+).?seconds"),
            compile("try.?again.?in\\D{0,2}(\\d+)"),
            compile("back.?off\\D{0,3}(\\d+)"));

    private static final double JITTER_FRACTION = 0.25;

    private final Random random;

    @Autowired
    public ErrorClassifier() {
        this(null);
    }

    /**
     * Creates a classifier whose backoff jitter draws from the given source.
     *
     * @param random jitter source, or null for a thread-local source
     */
    public ErrorClassifier(Random random) {
        this.random = random;
    }

    private static Map<ErrorKind, List<Pattern>> buildPhraseTable() {
        Map<ErrorKind, List<Pattern>> table = new EnumMap<>(ErrorKind.class);
        table.put(ErrorKind.RATE_LIMIT, patterns(
                "\\b429\\b", "rate.?limit", "too.?many.?requests", "requests.?per.?minute",
                "requests.?per.?second", "throttl", "rate.?exceeded"));
        table.put(ErrorKind.QUOTA_EXCEEDED, patterns(
                "quota.?exceeded", "quota.?exhausted", "insufficient.?quota", "usage.?limit", "daily.?limit",
                "monthly.?limit", "resource.?exhausted", "limit.?reached", "credits.?exhausted"));
        table.put(ErrorKind.AUTHENTICATION, patterns(
                "\\b401\\b", "unauthori[sz]ed", "invalid.?api.?key", "authentication.?failed",
                "api.?key.?not.?found", "invalid.?credentials"));
        table.put(ErrorKind.AUTHORIZATION, patterns(
                "\\b403\\b", "forbidden", "access.?denied", "insufficient.?permissions", "not.?authori[sz]ed"));
        table.put(ErrorKind.NOT_FOUND, patterns(
                "\\b404\\b", "not.?found", "model.?not.?found", "endpoint.?not.?found", "resource.?not.?found"));
        table.put(ErrorKind.SERVER_ERROR, patterns(
                "\\b500\\b", "\\b502\\b", "\\b503\\b", "\\b504\\b", "internal.?server.?error", "bad.?gateway",
                "service.?unavailable", "gateway.?timeout", "server.?error"));
        table.put(ErrorKind.NETWORK_ERROR, patterns(
                "connection.?error", "network.?error", "dns.?error", "connection.?refused", "connection.?timeout",
                "network.?unreachable", "connection.?reset"));
        table.put(ErrorKind.TIMEOUT, patterns(
                "timeout", "timed.?out", "request.?timeout", "read.?timeout", "connect.?timeout"));
        table.put(ErrorKind.PAYMENT_REQUIRED, patterns(
                "\\b402\\b", "payment.?required", "insufficient.?funds", "billing.?error", "subscription.?expired",
                "payment.?method"));
        table.put(ErrorKind.INVALID_REQUEST, patterns(
                "\\b400\\b", "bad.?request", "invalid.?request", "malformed.?request", "invalid.?parameter",
                "missing.?parameter"));
        return table;
    }

    private static List<Pattern> patterns(String... expressions) {
        return Arrays.stream(expressions).map(ErrorClassifier::compile).toList();
    }

    private static Pattern compile(String expression) {
        return Pattern.compile(expression);
    }

    /**
     * Classifies a failure thrown by a provider call.
     *
     * @param error failure, possibly wrapped
     * @return classification with kind and optional retry hint
     */
    public ErrorClassification classify(Throwable error) {
        if (error == null) {
            return new ErrorClassification(ErrorKind.UNKNOWN, null, "");
        }
        String message = chainMessage(error);
        Duration hint = structuredRetryAfter(error).orElseGet(() -> extractRetryAfter(message).orElse(null));

        ProviderCallException callFailure = findCause(error, ProviderCallException.class);
        if (callFailure != null && callFailure.hasStatus()) {
            ErrorKind byStatus = kindForStatus(callFailure.statusCode(), message);
            if (byStatus != null) {
                return new ErrorClassification(byStatus, hint, message);
            }
        }
        if (findCause(error, TimeoutException.class) != null || findCause(error, SocketTimeoutException.class) != null) {
            return new ErrorClassification(ErrorKind.TIMEOUT, hint, message);
        }
        if (findCause(error, ConnectException.class) != null
                || findCause(error, UnknownHostException.class) != null
                || findCause(error, NoRouteToHostException.class) != null) {
            return new ErrorClassification(ErrorKind.NETWORK_ERROR, hint, message);
        }
        return new ErrorClassification(matchKind(message), hint, message);
    }

    /**
     * Classifies raw failure text.
     *
     * @param errorText upstream failure message
     * @return classification with kind and optional retry hint
     */
    public ErrorClassification classify(String errorText) {
        String message = errorText == null ? "" : errorText;
        return new ErrorClassification(matchKind(message), extractRetryAfter(message).orElse(null), message);
    }

    /**
     * Finds an explicit retry delay in failure text.
     */
    public Optional<Duration> extractRetryAfter(String errorText) {
        if (errorText == null || errorText.isEmpty()) {
            return Optional.empty();
        }
        String normalized = AsciiTextNormalizer.toLowerAscii(errorText);
        for (Pattern pattern : RETRY_AFTER_PATTERNS) {
            Matcher matcher = pattern.matcher(normalized);
            if (matcher.find()) {
                try {
                    return Optional.of(Duration.ofSeconds(Long.parseLong(matcher.group(1))));
                } catch (NumberFormatException overflow) {
                    return Optional.empty();
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Computes how long to wait before retrying a failure of the given kind.
     *
     * <p>An explicit hint always wins. Otherwise the kind's base doubles per attempt up to its maximum, with
     * plus or minus 25 percent jitter and a floor of one second. Kinds without a backoff return zero.</p>
     *
     * @param kind classified kind
     * @param attempt zero-based attempt number
     * @param retryAfterHint explicit hint, or null
     * @return recommended delay
     */
    public Duration recommendedBackoff(ErrorKind kind, int attempt, Duration retryAfterHint) {
        if (retryAfterHint != null && !retryAfterHint.isNegative() && !retryAfterHint.isZero()) {
            return retryAfterHint;
        }
        RecoveryPolicy policy = kind.policy();
        if (policy.backoffMax().isZero()) {
            return Duration.ZERO;
        }
        double baseSeconds = policy.backoffBase().getSeconds();
        double backoff = Math.min(baseSeconds * Math.pow(2, Math.max(0, attempt)), policy.backoffMax().getSeconds());
        Random source = random != null ? random : ThreadLocalRandom.current();
        double jitter = backoff * JITTER_FRACTION * (2 * source.nextDouble() - 1);
        return Duration.ofSeconds(Math.max(1L, (long) (backoff + jitter)));
    }

    private static ErrorKind kindForStatus(int status, String message) {
        return switch (status) {
            case 429 -> matches(ErrorKind.QUOTA_EXCEEDED, message) ? ErrorKind.QUOTA_EXCEEDED : ErrorKind.RATE_LIMIT;
            case 401 -> ErrorKind.AUTHENTICATION;
            case 402 -> ErrorKind.PAYMENT_REQUIRED;
            case 403 -> ErrorKind.AUTHORIZATION;
            case 404 -> ErrorKind.NOT_FOUND;
            case 408 -> ErrorKind.TIMEOUT;
            case 400, 413, 422 -> ErrorKind.INVALID_REQUEST;
            default -> status >= 500 && status <= 599 ? ErrorKind.SERVER_ERROR : null;
        };
    }

    private static ErrorKind matchKind(String message) {
        for (ErrorKind kind : ErrorKind.values()) {
            if (matches(kind, message)) {
                return kind;
            }
        }
        return ErrorKind.UNKNOWN;
    }

    private static boolean matches(ErrorKind kind, String message) {
        String normalized = AsciiTextNormalizer.toLowerAscii(message);
        for (Pattern pattern : PHRASES.getOrDefault(kind, List.of())) {
            if (pattern.matcher(normalized).find()) {
                return true;
            }
        }
        return false;
    }

    private static Optional<Duration> structuredRetryAfter(Throwable error) {
        ProviderCallException callFailure = findCause(error, ProviderCallException.class);
        return callFailure == null ? Optional.empty() : callFailure.retryAfter();
    }

    private static <T extends Throwable> T findCause(Throwable error, Class<T> type) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < 16) {
            if (type.isInstance(current)) {
                return type.cast(current);
            }
            current = current.getCause();
        }
        return null;
    }

    private static String chainMessage(Throwable error) {
        StringBuilder messageBuilder = new StringBuilder();
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < 16) {
            String currentMessage = current.getMessage();
            if (currentMessage != null && !currentMessage.isBlank()) {
                if (messageBuilder.length() > 0) {
                    messageBuilder.append(' ');
                }
                messageBuilder.append(currentMessage);
            }
            current = current.getCause();
        }
        if (messageBuilder.length() == 0) {
            messageBuilder.append(error.getClass().getSimpleName());
        }
        return messageBuilder.toString();
    }
}
