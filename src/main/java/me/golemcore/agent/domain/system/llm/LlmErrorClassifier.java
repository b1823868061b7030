package me.golemcore.agent.domain.system.llm;

import me.golemcore.agent.domain.system.llm.LlmCallException.Kind;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Classifies model-call failures into the retry policy's {@link Kind}s.
 */
public final class LlmErrorClassifier {

    private static final String LANGCHAIN4J_EXCEPTIONS_PREFIX = "dev.langchain4j.exception.";
    private static final String CLASS_RATE_LIMIT_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "RateLimitException";
    private static final String CLASS_TIMEOUT_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "TimeoutException";
    private static final String CLASS_AUTHENTICATION_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "AuthenticationException";
    private static final String CLASS_HTTP_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "HttpException";

    private LlmErrorClassifier() {
    }

    /**
     * Classify a failure by walking its cause chain. The first link that can be
     * classified wins.
     */
    public static Kind classify(Throwable throwable) {
        if (throwable == null) {
            return Kind.OTHER;
        }

        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && !visited.contains(current)) {
            visited.add(current);

            Kind byType = classifyKnownThrowable(current);
            if (byType != Kind.OTHER) {
                return byType;
            }

            Kind byMessage = classifyFromMessage(current.getMessage());
            if (byMessage != Kind.OTHER) {
                return byMessage;
            }

            current = current.getCause();
        }
        return Kind.OTHER;
    }

    /**
     * Innermost meaningful message, used for retry notes and the final error.
     */
    public static String describe(Throwable throwable) {
        if (throwable == null) {
            return "Unknown error";
        }
        Throwable current = throwable;
        Set<Throwable> visited = new HashSet<>();
        while (current != null && !visited.contains(current)) {
            visited.add(current);
            String message = current.getMessage();
            boolean wrapper = current instanceof CompletionException
                    || current instanceof ExecutionException;
            if (!wrapper && message != null && !message.isBlank()) {
                return message;
            }
            current = current.getCause();
        }
        return throwable.getClass().getSimpleName();
    }

    private static Kind classifyKnownThrowable(Throwable throwable) {
        if (throwable instanceof LlmCallException) {
            return ((LlmCallException) throwable).getKind();
        }
        if (throwable instanceof RequestAbortedException
                || throwable instanceof CancellationException
                || throwable instanceof InterruptedException) {
            return Kind.ABORTED;
        }
        if (throwable instanceof SocketTimeoutException
                || throwable instanceof HttpTimeoutException
                || throwable instanceof TimeoutException) {
            return Kind.TIMEOUT;
        }

        String className = throwable.getClass().getName();
        if (!className.startsWith(LANGCHAIN4J_EXCEPTIONS_PREFIX)) {
            return Kind.OTHER;
        }

        if (CLASS_RATE_LIMIT_EXCEPTION.equals(className)) {
            return Kind.RATE_LIMIT;
        }
        if (CLASS_TIMEOUT_EXCEPTION.equals(className)) {
            return Kind.TIMEOUT;
        }
        if (CLASS_AUTHENTICATION_EXCEPTION.equals(className)) {
            return Kind.AUTH;
        }
        if (CLASS_HTTP_EXCEPTION.equals(className)) {
            return classifyByStatus(readHttpStatusCode(throwable));
        }
        return Kind.OTHER;
    }

    private static Kind classifyByStatus(Integer statusCode) {
        if (statusCode == null) {
            return Kind.OTHER;
        }
        if (statusCode == 429) {
            return Kind.RATE_LIMIT;
        }
        if (statusCode == 401 || statusCode == 403) {
            return Kind.AUTH;
        }
        if (statusCode == 408 || statusCode == 504) {
            return Kind.TIMEOUT;
        }
        return Kind.OTHER;
    }

    private static Integer readHttpStatusCode(Throwable throwable) {
        try {
            Method method = throwable.getClass().getMethod("statusCode");
            Object result = method.invoke(throwable);
            if (result instanceof Integer) {
                return (Integer) result;
            }
        } catch (NoSuchMethodException | IllegalAccessException | InvocationTargetException e) {
            return null;
        }
        return null;
    }

    private static Kind classifyFromMessage(String message) {
        if (message == null || message.isBlank()) {
            return Kind.OTHER;
        }

        String normalized = message.toLowerCase(Locale.ROOT);
        if (normalized.contains("rate limit")
                || normalized.contains("rate_limit")
                || normalized.contains("too many requests")
                || normalized.contains("429")) {
            return Kind.RATE_LIMIT;
        }
        if (normalized.contains("401")
                || normalized.contains("403")
                || normalized.contains("unauthorized")) {
            return Kind.AUTH;
        }
        if (normalized.contains("timed out") || normalized.contains("timeout")) {
            return Kind.TIMEOUT;
        }
        return Kind.OTHER;
    }
}
