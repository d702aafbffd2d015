package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.exception.ModelCallException;
import me.golemcore.agent.domain.exception.ModelErrorKind;
import me.golemcore.agent.domain.model.RetryableErrorKind;

import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.HashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Classifies model-call failures into {@link ModelErrorKind}s by walking the
 * cause chain. Understands {@link ModelCallException}, the LangChain4j
 * exception hierarchy (matched by class name, so provider modules are not
 * required on the classpath) and JDK network errors.
 */
public class ModelErrorClassifier {

    private static final String LANGCHAIN4J_EXCEPTIONS_PREFIX = "dev.langchain4j.exception.";
    private static final String CLASS_RATE_LIMIT_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "RateLimitException";
    private static final String CLASS_TIMEOUT_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "TimeoutException";
    private static final String CLASS_AUTHENTICATION_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "AuthenticationException";
    private static final String CLASS_INVALID_REQUEST_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "InvalidRequestException";
    private static final String CLASS_MODEL_NOT_FOUND_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "ModelNotFoundException";
    private static final String CLASS_CONTENT_FILTERED_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "ContentFilteredException";
    private static final String CLASS_INTERNAL_SERVER_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "InternalServerException";
    private static final String CLASS_UNSUPPORTED_FEATURE_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "UnsupportedFeatureException";
    private static final String CLASS_RETRIABLE_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "RetriableException";
    private static final String CLASS_NON_RETRIABLE_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "NonRetriableException";
    private static final String CLASS_HTTP_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "HttpException";

    /**
     * Classifies a failure, or returns empty when nothing in the cause chain is
     * recognized.
     */
    public Optional<ModelErrorKind> classify(Throwable throwable) {
        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && !visited.contains(current)) {
            visited.add(current);

            ModelErrorKind byType = classifyKnownThrowable(current);
            if (byType != null) {
                return Optional.of(byType);
            }

            ModelErrorKind byMessage = classifyFromMessage(current.getMessage());
            if (byMessage != null) {
                return Optional.of(byMessage);
            }

            current = current.getCause();
        }
        return Optional.empty();
    }

    /**
     * Maps a failure to the retryable class a {@code RetryPolicy} understands,
     * or empty for failures that are never retried.
     */
    public Optional<RetryableErrorKind> classifyRetryable(Throwable throwable) {
        return classify(throwable).flatMap(ModelErrorClassifier::toRetryable);
    }

    public static Optional<RetryableErrorKind> toRetryable(ModelErrorKind kind) {
        return switch (kind) {
        case RATE_LIMITED -> Optional.of(RetryableErrorKind.RATE_LIMITED);
        case SERVER_ERROR -> Optional.of(RetryableErrorKind.SERVER_ERROR);
        case NETWORK_ERROR -> Optional.of(RetryableErrorKind.NETWORK_ERROR);
        default -> Optional.empty();
        };
    }

    private ModelErrorKind classifyKnownThrowable(Throwable throwable) {
        if (throwable instanceof ModelCallException modelCallException) {
            return modelCallException.getKind();
        }
        if (throwable instanceof SocketTimeoutException
                || throwable instanceof HttpTimeoutException
                || throwable instanceof TimeoutException) {
            return ModelErrorKind.NETWORK_ERROR;
        }

        ModelErrorKind langchain4j = classifyLangchain4j(throwable);
        if (langchain4j != null) {
            return langchain4j;
        }

        if (throwable instanceof IOException) {
            return ModelErrorKind.NETWORK_ERROR;
        }
        return null;
    }

    private ModelErrorKind classifyLangchain4j(Throwable throwable) {
        // Most specific class first: the hierarchy is matched by walking superclasses.
        for (Class<?> type = throwable.getClass(); type != null && type != Throwable.class; type = type
                .getSuperclass()) {
            String className = type.getName();
            if (!className.startsWith(LANGCHAIN4J_EXCEPTIONS_PREFIX)) {
                continue;
            }
            switch (className) {
            case CLASS_RATE_LIMIT_EXCEPTION:
                return ModelErrorKind.RATE_LIMITED;
            case CLASS_TIMEOUT_EXCEPTION:
                return ModelErrorKind.NETWORK_ERROR;
            case CLASS_INTERNAL_SERVER_EXCEPTION:
                return ModelErrorKind.SERVER_ERROR;
            case CLASS_AUTHENTICATION_EXCEPTION:
                return ModelErrorKind.AUTHENTICATION;
            case CLASS_INVALID_REQUEST_EXCEPTION, CLASS_MODEL_NOT_FOUND_EXCEPTION:
                return ModelErrorKind.INVALID_REQUEST;
            case CLASS_CONTENT_FILTERED_EXCEPTION:
                return ModelErrorKind.CONTENT_FILTERED;
            case CLASS_UNSUPPORTED_FEATURE_EXCEPTION:
                return ModelErrorKind.UNSUPPORTED;
            case CLASS_HTTP_EXCEPTION:
                return classifyHttpExceptionByStatus(throwable);
            case CLASS_RETRIABLE_EXCEPTION:
                return ModelErrorKind.SERVER_ERROR;
            case CLASS_NON_RETRIABLE_EXCEPTION:
                return ModelErrorKind.INVALID_REQUEST;
            default:
                break;
            }
        }
        return null;
    }

    private static ModelErrorKind classifyHttpExceptionByStatus(Throwable throwable) {
        Integer statusCode = readHttpStatusCode(throwable);
        if (statusCode == null) {
            return null;
        }
        if (statusCode == 429) {
            return ModelErrorKind.RATE_LIMITED;
        }
        if (statusCode == 401 || statusCode == 403) {
            return ModelErrorKind.AUTHENTICATION;
        }
        if (statusCode == 408 || statusCode == 504) {
            return ModelErrorKind.NETWORK_ERROR;
        }
        if (statusCode >= 500) {
            return ModelErrorKind.SERVER_ERROR;
        }
        if (statusCode >= 400) {
            return ModelErrorKind.INVALID_REQUEST;
        }
        return null;
    }

    private static Integer readHttpStatusCode(Throwable throwable) {
        try {
            Method method = throwable.getClass().getMethod("statusCode");
            Object result = method.invoke(throwable);
            if (result instanceof Integer) {
                return (Integer) result;
            }
        } catch (NoSuchMethodException | IllegalAccessException | InvocationTargetException ignored) {
            return null;
        }
        return null;
    }

    private static ModelErrorKind classifyFromMessage(String message) {
        if (message == null || message.isBlank()) {
            return null;
        }

        String normalized = message.toLowerCase(Locale.ROOT);
        if (normalized.contains("context length")
                || normalized.contains("context window")
                || normalized.contains("maximum context")
                || normalized.contains("prompt is too long")) {
            return ModelErrorKind.CONTEXT_LENGTH_EXCEEDED;
        }
        return null;
    }
}
