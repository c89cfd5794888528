package com.example.Botlyne.resilience;

import com.example.Botlyne.exception.TransientDependencyException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Splits dependency failures into transient (retry, counts against the circuit) and
 * permanent (surface immediately, ignored by the circuit).
 */
public final class ErrorClassifier {

    private ErrorClassifier() {
    }

    public static boolean isTransient(Throwable error) {
        Throwable t = unwrap(error);
        return t instanceof TimeoutException
                || t instanceof ConnectException
                || t instanceof SocketTimeoutException
                || t instanceof TransientAiException
                || t instanceof ResourceAccessException
                || t instanceof HttpServerErrorException
                || t instanceof HttpClientErrorException.TooManyRequests
                || t instanceof TransientDataAccessException
                || t instanceof RecoverableDataAccessException
                || t instanceof DataAccessResourceFailureException
                || t instanceof RejectedExecutionException
                || t instanceof TransientDependencyException;
    }

    public static boolean isPermanent(Throwable error) {
        return !isTransient(error);
    }

    /**
     * Strips executor wrappers so the classification sees the failure the dependency raised.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while ((t instanceof ExecutionException || t instanceof CompletionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
