package com.example.Botlyne.resilience;

import com.example.Botlyne.exception.PermanentDependencyException;
import com.example.Botlyne.exception.TransientDependencyException;
import org.junit.jupiter.api.Test;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.net.ConnectException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorClassifierTest {

    @Test
    void networkTimeoutsAndServerErrorsAreTransient() {
        assertThat(List.<Throwable>of(
                new TimeoutException(),
                new ConnectException("refused"),
                new TransientAiException("503"),
                new ResourceAccessException("reset"),
                HttpServerErrorException.create(HttpStatus.BAD_GATEWAY, "bad gateway", new HttpHeaders(), new byte[0], StandardCharsets.UTF_8),
                HttpClientErrorException.create(HttpStatus.TOO_MANY_REQUESTS, "slow down", new HttpHeaders(), new byte[0], StandardCharsets.UTF_8),
                new TransientDependencyException("flaky"),
                new TaskRejectedException("dependency pool is full")
        )).allMatch(ErrorClassifier::isTransient);
    }

    @Test
    void clientErrorsAndUnknownFailuresArePermanent() {
        assertThat(List.<Throwable>of(
                new NonTransientAiException("401"),
                HttpClientErrorException.create(HttpStatus.BAD_REQUEST, "bad", new HttpHeaders(), new byte[0], StandardCharsets.UTF_8),
                new PermanentDependencyException("invalid"),
                new IllegalStateException("bug")
        )).allMatch(ErrorClassifier::isPermanent);
    }

    @Test
    void executorWrappersAreUnwrapped() {
        Throwable wrapped = new ExecutionException(new CompletionException(new TimeoutException()));

        assertThat(ErrorClassifier.unwrap(wrapped)).isInstanceOf(TimeoutException.class);
        assertThat(ErrorClassifier.isTransient(wrapped)).isTrue();
    }
}
