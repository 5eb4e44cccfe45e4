package com.bko.plansolve.api;

import com.bko.plansolve.connection.ConnectionRegistry;
import com.bko.plansolve.error.ErrorCode;
import com.bko.plansolve.error.SessionNotFoundException;
import com.bko.plansolve.orchestration.service.PipelineMetricsService;
import com.bko.plansolve.session.SessionRegistry;
import com.bko.plansolve.session.SessionService;
import com.bko.plansolve.session.SessionView;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class SessionController {

    private static final long DESCRIBE_TIMEOUT_SECONDS = 5;

    private final SessionService sessionService;
    private final SessionRegistry sessionRegistry;
    private final ConnectionRegistry connectionRegistry;
    private final PipelineMetricsService metricsService;

    @GetMapping("/status")
    public StatusResponse status() {
        return new StatusResponse(sessionRegistry.size(), connectionRegistry.size(),
                metricsService.attempts(), metricsService.retries(), metricsService.failedTasks(),
                metricsService.llmRequests(), metricsService.pipelinesCompleted());
    }

    @GetMapping("/sessions/{sessionId}")
    public SessionView session(@PathVariable String sessionId) {
        try {
            return sessionService.describe(sessionId).get(DESCRIBE_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Interrupted while reading session.", ex);
        } catch (TimeoutException ex) {
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Session is busy.", ex);
        } catch (ExecutionException ex) {
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to read session.", ex.getCause());
        }
    }

    @ExceptionHandler(SessionNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public ApiError sessionNotFound(SessionNotFoundException ex) {
        return new ApiError(ErrorCode.SESSION_NOT_FOUND.wireValue(), ex.getMessage());
    }
}
