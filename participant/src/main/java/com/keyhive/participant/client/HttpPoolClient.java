package com.keyhive.participant.client;

import com.keyhive.core.api.PoolApi;
import com.keyhive.core.error.InvalidStateException;
import com.keyhive.core.error.KeyspaceException;
import com.keyhive.core.error.PoolUnavailableException;
import com.keyhive.core.error.ValidationException;
import com.keyhive.core.model.Assignment;
import com.keyhive.core.model.PoolStats;
import com.keyhive.core.model.ProgressRecord;
import com.keyhive.core.msg.PoolMessages.AbandonRequest;
import com.keyhive.core.msg.PoolMessages.AssignmentRequest;
import com.keyhive.core.msg.PoolMessages.CompletionReport;
import com.keyhive.core.msg.PoolMessages.ErrorResponse;
import com.keyhive.core.msg.PoolMessages.ProgressReport;
import com.keyhive.core.util.JsonUtils;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.ByteBufFlux;
import reactor.netty.http.client.HttpClient;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * {@link PoolApi} over the coordinator's HTTP interface.
 * <p>
 * Status codes map back to the exceptions the coordinator raised: 400 to
 * {@link ValidationException}, 409 to {@link InvalidStateException}. Server
 * errors, timeouts and transport failures all surface as
 * {@link PoolUnavailableException}.
 * </p>
 */
public class HttpPoolClient implements PoolApi {
    private static final Logger log = LoggerFactory.getLogger(HttpPoolClient.class);

    private static final String ASSIGNMENTS = "/api/v1/assignments";

    private final HttpClient httpClient;
    private final String poolUrl;
    private final Duration timeout;

    public HttpPoolClient(String poolUrl, Duration timeout) {
        this.poolUrl = poolUrl;
        this.timeout = timeout;
        this.httpClient = HttpClient.create()
            .baseUrl(poolUrl)
            .headers(h -> h.set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_JSON)
                .set(HttpHeaderNames.ACCEPT, HttpHeaderValues.APPLICATION_JSON))
            .responseTimeout(timeout);

        log.info("HttpPoolClient initialized for {}", poolUrl);
    }

    @Override
    public Mono<Assignment> requestAssignment(AssignmentRequest request) {
        return post(ASSIGNMENTS, request, Assignment.class);
    }

    @Override
    public Mono<ProgressRecord> reportProgress(ProgressReport report) {
        return post(ASSIGNMENTS + "/" + encode(report.getAssignmentId()) + "/progress", report, ProgressRecord.class);
    }

    @Override
    public Mono<Assignment> reportCompletion(CompletionReport report) {
        return post(ASSIGNMENTS + "/" + encode(report.getAssignmentId()) + "/complete", report, Assignment.class);
    }

    @Override
    public Mono<Assignment> abandonAssignment(AbandonRequest request) {
        return post(ASSIGNMENTS + "/" + encode(request.getAssignmentId()) + "/abandon", request, Assignment.class);
    }

    @Override
    public Mono<PoolStats> getStats(String clientId) {
        String uri = "/api/v1/stats" + (clientId == null ? "" : "?clientId=" + encode(clientId));
        return exchange("GET " + uri, httpClient.get()
            .uri(uri)
            .responseSingle((res, body) -> body.asString()
                .defaultIfEmpty("")
                .flatMap(text -> decode(res.status(), text, PoolStats.class))));
    }

    private <T> Mono<T> post(String uri, Object body, Class<T> type) {
        return exchange("POST " + uri, httpClient.post()
            .uri(uri)
            .send(ByteBufFlux.fromString(Mono.fromCallable(() -> JsonUtils.writeValueAsString(body))))
            .responseSingle((res, content) -> content.asString()
                .defaultIfEmpty("")
                .flatMap(text -> decode(res.status(), text, type))));
    }

    private <T> Mono<T> exchange(String call, Mono<T> response) {
        return response
            .timeout(timeout)
            .onErrorMap(err -> !(err instanceof KeyspaceException),
                err -> new PoolUnavailableException("Pool " + poolUrl + " unreachable on " + call + ": "
                    + JsonUtils.rootMessage(err), err))
            .doOnError(PoolUnavailableException.class, err -> log.error("{}", err.getMessage()));
    }

    private static <T> Mono<T> decode(HttpResponseStatus status, String body, Class<T> type) {
        int code = status.code();
        if (code == HttpResponseStatus.NO_CONTENT.code()) {
            return Mono.empty();
        }
        if (code == HttpResponseStatus.OK.code()) {
            try {
                return Mono.just(JsonUtils.readValue(body, type));
            } catch (ValidationException e) {
                return Mono.error(new PoolUnavailableException("Unexpected response body: " + e.getMessage(), e));
            }
        }
        String message = errorMessage(status, body);
        if (code == HttpResponseStatus.BAD_REQUEST.code()) {
            return Mono.error(new ValidationException(message));
        }
        if (code == HttpResponseStatus.CONFLICT.code()) {
            return Mono.error(new InvalidStateException(message));
        }
        return Mono.error(new PoolUnavailableException("Pool answered " + code + ": " + message));
    }

    private static String errorMessage(HttpResponseStatus status, String body) {
        if (body == null || body.isBlank()) {
            return status.reasonPhrase();
        }
        try {
            ErrorResponse error = JsonUtils.readValue(body, ErrorResponse.class);
            return error.getError() != null ? error.getError() : status.reasonPhrase();
        } catch (ValidationException e) {
            return body;
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(String.valueOf(value), StandardCharsets.UTF_8);
    }
}
