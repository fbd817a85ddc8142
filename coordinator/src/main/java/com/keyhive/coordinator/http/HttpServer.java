package com.keyhive.coordinator.http;

import com.keyhive.coordinator.config.CoordinatorConfig;
import com.keyhive.coordinator.ledger.ProgressLedger;
import com.keyhive.coordinator.metrics.PrometheusMetricsExporter;
import com.keyhive.coordinator.schedule.AdaptiveScheduler;
import com.keyhive.core.api.PoolApi;
import com.keyhive.core.error.InvalidStateException;
import com.keyhive.core.error.ValidationException;
import com.keyhive.core.msg.PoolMessages.AbandonRequest;
import com.keyhive.core.msg.PoolMessages.AssignmentRequest;
import com.keyhive.core.msg.PoolMessages.CompletionReport;
import com.keyhive.core.msg.PoolMessages.ErrorResponse;
import com.keyhive.core.msg.PoolMessages.ProgressReport;
import com.keyhive.core.util.JsonUtils;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;
import reactor.netty.http.server.HttpServerRoutes;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * HTTP front of the pool coordinator.
 * <p>
 * Errors map to status codes: validation 400, invalid state 409, anything
 * else 500, each with an {@code {"error", "type"}} body.
 * </p>
 */
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private static final String JSON = "application/json";

    private final CoordinatorConfig config;
    private final PoolApi pool;
    private final ProgressLedger ledger;
    private final AdaptiveScheduler scheduler;
    private final PrometheusMetricsExporter metricsExporter;

    private DisposableServer server;

    public HttpServer(
        CoordinatorConfig config,
        PoolApi pool,
        ProgressLedger ledger,
        AdaptiveScheduler scheduler,
        PrometheusMetricsExporter metricsExporter
    ) {
        this.config = config;
        this.pool = pool;
        this.ledger = ledger;
        this.scheduler = scheduler;
        this.metricsExporter = metricsExporter;
    }

    /**
     * Starts the HTTP server; port 0 binds an ephemeral port.
     */
    public DisposableServer start() {
        server = reactor.netty.http.server.HttpServer.create()
            .port(config.getHttpPort())
            .route(this::configureRoutes)
            .bind()
            .doOnNext(s -> log.info("HTTP server started on port {}", s.port()))
            .doOnError(err -> log.error("Failed to start HTTP server", err))
            .block(Duration.ofSeconds(45));

        return server;
    }

    public int port() {
        return server.port();
    }

    public void stop() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(20));
        }
    }

    private void configureRoutes(HttpServerRoutes routes) {
        routes
            .get("/healthz", (req, res) ->
                res.status(200).sendString(Mono.just("OK"))
            )
            .get("/metrics", (req, res) ->
                res.addHeader("Content-Type", "text/plain; version=0.0.4; charset=utf-8")
                    .sendString(Mono.just(metricsExporter.scrape()))
                    .then()
            )
            .post("/api/v1/assignments", (req, res) ->
                body(req, AssignmentRequest.class)
                    .flatMap(pool::requestAssignment)
                    .map(Optional::of)
                    .defaultIfEmpty(Optional.empty())
                    .flatMap(granted -> granted.isPresent()
                        ? sendJson(res, granted.get())
                        : res.status(HttpResponseStatus.NO_CONTENT).send().then())
                    .onErrorResume(err -> sendError(res, err))
            )
            .post("/api/v1/assignments/{id}/progress", (req, res) ->
                body(req, ProgressReport.class)
                    .map(report -> report.withAssignmentId(req.param("id")))
                    .flatMap(pool::reportProgress)
                    .flatMap(record -> sendJson(res, record))
                    .onErrorResume(err -> sendError(res, err))
            )
            .post("/api/v1/assignments/{id}/complete", (req, res) ->
                body(req, CompletionReport.class)
                    .map(report -> report.withAssignmentId(req.param("id")))
                    .flatMap(pool::reportCompletion)
                    .flatMap(assignment -> sendJson(res, assignment))
                    .onErrorResume(err -> sendError(res, err))
            )
            .post("/api/v1/assignments/{id}/abandon", (req, res) ->
                body(req, AbandonRequest.class)
                    .map(request -> request.withAssignmentId(req.param("id")))
                    .flatMap(pool::abandonAssignment)
                    .flatMap(assignment -> sendJson(res, assignment))
                    .onErrorResume(err -> sendError(res, err))
            )
            .get("/api/v1/stats", (req, res) -> {
                QueryStringDecoder decoder = new QueryStringDecoder(req.uri());
                List<String> clientIds = decoder.parameters().get("clientId");
                String clientId = clientIds == null || clientIds.isEmpty() ? null : clientIds.get(0);
                return pool.getStats(clientId)
                    .flatMap(stats -> sendJson(res, stats))
                    .onErrorResume(err -> sendError(res, err));
            })
            .get("/api/v1/ranges", (req, res) ->
                Mono.fromCallable(ledger::snapshot)
                    .flatMap(snapshot -> sendJson(res, snapshot))
                    .onErrorResume(err -> sendError(res, err))
            )
            .get("/api/v1/strategy", (req, res) ->
                Mono.fromCallable(() -> scheduler.strategy(ledger.snapshot()))
                    .flatMap(strategy -> sendJson(res, strategy))
                    .onErrorResume(err -> sendError(res, err))
            );
    }

    private static <T> Mono<T> body(HttpServerRequest req, Class<T> type) {
        return req.receive()
            .aggregate()
            .asString()
            .defaultIfEmpty("")
            .map(json -> {
                if (json.isBlank()) {
                    throw new ValidationException("Missing request body");
                }
                return JsonUtils.readValue(json, type);
            });
    }

    private static Mono<Void> sendJson(HttpServerResponse res, Object body) {
        return Mono.fromCallable(() -> JsonUtils.writeValueAsString(body))
            .flatMap(json -> res.header("Content-Type", JSON)
                .sendString(Mono.just(json))
                .then());
    }

    private static Mono<Void> sendError(HttpServerResponse res, Throwable err) {
        HttpResponseStatus status;
        if (err instanceof ValidationException) {
            status = HttpResponseStatus.BAD_REQUEST;
        } else if (err instanceof InvalidStateException) {
            status = HttpResponseStatus.CONFLICT;
        } else {
            status = HttpResponseStatus.INTERNAL_SERVER_ERROR;
            log.error("Request failed", err);
        }
        String message = err.getMessage() != null ? err.getMessage() : err.getClass().getSimpleName();
        ErrorResponse body = ErrorResponse.builder()
            .error(message)
            .type(err.getClass().getSimpleName())
            .build();
        Publisher<String> json = Mono.just(JsonUtils.writeValueAsString(body));
        return res.status(status)
            .header("Content-Type", JSON)
            .sendString(json)
            .then();
    }
}
