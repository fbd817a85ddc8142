package com.keyhive.participant.session;

import com.keyhive.core.api.PoolApi;
import com.keyhive.core.error.PoolUnavailableException;
import com.keyhive.core.model.Assignment;
import com.keyhive.core.model.PoolStats;
import com.keyhive.core.model.ProgressRecord;
import com.keyhive.core.msg.PoolMessages.AbandonRequest;
import com.keyhive.core.msg.PoolMessages.AssignmentRequest;
import com.keyhive.core.msg.PoolMessages.CompletionReport;
import com.keyhive.core.msg.PoolMessages.ProgressReport;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Pool that is unreachable except for whatever stats it is told to serve.
 */
class StubPool implements PoolApi {
    final AtomicReference<Mono<PoolStats>> stats = new AtomicReference<>(StubPool.<PoolStats>down());
    final AtomicInteger progressCalls = new AtomicInteger();

    static <T> Mono<T> down() {
        return Mono.error(new PoolUnavailableException("connection refused"));
    }

    @Override
    public Mono<Assignment> requestAssignment(AssignmentRequest request) {
        return down();
    }

    @Override
    public Mono<ProgressRecord> reportProgress(ProgressReport report) {
        progressCalls.incrementAndGet();
        return down();
    }

    @Override
    public Mono<Assignment> reportCompletion(CompletionReport report) {
        return down();
    }

    @Override
    public Mono<Assignment> abandonAssignment(AbandonRequest request) {
        return down();
    }

    @Override
    public Mono<PoolStats> getStats(String clientId) {
        return stats.get();
    }
}
