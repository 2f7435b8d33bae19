package com.lifebutler.assistant.service;

import com.lifebutler.assistant.model.EmbeddingState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Tracks the embedding rebuild lifecycle and broadcasts every change. New subscribers receive
 * the current state first.
 */
@Component
@Slf4j
public class EmbeddingStatusTracker {

    private final AtomicReference<EmbeddingState> state = new AtomicReference<>(EmbeddingState.NOT_STARTED);
    private final Sinks.Many<EmbeddingState> sink = Sinks.many().replay().latest();

    public EmbeddingStatusTracker() {
        sink.tryEmitNext(EmbeddingState.NOT_STARTED);
    }

    /**
     * Moves to IN_PROGRESS. Returns false if a rebuild is already running.
     */
    public boolean start() {
        EmbeddingState previous = state.getAndUpdate(current ->
                current == EmbeddingState.IN_PROGRESS ? current : EmbeddingState.IN_PROGRESS);
        if (previous == EmbeddingState.IN_PROGRESS) {
            log.warn("⚠️ Embedding rebuild already in progress");
            return false;
        }
        publish(EmbeddingState.IN_PROGRESS);
        return true;
    }

    public void complete() {
        state.set(EmbeddingState.COMPLETE);
        publish(EmbeddingState.COMPLETE);
    }

    public void reset() {
        state.set(EmbeddingState.NOT_STARTED);
        publish(EmbeddingState.NOT_STARTED);
    }

    public EmbeddingState getState() {
        return state.get();
    }

    public boolean isGenerating() {
        return state.get() == EmbeddingState.IN_PROGRESS;
    }

    public boolean isComplete() {
        return state.get() == EmbeddingState.COMPLETE;
    }

    public Flux<EmbeddingState> changes() {
        return sink.asFlux();
    }

    private synchronized void publish(EmbeddingState next) {
        Sinks.EmitResult result = sink.tryEmitNext(next);
        if (result.isFailure()) {
            log.warn("Could not publish embedding state {}: {}", next, result);
        }
    }
}
