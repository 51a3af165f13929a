package com.phillippitts.pingwatch.service.trace;

import com.phillippitts.pingwatch.util.CancellationSignal;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * State of one trace run: the addresses, their output buffers, the per-address terminal
 * flags and the run's shared {@link CancellationSignal}.
 *
 * <p>Per address, {@code completed} is set once its task has cleaned up (whatever the
 * cause) and {@code stopAnnotated} the first time a stopped trailer is written. Both only
 * go from false to true. The stop handler and the run finalizer race to annotate unfinished
 * addresses; the check and the flag update happen under one lock, so every address ends
 * with exactly one trailer.
 *
 * <p>After an address's trailer is written its buffer accepts no more lines.
 *
 * <p><b>Thread Safety:</b> all methods are thread-safe.
 */
public final class TraceSession {

    private final UUID id;
    private final List<String> addresses;
    private final long timeoutMs;
    private final Instant startedAt;
    private final CancellationSignal signal = new CancellationSignal();
    private final CompletableFuture<Void> completion = new CompletableFuture<>();

    private final Lock lock = new ReentrantLock();
    private final Map<String, AddressState> states = new LinkedHashMap<>();

    private static final class AddressState {
        final TraceOutputBuffer buffer = new TraceOutputBuffer();
        boolean completed;
        boolean stopAnnotated;
        boolean trailerWritten;
    }

    TraceSession(UUID id, List<String> addresses, long timeoutMs, Instant startedAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.addresses = List.copyOf(addresses);
        this.timeoutMs = timeoutMs;
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt");
        for (String address : this.addresses) {
            states.put(address, new AddressState());
        }
    }

    /**
     * Appends a streamed line unless the address already has its trailer.
     *
     * @return {@code true} if the line was appended
     */
    boolean append(String address, String line) {
        lock.lock();
        try {
            AddressState state = require(address);
            if (state.trailerWritten) {
                return false;
            }
            state.buffer.append(line);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Appends a banner line to every address's buffer, trailers notwithstanding.
     */
    void broadcast(String line) {
        lock.lock();
        try {
            states.values().forEach(s -> s.buffer.append(line));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks an address's task as cleaned up and writes its trailer if it has none yet.
     *
     * @param address traced address
     * @param outcome how the task ended
     * @return {@code true} if this call wrote the trailer
     */
    boolean finish(String address, TraceOutcome outcome) {
        lock.lock();
        try {
            AddressState state = require(address);
            state.completed = true;
            if (state.stopAnnotated || state.trailerWritten) {
                return false;
            }
            if (outcome == TraceOutcome.STOPPED) {
                state.stopAnnotated = true;
            }
            state.buffer.append(outcome.trailer());
            state.trailerWritten = true;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Writes the stopped trailer to every address that is neither completed nor already
     * stop-annotated.
     *
     * @return addresses annotated by this call, in submission order
     */
    List<String> annotatePendingStopped() {
        List<String> annotated = new ArrayList<>();
        lock.lock();
        try {
            for (Map.Entry<String, AddressState> entry : states.entrySet()) {
                AddressState state = entry.getValue();
                if (!state.completed && !state.stopAnnotated) {
                    state.stopAnnotated = true;
                    state.trailerWritten = true;
                    state.buffer.append(TraceOutcome.STOPPED.trailer());
                    annotated.add(entry.getKey());
                }
            }
        } finally {
            lock.unlock();
        }
        return annotated;
    }

    public boolean isCompleted(String address) {
        lock.lock();
        try {
            return require(address).completed;
        } finally {
            lock.unlock();
        }
    }

    public boolean isStopAnnotated(String address) {
        lock.lock();
        try {
            return require(address).stopAnnotated;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Copy of an address's output lines, empty if the address is not part of this run.
     */
    public Optional<List<String>> output(String address) {
        lock.lock();
        try {
            AddressState state = states.get(address);
            return state == null ? Optional.empty() : Optional.of(state.buffer.lines());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Full transcript of an address, lines joined with the platform separator.
     */
    public Optional<String> transcript(String address) {
        lock.lock();
        try {
            AddressState state = states.get(address);
            return state == null ? Optional.empty() : Optional.of(state.buffer.text());
        } finally {
            lock.unlock();
        }
    }

    public UUID id() {
        return id;
    }

    public List<String> addresses() {
        return addresses;
    }

    public long timeoutMs() {
        return timeoutMs;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public CancellationSignal signal() {
        return signal;
    }

    /**
     * Completes once the run finalizer has written the finish banner.
     */
    public CompletableFuture<Void> completion() {
        return completion;
    }

    public boolean isFinished() {
        return completion.isDone();
    }

    public TraceRunInfo info() {
        return new TraceRunInfo(id, addresses, timeoutMs, startedAt, isFinished());
    }

    void markFinished() {
        completion.complete(null);
    }

    private AddressState require(String address) {
        AddressState state = states.get(address);
        if (state == null) {
            throw new IllegalArgumentException("Address not part of trace run: " + address);
        }
        return state;
    }
}
