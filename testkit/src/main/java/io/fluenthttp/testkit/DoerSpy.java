package io.fluenthttp.testkit;

import io.fluenthttp.core.model.Request;
import io.fluenthttp.core.model.Response;
import io.fluenthttp.core.spi.Doer;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link Doer} that forwards every request to another doer and records the
 * request together with the response or exception it produced.
 *
 * <p>
 * Thread-safe.
 */
public final class DoerSpy implements Doer {

    private final Doer delegate;
    private final List<DoerSpyRecord> calls = new ArrayList<>();

    public DoerSpy(Doer delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
    }

    @Override
    public Response execute(Request request) throws IOException {
        Response response;
        try {
            response = delegate.execute(request);
        } catch (IOException | RuntimeException e) {
            record(new DoerSpyRecord(request, null, e));
            throw e;
        }
        record(new DoerSpyRecord(request, response, null));
        return response;
    }

    /**
     * Returns the calls recorded since the previous invocation, oldest first,
     * and clears the history.
     */
    public synchronized List<DoerSpyRecord> calls() {
        List<DoerSpyRecord> copy = List.copyOf(calls);
        calls.clear();
        return copy;
    }

    private synchronized void record(DoerSpyRecord call) {
        calls.add(call);
    }
}
