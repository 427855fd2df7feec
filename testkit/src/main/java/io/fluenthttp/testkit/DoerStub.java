package io.fluenthttp.testkit;

import io.fluenthttp.core.model.Request;
import io.fluenthttp.core.model.Response;
import io.fluenthttp.core.spi.Doer;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Doer} answering from a list of pre-configured calls without any
 * network access. Each call is consumed once.
 *
 * <p>
 * In strict order the next configured call must accept the request; a
 * mismatch fails with an {@link IOException} listing the mismatches and
 * consumes nothing. In flexible order the first call that accepts the request
 * (or has no matcher) is consumed, skipping the others.
 *
 * <p>
 * Thread-safe.
 */
public final class DoerStub implements Doer {

    private static final Logger LOG = LoggerFactory.getLogger(DoerStub.class);

    private final boolean strictOrder;
    private final List<DoerStubCall> calls;

    public DoerStub(List<DoerStubCall> calls, boolean strictOrder) {
        this.calls = new ArrayList<>(calls);
        this.strictOrder = strictOrder;
    }

    @Override
    public synchronized Response execute(Request request) throws IOException {
        int index = -1;
        for (int i = 0; i < calls.size(); i++) {
            RequestMatcher matcher = calls.get(i).matcher();
            if (matcher == null) {
                index = i;
                break;
            }
            List<String> mismatches = matcher.mismatches(request);
            if (mismatches.isEmpty()) {
                index = i;
                break;
            }
            if (strictOrder) {
                throw new IOException("request does not match: " + String.join("; ", mismatches));
            }
        }

        if (index == -1) {
            throw new IOException("http doer not configured for this call");
        }

        DoerStubCall call = calls.remove(index);
        LOG.debug("Stubbed {} {} with call #{}, {} remaining", request.method(), request.uri(), index, calls.size());
        if (call.error() != null) {
            throw call.error();
        }
        return call.response();
    }

    /** Calls not consumed yet, in configuration order. */
    public synchronized List<DoerStubCall> remainingCalls() {
        return List.copyOf(calls);
    }
}
