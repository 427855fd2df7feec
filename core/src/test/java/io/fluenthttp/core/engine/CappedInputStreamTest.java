package io.fluenthttp.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;

/** Tests for {@link CappedInputStream}. */
class CappedInputStreamTest {

    private static final byte[] TEN_BYTES = {0, 1, 2, 3, 4, 5, 6, 7, 8, 9};

    @Test
    void readAllStopsAtCap() throws IOException {
        CappedInputStream in = new CappedInputStream(new ByteArrayInputStream(TEN_BYTES), 4);
        assertThat(in.readAllBytes()).containsExactly(0, 1, 2, 3);
        assertThat(in.read()).isEqualTo(-1);
    }

    @Test
    void capAboveLengthReadsEverything() throws IOException {
        assertThat(new CappedInputStream(new ByteArrayInputStream(TEN_BYTES), 100).readAllBytes())
                .hasSize(10);
    }

    @Test
    void zeroCapReadsNothing() throws IOException {
        assertThat(new CappedInputStream(new ByteArrayInputStream(TEN_BYTES), 0).readAllBytes()).isEmpty();
    }

    @Test
    void singleByteReadsCountTowardsCap() throws IOException {
        CappedInputStream in = new CappedInputStream(new ByteArrayInputStream(TEN_BYTES), 2);
        assertThat(in.read()).isEqualTo(0);
        assertThat(in.read()).isEqualTo(1);
        assertThat(in.read()).isEqualTo(-1);
    }

    @Test
    void skipAndAvailableRespectCap() throws IOException {
        CappedInputStream in = new CappedInputStream(new ByteArrayInputStream(TEN_BYTES), 5);
        assertThat(in.available()).isEqualTo(5);
        assertThat(in.skip(3)).isEqualTo(3);
        assertThat(in.skip(10)).isEqualTo(2);
        assertThat(in.read()).isEqualTo(-1);
    }

    @Test
    void closeLeavesWrappedStreamOpen() throws IOException {
        AtomicBoolean closed = new AtomicBoolean();
        CappedInputStream in = new CappedInputStream(new ByteArrayInputStream(TEN_BYTES) {
            @Override
            public void close() {
                closed.set(true);
            }
        }, 3);

        in.close();

        assertThat(closed).isFalse();
    }
}
