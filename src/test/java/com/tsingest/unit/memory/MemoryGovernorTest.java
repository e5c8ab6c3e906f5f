package com.tsingest.unit.memory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.tsingest.config.IngestionConfig;
import com.tsingest.dataset.Dataset;
import com.tsingest.dataset.NumericColumn;
import com.tsingest.dataset.TextColumn;
import com.tsingest.dataset.TimestampColumn;
import com.tsingest.memory.MemoryGovernor;
import com.tsingest.memory.MemoryProbe;
import com.tsingest.memory.MemorySnapshot;
import com.tsingest.memory.MostConstrainedMemoryProbe;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for MemoryGovernor: sizing rule, headroom checks and the optimistic fallback
 * when memory cannot be read.
 */
@ExtendWith(MockitoExtension.class)
class MemoryGovernorTest {

    private static final long MB = IngestionConfig.MB;

    @Mock
    private MemoryProbe memoryProbe;

    private IngestionConfig ingestionConfig;
    private MemoryGovernor memoryGovernor;

    @BeforeEach
    void setUp() {
        ingestionConfig = new IngestionConfig();
        memoryGovernor = new MemoryGovernor(memoryProbe, ingestionConfig);
    }

    @Nested
    @DisplayName("shouldChunk")
    class ShouldChunk {

        @Test
        @DisplayName("chunks only files strictly larger than the threshold")
        void thresholdIsExclusive() {
            assertThat(memoryGovernor.shouldChunk(100 * MB)).isFalse();
            assertThat(memoryGovernor.shouldChunk(100 * MB + 1)).isTrue();
            assertThat(memoryGovernor.shouldChunk(0)).isFalse();
        }

        @Test
        @DisplayName("follows the configured threshold")
        void configurableThreshold() {
            ingestionConfig.setChunkSizeThresholdBytes(10);

            assertThat(memoryGovernor.shouldChunk(11)).isTrue();
        }
    }

    @Nested
    @DisplayName("hasHeadroom")
    class HasHeadroom {

        @Test
        @DisplayName("default margin: 80% of available must reach 100 MB")
        void defaultMargin() {
            when(memoryProbe.read()).thenReturn(MemorySnapshot.of(1024 * MB, 125 * MB));
            assertThat(memoryGovernor.hasHeadroom()).isTrue();

            when(memoryProbe.read()).thenReturn(MemorySnapshot.of(1024 * MB, 124 * MB));
            assertThat(memoryGovernor.hasHeadroom()).isFalse();
        }

        @Test
        @DisplayName("explicit requirement compares against available bytes")
        void explicitRequirement() {
            when(memoryProbe.read()).thenReturn(MemorySnapshot.of(1000, 500));

            assertThat(memoryGovernor.hasHeadroom(500)).isTrue();
            assertThat(memoryGovernor.hasHeadroom(501)).isFalse();
        }

        @Test
        @DisplayName("assumes headroom when the probe fails")
        void probeFailureIsOptimistic() {
            when(memoryProbe.read()).thenThrow(new IllegalStateException("no /proc"));

            assertThat(memoryGovernor.hasHeadroom()).isTrue();
            assertThat(memoryGovernor.hasHeadroom(Long.MAX_VALUE - 1)).isTrue();
        }

        @Test
        @DisplayName("re-queries the probe on every call")
        void noMemoization() {
            when(memoryProbe.read()).thenReturn(MemorySnapshot.of(1000, 500));

            memoryGovernor.snapshot();
            memoryGovernor.snapshot();
            memoryGovernor.hasHeadroom();

            verify(memoryProbe, times(3)).read();
        }
    }

    @Nested
    @DisplayName("snapshot")
    class Snapshot {

        @Test
        @DisplayName("never throws and marks the fallback as unknown")
        void fallbackSnapshot() {
            when(memoryProbe.read()).thenThrow(new RuntimeException("boom"));

            MemorySnapshot snapshot = memoryGovernor.snapshot();

            assertThat(snapshot.known()).isFalse();
            assertThat(snapshot.availableBytes()).isEqualTo(Long.MAX_VALUE);
        }

        @Test
        @DisplayName("derives used bytes and percentage")
        void derivedFields() {
            when(memoryProbe.read()).thenReturn(MemorySnapshot.of(1000, 250));

            MemorySnapshot snapshot = memoryGovernor.snapshot();

            assertThat(snapshot.usedBytes()).isEqualTo(750);
            assertThat(snapshot.percentUsed()).isEqualTo(75.0);
            assertThat(snapshot.known()).isTrue();
        }
    }

    @Test
    @DisplayName("estimateFootprint uses wider widths for text and timestamp columns")
    void estimateFootprint() {
        Dataset dataset = Dataset.of(List.of(
                NumericColumn.of("close", 1.0, 2.0),
                TextColumn.of("symbol", "A", "B"),
                TimestampColumn.of("time", Instant.EPOCH, Instant.EPOCH)));

        assertThat(memoryGovernor.estimateFootprint(dataset)).isEqualTo(2 * (8 + 48 + 16));
    }

    @Nested
    @DisplayName("MostConstrainedMemoryProbe")
    class MostConstrained {

        @Test
        @DisplayName("reports the reading with the least available memory")
        void picksLowest() {
            MemoryProbe probe = new MostConstrainedMemoryProbe(List.of(
                    () -> MemorySnapshot.of(1000, 600),
                    () -> MemorySnapshot.of(2000, 300)));

            assertThat(probe.read().availableBytes()).isEqualTo(300);
        }

        @Test
        @DisplayName("skips failing probes and fails only when all fail")
        void failingProbes() {
            MemoryProbe partlyBroken = new MostConstrainedMemoryProbe(List.of(
                    () -> {
                        throw new IllegalStateException("unsupported");
                    },
                    () -> MemorySnapshot.of(1000, 400)));
            MemoryProbe broken = new MostConstrainedMemoryProbe(List.of(() -> {
                throw new IllegalStateException("unsupported");
            }));

            assertThat(partlyBroken.read().availableBytes()).isEqualTo(400);
            assertThatThrownBy(broken::read).isInstanceOf(IllegalStateException.class);
        }
    }
}
