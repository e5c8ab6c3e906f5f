package com.tsingest.unit.resolution;

import static org.assertj.core.api.Assertions.assertThat;

import com.tsingest.resolution.ResolutionClassifier;
import com.tsingest.resolution.ResolutionLabel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("ResolutionClassifier")
class ResolutionClassifierTest {

    @Nested
    @DisplayName("Markers")
    class Markers {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
            "EURUSD_PERIOD_M15_2023.csv, M15",
            "eurusd_m1_2023.csv, M1",
            "EURUSD_M5.csv, M5",
            "EURUSD_30M_export.txt, M30",
            "xauusd_h1.csv, H1",
            "XAUUSD_4H_2020.csv, H4",
            "EURUSD_D1.tscol, D1",
            "EURUSD_DAILY_2023.csv, D1",
            "EURUSD_W1.csv, W1",
            "EURUSD_MONTHLY_all.csv, MN1",
            "EURUSD_MN1.csv, MN1"
        })
        void classifies(String fileName, ResolutionLabel expected) {
            assertThat(ResolutionClassifier.classify(fileName)).isEqualTo(expected);
        }

        @Test
        @DisplayName("a finer marker yields to a coarser one that contains it")
        void suppression() {
            assertThat(ResolutionClassifier.classify("EURUSD_M1_M15.csv")).isEqualTo(ResolutionLabel.M15);
            assertThat(ResolutionClassifier.classify("EURUSD_M5_M30.csv")).isEqualTo(ResolutionLabel.M30);
            assertThat(ResolutionClassifier.classify("EURUSD_H1_H4.csv")).isEqualTo(ResolutionLabel.H4);
        }
    }

    @Nested
    @DisplayName("Keyword fallback")
    class Keywords {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
            "eurusd_15minute_2023.csv, M15",
            "eurusd 5 min.csv, M5",
            "EURUSD-MINUTE-30.csv, M30",
            "gbpusd_1hour.csv, H1",
            "gbpusd_4_hours.csv, H4",
            "eurusd daily 2023.csv, D1",
            "eurusd_week.csv, W1",
            "eurusd_1month.csv, MN1"
        })
        void classifies(String fileName, ResolutionLabel expected) {
            assertThat(ResolutionClassifier.classify(fileName)).isEqualTo(expected);
        }

        @Test
        @DisplayName("unsupported counts and years do not classify")
        void unsupportedCounts() {
            assertThat(ResolutionClassifier.classify("eurusd_3minute.csv")).isEqualTo(ResolutionLabel.UNCLASSIFIED);
            assertThat(ResolutionClassifier.classify("eurusd_2days.csv")).isEqualTo(ResolutionLabel.UNCLASSIFIED);
        }
    }

    @Test
    @DisplayName("names without any resolution hint are unclassified")
    void unclassified() {
        assertThat(ResolutionClassifier.classify("EURUSD_2023.csv")).isEqualTo(ResolutionLabel.UNCLASSIFIED);
        assertThat(ResolutionClassifier.classify("prices.csv")).isEqualTo(ResolutionLabel.UNCLASSIFIED);
        assertThat(ResolutionLabel.UNCLASSIFIED.getCode()).isEqualTo("UNKNOWN");
    }
}
