package com.tsingest.unit.repair;

import static org.assertj.core.api.Assertions.assertThat;

import com.tsingest.dataset.ColumnRef;
import com.tsingest.dataset.Dataset;
import com.tsingest.dataset.NumericColumn;
import com.tsingest.dataset.TextColumn;
import com.tsingest.gaps.GapAnalysisConfig;
import com.tsingest.gaps.GapAnalyzer;
import com.tsingest.gaps.GapReport;
import com.tsingest.repair.PassThroughGapFiller;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("PassThroughGapFiller")
class PassThroughGapFillerTest {

    private final PassThroughGapFiller gapFiller = new PassThroughGapFiller(new GapAnalyzer(new GapAnalysisConfig()));

    @Test
    @DisplayName("detects gaps through the analyzer and returns the dataset untouched")
    void detectsButDoesNotFill() {
        Dataset dataset = Dataset.of(List.of(
                TextColumn.of("date", "2024-01-01", "2024-01-02", "2024-01-03", "2024-01-08"),
                NumericColumn.of("close", 1.0, 1.1, 1.2, 1.3)));

        ColumnRef timeColumn = gapFiller.findTimestampColumn(dataset).orElseThrow();
        GapReport report = gapFiller.detectGaps(dataset, timeColumn);
        Dataset result = gapFiller.applyAlgorithm(dataset, "auto", report);

        assertThat(timeColumn).isEqualTo(ColumnRef.column("date"));
        assertThat(report.gapCount()).isEqualTo(1);
        assertThat(report.totalMissingSamples()).isEqualTo(4);
        assertThat(result).isSameAs(dataset);
    }
}
