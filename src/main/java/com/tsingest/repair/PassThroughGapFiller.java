package com.tsingest.repair;

import com.tsingest.dataset.ColumnRef;
import com.tsingest.dataset.Dataset;
import com.tsingest.gaps.GapAnalyzer;
import com.tsingest.gaps.GapReport;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Filler used when no imputation strategy is installed: detection is delegated to
 * {@link GapAnalyzer} and datasets are returned unchanged.
 */
public class PassThroughGapFiller implements GapFiller {

    private static final Logger log = LoggerFactory.getLogger(PassThroughGapFiller.class);

    private final GapAnalyzer gapAnalyzer;

    public PassThroughGapFiller(GapAnalyzer gapAnalyzer) {
        this.gapAnalyzer = gapAnalyzer;
    }

    @Override
    public Optional<ColumnRef> findTimestampColumn(Dataset dataset) {
        return gapAnalyzer.findTimeColumn(dataset);
    }

    @Override
    public GapReport detectGaps(Dataset dataset, ColumnRef timeColumn) {
        return gapAnalyzer.analyze(dataset, timeColumn);
    }

    @Override
    public Dataset applyAlgorithm(Dataset dataset, String algorithm, GapReport gapReport) {
        log.debug("No gap filling installed, keeping {} gaps as-is (algorithm {})", gapReport.gapCount(), algorithm);
        return dataset;
    }
}
