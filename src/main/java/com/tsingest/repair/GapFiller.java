package com.tsingest.repair;

import com.tsingest.dataset.ColumnRef;
import com.tsingest.dataset.Dataset;
import com.tsingest.exception.RepairFailureException;
import com.tsingest.gaps.GapReport;
import java.util.Optional;

/**
 * Repairs gaps in a dataset. Implementations supply the imputation strategies; the coordinator
 * only drives them through this contract and uses the filler's own time-column detection.
 */
public interface GapFiller {

    Optional<ColumnRef> findTimestampColumn(Dataset dataset);

    GapReport detectGaps(Dataset dataset, ColumnRef timeColumn);

    /**
     * Returns {@code dataset} itself when nothing changed, or a new repaired dataset.
     *
     * @param algorithm opaque strategy name chosen by the caller, e.g. {@code auto}
     * @throws RepairFailureException when the repair cannot be performed
     */
    Dataset applyAlgorithm(Dataset dataset, String algorithm, GapReport gapReport);
}
