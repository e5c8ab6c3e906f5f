package com.tsingest.event;

import com.tsingest.resolution.FileOutcome;
import com.tsingest.resolution.ResolutionLabel;
import java.util.List;
import org.springframework.context.ApplicationEvent;

/**
 * Published when the coordinator finishes a resolution bucket, including buckets where every
 * file failed.
 */
public class BucketLoadedEvent extends ApplicationEvent {

    private final ResolutionLabel label;
    private final boolean base;
    private final int rows;
    private final List<FileOutcome> outcomes;

    public BucketLoadedEvent(Object source, ResolutionLabel label, boolean base, int rows, List<FileOutcome> outcomes) {
        super(source);
        this.label = label;
        this.base = base;
        this.rows = rows;
        this.outcomes = List.copyOf(outcomes);
    }

    public ResolutionLabel getLabel() {
        return label;
    }

    public boolean isBase() {
        return base;
    }

    public int getRows() {
        return rows;
    }

    public List<FileOutcome> getOutcomes() {
        return outcomes;
    }
}
