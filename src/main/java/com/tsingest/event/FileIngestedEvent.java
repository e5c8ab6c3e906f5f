package com.tsingest.event;

import com.tsingest.ingest.IngestResult;
import org.springframework.context.ApplicationEvent;

/**
 * Published once a file has been loaded, truncated or not.
 */
public class FileIngestedEvent extends ApplicationEvent {

    private final IngestResult result;

    public FileIngestedEvent(Object source, IngestResult result) {
        super(source);
        this.result = result;
    }

    public IngestResult getResult() {
        return result;
    }
}
