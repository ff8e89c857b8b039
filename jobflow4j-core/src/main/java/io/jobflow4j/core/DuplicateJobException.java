package io.jobflow4j.core;

public class DuplicateJobException extends IllegalStateException {

    private final String jobId;

    public DuplicateJobException(String jobId) {
        super("Job already queued, scheduled or running: " + jobId);
        this.jobId = jobId;
    }

    public String jobId() {
        return jobId;
    }
}
