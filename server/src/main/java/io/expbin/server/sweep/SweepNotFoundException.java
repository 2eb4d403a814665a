package io.expbin.server.sweep;

/** No sweep job with this id is registered (never started, or evicted from the registry). */
public class SweepNotFoundException extends RuntimeException {
    private final String jobId;

    public SweepNotFoundException(String jobId) {
        super("sweep not found: " + jobId);
        this.jobId = jobId;
    }

    public String jobId() {
        return jobId;
    }
}
