package com.yerin.storyq.generation;

public class JobCancelledException extends TerminalGenerationException {

    public static final String REASON = "cancelled";

    public JobCancelledException(String jobId) {
        super(REASON + " (jobId=" + jobId + ")");
    }
}
