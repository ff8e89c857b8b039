package io.jobflow4j.executor;

/**
 * A job's command did not succeed. The message becomes the job's error message.
 */
public class JobExecutionException extends Exception {

    public JobExecutionException(String message) {
        super(message);
    }

    public JobExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
