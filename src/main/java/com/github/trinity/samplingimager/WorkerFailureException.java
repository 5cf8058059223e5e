package com.github.trinity.samplingimager;

/**
 * Raised when a worker terminates abnormally. The run is aborted and no partial
 * field is returned.
 *
 * @author Sean Phillips
 */
public class WorkerFailureException extends ImagingException {

    private final int firstIndex;
    private final int lastIndex;
    private final int failedIndex;

    /**
     * @param firstIndex  first grid index of the failed chunk
     * @param lastIndex   last grid index of the failed chunk (inclusive)
     * @param failedIndex grid index being evaluated when the worker failed, or -1 if unknown
     * @param cause       the worker's failure
     */
    public WorkerFailureException(int firstIndex, int lastIndex, int failedIndex, Throwable cause) {
        super(String.format("Worker failed on grid indices [%d, %d]%s", firstIndex, lastIndex,
            failedIndex >= 0 ? " at index " + failedIndex : ""), cause);
        this.firstIndex = firstIndex;
        this.lastIndex = lastIndex;
        this.failedIndex = failedIndex;
    }

    public int getFirstIndex() {
        return firstIndex;
    }

    public int getLastIndex() {
        return lastIndex;
    }

    public int getFailedIndex() {
        return failedIndex;
    }

    public boolean covers(int gridIndex) {
        return gridIndex >= firstIndex && gridIndex <= lastIndex;
    }
}
