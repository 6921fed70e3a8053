package org.pgninja.batch;

import org.pgninja.query.Query;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Outcome of one batch call. Items record into it concurrently while the batch runs; once {@link #isSettled()}
 * it no longer changes.
 *
 * <p>Keys of the per-index maps are positions in the submitted request. For a settled report
 * {@code completedCount + failureByIndex.size() == totalCount}, and {@link #isOverallSuccess()} holds exactly
 * when no item failed and no fatal error occurred.
 */
public class BatchReport {

    private final int totalCount;
    private int completedCount;
    private final SortedMap<Integer, List<Map<String, Object>>> successByIndex = new TreeMap<>();
    private final SortedMap<Integer, Query> failureByIndex = new TreeMap<>();
    private final SortedMap<Integer, Throwable> errorByIndex = new TreeMap<>();
    private Throwable fatalError;
    private long elapsedMillis;
    private boolean settled;

    public BatchReport(int totalCount) {
        this.totalCount = totalCount;
    }

    synchronized void recordSuccess(int index, List<Map<String, Object>> rows, boolean retainRows) {
        checkOpen();
        completedCount++;
        if (retainRows) {
            successByIndex.put(index, rows);
        }
    }

    synchronized void recordFailure(int index, Query query, Throwable error) {
        checkOpen();
        failureByIndex.put(index, query);
        errorByIndex.put(index, error);
    }

    synchronized void recordFatal(Throwable error) {
        if (fatalError == null) {
            fatalError = error;
        } else if (fatalError != error) {
            fatalError.addSuppressed(error);
        }
    }

    synchronized void settle(long elapsedMillis) {
        if (settled) {
            return;
        }
        this.elapsedMillis = elapsedMillis;
        this.settled = true;
    }

    private void checkOpen() {
        if (settled) {
            throw new IllegalStateException("batch report already settled");
        }
    }

    public int getTotalCount() {
        return totalCount;
    }

    public synchronized int getCompletedCount() {
        return completedCount;
    }

    /** Rows of successful items; empty unless the request asked to retain them. */
    public synchronized SortedMap<Integer, List<Map<String, Object>>> getSuccessByIndex() {
        return Collections.unmodifiableSortedMap(new TreeMap<>(successByIndex));
    }

    public synchronized SortedMap<Integer, Query> getFailureByIndex() {
        return Collections.unmodifiableSortedMap(new TreeMap<>(failureByIndex));
    }

    public synchronized SortedMap<Integer, Throwable> getErrorByIndex() {
        return Collections.unmodifiableSortedMap(new TreeMap<>(errorByIndex));
    }

    public synchronized Optional<Throwable> getFatalError() {
        return Optional.ofNullable(fatalError);
    }

    public synchronized long getElapsedMillis() {
        return elapsedMillis;
    }

    public synchronized boolean isSettled() {
        return settled;
    }

    public synchronized boolean isOverallSuccess() {
        return errorByIndex.isEmpty() && fatalError == null;
    }

    @Override
    public synchronized String toString() {
        return "BatchReport[completed=" + completedCount + "/" + totalCount
                + ", failed=" + failureByIndex.keySet()
                + ", fatal=" + (fatalError == null ? "none" : fatalError.toString())
                + ", elapsedMillis=" + elapsedMillis
                + ", success=" + isOverallSuccess() + "]";
    }
}
