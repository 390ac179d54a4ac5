package org.broadinstitute.fastproject.engine.progressmeter;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.fastproject.utils.Utils;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Progress meter for batches of named work items (signatures to score, projections to test, ...).
 *
 * Call {@link #start} once, {@link #update(String)} from any thread after each item completes,
 * and {@link #stop} when the batch is finished. A line is printed every {@code secondsBetweenUpdates}
 * by a background daemon thread, and a summary line on {@link #stop}.
 *
 * All output is made at INFO level via log4j.
 */
public final class ProgressMeter {
    private static final Logger logger = LogManager.getLogger(ProgressMeter.class);

    public static final double DEFAULT_SECONDS_BETWEEN_UPDATES = 10.0;

    public static final long MILLISECONDS_PER_SECOND = 1000L;

    public static final long MILLISECONDS_PER_MINUTE = MILLISECONDS_PER_SECOND * 60L;

    public static final String DEFAULT_RECORD_LABEL = "items";

    private final long millisecondsBetweenUpdates;

    private final long expectedRecords;

    private long numRecordsProcessed = 0L;

    private long startTimeMs = 0L;

    private long currentTimeMs = 0L;

    /**
     * Name of the last item reported through {@link #update}; null before the first one.
     */
    private String currentRecord = null;

    /**
     * Number of progress lines written; for unit tests.
     */
    private long numLoggerUpdates = 0L;

    private boolean started;

    private boolean stopped;

    private final boolean disabled;

    private final String recordLabel;

    private ScheduledExecutorService scheduler;

    /**
     * @param recordLabel plural noun for the items, used in the log lines
     * @param expectedRecords total number of items in the batch, or 0 if unknown
     */
    public ProgressMeter(final String recordLabel, final long expectedRecords) {
        this(recordLabel, expectedRecords, DEFAULT_SECONDS_BETWEEN_UPDATES, false);
    }

    /**
     * @param secondsBetweenUpdates number of seconds that should elapse between progress lines
     * @param disabled if true, all operations on this meter are no-ops
     */
    public ProgressMeter(final String recordLabel, final long expectedRecords,
                         final double secondsBetweenUpdates, final boolean disabled) {
        Utils.nonNull(recordLabel);
        Utils.validateArg(expectedRecords >= 0, "expectedRecords must be >= 0");
        Utils.validateArg(secondsBetweenUpdates > 0, "secondsBetweenUpdates must be > 0.0");
        this.recordLabel = recordLabel;
        this.expectedRecords = expectedRecords;
        this.disabled = disabled;
        this.millisecondsBetweenUpdates = (long)(secondsBetweenUpdates * (double)MILLISECONDS_PER_SECOND);
        Utils.validate(millisecondsBetweenUpdates > 0, "millisecondsBetweenUpdates must be > 0");
    }

    /**
     * Start the progress meter and print the column headings.
     * @throws IllegalStateException if the meter has been started before or has been stopped already
     */
    public synchronized void start() {
        if ( disabled ) {
            return;
        }
        Utils.validate( !started, "the progress meter has been started already");
        Utils.validate( !stopped, "the progress meter has been stopped already");
        started = true;
        logger.info(String.format("%40s  %15s  %20s  %15s",
                "Current " + StringUtils.capitalize(recordLabel), "Elapsed Minutes",
                StringUtils.capitalize(recordLabel) + " Processed",
                StringUtils.capitalize(recordLabel) + "/Minute"));

        startTimeMs = getTime();
        currentTimeMs = startTimeMs;

        scheduler = Executors.newSingleThreadScheduledExecutor(
                new ThreadFactoryBuilder().setDaemon(true).setNameFormat("Progress Meter").build());
        scheduler.scheduleAtFixedRate(this::printProgress, millisecondsBetweenUpdates, millisecondsBetweenUpdates, TimeUnit.MILLISECONDS);
    }

    private long getTime() {
        return System.currentTimeMillis();
    }

    /**
     * Signal that one more item has been processed.
     * @param itemName name of the item just processed; may be null
     * @throws IllegalStateException if the meter has not been started yet or has been stopped already
     */
    public synchronized void update(final String itemName) {
        if ( disabled ) {
            return;
        }
        Utils.validate(started, "the progress meter has not been started yet");
        Utils.validate( !stopped, "the progress meter has been stopped already");
        ++numRecordsProcessed;
        currentRecord = itemName;
    }

    /**
     * Stop the progress meter and output summary statistics to the logger
     * @throws IllegalStateException if the meter has not been started yet or has been stopped already
     */
    public synchronized void stop() {
        if ( disabled ) {
            return;
        }
        Utils.validate(started, "the progress meter has not been started yet");
        Utils.validate( !stopped, "the progress meter has been stopped already");
        stopped = true;
        scheduler.shutdown();
        printProgress();
        logger.info(String.format("Processed %d total %s in %.1f minutes.", numRecordsProcessed, recordLabel, elapsedTimeInMinutes()));
    }

    private synchronized void printProgress() {
        currentTimeMs = getTime();
        ++numLoggerUpdates;
        final String count = expectedRecords > 0
                ? String.format("%d/%d", numRecordsProcessed, expectedRecords)
                : Long.toString(numRecordsProcessed);
        logger.info(String.format("%40s  %15.1f  %20s  %15.1f",
                currentRecord == null ? "-" : StringUtils.abbreviate(currentRecord, 40),
                elapsedTimeInMinutes(), count, processingRate()));
    }

    @VisibleForTesting
    synchronized double elapsedTimeInMinutes() {
        return (currentTimeMs - startTimeMs) / (double)MILLISECONDS_PER_MINUTE;
    }

    private double processingRate() {
        final double minutes = elapsedTimeInMinutes();
        return minutes > 0 ? numRecordsProcessed / minutes : 0.0;
    }

    @VisibleForTesting
    synchronized long numLoggerUpdates() {
        return numLoggerUpdates;
    }

    @VisibleForTesting
    synchronized long getNumRecordsProcessed() {
        return numRecordsProcessed;
    }

    public synchronized boolean started() {
        return started;
    }

    public synchronized boolean stopped() {
        return stopped;
    }
}
