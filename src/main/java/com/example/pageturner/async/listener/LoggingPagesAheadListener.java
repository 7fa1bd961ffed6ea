package com.example.pageturner.async.listener;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link PagesAheadListener} that writes scheduling events to SLF4J.
 *
 * <p>Scheduling and completion events are logged at TRACE, end-of-data and
 * error reconciliation at DEBUG. Past-the-end errors are expected when look-ahead
 * is not capped with a limit, so they are never logged above DEBUG.
 */
public class LoggingPagesAheadListener implements PagesAheadListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingPagesAheadListener.class);

    private final String streamName;

    public LoggingPagesAheadListener(String streamName) {
        this.streamName = streamName;
    }

    @Override
    public void onScheduled(long index, Object request) {
        log.trace("[{}] scheduled page #{}: {}", streamName, index, request);
    }

    @Override
    public void onCompleted(long index, boolean success) {
        log.trace("[{}] page #{} completed, success={}", streamName, index, success);
    }

    @Override
    public void onLastPage(long index) {
        log.debug("[{}] page #{} is the last page", streamName, index);
    }

    @Override
    public void onErrorRetained(long index, Throwable error) {
        log.debug("[{}] holding back error of page #{} until the last page is known: {}",
                streamName, index, error.toString());
    }

    @Override
    public void onErrorDiscarded(long index, Throwable error) {
        log.debug("[{}] discarding error of page #{} queried past the last page: {}",
                streamName, index, error.toString());
    }

    @Override
    public void onPageDiscarded(long index) {
        log.debug("[{}] dropping page #{} answered past the last page", streamName, index);
    }

    @Override
    public void onTerminated(boolean failed) {
        log.debug("[{}] stream terminated{}", streamName, failed ? " with an error" : "");
    }
}
