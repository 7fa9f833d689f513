package de.bsommerfeld.sysml.sql.cli;

import com.google.common.base.Ticker;
import com.google.common.eventbus.Subscribe;
import de.bsommerfeld.sysml.sql.core.event.SyncEvents;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Logs fetch and import progress at most once per interval. Listens on the
 * application event bus.
 */
public class ProgressReporter {

    private static final Logger LOG = LoggerFactory.getLogger(ProgressReporter.class);

    private final long intervalNanos;
    private final Ticker ticker;
    private long lastReport;
    private int reports;

    public ProgressReporter(Duration interval) {
        this(interval, Ticker.systemTicker());
    }

    ProgressReporter(Duration interval, Ticker ticker) {
        this.intervalNanos = interval.toNanos();
        this.ticker = ticker;
        this.lastReport = ticker.read();
    }

    @Subscribe
    public void onPageFetched(SyncEvents.PageFetchedEvent event) {
        if (due()) {
            LOG.info("Fetched {} elements in {} pages", event.totalRecords(), event.pageNumber());
        }
    }

    @Subscribe
    public void onImportProgress(SyncEvents.ImportProgressEvent event) {
        if (due()) {
            long seconds = Math.max(1, event.elapsed().toSeconds());
            LOG.info("Imported {} {} ({} rows/s)", event.rows(), event.phase(), event.rows() / seconds);
        }
    }

    private synchronized boolean due() {
        long now = ticker.read();
        if (now - lastReport < intervalNanos) {
            return false;
        }
        lastReport = now;
        reports++;
        return true;
    }

    synchronized int reports() {
        return reports;
    }
}
