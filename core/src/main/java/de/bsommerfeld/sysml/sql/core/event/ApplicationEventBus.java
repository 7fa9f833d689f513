package de.bsommerfeld.sysml.sql.core.event;

import com.google.common.eventbus.EventBus;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A thin wrapper around Guava's EventBus. The fetcher and the importer report
 * progress through it without knowing who, if anyone, is listening.
 */
@Singleton
public class ApplicationEventBus {

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationEventBus.class);
    private final EventBus eventBus;

    public ApplicationEventBus() {
        this.eventBus = new EventBus("SysmlSql-EventBus");
    }

    public void post(Object event) {
        // Progress events arrive per page and per batch, keep them out of debug
        if (event instanceof SyncEvents.ProgressEvent) {
            LOG.trace("Posting event: {}", event);
        } else {
            LOG.debug("Posting event: {}", event);
        }
        eventBus.post(event);
    }

    public void register(Object listener) {
        LOG.trace("Registering listener: {}", listener.getClass().getName());
        eventBus.register(listener);
    }

    public void unregister(Object listener) {
        LOG.trace("Unregistering listener: {}", listener.getClass().getName());
        eventBus.unregister(listener);
    }
}
