package com.libragraph.steward.core.component;

import org.jboss.logging.Logger;

/**
 * Base class for {@link ManagedComponent} implementations whose initialization finishes
 * when {@link #doStart()} returns. A normal return reports success, an exception reports
 * failure with the exception message.
 * <p>
 * Components with long-running or asynchronous initialization implement
 * {@link ManagedComponent#start} directly and report when ready.
 */
public abstract class AbstractManagedComponent implements ManagedComponent {

    protected final Logger log = Logger.getLogger(getClass());

    // -- template methods for subclasses --

    protected abstract void doStart() throws Exception;

    protected void doStop() throws Exception {
    }

    // -- ManagedComponent contract --

    @Override
    public void start(ComponentContext context) throws Exception {
        try {
            doStart();
        } catch (Exception e) {
            log.errorf("Component '%s' failed to start: %s", componentId(), e.getMessage());
            context.initFailed(e.getMessage() != null ? e.getMessage() : e.getClass().getName());
            throw e;
        }
        context.initSucceeded();
    }

    @Override
    public void stop() throws Exception {
        doStop();
        log.debugf("Component '%s' stopped", componentId());
    }
}
