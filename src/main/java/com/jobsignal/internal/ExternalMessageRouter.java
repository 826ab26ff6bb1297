package com.jobsignal.internal;

import com.jobsignal.broker.BrokerMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Hands a foreign message to the first handler that claims it. Handlers are scanned in
 * registration order and at most one runs.
 */
public class ExternalMessageRouter {

    private static final Logger log = LoggerFactory.getLogger(ExternalMessageRouter.class);

    private final List<ExternalMessageHandler> handlers;

    public ExternalMessageRouter(List<ExternalMessageHandler> handlers) {
        this.handlers = List.copyOf(handlers);
    }

    /**
     * @return true when a handler claimed and handled the message
     */
    public boolean route(BrokerMessage message) {
        for (ExternalMessageHandler handler : handlers) {
            if (handler.claims(message)) {
                log.debug("Routing external message to {}", handler.getClass().getName());
                handler.handle(message.payload());
                return true;
            }
        }
        log.warn("No handler claimed a broker message that is not a job notification ({} bytes)",
                message.payload().length);
        return false;
    }
}
