package com.schemaid.behavior;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default listener: logs every degraded resolution as a warning.
 */
public final class Slf4jBehaviorResolutionListener implements BehaviorResolutionListener {

    private static final Logger log = LoggerFactory.getLogger(Slf4jBehaviorResolutionListener.class);

    @Override
    public void onDegraded(BehaviorResolutionDegraded event) {
        log.warn("Behavior {} at {} fingerprinted {}: {}",
                event.getQualifiedName(),
                event.getOrigin(),
                event.getStrategy().getLabel(),
                event.getReason());
    }
}
