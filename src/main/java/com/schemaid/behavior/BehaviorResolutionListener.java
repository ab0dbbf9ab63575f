package com.schemaid.behavior;

/**
 * Receives degraded behavior resolutions. Implementations must not throw.
 */
public interface BehaviorResolutionListener {

    void onDegraded(BehaviorResolutionDegraded event);
}
