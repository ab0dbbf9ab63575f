package com.schemaid.behavior;

/**
 * No-op listener.
 */
public final class NullBehaviorResolutionListener implements BehaviorResolutionListener {

    public static final NullBehaviorResolutionListener INSTANCE = new NullBehaviorResolutionListener();

    private NullBehaviorResolutionListener() {}

    @Override
    public void onDegraded(BehaviorResolutionDegraded event) {}
}
