package cloud.anchorwatch.sdk.sync;

import cloud.anchorwatch.sdk.store.Subscription;

/**
 * Producer of the anchor, position and alarm data (GPS and drift detection live outside the SDK).
 */
public interface MonitoringDataSource {

    MonitoringState current();

    /**
     * Registers {@code listener} for subsequent changes; the current value is not replayed.
     */
    Subscription subscribe(MonitoringListener listener);
}
