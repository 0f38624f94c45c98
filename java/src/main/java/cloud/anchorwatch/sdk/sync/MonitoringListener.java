package cloud.anchorwatch.sdk.sync;

@FunctionalInterface
public interface MonitoringListener {

    void onChange(MonitoringState state);
}
