package cloud.anchorwatch.sdk.sync;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Snapshot of the monitoring data a primary device publishes.
 *
 * @param anchor   current anchor, nullable
 * @param position latest position, nullable
 * @param alarms   alarms known to the monitoring engine, acknowledged or not
 */
public record MonitoringState(Anchor anchor, PositionUpdate position, List<AlarmEvent> alarms) {

    public static final MonitoringState EMPTY = new MonitoringState(null, null, List.of());

    public MonitoringState {
        alarms = alarms == null ? List.of() : List.copyOf(alarms);
    }

    public List<AlarmEvent> activeAlarms() {
        return alarms.stream().filter(alarm -> !alarm.acknowledged()).collect(Collectors.toList());
    }

    public MonitoringState withAnchor(Anchor value) {
        return new MonitoringState(value, position, alarms);
    }

    public MonitoringState withPosition(PositionUpdate value) {
        return new MonitoringState(anchor, value, alarms);
    }

    public MonitoringState withAlarms(List<AlarmEvent> value) {
        return new MonitoringState(anchor, position, value);
    }
}
