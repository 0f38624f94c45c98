package cloud.anchorwatch.sdk.sync;

import cloud.anchorwatch.sdk.store.Subscription;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.UnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Mutable {@link MonitoringDataSource} fed by the application's GPS and alarm engine. Listeners run on the thread
 * that made the change and are only told about actual changes.
 */
public final class LocalMonitoringData implements MonitoringDataSource {

    private static final Logger LOGGER = Logger.getLogger(LocalMonitoringData.class.getName());

    private final List<MonitoringListener> listeners = new CopyOnWriteArrayList<>();
    private MonitoringState state = MonitoringState.EMPTY;

    @Override
    public synchronized MonitoringState current() {
        return state;
    }

    @Override
    public Subscription subscribe(MonitoringListener listener) {
        Objects.requireNonNull(listener, "listener");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public void setAnchor(Anchor anchor) {
        apply(current -> current.withAnchor(anchor));
    }

    public void setPosition(PositionUpdate position) {
        apply(current -> current.withPosition(position));
    }

    public void setAlarms(List<AlarmEvent> alarms) {
        apply(current -> current.withAlarms(alarms));
    }

    private void apply(UnaryOperator<MonitoringState> change) {
        MonitoringState next;
        synchronized (this) {
            next = change.apply(state);
            if (next.equals(state)) {
                return;
            }
            state = next;
        }
        for (MonitoringListener listener : listeners) {
            try {
                listener.onChange(next);
            } catch (RuntimeException ex) {
                LOGGER.log(Level.WARNING, "[anchorwatch] monitoring listener failed", ex);
            }
        }
    }
}
