package cloud.anchorwatch.sdk.sync;

public enum AlarmType {
    DRIFT_EXCEEDED("driftExceeded"),
    GPS_LOST("gpsLost"),
    GPS_INACCURATE("gpsInaccurate");

    private final String wireName;

    AlarmType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
