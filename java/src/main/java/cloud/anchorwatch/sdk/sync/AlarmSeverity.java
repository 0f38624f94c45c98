package cloud.anchorwatch.sdk.sync;

/**
 * {@link #ALARM} needs immediate attention (drift exceeded); {@link #WARNING} is informational (GPS issues).
 */
public enum AlarmSeverity {
    ALARM("alarm"),
    WARNING("warning");

    private final String wireName;

    AlarmSeverity(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
