package cloud.anchorwatch.sdk.sync;

final class Coordinates {

    private Coordinates() {
    }

    static void check(double latitude, double longitude) {
        if (Double.isNaN(latitude) || latitude < -90 || latitude > 90) {
            throw new IllegalArgumentException("latitude must be between -90 and 90, got " + latitude);
        }
        if (Double.isNaN(longitude) || longitude < -180 || longitude > 180) {
            throw new IllegalArgumentException("longitude must be between -180 and 180, got " + longitude);
        }
    }

    static void checkNonNegative(String name, Double value) {
        if (value != null && (value.isNaN() || value < 0)) {
            throw new IllegalArgumentException(name + " must be non-negative, got " + value);
        }
    }
}
