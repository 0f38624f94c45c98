package cloud.anchorwatch.sdk.session;

import java.security.SecureRandom;
import java.util.Objects;

/**
 * Session token format shared with QR codes and deep links: exactly 32 characters from {@code A-Z0-9}.
 */
public final class SessionTokens {

    public static final int LENGTH = 32;
    static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";

    private SessionTokens() {
    }

    public static String generate(SecureRandom random) {
        Objects.requireNonNull(random, "random");
        char[] chars = new char[LENGTH];
        for (int i = 0; i < LENGTH; i++) {
            chars[i] = ALPHABET.charAt(random.nextInt(ALPHABET.length()));
        }
        return new String(chars);
    }

    public static boolean isValid(String token) {
        if (token == null || token.length() != LENGTH) {
            return false;
        }
        for (int i = 0; i < LENGTH; i++) {
            char ch = token.charAt(i);
            if (!((ch >= 'A' && ch <= 'Z') || (ch >= '0' && ch <= '9'))) {
                return false;
            }
        }
        return true;
    }
}
