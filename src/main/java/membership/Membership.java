package membership;

import java.nio.charset.StandardCharsets;

public interface Membership {
    void add(byte[] data);
    boolean test(byte[] data);
    void reset();

    double approximateFalsePositiveRate();

    default void add(String token) {
        add(token.getBytes(StandardCharsets.UTF_8));
    }

    default boolean test(String token) {
        return test(token.getBytes(StandardCharsets.UTF_8));
    }
}
