package membership;

import java.util.Objects;

/**
 * Raised by filter construction, merge and deserialization. The {@link Kind} tells
 * callers which rule was broken; the filter that threw is left as it was.
 */
public class FilterException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        INVALID_PARAMETERS,
        INCOMPATIBLE_PARAMETERS,
        TRUNCATED_DATA,
        UNSUPPORTED_VERSION,
        CORRUPT_DATA
    }

    private final Kind kind;

    public FilterException(Kind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public Kind kind() {
        return kind;
    }

    static FilterException invalidParameters(String message) {
        return new FilterException(Kind.INVALID_PARAMETERS, message);
    }

    static FilterException incompatible(String message) {
        return new FilterException(Kind.INCOMPATIBLE_PARAMETERS, message);
    }

    static FilterException truncated(String message) {
        return new FilterException(Kind.TRUNCATED_DATA, message);
    }

    static FilterException unsupportedVersion(String message) {
        return new FilterException(Kind.UNSUPPORTED_VERSION, message);
    }

    static FilterException corrupt(String message) {
        return new FilterException(Kind.CORRUPT_DATA, message);
    }
}
