package membership;

import java.util.Objects;

/**
 * Central place to construct membership filters from a {@link FilterConfiguration}.
 */
public final class FilterFactory {

    private FilterFactory() {}

    public static Membership create(FilterConfiguration configuration) {
        Objects.requireNonNull(configuration, "configuration");
        BloomFilter filter = BloomFilter.create(configuration);
        if (configuration.historySize() > 0) {
            return new RecentHistoryFilter(filter, configuration.historySize());
        }
        return filter;
    }
}
