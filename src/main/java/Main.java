import datagenerators.TokenGenerator;
import membership.BloomFilter;
import membership.FilterConfiguration;
import membership.FilterFactory;
import membership.Membership;
import membership.RecentHistoryFilter;
import membership.hash.CarterWegmanSeedHash;
import membership.hash.Murmur3SeedHash;
import membership.hash.SeedHash;
import utilities.FootprintReport;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Demo driver: sizes a filter from the command line, inserts random tokens, then measures
 * the false positive rate on as many fresh tokens. Options: --elements, --fp, --history,
 * --hash (murmur3 | cw), --tokens, --seed.
 */
public final class Main {

    private static final long DEFAULT_ELEMENTS = 1_000_000L;
    private static final double DEFAULT_FP_RATE = 0.001;
    private static final int DEFAULT_HISTORY = 0;
    private static final long DEFAULT_SEED = 42L;

    public static void main(String[] args) {
        CliOptions options = CliOptions.parse(args);

        System.out.printf(Locale.ROOT,
                "Elements: %d  FP: %.3g  Tokens: %d  History: %d  Hash: %s%n",
                options.elements, options.fpRate, options.tokens, options.history, options.hash);

        FilterConfiguration configuration = FilterConfiguration.builder()
                .expectedElements(options.elements)
                .falsePositiveRate(options.fpRate)
                .historySize(options.history)
                .seedHash(seedHashFor(options.hash, options.seed))
                .build();
        Membership membership = FilterFactory.create(configuration);

        byte[] hello = "hello".getBytes(StandardCharsets.UTF_8);
        System.out.printf("hello in filter :: %b%n", membership.test(hello));
        membership.add(hello);
        System.out.printf("hello in filter :: %b%n", membership.test(hello));
        membership.reset();
        System.out.printf("hello in filter :: %b%n", membership.test(hello));

        TokenGenerator generator = new TokenGenerator(options.seed);
        long start = System.nanoTime();
        for (long i = 0; i < options.tokens; i++) {
            membership.add(generator.next());
        }
        double addMs = (System.nanoTime() - start) / 1_000_000.0;

        long falsePositives = 0;
        start = System.nanoTime();
        for (long i = 0; i < options.tokens; i++) {
            if (membership.test(generator.next())) {
                falsePositives++;
            }
        }
        double testMs = (System.nanoTime() - start) / 1_000_000.0;

        BloomFilter filter = membership instanceof RecentHistoryFilter
                ? ((RecentHistoryFilter) membership).filter()
                : (BloomFilter) membership;

        System.out.printf(Locale.ROOT, "Filter: %s%n", filter);
        System.out.printf(Locale.ROOT, "Add: %.1f ms  Test: %.1f ms%n", addMs, testMs);
        System.out.printf(Locale.ROOT, "False positives: %d (%.5f, target %.5f, estimated %.5f)%n",
                falsePositives, falsePositives / (double) Math.max(1, options.tokens), options.fpRate,
                membership.approximateFalsePositiveRate());
        System.out.printf(Locale.ROOT, "Estimated distinct: %d%n", filter.estimateDistinct());
        System.out.println(FootprintReport.of(filter));
    }

    private static SeedHash seedHashFor(String name, long seed) {
        return switch (name) {
            case "murmur3" -> Murmur3SeedHash.getDefault();
            case "cw" -> CarterWegmanSeedHash.withSeed(seed);
            default -> throw new IllegalArgumentException("Unknown hash " + name + ", expected murmur3 or cw");
        };
    }

    private static final class CliOptions {
        final long elements;
        final double fpRate;
        final int history;
        final String hash;
        final long tokens;
        final long seed;

        private CliOptions(long elements, double fpRate, int history, String hash, long tokens, long seed) {
            this.elements = elements;
            this.fpRate = fpRate;
            this.history = history;
            this.hash = hash;
            this.tokens = tokens;
            this.seed = seed;
        }

        static CliOptions parse(String[] args) {
            long elements = DEFAULT_ELEMENTS;
            double fp = DEFAULT_FP_RATE;
            int history = DEFAULT_HISTORY;
            String hash = "murmur3";
            long tokens = -1;
            long seed = DEFAULT_SEED;

            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if (!arg.startsWith("--")) {
                    continue;
                }
                String key;
                String value;
                int eq = arg.indexOf('=');
                if (eq >= 0) {
                    key = arg.substring(2, eq);
                    value = arg.substring(eq + 1);
                } else {
                    key = arg.substring(2);
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Missing value for option --" + key);
                    }
                    value = args[++i];
                }
                switch (key) {
                    case "elements" -> elements = Long.parseLong(value);
                    case "fp" -> fp = Double.parseDouble(value);
                    case "history" -> history = Integer.parseInt(value);
                    case "hash" -> hash = value;
                    case "tokens" -> tokens = Long.parseLong(value);
                    case "seed" -> seed = Long.parseLong(value);
                    default -> throw new IllegalArgumentException("Unknown option --" + key);
                }
            }

            return new CliOptions(elements, fp, history, hash, tokens < 0 ? elements : tokens, seed);
        }
    }
}
