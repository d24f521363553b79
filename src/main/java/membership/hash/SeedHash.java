package membership.hash;

/**
 * Produces the two 64-bit seed hashes {h1, h2} that double hashing expands into
 * any number of bit indices.
 *
 * Implementations must be deterministic: the same bytes give the same pair in
 * every process, otherwise merged or deserialized filters stop answering for
 * items added elsewhere.
 */
@FunctionalInterface
public interface SeedHash {

    /** Returns a fresh two-element array {h1, h2}. */
    long[] hash(byte[] data);
}
