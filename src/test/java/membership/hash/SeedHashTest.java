package membership.hash;

import org.apache.commons.codec.digest.MurmurHash3;
import org.junit.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

public class SeedHashTest {

    private static final byte[] HELLO = "hello".getBytes(StandardCharsets.UTF_8);
    private static final byte[] WORLD = "world".getBytes(StandardCharsets.UTF_8);

    @Test
    public void murmurSplitsThe128BitHash() {
        long[] expected = MurmurHash3.hash128x64(HELLO, 0, HELLO.length, 0);
        assertArrayEquals(expected, Murmur3SeedHash.getDefault().hash(HELLO));
        assertEquals(2, Murmur3SeedHash.getDefault().hash(new byte[0]).length);
    }

    @Test
    public void murmurIsDeterministicAcrossInstances() {
        assertArrayEquals(new Murmur3SeedHash(0).hash(HELLO), Murmur3SeedHash.getDefault().hash(HELLO));
        assertFalse(Murmur3SeedHash.getDefault().hash(HELLO)[0] == Murmur3SeedHash.getDefault().hash(WORLD)[0]);
        assertFalse(new Murmur3SeedHash(7).hash(HELLO)[0] == new Murmur3SeedHash(0).hash(HELLO)[0]);
    }

    @Test
    public void carterWegmanIsReproducibleForTheSameSeed() {
        assertArrayEquals(CarterWegmanSeedHash.withSeed(99).hash(HELLO), CarterWegmanSeedHash.withSeed(99).hash(HELLO));
        assertFalse(CarterWegmanSeedHash.withSeed(99).hash(HELLO)[0] == CarterWegmanSeedHash.withSeed(100).hash(HELLO)[0]);
    }

    @Test
    public void carterWegmanHalvesAreIndependent() {
        long[] h = CarterWegmanSeedHash.withSeed(1).hash(HELLO);
        assertFalse(h[0] == h[1]);
    }

    @Test
    public void carterWegmanSeparatesZeroPaddedInputs() {
        SeedHash hash = CarterWegmanSeedHash.withSeed(5);
        assertFalse(hash.hash(new byte[]{0})[0] == hash.hash(new byte[]{0, 0})[0]);
        assertFalse(hash.hash(new byte[0])[0] == hash.hash(new byte[]{0})[0]);
    }

    @Test(expected = NullPointerException.class)
    public void nullInputIsRejected() {
        Murmur3SeedHash.getDefault().hash(null);
    }
}
