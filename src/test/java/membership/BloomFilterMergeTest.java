package membership;

import membership.hash.CarterWegmanSeedHash;
import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class BloomFilterMergeTest {

    private static void assertIncompatible(BloomFilter target, BloomFilter source) {
        byte[] before = target.marshalBinary();
        try {
            target.merge(source);
            fail("expected INCOMPATIBLE_PARAMETERS");
        } catch (FilterException e) {
            assertEquals(FilterException.Kind.INCOMPATIBLE_PARAMETERS, e.kind());
        }
        assertArrayEquals(before, target.marshalBinary());
    }

    @Test
    public void mergedFilterContainsBothSides() {
        BloomFilter a = BloomFilter.bySize(2_000, 0.01);
        BloomFilter b = BloomFilter.bySize(2_000, 0.01);
        for (int i = 0; i < 1_000; i++) {
            a.add("a-" + i);
            b.add("b-" + i);
        }
        assertTrue(a.isCompatible(b));

        a.merge(b);
        for (int i = 0; i < 1_000; i++) {
            assertTrue(a.test("a-" + i));
            assertTrue(a.test("b-" + i));
        }
        // source is read only
        for (int i = 0; i < 1_000; i++) {
            assertTrue(b.test("b-" + i));
        }
        assertTrue(b.cardinality() <= a.cardinality());
    }

    @Test
    public void everyPriorPositiveSurvivesMerge() {
        BloomFilter a = BloomFilter.bySize(500, 0.05);
        BloomFilter b = BloomFilter.bySize(500, 0.05);
        for (int i = 0; i < 500; i++) {
            a.add("x" + i);
            b.add("y" + (i * 7));
        }
        boolean[] before = new boolean[5_000];
        for (int i = 0; i < before.length; i++) {
            before[i] = a.test("x" + i) || a.test("y" + i) || b.test("x" + i) || b.test("y" + i);
        }
        a.merge(b);
        for (int i = 0; i < before.length; i++) {
            if (before[i]) {
                assertTrue(a.test("x" + i) || a.test("y" + i));
            }
        }
    }

    @Test
    public void mergeIsAByteWiseOr() {
        BloomFilter a = BloomFilter.byParameters(64, 1);
        BloomFilter b = BloomFilter.byParameters(64, 1);
        a.add("left");
        b.add("right");
        long expected = a.cardinality() + b.cardinality();
        a.merge(b);
        assertTrue(a.cardinality() == expected || a.cardinality() == expected - 1);
    }

    @Test
    public void mismatchedParametersAreRejected() {
        BloomFilter target = BloomFilter.bySize(1_000, 0.01);
        target.add("kept");
        assertIncompatible(target, BloomFilter.bySize(1_000, 0.001));
        assertIncompatible(target, BloomFilter.bySize(2_000, 0.01));
        assertIncompatible(target, BloomFilter.byParameters(target.bitCount(), target.hashRounds() + 1));
        assertIncompatible(target, BloomFilter.byParameters(target.bitCount() + 1, target.hashRounds()));
        assertFalse(target.isCompatible(BloomFilter.bySize(2_000, 0.01)));
        assertTrue(target.test("kept"));
    }

    @Test
    public void mergeWithItselfIsANoOp() {
        BloomFilter filter = BloomFilter.bySize(100, 0.01);
        filter.add("self");
        byte[] before = filter.marshalBinary();
        filter.merge(filter);
        assertArrayEquals(before, filter.marshalBinary());
    }

    @Test
    public void compatibilityIgnoresTheSeedHash() {
        BloomFilter murmur = BloomFilter.byParameters(1024, 3);
        BloomFilter cw = BloomFilter.byParameters(1024, 3, CarterWegmanSeedHash.withSeed(1));
        assertTrue(murmur.isCompatible(cw));
        murmur.merge(cw);
    }
}
