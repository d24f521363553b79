package membership;

import membership.hash.Murmur3SeedHash;
import membership.hash.SeedHash;
import org.junit.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class RecentHistoryFilterTest {

    @Test
    public void onlyTheLastItemsTestPositive() {
        RecentHistoryFilter filter = new RecentHistoryFilter(BloomFilter.bySize(100, 0.01), 3);
        filter.add("a");
        filter.add("b");
        filter.add("c");
        assertTrue(filter.test("a"));
        filter.add("d");

        assertFalse(filter.test("a"));
        assertTrue(filter.test("b"));
        assertTrue(filter.test("c"));
        assertTrue(filter.test("d"));
        // the bits themselves still remember "a"
        assertTrue(filter.filter().test("a"));
    }

    @Test
    public void readdingRefreshesAnItem() {
        RecentHistoryFilter filter = new RecentHistoryFilter(BloomFilter.bySize(100, 0.01), 2);
        filter.add("a");
        filter.add("b");
        filter.add("a");
        filter.add("c");
        assertTrue(filter.test("a"));
        assertFalse(filter.test("b"));
    }

    @Test
    public void neverAddedItemsStayAbsent() {
        RecentHistoryFilter filter = new RecentHistoryFilter(BloomFilter.bySize(1_000, 0.01), 1_000);
        for (int i = 0; i < 1_000; i++) {
            filter.add("in-" + i);
        }
        for (int i = 0; i < 1_000; i++) {
            assertTrue(filter.test("in-" + i));
            assertFalse(filter.test("out-" + i));
        }
    }

    @Test
    public void resetClearsBitsAndHistory() {
        RecentHistoryFilter filter = new RecentHistoryFilter(BloomFilter.bySize(100, 0.01), 10);
        filter.add("a");
        filter.reset();
        assertFalse(filter.test("a"));
        assertFalse(filter.filter().test("a"));
        filter.add("a");
        assertTrue(filter.test("a"));
    }

    @Test
    public void eachOperationHashesOnce() {
        AtomicInteger calls = new AtomicInteger();
        SeedHash counting = data -> {
            calls.incrementAndGet();
            return Murmur3SeedHash.getDefault().hash(data);
        };
        RecentHistoryFilter filter = new RecentHistoryFilter(BloomFilter.bySize(100, 0.01, counting), 4);
        filter.add("a");
        assertEquals(1, calls.get());
        assertTrue(filter.test("a"));
        assertEquals(2, calls.get());
        assertFalse(filter.test("b"));
        assertEquals(3, calls.get());
    }

    @Test
    public void historySizeMustBePositive() {
        try {
            new RecentHistoryFilter(BloomFilter.bySize(100, 0.01), 0);
            fail("expected INVALID_PARAMETERS");
        } catch (FilterException e) {
            assertEquals(FilterException.Kind.INVALID_PARAMETERS, e.kind());
        }
    }
}
