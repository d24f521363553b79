package utilities;

import membership.BloomFilter;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class FootprintReportTest {

    @Test
    public void bufferDominatesTheFootprint() {
        BloomFilter filter = BloomFilter.bySize(100_000, 0.01);
        FootprintReport report = FootprintReport.of(filter);

        assertEquals(filter.sizeInBytes(), report.rawBitBytes());
        assertTrue(report.bufferBytes() >= report.rawBitBytes());
        assertTrue(report.bufferBytes() - report.rawBitBytes() < 64);
        assertTrue(report.shellBytes() > 0);
        assertEquals(report.shellBytes() + report.bufferBytes(), report.totalBytes());
        assertTrue(report.toString().startsWith("Total: "));
    }

    @Test
    public void reportFollowsAnUnmarshaledFilter() {
        BloomFilter filter = BloomFilter.bySize(100, 0.01);
        filter.unmarshalBinary(BloomFilter.bySize(10_000, 0.01).marshalBinary());
        FootprintReport report = FootprintReport.of(filter);
        assertEquals(11_982L, report.rawBitBytes());
        assertEquals(filter.sizeInBytes(), report.rawBitBytes());
    }

    @Test
    public void filterIsFarSmallerThanTheKeys() {
        BloomFilter filter = BloomFilter.bySize(100_000, 0.01);
        FootprintReport report = FootprintReport.of(filter);
        // ~9.6 bits per item against 32-byte keys
        assertTrue(report.savingsAgainst(100_000, 32) > 0.9);
        assertEquals(0.0, report.savingsAgainst(0, 32), 0.0);
    }
}
