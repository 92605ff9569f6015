package eu.nurkert.depSync.update;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VersionComparatorTest {

    private final VersionComparator comparator = new VersionComparator();

    @Test
    void comparesNumericSegmentsInsteadOfText() {
        assertEquals(1, comparator.compare("v1.2.10", "v1.2.9"));
        assertEquals(-1, comparator.compare("1.9", "1.10"));
        assertEquals(0, comparator.compare("2.0", "2.0"));
    }

    @Test
    void missingSegmentsCountAsZero() {
        assertEquals(0, comparator.compare("1.0", "1.0.0"));
        assertEquals(-1, comparator.compare("1.0", "1.0.1"));
        assertEquals(1, comparator.compare("1.0.0.1", "1.0"));
    }

    @Test
    void stripsKnownPrefixes() {
        assertEquals(0, comparator.compare("v1.5.2", "1.5.2"));
        assertEquals(0, comparator.compare("n8.0.1", "8.0.1"));
        assertEquals(0, comparator.compare("nasm-2.16.03", "2.16.3"));
        assertEquals(1, comparator.compare("openssl-3.4.1", "3.4.0"));
        assertEquals("3.4.0", VersionComparator.stripKnownPrefix("openssl-3.4.0"));
    }

    @Test
    void treatsDashAndDotAsEquivalentSeparators() {
        assertEquals(0, comparator.compare("1-2-3", "1.2.3"));
    }

    @Test
    void ignoresLeadingZerosAndNonNumericSegments() {
        assertEquals(0, comparator.compare("2.016", "2.16"));
        assertEquals(0, comparator.compare("1.abc", "1.0"));
        assertEquals(0, comparator.compare("stable", "0"));
    }

    @Test
    void comparesNumbersBeyondLongRange() {
        assertEquals(1, comparator.compare("1.12345678901234567890", "1.12345678901234567889"));
        assertEquals(-1, comparator.compare("99999999999999999999", "100000000000000000000"));
    }

    @Test
    void emptyStringsSortFirst() {
        assertEquals(0, comparator.compare("", ""));
        assertEquals(-1, comparator.compare("", "0"));
        assertEquals(1, comparator.compare("0.1", ""));
    }

    @Test
    void sortsAsComparator() {
        List<String> versions = new ArrayList<>(List.of("v1.10.0", "v1.2.0", "v1.9.9", "v0.99"));
        versions.sort(comparator);

        assertEquals(List.of("v0.99", "v1.2.0", "v1.9.9", "v1.10.0"), versions);
    }

    @Test
    void isAntisymmetricAndTransitiveOverMixedVersions() {
        List<String> versions = List.of(
                "", " ", "0", "0.0.0", "1", "v1", "1.0", "1.0.0", "n1.0", "01.2", "1.02", "1.2", "1.2.0",
                "1-2", "v1.2.3", "n1.2.3", "1.2.03", "nasm-2.16.03", "2.16.3", "openssl-3.4.0", "3.4",
                "1.abc", "abc", "stable", "1.10", "1.9", "99999999999999999999", "100000000000000000000",
                "1.99999999999999999999", "1.100000000000000000000");

        for (String a : versions) {
            assertEquals(0, comparator.compare(a, a), a);
            for (String b : versions) {
                int ab = comparator.compare(a, b);
                assertEquals(-ab, comparator.compare(b, a), () -> a + " vs " + b);
                for (String c : versions) {
                    int bc = comparator.compare(b, c);
                    int ac = comparator.compare(a, c);
                    if (ab <= 0 && bc <= 0) {
                        assertTrue(ac <= 0, () -> a + " <= " + b + " <= " + c);
                    }
                    if (ab == 0) {
                        assertEquals(Integer.signum(bc), Integer.signum(ac), () -> a + " == " + b + " against " + c);
                    }
                }
            }
        }
    }
}
