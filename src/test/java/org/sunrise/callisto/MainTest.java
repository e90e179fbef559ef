package org.sunrise.callisto;

import static org.junit.Assert.assertEquals;
import java.time.LocalDate;
import org.junit.Test;

public class MainTest {

    @Test
    public void testDerivedName() {
        assertEquals("burst-AMF.fits", Main.derivedName("burst.fits", "-AMF"));
        assertEquals("data/ALASKA_20230101_130000_01-AGBS.fits", Main.derivedName("data/ALASKA_20230101_130000_01.fit.gz", "-AGBS"));
        assertEquals("dir.v2/burst-AMF.fits", Main.derivedName("dir.v2/burst", "-AMF"));
    }

    @Test
    public void testParseDate() {
        assertEquals(LocalDate.of(2023, 9, 4), Main.parseDate("9", "4", "2023"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testParseDateInvalidMonth() {
        Main.parseDate("13", "1", "2023");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testParseDateNotANumber() {
        Main.parseDate("a", "1", "2023");
    }
}
