package org.Arcane.otf.rename;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PointingNamerTest {

    @Test
    @DisplayName("Name uses J-coordinates with two second decimals and underscores for dots")
    void testName() {
        assertEquals("OTFaspJ100028_58+021227_36",
                PointingNamer.name(PointingNamer.DEFAULT_ACRONYM, 150.1191d, 2.2076d));
        assertEquals("SurveyJ000000_00+000000_00", PointingNamer.name("Survey", 0.0d, 0.0d));
    }

    @Test
    @DisplayName("Direction string uses four second decimals")
    void testDirectionString() {
        assertEquals("10h00m28.5840s +02d12m27.3600s", PointingNamer.directionString(150.1191d, 2.2076d));
    }

    @Test
    @DisplayName("Negative declination keeps its sign on a zero degree field")
    void testNegativeDeclination() {
        assertEquals("12h00m00.0000s -30d30m00.0000s", PointingNamer.directionString(180.0d, -30.5d));
        assertEquals("OTFaspJ120000_00-003000_00", PointingNamer.name("OTFasp", 180.0d, -0.5d));
    }

    @Test
    @DisplayName("Rounded seconds carry into minutes, hours and the 24h wrap")
    void testCarry() {
        assertEquals("00h00m00.0000s +00d00m00.0000s", PointingNamer.directionString(359.9999999999d, 0.0d));
        assertEquals("01h00m00.0000s +01d00m00.0000s",
                PointingNamer.directionString(14.99999999999d, 0.99999999999d));
        assertEquals("23h00m00.0000s +00d00m00.0000s", PointingNamer.directionString(-15.0d, 0.0d));
    }

    @Test
    @DisplayName("Non-finite coordinates are rejected")
    void testNonFinite() {
        assertThrows(IllegalArgumentException.class, () -> PointingNamer.name("OTFasp", Double.NaN, 0.0d));
        assertThrows(IllegalArgumentException.class,
                () -> PointingNamer.directionString(0.0d, Double.POSITIVE_INFINITY));
    }
}
