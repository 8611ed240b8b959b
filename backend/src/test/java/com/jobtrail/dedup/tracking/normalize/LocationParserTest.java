package com.jobtrail.dedup.tracking.normalize;

import com.jobtrail.dedup.tracking.model.ParsedLocation;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class LocationParserTest {

    @Test
    void cityAndStateAreAUsLocation() {
        assertEquals(new ParsedLocation("san francisco", "ca", "us", false), LocationParser.parse("San Francisco, CA"));
        assertEquals(new ParsedLocation("new york", "ny", "us", false), LocationParser.parse("New York, NY"));
    }

    @Test
    void stateNamesBecomeCodesWhenCountryIsUs() {
        assertEquals(new ParsedLocation("austin", "tx", "us", false), LocationParser.parse("Austin, Texas, USA"));
    }

    @Test
    void countryAliasesAreCanonicalized() {
        assertEquals(new ParsedLocation("london", "", "uk", false), LocationParser.parse("London, United Kingdom"));
        assertEquals(new ParsedLocation("", "", "germany", false), LocationParser.parse("Deutschland"));
    }

    @Test
    void remoteMarkersSetTheFlag() {
        assertEquals(new ParsedLocation("", "", ParsedLocation.REMOTE_COUNTRY, true), LocationParser.parse("Remote"));
        assertEquals(new ParsedLocation("", "", "us", true), LocationParser.parse("Remote - US"));
    }

    @Test
    void unknownInputNeverFails() {
        assertEquals(ParsedLocation.unknown(), LocationParser.parse(null));
        assertEquals(ParsedLocation.unknown(), LocationParser.parse("   "));
        assertEquals(new ParsedLocation("berlin", "", ParsedLocation.UNKNOWN_COUNTRY, false), LocationParser.parse("Berlin (Hybrid)"));
    }

    @Test
    void regionGroupFallsBackToOther() {
        assertEquals("Europe", LocationParser.regionGroup("uk"));
        assertEquals("North America", LocationParser.regionGroup("us"));
        assertEquals("Remote", LocationParser.regionGroup(ParsedLocation.REMOTE_COUNTRY));
        assertEquals("Other", LocationParser.regionGroup("atlantis"));
        assertEquals("Other", LocationParser.regionGroup(null));
    }
}
