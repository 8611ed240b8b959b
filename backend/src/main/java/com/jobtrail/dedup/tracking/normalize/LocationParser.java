package com.jobtrail.dedup.tracking.normalize;

import com.jobtrail.dedup.tracking.model.ParsedLocation;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Deterministic "city, region, country" parser. Never fails: components it cannot place
 * stay empty and an unrecognized country becomes {@link ParsedLocation#UNKNOWN_COUNTRY}.
 */
public final class LocationParser {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern PARENTHETICAL = Pattern.compile("\\([^)]*\\)");
    private static final Pattern REMOTE_MARKER = Pattern.compile(
        "\\b(?:fully remote|remote|work from home|wfh|anywhere)\\b"
    );
    private static final Pattern SEPARATORS = Pattern.compile("[,;|]");

    private static final Map<String, String> COUNTRY_ALIASES = new HashMap<>();
    private static final Map<String, String> US_STATES = new HashMap<>();
    private static final Map<String, String> REGION_GROUPS = new HashMap<>();

    static {
        alias("us", "us", "usa", "u.s.", "u.s.a.", "united states", "united states of america", "america");
        alias("uk", "uk", "u.k.", "united kingdom", "great britain", "england", "scotland", "wales");
        alias("canada", "canada");
        alias("mexico", "mexico");
        alias("germany", "germany", "deutschland", "de");
        alias("france", "france", "fr");
        alias("spain", "spain", "es");
        alias("italy", "italy");
        alias("netherlands", "netherlands", "the netherlands", "holland", "nl");
        alias("ireland", "ireland");
        alias("poland", "poland");
        alias("india", "india");
        alias("china", "china");
        alias("japan", "japan");
        alias("singapore", "singapore");
        alias("australia", "australia", "au");
        alias("new zealand", "new zealand", "nz");
        alias("brazil", "brazil");

        state("al", "alabama");
        state("ak", "alaska");
        state("az", "arizona");
        state("ar", "arkansas");
        state("ca", "california");
        state("co", "colorado");
        state("ct", "connecticut");
        state("de", "delaware");
        state("fl", "florida");
        state("ga", "georgia");
        state("hi", "hawaii");
        state("id", "idaho");
        state("il", "illinois");
        state("in", "indiana");
        state("ia", "iowa");
        state("ks", "kansas");
        state("ky", "kentucky");
        state("la", "louisiana");
        state("me", "maine");
        state("md", "maryland");
        state("ma", "massachusetts");
        state("mi", "michigan");
        state("mn", "minnesota");
        state("ms", "mississippi");
        state("mo", "missouri");
        state("mt", "montana");
        state("ne", "nebraska");
        state("nv", "nevada");
        state("nh", "new hampshire");
        state("nj", "new jersey");
        state("nm", "new mexico");
        state("ny", "new york");
        state("nc", "north carolina");
        state("nd", "north dakota");
        state("oh", "ohio");
        state("ok", "oklahoma");
        state("or", "oregon");
        state("pa", "pennsylvania");
        state("ri", "rhode island");
        state("sc", "south carolina");
        state("sd", "south dakota");
        state("tn", "tennessee");
        state("tx", "texas");
        state("ut", "utah");
        state("vt", "vermont");
        state("va", "virginia");
        state("wa", "washington");
        state("wv", "west virginia");
        state("wi", "wisconsin");
        state("wy", "wyoming");
        state("dc", "district of columbia");

        group("North America", "us", "canada", "mexico");
        group("Europe", "uk", "germany", "france", "spain", "italy", "netherlands", "ireland", "poland");
        group("Asia", "india", "china", "japan", "singapore");
        group("Oceania", "australia", "new zealand");
        group("South America", "brazil");
        group("Remote", ParsedLocation.REMOTE_COUNTRY);
    }

    private LocationParser() {
    }

    public static ParsedLocation parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return ParsedLocation.unknown();
        }
        String value = raw.replace('\u00A0', ' ').toLowerCase(Locale.ROOT);
        value = PARENTHETICAL.matcher(value).replaceAll(" ");
        boolean remote = REMOTE_MARKER.matcher(value).find();
        if (remote) {
            value = REMOTE_MARKER.matcher(value).replaceAll(" ");
        }

        List<String> parts = new ArrayList<>();
        for (String part : SEPARATORS.split(value)) {
            String cleaned = cleanPart(part);
            if (!cleaned.isEmpty()) {
                parts.add(cleaned);
            }
        }

        if (parts.isEmpty()) {
            return remote
                ? new ParsedLocation("", "", ParsedLocation.REMOTE_COUNTRY, true)
                : ParsedLocation.unknown();
        }
        if (parts.size() == 1) {
            String only = parts.get(0);
            String country = COUNTRY_ALIASES.get(only);
            if (country != null) {
                return new ParsedLocation("", "", country, remote);
            }
            String state = US_STATES.get(only);
            if (state != null) {
                return new ParsedLocation("", state, "us", remote);
            }
            return new ParsedLocation(only, "", ParsedLocation.UNKNOWN_COUNTRY, remote);
        }
        if (parts.size() == 2) {
            String city = parts.get(0);
            String second = parts.get(1);
            String state = US_STATES.get(second);
            if (state != null) {
                return new ParsedLocation(city, state, "us", remote);
            }
            String country = COUNTRY_ALIASES.get(second);
            if (country != null) {
                return new ParsedLocation(city, "", country, remote);
            }
            return new ParsedLocation(city, second, ParsedLocation.UNKNOWN_COUNTRY, remote);
        }

        String city = parts.get(0);
        String region = parts.get(1);
        String last = parts.get(parts.size() - 1);
        String country = COUNTRY_ALIASES.getOrDefault(last, last);
        if ("us".equals(country)) {
            region = US_STATES.getOrDefault(region, region);
        }
        return new ParsedLocation(city, region, country, remote);
    }

    public static String regionGroup(String country) {
        if (country == null || country.isBlank()) {
            return "Other";
        }
        return REGION_GROUPS.getOrDefault(country, "Other");
    }

    private static String cleanPart(String part) {
        String cleaned = WHITESPACE.matcher(part).replaceAll(" ").trim();
        while (!cleaned.isEmpty() && isTrim(cleaned.charAt(cleaned.length() - 1))) {
            cleaned = cleaned.substring(0, cleaned.length() - 1).trim();
        }
        while (!cleaned.isEmpty() && isTrim(cleaned.charAt(0))) {
            cleaned = cleaned.substring(1).trim();
        }
        return cleaned;
    }

    private static boolean isTrim(char c) {
        return c == '-' || c == '/' || c == '\u2013' || c == ':';
    }

    private static void alias(String country, String... names) {
        for (String name : names) {
            COUNTRY_ALIASES.put(name, country);
        }
    }

    private static void state(String code, String name) {
        US_STATES.put(code, code);
        US_STATES.put(name, code);
    }

    private static void group(String group, String... countries) {
        for (String country : countries) {
            REGION_GROUPS.put(country, group);
        }
    }
}
