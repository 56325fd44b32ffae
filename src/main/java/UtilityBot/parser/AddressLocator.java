package UtilityBot.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/*
Sucht eine österreichische Postanschrift im zeilenweisen OCR-Text.
 * Die OCR bricht einen Adressblock oft auf 1-3 Zeilen in unvorhersehbarer Reihenfolge um.
 * Drei Stufen, die erste mit Treffer gewinnt:
 *   1. PLZ-Zeile als Anker, Straße darüber, optional Name zwei Zeilen darüber
 *   2. Straßenzeile, PLZ-Zeile direkt darunter, optional Name darüber
 *   3. alles in einer Zeile
 * Stufe 1 und 2 brauchen mindestens zwei Teile, eine einzelne PLZ-Zeile ist keine Adresse.

Locates an Austrian postal address in line-based OCR text.
*/
@Component
public class AddressLocator {

    private static final Logger LOGGER = LoggerFactory.getLogger(AddressLocator.class);

    // PLZ in Österreich: genau 4 Ziffern, danach Ortsname(n)
    static final String CITY = "[A-ZÄÖÜ][a-zäöüß]+(?:[\\s-][A-ZÄÖÜ][a-zäöüß]+)*";
    static final String STREET = "[A-ZÄÖÜ][a-zäöüß-]+(?:\\.|Straße|Strasse|Platz|Weg|Gasse|Allee|Ring|Str\\.?)";
    static final String HOUSE_NUMBER = "\\d+[a-z]?";
    static final String NAME = "[A-ZÄÖÜ][a-zäöüß]+\\s+[A-ZÄÖÜ][a-zäöüß]+";

    private static final Pattern POSTAL_LINE = Pattern.compile("^(\\d{4})\\s+(" + CITY + ")$");
    private static final Pattern STREET_WITH_NUMBER = Pattern.compile(
            "(" + STREET + ")\\s+(" + HOUSE_NUMBER + ")",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern NAME_LINE = Pattern.compile("^" + NAME + "$");
    private static final Pattern SINGLE_LINE = Pattern.compile(
            "(" + NAME + ")?,?\\s*(" + STREET + ")\\s+(" + HOUSE_NUMBER + "),?\\s*(\\d{4})\\s+(" + CITY + ")",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    // Eine Namenszeile darf selbst kein Straßenwort enthalten ("Linzer Gasse" ist kein Name)
    private static final List<String> STREET_WORDS = List.of("straße", "strasse", "gasse", "platz", "allee");
    // kurze Wörter nur als ganzes Wort, sonst fallen "Herweg" oder "Ringseis" als Namen weg
    private static final List<String> SHORT_STREET_WORDS = List.of("weg", "ring");

    private static final String SEPARATOR = ", ";

    private final TierChain tiers = TierChain.builder()
            .tier("postal-code-anchor", text -> findByPostalCodeAnchor(toLines(text)))
            .tier("street-then-postal", text -> findByStreetThenPostal(toLines(text)))
            .tier("single-line", text -> findSingleLine(toLines(text)))
            .build();

    public Optional<String> locateAddress(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        return tiers.firstMatchWithTier(text)
                .map(match -> {
                    LOGGER.debug("Adresse gefunden über Stufe '{}': {}", match.tier(), match.value());
                    return match.value();
                });
    }

    /**
     * Stufe 1: PLZ-Zeile als Anker, Straße auf der Zeile davor, optional Name zwei Zeilen davor.
     */
    public Optional<String> findByPostalCodeAnchor(List<String> lines) {
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (!isPostalLine(line)) {
                continue;
            }

            List<String> parts = new ArrayList<>();
            if (i > 0 && isStreetLine(lines.get(i - 1))) {
                if (i > 1 && isNameLine(lines.get(i - 2))) {
                    parts.add(lines.get(i - 2));
                }
                parts.add(lines.get(i - 1));
            }
            parts.add(line);

            if (parts.size() >= 2) {
                return Optional.of(String.join(SEPARATOR, parts));
            }
        }
        return Optional.empty();
    }

    /**
     * Stufe 2: Straßenzeile, direkt gefolgt von der PLZ-Zeile, optional Name auf der Zeile davor.
     */
    public Optional<String> findByStreetThenPostal(List<String> lines) {
        for (int i = 0; i < lines.size() - 1; i++) {
            String line = lines.get(i);
            String nextLine = lines.get(i + 1);
            if (!isStreetLine(line) || !isPostalLine(nextLine)) {
                continue;
            }

            List<String> parts = new ArrayList<>();
            if (i > 0 && isNameLine(lines.get(i - 1))) {
                parts.add(lines.get(i - 1));
            }
            parts.add(line);
            parts.add(nextLine);

            if (parts.size() >= 2) {
                return Optional.of(String.join(SEPARATOR, parts));
            }
        }
        return Optional.empty();
    }

    /**
     * Stufe 3: Name (optional), Straße mit Hausnummer und PLZ mit Ort in einer einzigen Zeile.
     */
    public Optional<String> findSingleLine(List<String> lines) {
        for (String line : lines) {
            Matcher matcher = SINGLE_LINE.matcher(line);
            if (!matcher.find()) {
                continue;
            }
            List<String> parts = new ArrayList<>();
            if (matcher.group(1) != null) {
                parts.add(matcher.group(1));
            }
            parts.add(matcher.group(2) + " " + matcher.group(3));
            parts.add(matcher.group(4) + " " + matcher.group(5));
            return Optional.of(String.join(SEPARATOR, parts));
        }
        return Optional.empty();
    }

    /**
     * Zerlegt den Text in getrimmte, nicht leere Zeilen (Reihenfolge bleibt erhalten).
     */
    public static List<String> toLines(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        return Arrays.stream(text.split("\\R"))
                .map(String::trim)
                .filter(line -> !line.isEmpty())
                .toList();
    }

    boolean isPostalLine(String line) {
        return POSTAL_LINE.matcher(line).matches();
    }

    boolean isStreetLine(String line) {
        return STREET_WITH_NUMBER.matcher(line).find();
    }

    boolean isNameLine(String line) {
        if (!NAME_LINE.matcher(line).matches()) {
            return false;
        }
        String lower = line.toLowerCase(Locale.GERMAN);
        if (STREET_WORDS.stream().anyMatch(lower::contains)) {
            return false;
        }
        return Arrays.stream(lower.split("\\s+")).noneMatch(SHORT_STREET_WORDS::contains);
    }
}
