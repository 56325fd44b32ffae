package UtilityBot.parser;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/*
Sucht die Zählpunktnummer (33 Zeichen, alphanumerisch, meist mit "AT" beginnend).
 * Kann zusammenhängend oder in Gruppen geschrieben sein: "AT 004000 05020 00000 00000 00101 27094".
 * Fünf Stufen, die erste mit Treffer gewinnt, innerhalb einer Stufe der erste Treffer im Dokument:
 *   1. mit Label, in Gruppen
 *   2. mit Label, zusammenhängend
 *   3. ohne Label, "AT" + Gruppen
 *   4. ohne Label, "AT" + zusammenhängend
 *   5. beliebiges Token der Länge 33 mit mindestens einem Buchstaben

Locates the Austrian meter-point number.
*/
@Component
public class MeterPointIdLocator {

    private static final Logger LOGGER = LoggerFactory.getLogger(MeterPointIdLocator.class);

    static final String LABEL =
            "(?:zählpunktnummer|zählpunkt|zp-nr|zp\\s*nr|zählernummer|metering\\s*point)";

    // Gruppen nur innerhalb einer Zeile, sonst wird die Folgezeile Teil der Nummer
    private static final String GROUP_SEPARATOR = "[ \\t]+";
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern HAS_LETTER = Pattern.compile("[A-Z]");
    private static final Pattern HAS_DIGIT = Pattern.compile("[0-9]");

    private final int length;
    private final Pattern labeledGrouped;
    private final Pattern labeledContiguous;
    private final Pattern countryGrouped;
    private final Pattern countryContiguous;
    private final Pattern genericContiguous;
    private final TierChain tiers;

    @Autowired
    public MeterPointIdLocator(ExtractionSettings settings) {
        this(settings.getMeterIdLength());
    }

    public MeterPointIdLocator(int length) {
        this.length = length;
        int flags = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
        this.labeledGrouped = Pattern.compile(LABEL + "[:\\s]*(AT(?:" + GROUP_SEPARATOR + "[A-Z0-9]+)+)", flags);
        this.labeledContiguous = Pattern.compile(LABEL + "[:\\s]*([A-Z0-9]{" + length + "})(?![A-Z0-9])", flags);
        this.countryGrouped = Pattern.compile("\\b(AT(?:" + GROUP_SEPARATOR + "[A-Z0-9]+)+)\\b");
        this.countryContiguous = Pattern.compile("\\b(AT[A-Z0-9]{" + (length - 2) + "})\\b");
        this.genericContiguous = Pattern.compile("\\b([A-Z0-9]{" + length + "})\\b");

        this.tiers = TierChain.builder()
                .tier("labeled-grouped", this::findLabeledGrouped)
                .tier("labeled-contiguous", this::findLabeledContiguous)
                .tier("country-grouped", this::findCountryPrefixedGrouped)
                .tier("country-contiguous", this::findCountryPrefixedContiguous)
                .tier("generic", this::findGeneric)
                .build();
    }

    public Optional<String> locateMeterId(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        return tiers.firstMatchWithTier(text)
                .map(match -> {
                    LOGGER.debug("Zählpunktnummer gefunden über Stufe '{}': {}", match.tier(), match.value());
                    return match.value();
                });
    }

    /**
     * Stufe 1: Label, danach "AT" und durch Leerraum getrennte Gruppen.
     * Nur der erste Label-Treffer im Dokument wird betrachtet.
     */
    public Optional<String> findLabeledGrouped(String text) {
        Matcher matcher = labeledGrouped.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return joinGroups(matcher.group(1).toUpperCase(Locale.ROOT));
    }

    /**
     * Stufe 2: Label, danach ein zusammenhängendes Token der vollen Länge.
     */
    public Optional<String> findLabeledContiguous(String text) {
        Matcher matcher = labeledContiguous.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(matcher.group(1).toUpperCase(Locale.ROOT));
    }

    /**
     * Stufe 3: irgendwo "AT" gefolgt von Gruppen; Buchstabe und Ziffer müssen vorkommen
     * (filtert reine Ziffernfolgen wie Telefonnummern).
     */
    public Optional<String> findCountryPrefixedGrouped(String text) {
        Matcher matcher = countryGrouped.matcher(text);
        while (matcher.find()) {
            Optional<String> candidate = joinGroups(matcher.group(1))
                    .filter(MeterPointIdLocator::hasLetterAndDigit);
            if (candidate.isPresent()) {
                return candidate;
            }
        }
        return Optional.empty();
    }

    /**
     * Stufe 4: zusammenhängendes Token, das mit "AT" beginnt.
     */
    public Optional<String> findCountryPrefixedContiguous(String text) {
        Matcher matcher = countryContiguous.matcher(text);
        while (matcher.find()) {
            String candidate = matcher.group(1);
            if (hasLetterAndDigit(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * Stufe 5: schwächste Stufe, jedes Token der vollen Länge mit mindestens einem Buchstaben.
     */
    public Optional<String> findGeneric(String text) {
        Matcher matcher = genericContiguous.matcher(text);
        while (matcher.find()) {
            String candidate = matcher.group(1);
            if (HAS_LETTER.matcher(candidate).find()) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * Entfernt den Leerraum zwischen den Gruppen. Nur eine Nummer mit genau der Ziellänge
     * wird akzeptiert, längere werden verworfen und nicht abgeschnitten.
     */
    Optional<String> joinGroups(String grouped) {
        String joined = WHITESPACE.matcher(grouped).replaceAll("");
        return joined.length() == length ? Optional.of(joined) : Optional.empty();
    }

    static boolean hasLetterAndDigit(String candidate) {
        return HAS_LETTER.matcher(candidate).find() && HAS_DIGIT.matcher(candidate).find();
    }

    public int getLength() { return length; }
}
