package UtilityBot.parser;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

/**
 * Normalisiert Zahlen in deutscher oder englischer Schreibweise.
 *
 * Normalizes numbers written with German or English separators:
 * <ul>
 *   <li>beide Trenner ("2.573,1" / "2,573.1"): der letzte Trenner ist das Dezimalzeichen, der andere der Tausendertrenner</li>
 *   <li>nur Komma: 1-2 Ziffern nach dem letzten Komma → Dezimalkomma, sonst Tausendertrenner</li>
 *   <li>nur Punkt: 1-2 Ziffern nach dem letzten Punkt → Dezimalpunkt, sonst Tausendertrenner</li>
 * </ul>
 * Die Reihenfolge der Regeln ist entscheidend ("2.573" ist 2573, "25.73" ist 25.73).
 */
@Component
public class GermanNumberNormalizer {

    private static final Pattern DECIMAL_COMMA_TAIL = Pattern.compile(",\\d{1,2}$");
    private static final Pattern DECIMAL_DOT_TAIL = Pattern.compile("\\.\\d{1,2}$");

    private final ExtractionSettings settings;

    public GermanNumberNormalizer(ExtractionSettings settings) {
        this.settings = settings;
    }

    /**
     * Wandelt ein Zahl-Token in einen Wert um, ohne Bereichsprüfung.
     *
     * @return leer, wenn das Token keine Zahl ist
     */
    public Optional<BigDecimal> normalize(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim();
        if (normalized.isEmpty()) {
            return Optional.empty();
        }

        boolean hasDot = normalized.indexOf('.') >= 0;
        boolean hasComma = normalized.indexOf(',') >= 0;

        if (hasDot && hasComma) {
            if (normalized.lastIndexOf(',') > normalized.lastIndexOf('.')) {
                // Deutsch: 2.573,1 → 2573.1
                normalized = normalized.replace(".", "").replace(",", ".");
            } else {
                // Englisch: 2,573.1 → 2573.1
                normalized = normalized.replace(",", "");
            }
        } else if (hasComma) {
            if (DECIMAL_COMMA_TAIL.matcher(normalized).find()) {
                normalized = normalized.replace(",", ".");
            } else {
                normalized = normalized.replace(",", "");
            }
        } else if (hasDot) {
            if (!DECIMAL_DOT_TAIL.matcher(normalized).find()) {
                normalized = normalized.replace(".", "");
            }
        }

        try {
            return Optional.of(new BigDecimal(normalized));
        } catch (NumberFormatException e) {
            // z.B. "1,234,56" → "1.234.56": kein Kandidat
            return Optional.empty();
        }
    }

    /**
     * Wie {@link #normalize(String)}, rundet auf eine Nachkommastelle und verwirft Werte außerhalb
     * des offenen Verbrauchsbereichs (Rechnungs-/Kundennummern, Jahreszahlen).
     */
    public Optional<BigDecimal> parseConsumption(String raw) {
        return normalize(raw).map(GermanNumberNormalizer::round).filter(this::isPlausibleConsumption);
    }

    /**
     * Geprüft wird der gerundete Wert, also genau das, was {@link #format(BigDecimal)} ausgibt.
     * "1,04" wird zu 1.0 und liegt damit nicht mehr im Bereich.
     */
    public boolean isPlausibleConsumption(BigDecimal value) {
        if (value == null) {
            return false;
        }
        BigDecimal rounded = round(value);
        return rounded.compareTo(settings.getMinConsumptionExclusive()) > 0
                && rounded.compareTo(settings.getMaxConsumptionExclusive()) < 0;
    }

    /**
     * Kanonische Darstellung mit genau einer Nachkommastelle, z.B. "2573.1".
     */
    public String format(BigDecimal value) {
        return round(value).toPlainString();
    }

    private static BigDecimal round(BigDecimal value) {
        return value.setScale(1, RoundingMode.HALF_UP);
    }
}
