package UtilityBot;

import UtilityBot.parser.ExtractionSettings;
import UtilityBot.parser.GermanNumberNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class GermanNumberNormalizerTest {

    private GermanNumberNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new GermanNumberNormalizer(ExtractionSettings.defaults());
    }

    @Test
    @DisplayName("Deutsche und englische Schreibweisen werden normalisiert")
    void normalizesSeparators() {
        assertEquals(Optional.of(new BigDecimal("2573.1")), normalizer.normalize("2.573,1"));
        assertEquals(Optional.of(new BigDecimal("2573.1")), normalizer.normalize("2,573.1"));
        assertEquals(Optional.of(new BigDecimal("2573.1")), normalizer.normalize("2573,1"));
        assertEquals(Optional.of(new BigDecimal("2573.1")), normalizer.normalize(" 2573.1 "));
        assertEquals(Optional.of(new BigDecimal("812.40")), normalizer.normalize("812,40"));
    }

    @Test
    @DisplayName("Drei Ziffern nach dem einzigen Trenner: Tausendertrenner")
    void thousandsSeparatorOnly() {
        assertEquals(Optional.of(new BigDecimal("2573")), normalizer.normalize("2.573"));
        assertEquals(Optional.of(new BigDecimal("2573")), normalizer.normalize("2,573"));
        assertEquals(Optional.of(new BigDecimal("1234567")), normalizer.normalize("1.234.567"));
        assertEquals(Optional.of(new BigDecimal("25.73")), normalizer.normalize("25.73"));
    }

    @Test
    @DisplayName("Kein Zahl-Token ergibt leeres Ergebnis")
    void rejectsGarbage() {
        assertTrue(normalizer.normalize("").isEmpty());
        assertTrue(normalizer.normalize("   ").isEmpty());
        assertTrue(normalizer.normalize("abc").isEmpty());
        assertTrue(normalizer.normalize("1,234,56").isEmpty());
        assertTrue(normalizer.normalize("12.34.5,6,7").isEmpty());
    }

    @Test
    @DisplayName("null ergibt leeres Ergebnis")
    void nullIsEmpty() {
        assertTrue(normalizer.normalize(null).isEmpty());
        assertTrue(normalizer.parseConsumption(null).isEmpty());
    }

    @Test
    @DisplayName("Verbrauchsbereich ist offen: 1 und 100000 sind ausgeschlossen")
    void consumptionBoundsAreExclusive() {
        assertTrue(normalizer.parseConsumption("1").isEmpty());
        assertTrue(normalizer.parseConsumption("100.000").isEmpty());
        assertTrue(normalizer.parseConsumption("0,5").isEmpty());

        assertEquals(Optional.of(new BigDecimal("1.1")), normalizer.parseConsumption("1,1"));
        assertEquals(Optional.of(new BigDecimal("99999.9")), normalizer.parseConsumption("99.999,9"));
    }

    @Test
    @DisplayName("Bereichsprüfung nach dem Runden: knapp innerhalb wird zur Grenze und fällt heraus")
    void boundsAreCheckedAfterRounding() {
        assertTrue(normalizer.parseConsumption("1,04").isEmpty());
        assertTrue(normalizer.parseConsumption("99.999,96").isEmpty());
        assertFalse(normalizer.isPlausibleConsumption(new BigDecimal("1.04")));
        assertFalse(normalizer.isPlausibleConsumption(new BigDecimal("99999.96")));

        assertEquals(Optional.of(new BigDecimal("1.1")), normalizer.parseConsumption("1,05"));
        assertEquals(Optional.of(new BigDecimal("99999.9")), normalizer.parseConsumption("99.999,94"));
    }

    @Test
    @DisplayName("Ausgabe hat genau eine Nachkommastelle")
    void formatsWithOneFractionDigit() {
        assertEquals("2573.0", normalizer.format(new BigDecimal("2573")));
        assertEquals("2573.1", normalizer.format(new BigDecimal("2573.1")));
        assertEquals("812.5", normalizer.format(new BigDecimal("812.45")));
    }
}
