package UtilityBot;

import UtilityBot.parser.ConsumptionLocator;
import UtilityBot.parser.ExtractionSettings;
import UtilityBot.parser.ExtractionSettings.CurrentValuePolicy;
import UtilityBot.parser.GermanNumberNormalizer;
import UtilityBot.parser.KeywordProximityFilter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ConsumptionLocatorTest {

    private static ConsumptionLocator locator(ExtractionSettings settings) {
        return new ConsumptionLocator(
                new GermanNumberNormalizer(settings),
                new KeywordProximityFilter(settings),
                settings);
    }

    private final ConsumptionLocator locator = locator(ExtractionSettings.defaults());

    // ==========================================
    // DURCHGANG 1: "aktuell" / "current"
    // ==========================================

    @Test
    @DisplayName("Aktueller Wert gewinnt gegen die Vorperiode")
    void currentBeatsPreviousPeriod() {
        // Arrange
        String text = """
                Vorperiode: 2.100,5 kWh
                Aktuell: 2.573,1 kWh
                """;

        // Act
        Optional<String> kwh = locator.locateConsumptionKwh(text);

        // Assert
        assertEquals(Optional.of("2573.1"), kwh);
    }

    @Test
    @DisplayName("Größerer Wert der Vorperiode wird nicht genommen")
    void largerPreviousValueLoses() {
        String text = "aktuell: 2.573,1 kWh\nVorperiode: 3.000,0 kWh";

        assertEquals(Optional.of("2573.1"), locator.locateConsumptionKwh(text));
    }

    @Test
    @DisplayName("Englische Schreibweise nach 'current'")
    void englishCurrentValue() {
        assertEquals(Optional.of("1234.5"), locator.locateConsumptionKwh("Current: 1,234.5 kWh"));
    }

    @Test
    @DisplayName("Mehrere 'aktuell'-Werte: MAXIMUM nimmt den größten, FIRST den ersten")
    void currentValuePolicy() {
        String text = "Aktuell: 2.573,1 kWh\nAktuell: 3.000 kWh";

        ConsumptionLocator first = locator(ExtractionSettings.defaults()
                .withCurrentValuePolicy(CurrentValuePolicy.FIRST));

        assertEquals(Optional.of("3000.0"), locator.locateConsumptionKwh(text));
        assertEquals(Optional.of("2573.1"), first.locateConsumptionKwh(text));
    }

    // ==========================================
    // DURCHGANG 2: beliebige kWh-Werte
    // ==========================================

    @Test
    @DisplayName("Ohne 'aktuell' gewinnt der größte plausible Wert")
    void fallbackTakesMaximum() {
        String text = """
                Verbrauch: 1.200 kWh
                Davon Nacht: 300,5 kWh
                """;

        assertEquals(Optional.of("1200.0"), locator.locateConsumptionKwh(text));
    }

    @Test
    @DisplayName("Werte im Umfeld der Vorperiode werden verworfen")
    void fallbackSkipsPreviousPeriod() {
        String filler = "x".repeat(60);
        String text = "Verbrauch Vorperiode 3.000 kWh\n" + filler + "\nVerbrauch 2.500 kWh";

        assertEquals(Optional.of("2500.0"), locator.locateConsumptionKwh(text));
    }

    @Test
    @DisplayName("Werte außerhalb des plausiblen Bereichs werden ignoriert")
    void implausibleValuesAreIgnored() {
        assertTrue(locator.locateConsumptionKwh("Aktuell: 150.000 kWh").isEmpty());
        assertTrue(locator.locateConsumptionKwh("Grundpreis 1 kWh").isEmpty());
    }

    @Test
    @DisplayName("Werte, die auf eine Bereichsgrenze runden, werden ignoriert")
    void valuesRoundingToBoundAreIgnored() {
        assertTrue(locator.locateConsumptionKwh("Verbrauch 1,04 kWh").isEmpty());
        assertTrue(locator.locateConsumptionKwh("Verbrauch 99.999,96 kWh").isEmpty());
        assertTrue(locator.locateConsumptionKwh("Aktuell: 99.999,96 kWh").isEmpty());
        assertEquals(Optional.of("99999.9"), locator.locateConsumptionKwh("Verbrauch 99.999,94 kWh"));
    }

    @Test
    @DisplayName("Ohne kWh-Angabe kein Verbrauch")
    void noKwhNoValue() {
        assertTrue(locator.locateConsumptionKwh("Gesamtbetrag: 812,40 EUR").isEmpty());
        assertTrue(locator.locateConsumptionKwh(null).isEmpty());
        assertTrue(locator.locateConsumptionKwh(" ").isEmpty());
    }
}
