package UtilityBot.validation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import UtilityBot.model.ExtractedInvoiceData;


/**
 * Berechnet einen Trust-Score für extrahierte Zählerdaten.
 * Jedes vorhandene und plausible Feld bringt Punkte: Adresse 30, Zählpunktnummer 35, Verbrauch 35.
 *
 *
 * Calculates a trust score for extracted meter data.
 * Every present and plausible field adds points: address 30, meter point id 35, consumption 35.
 */
@Component
public class TrustScoreCalculator {

    private static final Logger LOGGER = LoggerFactory.getLogger(TrustScoreCalculator.class);

    static final int ADDRESS_POINTS = 30;
    static final int METER_POINT_ID_POINTS = 35;
    static final int CONSUMPTION_POINTS = 35;

    private final FieldValidator validator;

    public TrustScoreCalculator(FieldValidator validator) {
        this.validator = validator;
    }

    /**
     * Berechnet den Trust-Score für die gegebenen Daten.
     *
     * @param data Die zu bewertenden Daten
     * @return Trust-Score zwischen 0 und 100
     */
    public int calculate(ExtractedInvoiceData data) {
        if (data == null) {
            return 0;
        }

        int score = 0;

        if (data.hasAddress()) {
            if (validator.isValidAddress(data.address())) {
                score += ADDRESS_POINTS;
            } else {
                LOGGER.debug("Trust-Score: Adresse erscheint ungültig: {}", data.address());
            }
        }

        if (data.hasMeterPointId()) {
            if (validator.isValidMeterPointId(data.meterPointId())) {
                score += METER_POINT_ID_POINTS;
            } else {
                LOGGER.debug("Trust-Score: Zählpunktnummer erscheint ungültig: {}", data.meterPointId());
            }
        }

        if (data.hasCurrentConsumption()) {
            if (validator.isValidConsumption(data.currentConsumptionKwh())) {
                score += CONSUMPTION_POINTS;
            } else {
                LOGGER.debug("Trust-Score: Verbrauch erscheint ungültig: {}", data.currentConsumptionKwh());
            }
        }

        return score;
    }

    /**
     * Gibt eine textuelle Beschreibung des Trust-Scores zurück.
     */
    public static String getScoreDescription(int score) {
        if (score >= 100) {
            return "Vollständig - Alle Felder plausibel";
        } else if (score >= 65) {
            return "Gut - Zwei von drei Feldern plausibel";
        } else if (score > 0) {
            return "Unvollständig - Felder fehlen";
        } else {
            return "Keine Daten erkannt";
        }
    }
}
