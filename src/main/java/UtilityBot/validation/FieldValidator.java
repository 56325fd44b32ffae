package UtilityBot.validation;

import java.math.BigDecimal;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import UtilityBot.parser.ExtractionSettings;

/**
 * Plausibilitätsregeln für einzelne Felder, unabhängig davon, wer sie geliefert hat (Regeln oder LLM).
 */
@Component
public class FieldValidator {

    private static final Pattern ALPHANUMERIC = Pattern.compile("[A-Z0-9]+");
    private static final Pattern HAS_LETTER = Pattern.compile("[A-Z]");
    private static final Pattern HAS_DIGIT = Pattern.compile("\\d");
    private static final Pattern ONE_FRACTION_DIGIT = Pattern.compile("\\d+\\.\\d");

    private final ExtractionSettings settings;

    public FieldValidator(ExtractionSettings settings) {
        this.settings = settings;
    }

    /**
     * Zählpunktnummer: exakte Länge, nur A-Z/0-9, mindestens ein Buchstabe und eine Ziffer.
     */
    public boolean isValidMeterPointId(String value) {
        if (value == null || value.length() != settings.getMeterIdLength()) {
            return false;
        }
        return ALPHANUMERIC.matcher(value).matches()
                && HAS_LETTER.matcher(value).find()
                && HAS_DIGIT.matcher(value).find();
    }

    /**
     * Verbrauch: kanonische Form mit einer Nachkommastelle, im offenen Bereich (min, max).
     */
    public boolean isValidConsumption(String value) {
        if (value == null || !ONE_FRACTION_DIGIT.matcher(value).matches()) {
            return false;
        }
        BigDecimal number = new BigDecimal(value);
        return number.compareTo(settings.getMinConsumptionExclusive()) > 0
                && number.compareTo(settings.getMaxConsumptionExclusive()) < 0;
    }

    /**
     * Adresse: mindestens eine Ziffer (Hausnummer/PLZ) und mehr als zwei Buchstaben.
     */
    public boolean isValidAddress(String value) {
        if (value == null || value.isBlank()) {
            return false;
        }
        long letterCount = value.chars().filter(Character::isLetter).count();
        return letterCount > 2 && HAS_DIGIT.matcher(value).find();
    }
}
