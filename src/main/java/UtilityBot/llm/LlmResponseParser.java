package UtilityBot.llm;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;

import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import UtilityBot.model.ExtractedInvoiceData;
import UtilityBot.parser.GermanNumberNormalizer;
import UtilityBot.validation.FieldValidator;

/*
Verantwortlich für das Parsen der LLM-Antworten.
 * Die Antwort muss dieselbe Form wie die regelbasierte Extraktion haben, sonst gilt sie als unbrauchbar
 * und der Aufrufer verwendet vollständig das Ergebnis der Regeln (kein feldweises Mischen).

Responsible for parsing the responses from the LLM.
 * An unusable answer yields an empty result; the caller then replaces it entirely with the rule-based result.
*/
@Service
public class LlmResponseParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(LlmResponseParser.class);

    static final String ADDRESS_KEY = "address";
    static final String METER_POINT_ID_KEY = "zaehlpunktnummer";
    static final String CONSUMPTION_KEY = "kwh_aktuell";

    private final GermanNumberNormalizer normalizer;
    private final FieldValidator validator;

    public LlmResponseParser(GermanNumberNormalizer normalizer, FieldValidator validator) {
        this.normalizer = normalizer;
        this.validator = validator;
    }

    /**
     * @return leer, wenn die Antwort kein JSON-Objekt enthält, ein Feld nicht verwertbar ist
     *         oder kein einziges Feld gefüllt ist
     */
    public Optional<ExtractedInvoiceData> parse(String content) {
        Optional<String> json = extractJson(content);
        if (json.isEmpty()) {
            LOGGER.warn("LLM-Antwort enthält kein JSON-Objekt");
            return Optional.empty();
        }

        JSONObject obj;
        try {
            obj = new JSONObject(json.get());
        } catch (JSONException e) {
            LOGGER.warn("LLM-Antwort ist kein gültiges JSON: {}", e.getMessage());
            return Optional.empty();
        }

        try {
            String address = readAddress(obj);
            String meterPointId = readMeterPointId(obj);
            String consumption = readConsumption(obj);

            ExtractedInvoiceData data = new ExtractedInvoiceData(address, meterPointId, consumption);
            if (data.isEmpty()) {
                LOGGER.warn("LLM-Antwort enthält keinen einzigen Wert");
                return Optional.empty();
            }
            return Optional.of(data);

        } catch (UnusableFieldException e) {
            LOGGER.warn("LLM-Antwort unbrauchbar: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Schneidet das JSON-Objekt zwischen der ersten "{" und der letzten "}" aus
     * (Modelle schreiben gern Text davor oder danach).
     */
    static Optional<String> extractJson(String text) {
        if (text == null) {
            return Optional.empty();
        }
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start == -1 || end == -1 || end <= start) {
            return Optional.empty();
        }
        return Optional.of(text.substring(start, end + 1));
    }

    private String readAddress(JSONObject obj) {
        Object value = obj.opt(ADDRESS_KEY);
        if (isAbsent(value)) {
            return null;
        }
        if (!(value instanceof String)) {
            throw new UnusableFieldException(ADDRESS_KEY + " ist kein Text: " + value);
        }
        String address = ((String) value).trim();
        return address.isEmpty() ? null : address;
    }

    private String readMeterPointId(JSONObject obj) {
        Object value = obj.opt(METER_POINT_ID_KEY);
        if (isAbsent(value)) {
            return null;
        }
        if (!(value instanceof String)) {
            throw new UnusableFieldException(METER_POINT_ID_KEY + " ist kein Text: " + value);
        }
        String raw = (String) value;
        if (raw.isBlank()) {
            return null;
        }
        String meterPointId = raw.replaceAll("\\s+", "").toUpperCase(Locale.ROOT);
        if (!validator.isValidMeterPointId(meterPointId)) {
            throw new UnusableFieldException(METER_POINT_ID_KEY + " ist keine gültige Zählpunktnummer: " + raw);
        }
        return meterPointId;
    }

    private String readConsumption(JSONObject obj) {
        Object value = obj.opt(CONSUMPTION_KEY);
        if (isAbsent(value)) {
            return null;
        }

        Optional<BigDecimal> number;
        if (value instanceof Number) {
            number = Optional.of(new BigDecimal(value.toString()));
        } else if (value instanceof String) {
            String raw = (String) value;
            if (raw.isBlank()) {
                return null;
            }
            // "2.573,1 kWh" → "2.573,1"
            number = normalizer.normalize(raw.replaceAll("(?i)\\s*kwh\\s*$", ""));
        } else {
            throw new UnusableFieldException(CONSUMPTION_KEY + " ist weder Zahl noch Text: " + value);
        }

        BigDecimal consumption = number
                .filter(normalizer::isPlausibleConsumption)
                .orElseThrow(() -> new UnusableFieldException(
                        CONSUMPTION_KEY + " ist kein plausibler Verbrauch: " + value));
        return normalizer.format(consumption);
    }

    private static boolean isAbsent(Object value) {
        return value == null || JSONObject.NULL.equals(value);
    }

    private static class UnusableFieldException extends RuntimeException {
        UnusableFieldException(String message) {
            super(message);
        }
    }
}
