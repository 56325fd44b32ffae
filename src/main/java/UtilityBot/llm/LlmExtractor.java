package UtilityBot.llm;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;


/* LLM Extractor für Zählerdaten aus OCR-Text von Stromrechnungen.
 * Zweistufig: Standard-Prompt, danach (optional) ein strengerer Retry-Prompt.
 * Beide verlangen dasselbe JSON-Format wie die regelbasierte Extraktion liefert.
 *
 * LLM extractor for meter data from OCR text of utility invoices.
 * Two stages: standard prompt, then (optionally) a stricter retry prompt.
 */
@Service
public class LlmExtractor {

    static final String JSON_SHAPE = """
        {"address": null, "zaehlpunktnummer": null, "kwh_aktuell": null}""";

    private final LlmClient client;
    private final int maxInputChars;

    public LlmExtractor(LlmClient client,
                        @Value("${llm.max-input-chars:4000}") int maxInputChars) {
        this.client = client;
        this.maxInputChars = maxInputChars;
    }

    /**
     * STUFE 1: Standard-Extraktion
     */
    public String extract(String text) {
        String prompt = """
        Du erhältst OCR-Text einer österreichischen Stromrechnung.
        Extrahiere exakt folgende Felder und gib NUR valides JSON zurück:
        {
          "address": "Vollständige Adresse inkl. Name, Straße, PLZ, Ort oder null",
          "zaehlpunktnummer": "33-stellige alphanumerische Zählpunktnummer (z.B. beginnt mit AT...) oder null",
          "kwh_aktuell": "aktueller Verbrauch in kWh als Zahl/Dezimalstring (z.B. 2573.1) oder null"
        }

        Wichtige Regeln:
        - Wenn mehrere kWh-Werte vorkommen, nimm den nach 'aktuell' (oder 'current') beschriebenen Wert.
        - Akzeptiere deutsche Zahlenformate (z.B. 2.573,1 -> 2573.1).
        - Wenn ein Feld fehlt, setze es auf null.

        OCR-Text:
        %s
        """.formatted(truncate(text));

        return client.sendPrompt(prompt);
    }

    /**
     * STUFE 2: Retry mit strengerem Prompt, wenn Stufe 1 kein verwertbares JSON geliefert hat
     */
    public String extractWithRetry(String text) {
        String prompt = """
        ZWEITER VERSUCH - deine letzte Antwort war kein verwertbares JSON.
        Antworte AUSSCHLIESSLICH mit genau diesem JSON-Objekt (keine Erklärungen, kein Markdown):
        %s

        FELDER:
        1. address: Name (falls vorhanden), Straße mit Hausnummer, 4-stellige PLZ mit Ort,
           getrennt durch ", " - z.B. "Max Mustermann, Hauptstraße 12, 1010 Wien"
        2. zaehlpunktnummer: genau 33 Zeichen, nur Großbuchstaben und Ziffern, OHNE Leerzeichen.
           Steht oft gruppiert: "AT 004000 05020 00000 00000 00101 27094" -> "AT0040000502000000000000010127094"
        3. kwh_aktuell: Verbrauch der AKTUELLEN Periode als Zahl mit Punkt als Dezimaltrenner.
           - NIEMALS den Wert der "Vorperiode" / "previous period" verwenden
           - "2.573,1 kWh" -> 2573.1

        Unsichere Felder sind null. Erfinde nichts.

        OCR-Text:
        %s
        """.formatted(JSON_SHAPE, truncate(text));

        return client.sendPrompt(prompt);
    }

    private String truncate(String text) {
        String trimmed = text == null ? "" : text.trim();
        return trimmed.length() > maxInputChars ? trimmed.substring(0, maxInputChars) : trimmed;
    }
}
