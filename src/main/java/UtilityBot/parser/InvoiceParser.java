package UtilityBot.parser;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import UtilityBot.llm.LlmExtractor;
import UtilityBot.llm.LlmResponseParser;
import UtilityBot.model.ExtractedInvoiceData;
import UtilityBot.model.ExtractionMode;
import UtilityBot.model.ExtractionSource;


/*

Wählt den Extraktionsweg für einen OCR-Text.
 * HEURISTIC: nur die regelbasierte Extraktion.
 * LLM: Sprachmodell (Stufe 1, optional Retry in Stufe 2); liefert es nichts Verwertbares
 *      oder schlägt es fehl, ersetzt das regelbasierte Ergebnis die LLM-Antwort vollständig.


Chooses the extraction path for an OCR text.
* LLM failures never propagate: the rule-based result is the fallback.

*/
@Service
public class InvoiceParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(InvoiceParser.class);

    private final InvoiceFieldExtractor fieldExtractor;
    private final LlmExtractor llmExtractor;
    private final LlmResponseParser responseParser;
    private final boolean retryEnabled;

    public InvoiceParser(InvoiceFieldExtractor fieldExtractor,
                         LlmExtractor llmExtractor,
                         LlmResponseParser responseParser,
                         @Value("${llm.retry-enabled:true}") boolean retryEnabled) {
        this.fieldExtractor = fieldExtractor;
        this.llmExtractor = llmExtractor;
        this.responseParser = responseParser;
        this.retryEnabled = retryEnabled;
    }

    public ParseResult parse(String text, ExtractionMode mode) {
        if (mode != ExtractionMode.LLM) {
            return new ParseResult(fieldExtractor.extractInvoiceData(text), ExtractionSource.HEURISTIC, null);
        }

        if (text == null || text.isBlank()) {
            return fallback(text, "Leerer OCR-Text, LLM nicht aufgerufen");
        }

        try {
            // ========================================
            // STUFE 1: Standard-Extraktion
            // ========================================
            Optional<ExtractedInvoiceData> data = responseParser.parse(llmExtractor.extract(text));
            if (data.isPresent()) {
                LOGGER.info("LLM-Extraktion erfolgreich (Stufe 1), {} von 3 Feldern", data.get().presentFieldCount());
                return new ParseResult(data.get(), ExtractionSource.LLM, null);
            }

            // ========================================
            // STUFE 2: Retry mit strengerem Prompt
            // ========================================
            if (retryEnabled) {
                LOGGER.info("Stufe 1 ohne verwertbares JSON, Retry mit strengerem Prompt");
                data = responseParser.parse(llmExtractor.extractWithRetry(text));
                if (data.isPresent()) {
                    LOGGER.info("LLM-Extraktion erfolgreich (Stufe 2), {} von 3 Feldern", data.get().presentFieldCount());
                    return new ParseResult(data.get(), ExtractionSource.LLM, null);
                }
            }

            return fallback(text, "LLM lieferte kein verwertbares JSON");

        } catch (RuntimeException e) {
            LOGGER.warn("LLM-Extraktion fehlgeschlagen, verwende regelbasierte Extraktion: {}", e.getMessage());
            return fallback(text, "LLM-Fehler: " + e.getMessage());
        }
    }

    private ParseResult fallback(String text, String reason) {
        LOGGER.debug("Fallback auf regelbasierte Extraktion: {}", reason);
        return new ParseResult(fieldExtractor.extractInvoiceData(text), ExtractionSource.HEURISTIC_FALLBACK, reason);
    }
}
