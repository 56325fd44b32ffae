package UtilityBot.parser;

import UtilityBot.model.ExtractedInvoiceData;
import UtilityBot.model.ExtractionSource;

/**
 * Ergebnis der Parsing-Operation.
 * Enthält die extrahierten Daten, den Weg, der sie geliefert hat, und den Grund für einen LLM-Fallback (falls vorhanden).
 */
public record ParseResult(ExtractedInvoiceData data, ExtractionSource source, String fallbackReason) {

    public boolean isFallback() {
        return source == ExtractionSource.HEURISTIC_FALLBACK;
    }
}
