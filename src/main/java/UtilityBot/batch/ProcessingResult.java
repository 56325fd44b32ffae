package UtilityBot.batch;

import java.io.File;

import UtilityBot.model.ExtractedInvoiceData;
import UtilityBot.model.ExtractionSource;
import UtilityBot.parser.ParseResult;

/**
 * Ergebnis der Verarbeitung einer Datei.
 * Bei einem Fehler sind {@code data} und {@code source} leer und {@code errorMessage} gesetzt.
 */
public record ProcessingResult(String fileName,
                               String filePath,
                               ExtractedInvoiceData data,
                               ExtractionSource source,
                               String fallbackReason,
                               int trustScore,
                               String errorMessage) {

    public static ProcessingResult success(File file, ParseResult parsed, int trustScore) {
        return new ProcessingResult(file.getName(), file.getAbsolutePath(),
                parsed.data(), parsed.source(), parsed.fallbackReason(), trustScore, null);
    }

    public static ProcessingResult failure(File file, String errorMessage) {
        return new ProcessingResult(file.getName(), file.getAbsolutePath(),
                null, null, null, 0, errorMessage != null ? errorMessage : "Unbekannter Fehler");
    }

    public boolean isSuccess() {
        return errorMessage == null && data != null;
    }
}
