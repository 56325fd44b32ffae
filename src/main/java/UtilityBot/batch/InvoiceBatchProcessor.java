package UtilityBot.batch;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import UtilityBot.export.ExcelExporter;
import UtilityBot.model.ExtractedInvoiceData;
import UtilityBot.model.ExtractionMode;
import UtilityBot.parser.InvoiceParser;
import UtilityBot.parser.InvoiceTextReader;
import UtilityBot.parser.ParseResult;
import UtilityBot.validation.TrustScoreCalculator;


/*
Verarbeitet eine Liste von Rechnungsdateien nacheinander:
 Text lesen, Felder extrahieren, Trust-Score berechnen.
 Ein Fehler bei einer Datei stoppt den Stapel nicht.
*/
@Service
public class InvoiceBatchProcessor {

    private static final Logger LOGGER = LoggerFactory.getLogger(InvoiceBatchProcessor.class);

    private final InvoiceTextReader textReader;
    private final InvoiceParser parser;
    private final TrustScoreCalculator trustScoreCalculator;
    private final ExcelExporter excelExporter;
    private final int minTrustScore;

    public InvoiceBatchProcessor(InvoiceTextReader textReader,
                                 InvoiceParser parser,
                                 TrustScoreCalculator trustScoreCalculator,
                                 ExcelExporter excelExporter,
                                 @Value("${batch.min-trust-score:65}") int minTrustScore) {
        this.textReader = textReader;
        this.parser = parser;
        this.trustScoreCalculator = trustScoreCalculator;
        this.excelExporter = excelExporter;
        this.minTrustScore = minTrustScore;
    }

    public List<ProcessingResult> process(List<File> files, ExtractionMode mode) {
        List<ProcessingResult> results = new ArrayList<>();
        for (int i = 0; i < files.size(); i++) {
            File file = files.get(i);
            LOGGER.info("[{}/{}] Verarbeite {} ({})", i + 1, files.size(), file.getName(), mode);
            results.add(processFile(file, mode));
        }
        return results;
    }

    ProcessingResult processFile(File file, ExtractionMode mode) {
        try {
            // 1. Text lesen
            String text = textReader.read(file);

            // 2. Extraktion (Regeln oder LLM mit Fallback)
            ParseResult parsed = parser.parse(text, mode);

            // 3. Trust-Score berechnen
            int trustScore = trustScoreCalculator.calculate(parsed.data());
            LOGGER.info("{}: {} von 3 Feldern über {}, Trust-Score {}%", file.getName(),
                    parsed.data().presentFieldCount(), parsed.source().displayName(), trustScore);

            return ProcessingResult.success(file, parsed, trustScore);

        } catch (IOException e) {
            LOGGER.error("Datei {} konnte nicht gelesen werden: {}", file.getName(), e.getMessage());
            return ProcessingResult.failure(file, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    /**
     * Dateien, die fehlgeschlagen sind oder unter der Trust-Score-Schwelle liegen.
     */
    public List<ProcessingResult> failedResults(List<ProcessingResult> results) {
        return results.stream()
                .filter(r -> !r.isSuccess() || r.trustScore() < minTrustScore)
                .collect(Collectors.toList());
    }

    public void exportResults(List<ProcessingResult> results, File targetFile) throws IOException {
        excelExporter.export(results, targetFile);
    }

    /**
     * Erstellt die Fehlerliste-Datei.
     *
     * @return Anzahl der aufgeführten Dateien
     */
    public int writeFailedList(List<ProcessingResult> results, File file) throws IOException {
        List<ProcessingResult> failed = failedResults(results);

        StringBuilder content = new StringBuilder();
        content.append("=== FEHLERHAFTE DATEIEN ===\n");
        content.append("Erstellt am: ").append(LocalDateTime.now()).append("\n");
        content.append("Trust-Score Schwelle: ").append(minTrustScore).append("%\n\n");
        content.append("Anzahl fehlerhafter Dateien: ").append(failed.size()).append("\n\n");
        content.append("=".repeat(40)).append("\n\n");

        for (int i = 0; i < failed.size(); i++) {
            ProcessingResult result = failed.get(i);

            content.append(i + 1).append(". ").append(result.fileName()).append("\n");
            content.append("   ").append("-".repeat(50)).append("\n");

            if (!result.isSuccess()) {
                content.append("   Status: Verarbeitungsfehler\n");
                content.append("   Fehler: ").append(result.errorMessage()).append("\n");
            } else {
                int score = result.trustScore();
                content.append("   Status: Trust-Score zu niedrig\n");
                content.append("   Trust-Score: ").append(score).append("%");
                content.append(" (Schwelle: ").append(minTrustScore).append("%)\n");
                content.append("   Bewertung: ").append(TrustScoreCalculator.getScoreDescription(score)).append("\n");
                if (result.source() != null) {
                    content.append("   Quelle: ").append(result.source().displayName()).append("\n");
                }
                if (result.fallbackReason() != null) {
                    content.append("   Fallback-Grund: ").append(result.fallbackReason()).append("\n");
                }

                ExtractedInvoiceData data = result.data();
                if (data != null) {
                    content.append("\n   Extrahierte Daten:\n");
                    content.append("     * Adresse: ").append(orDash(data.address())).append("\n");
                    content.append("     * Zählpunktnummer: ").append(orDash(data.meterPointId())).append("\n");
                    content.append("     * Verbrauch aktuell: ").append(orDash(data.currentConsumptionKwh())).append("\n");
                }
            }
            content.append("\n");
        }

        content.append("=".repeat(60)).append("\n");

        try (FileWriter writer = new FileWriter(file, StandardCharsets.UTF_8)) {
            writer.write(content.toString());
        }
        LOGGER.info("Fehlerliste geschrieben: {} ({} Einträge)", file.getAbsolutePath(), failed.size());
        return failed.size();
    }

    public int getMinTrustScore() {
        return minTrustScore;
    }

    private static String orDash(String value) {
        return value != null ? value : "-";
    }
}
