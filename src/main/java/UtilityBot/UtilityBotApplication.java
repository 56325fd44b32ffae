package UtilityBot;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

import UtilityBot.batch.InvoiceBatchProcessor;
import UtilityBot.batch.ProcessingResult;
import UtilityBot.model.ExtractedInvoiceData;
import UtilityBot.model.ExtractionMode;


/*
Kommandozeilen-Einstieg:
  java -jar utility-invoice-bot.jar [--mode=HEURISTIC|LLM] [--export=daten.xlsx] [--failed-list=fehler.txt] datei1.pdf datei2.txt ...
*/
@SpringBootApplication
public class UtilityBotApplication {

    public static void main(String[] args) {
        System.setProperty("java.net.preferIPv4Stack", "true");

        SpringApplication app = new SpringApplication(UtilityBotApplication.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        ConfigurableApplicationContext context = app.run(args);

        InvoiceBatchProcessor processor = context.getBean(InvoiceBatchProcessor.class);
        int exitCode = runSafely(processor, args, context.getEnvironment().getProperty("extraction.mode"));
        System.exit(SpringApplication.exit(context, () -> 0) == 0 ? exitCode : 1);
    }

    /**
     * Wie {@link #run}, aber Konfigurations- und Ein-/Ausgabefehler enden mit Meldung und Code 2.
     */
    static int runSafely(InvoiceBatchProcessor processor, String[] args, String configuredMode) {
        try {
            ExtractionMode defaultMode = parseMode(configuredMode, ExtractionMode.HEURISTIC);
            return run(processor, new DefaultApplicationArguments(args), defaultMode);
        } catch (IllegalArgumentException | IOException e) {
            System.err.println("Fehler: " + e.getMessage());
            return 2;
        }
    }

    /**
     * Verarbeitet die übergebenen Dateien und schreibt optional Export und Fehlerliste.
     *
     * @return 0 wenn alle Dateien gelesen werden konnten, 1 sonst, 2 ohne Eingabedateien
     */
    static int run(InvoiceBatchProcessor processor, ApplicationArguments arguments, ExtractionMode defaultMode)
            throws IOException {
        List<File> files = arguments.getNonOptionArgs().stream()
                .map(File::new)
                .collect(Collectors.toList());
        if (files.isEmpty()) {
            System.err.println("Keine Eingabedateien angegeben.");
            System.err.println("Aufruf: [--mode=HEURISTIC|LLM] [--export=<xlsx>] [--failed-list=<txt>] <dateien...>");
            return 2;
        }

        ExtractionMode mode = parseMode(firstOptionValue(arguments, "mode"), defaultMode);
        List<ProcessingResult> results = processor.process(files, mode);

        for (ProcessingResult result : results) {
            System.out.println(summaryLine(result));
        }

        String export = firstOptionValue(arguments, "export");
        if (export != null) {
            processor.exportResults(results, new File(export));
            System.out.println("Excel-Export: " + export);
        }

        String failedList = firstOptionValue(arguments, "failed-list");
        if (failedList != null) {
            int count = processor.writeFailedList(results, new File(failedList));
            System.out.println("Fehlerliste (" + count + " Einträge): " + failedList);
        }

        boolean anyFailed = results.stream().anyMatch(r -> !r.isSuccess());
        return anyFailed ? 1 : 0;
    }

    static ExtractionMode parseMode(String value, ExtractionMode defaultMode) {
        if (value == null || value.isBlank()) {
            return defaultMode;
        }
        try {
            return ExtractionMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unbekannter Modus: " + value + " (erlaubt: HEURISTIC, LLM)", e);
        }
    }

    static String summaryLine(ProcessingResult result) {
        if (!result.isSuccess()) {
            return result.fileName() + " | FEHLER: " + result.errorMessage();
        }
        ExtractedInvoiceData data = result.data();
        return String.join(" | ",
                result.fileName(),
                "Adresse: " + orDash(data.address()),
                "ZP: " + orDash(data.meterPointId()),
                "kWh: " + orDash(data.currentConsumptionKwh()),
                result.source().displayName(),
                "Trust " + result.trustScore() + "%");
    }

    private static String firstOptionValue(ApplicationArguments arguments, String name) {
        List<String> values = arguments.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    private static String orDash(String value) {
        return value != null ? value : "-";
    }
}
