package UtilityBot;

import UtilityBot.batch.InvoiceBatchProcessor;
import UtilityBot.batch.ProcessingResult;
import UtilityBot.model.ExtractedInvoiceData;
import UtilityBot.model.ExtractionMode;
import UtilityBot.model.ExtractionSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.File;
import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UtilityBotApplicationTest {

    @Mock InvoiceBatchProcessor processor;

    private static ProcessingResult success(String name) {
        return new ProcessingResult(name, null, new ExtractedInvoiceData(null, null, "2573.1"),
                ExtractionSource.LLM, null, 35, null);
    }

    @Test
    @DisplayName("CLI: Modus, Export und Fehlerliste aus den Argumenten")
    void runWithAllOptions() throws IOException {
        // Arrange
        DefaultApplicationArguments args = new DefaultApplicationArguments(
                "--mode=llm", "--export=out.xlsx", "--failed-list=fehler.txt", "a.pdf", "b.txt");
        List<ProcessingResult> results = List.of(success("a.pdf"), success("b.txt"));
        when(processor.process(List.of(new File("a.pdf"), new File("b.txt")), ExtractionMode.LLM)).thenReturn(results);
        when(processor.writeFailedList(results, new File("fehler.txt"))).thenReturn(2);

        // Act
        int exitCode = UtilityBotApplication.run(processor, args, ExtractionMode.HEURISTIC);

        // Assert
        assertEquals(0, exitCode);
        verify(processor).exportResults(results, new File("out.xlsx"));
    }

    @Test
    @DisplayName("CLI: ohne Modus gilt der konfigurierte Standard, ohne Export wird nichts geschrieben")
    void runWithDefaults() throws IOException {
        ProcessingResult failed = ProcessingResult.failure(new File("x.pdf"), "nicht lesbar");
        when(processor.process(anyList(), eq(ExtractionMode.HEURISTIC))).thenReturn(List.of(failed));

        int exitCode = UtilityBotApplication.run(processor, new DefaultApplicationArguments("x.pdf"), ExtractionMode.HEURISTIC);

        assertEquals(1, exitCode);
        verify(processor, never()).exportResults(any(), any());
        verify(processor, never()).writeFailedList(any(), any());
    }

    @Test
    @DisplayName("CLI: ohne Dateien wird nichts verarbeitet")
    void runWithoutFiles() throws IOException {
        assertEquals(2, UtilityBotApplication.run(processor, new DefaultApplicationArguments("--mode=LLM"), ExtractionMode.HEURISTIC));
        verifyNoInteractions(processor);
    }

    @Test
    @DisplayName("CLI: unbekannter Modus wird abgelehnt")
    void unknownMode() {
        assertEquals(ExtractionMode.LLM, UtilityBotApplication.parseMode(" llm ", ExtractionMode.HEURISTIC));
        assertEquals(ExtractionMode.HEURISTIC, UtilityBotApplication.parseMode(null, ExtractionMode.HEURISTIC));
        assertThrows(IllegalArgumentException.class, () -> UtilityBotApplication.parseMode("OCR", ExtractionMode.HEURISTIC));
    }

    @Test
    @DisplayName("CLI: ungültiger extraction.mode endet mit Code 2 statt Stacktrace")
    void invalidConfiguredModeExitsWithTwo() throws IOException {
        assertEquals(2, UtilityBotApplication.runSafely(processor, new String[] {"a.pdf"}, "OCR"));
        verifyNoInteractions(processor);
    }

    @Test
    @DisplayName("CLI: konfigurierter Modus gilt, wenn --mode fehlt")
    void configuredModeIsDefault() throws IOException {
        when(processor.process(anyList(), eq(ExtractionMode.LLM))).thenReturn(List.of(success("a.pdf")));

        assertEquals(0, UtilityBotApplication.runSafely(processor, new String[] {"a.pdf"}, " llm "));
        assertEquals(0, UtilityBotApplication.runSafely(processor, new String[] {"--mode=LLM", "a.pdf"}, null));
    }

    @Test
    @DisplayName("CLI: Zusammenfassung pro Datei")
    void summaryLine() {
        assertEquals("a.pdf | Adresse: - | ZP: - | kWh: 2573.1 | LLM | Trust 35%",
                UtilityBotApplication.summaryLine(success("a.pdf")));
        assertEquals("x.pdf | FEHLER: nicht lesbar",
                UtilityBotApplication.summaryLine(ProcessingResult.failure(new File("x.pdf"), "nicht lesbar")));
    }
}
