package UtilityBot;

import UtilityBot.batch.InvoiceBatchProcessor;
import UtilityBot.batch.ProcessingResult;
import UtilityBot.llm.LlmExtractor;
import UtilityBot.model.ExtractionMode;
import UtilityBot.model.ExtractionSource;
import UtilityBot.parser.InvoiceParser;
import UtilityBot.parser.ParseResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
@Tag("integration")
class InvoicePipelineIntegrationTest {

    @Autowired
    private InvoiceParser invoiceParser;

    @Autowired
    private InvoiceBatchProcessor batchProcessor;

    @MockitoBean
    private LlmExtractor llmExtractor;

    @Test
    @DisplayName("PIPELINE: LLM-Antwort wird normalisiert übernommen")
    void testLlmPathWithMockedModel() throws IOException {
        // 1. ARRANGE
        String text = InvoiceFieldExtractorTest.loadFixture("sample-invoice.txt");
        String llmJson = """
            Ergebnis:
            {
                "address": "Max Mustermann, Hauptstraße 12, 1010 Wien",
                "zaehlpunktnummer": "AT 004000 05020 00000 00000 00101 27094",
                "kwh_aktuell": "2.573,1"
            }
            """;

        // 2. MOCKING
        when(llmExtractor.extract(anyString())).thenReturn(llmJson);

        // 3. ACT
        ParseResult result = invoiceParser.parse(text, ExtractionMode.LLM);

        // 4. ASSERT
        assertEquals(ExtractionSource.LLM, result.source());
        assertEquals("AT0040000502000000000000010127094", result.data().meterPointId());
        assertEquals("2573.1", result.data().currentConsumptionKwh());
        verify(llmExtractor, never()).extractWithRetry(anyString());
    }

    @Test
    @DisplayName("PIPELINE: unbrauchbare LLM-Antworten führen zum Regel-Ergebnis")
    void testLlmFallbackToRules() throws IOException {
        // Arrange
        String text = InvoiceFieldExtractorTest.loadFixture("sample-invoice.txt");
        when(llmExtractor.extract(anyString())).thenReturn("Das weiß ich nicht.");
        when(llmExtractor.extractWithRetry(anyString())).thenReturn("{\"kwh_aktuell\": \"unbekannt\"}");

        // Act
        ParseResult result = invoiceParser.parse(text, ExtractionMode.LLM);

        // Assert
        assertEquals(ExtractionSource.HEURISTIC_FALLBACK, result.source());
        assertEquals("Max Mustermann, Hauptstraße 12, 1010 Wien", result.data().address());
        assertEquals("2573.1", result.data().currentConsumptionKwh());
    }

    @Test
    @DisplayName("PIPELINE: Stapel mit Export und Fehlerliste")
    void testBatchWithExport(@TempDir Path tempDir) throws IOException {
        // Arrange
        Path invoice = tempDir.resolve("rechnung.txt");
        Files.writeString(invoice, InvoiceFieldExtractorTest.loadFixture("sample-invoice.txt"), StandardCharsets.UTF_8);
        File missing = tempDir.resolve("fehlt.pdf").toFile();
        File xlsx = tempDir.resolve("export.xlsx").toFile();
        File failedList = tempDir.resolve("fehler.txt").toFile();

        // Act
        List<ProcessingResult> results = batchProcessor.process(List.of(invoice.toFile(), missing), ExtractionMode.HEURISTIC);
        batchProcessor.exportResults(results, xlsx);
        int failedCount = batchProcessor.writeFailedList(results, failedList);

        // Assert
        assertEquals(2, results.size());
        assertTrue(results.get(0).isSuccess());
        assertEquals(100, results.get(0).trustScore());
        assertFalse(results.get(1).isSuccess());
        assertTrue(xlsx.length() > 0);
        assertEquals(1, failedCount);
        verifyNoInteractions(llmExtractor);
    }
}
