package UtilityBot.parser;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Locale;


/* Liest den Rohtext einer Rechnung.
 * PDFs mit Textlayer über Apache PDFBox, alle anderen Dateien als UTF-8-Text (z.B. gespeicherte OCR-Ausgabe).
 * Bilder werden hier nicht erkannt, die OCR läuft außerhalb.
 */

@Service
public class InvoiceTextReader {

    public String read(File file) throws IOException {
        if (isPdf(file)) {
            return extractPdf(file);
        }
        return Files.readString(file.toPath(), StandardCharsets.UTF_8);
    }

    public static String extractPdf(File pdf) throws IOException {
        try (PDDocument doc = PDDocument.load(pdf)) {
            return new PDFTextStripper().getText(doc);
        }
    }

    static boolean isPdf(File file) {
        return file.getName().toLowerCase(Locale.ROOT).endsWith(".pdf");
    }
}
