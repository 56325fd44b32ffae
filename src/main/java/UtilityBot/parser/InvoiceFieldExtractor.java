package UtilityBot.parser;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import UtilityBot.model.ExtractedInvoiceData;

/*
Regelbasierte Extraktion aller drei Felder aus dem OCR-Text.
 * Die drei Suchen sind reine Funktionen des Textes und voneinander unabhängig,
 * Teilergebnisse (1 oder 2 von 3 Feldern) sind normal. Wirft nie.

Rule-based extraction of all three fields from OCR text.
*/
@Service
public class InvoiceFieldExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(InvoiceFieldExtractor.class);

    private final AddressLocator addressLocator;
    private final MeterPointIdLocator meterPointIdLocator;
    private final ConsumptionLocator consumptionLocator;
    private final boolean parallel;

    public InvoiceFieldExtractor(AddressLocator addressLocator,
                                 MeterPointIdLocator meterPointIdLocator,
                                 ConsumptionLocator consumptionLocator,
                                 ExtractionSettings settings) {
        this.addressLocator = addressLocator;
        this.meterPointIdLocator = meterPointIdLocator;
        this.consumptionLocator = consumptionLocator;
        this.parallel = settings.isParallel();
    }

    /**
     * Verdrahtet alle Bausteine mit den übergebenen Einstellungen (ohne Spring).
     */
    public static InvoiceFieldExtractor create(ExtractionSettings settings) {
        GermanNumberNormalizer normalizer = new GermanNumberNormalizer(settings);
        return new InvoiceFieldExtractor(
                new AddressLocator(),
                new MeterPointIdLocator(settings),
                new ConsumptionLocator(normalizer, new KeywordProximityFilter(settings), settings),
                settings);
    }

    public ExtractedInvoiceData extractInvoiceData(String text) {
        String input = text == null ? "" : text;

        ExtractedInvoiceData data = parallel ? extractParallel(input) : extractSequential(input);

        LOGGER.debug("Regelbasierte Extraktion: {} von 3 Feldern gefunden", data.presentFieldCount());
        return data;
    }

    private ExtractedInvoiceData extractSequential(String text) {
        return new ExtractedInvoiceData(
                addressLocator.locateAddress(text).orElse(null),
                meterPointIdLocator.locateMeterId(text).orElse(null),
                consumptionLocator.locateConsumptionKwh(text).orElse(null));
    }

    private ExtractedInvoiceData extractParallel(String text) {
        CompletableFuture<Optional<String>> address =
                CompletableFuture.supplyAsync(() -> addressLocator.locateAddress(text));
        CompletableFuture<Optional<String>> meterPointId =
                CompletableFuture.supplyAsync(() -> meterPointIdLocator.locateMeterId(text));
        CompletableFuture<Optional<String>> consumption =
                CompletableFuture.supplyAsync(() -> consumptionLocator.locateConsumptionKwh(text));

        return new ExtractedInvoiceData(
                address.join().orElse(null),
                meterPointId.join().orElse(null),
                consumption.join().orElse(null));
    }
}
