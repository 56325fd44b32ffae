package UtilityBot.parser;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/*
Domänenkonstanten der Extraktion (österreichisches Rechnungsformat).
 * Alle Werte sind über application.properties überschreibbar.

Domain constants of the extraction (Austrian invoice format).
 * Every value can be overridden through application.properties.
*/
@Component
public class ExtractionSettings {

    public static final int DEFAULT_METER_ID_LENGTH = 33;
    public static final BigDecimal DEFAULT_MIN_CONSUMPTION = BigDecimal.ONE;
    public static final BigDecimal DEFAULT_MAX_CONSUMPTION = new BigDecimal("100000");
    public static final int DEFAULT_CONTEXT_WINDOW = 50;
    public static final List<String> DEFAULT_EXCLUSION_KEYWORDS = List.of("vorperiode", "previous");

    /**
     * Auswahl unter mehreren "aktuell"-Treffern.
     * MAXIMUM fängt von der OCR doppelt erkannte Fragmente ab, ist aber keine gesicherte Geschäftsregel.
     */
    public enum CurrentValuePolicy {
        MAXIMUM,
        FIRST
    }

    private final int meterIdLength;
    private final BigDecimal minConsumptionExclusive;
    private final BigDecimal maxConsumptionExclusive;
    private final int contextWindow;
    private final List<String> exclusionKeywords;
    private final CurrentValuePolicy currentValuePolicy;
    private final boolean parallel;

    @Autowired
    public ExtractionSettings(@Value("${extraction.meter-id.length:33}") int meterIdLength,
                              @Value("${extraction.consumption.min-exclusive:1}") BigDecimal minConsumptionExclusive,
                              @Value("${extraction.consumption.max-exclusive:100000}") BigDecimal maxConsumptionExclusive,
                              @Value("${extraction.consumption.context-window:50}") int contextWindow,
                              @Value("${extraction.consumption.exclusion-keywords:vorperiode,previous}") String[] exclusionKeywords,
                              @Value("${extraction.consumption.current-policy:MAXIMUM}") CurrentValuePolicy currentValuePolicy,
                              @Value("${extraction.parallel:false}") boolean parallel) {
        if (meterIdLength < 3) {
            throw new IllegalArgumentException("extraction.meter-id.length muss mindestens 3 sein: " + meterIdLength);
        }
        if (minConsumptionExclusive.compareTo(maxConsumptionExclusive) >= 0) {
            throw new IllegalArgumentException("Ungültiger Verbrauchsbereich: ("
                    + minConsumptionExclusive + ", " + maxConsumptionExclusive + ")");
        }
        if (contextWindow < 0) {
            throw new IllegalArgumentException("extraction.consumption.context-window darf nicht negativ sein");
        }
        this.meterIdLength = meterIdLength;
        this.minConsumptionExclusive = minConsumptionExclusive;
        this.maxConsumptionExclusive = maxConsumptionExclusive;
        this.contextWindow = contextWindow;
        this.exclusionKeywords = List.of(exclusionKeywords).stream()
                .map(String::trim)
                .filter(keyword -> !keyword.isEmpty())
                .map(keyword -> keyword.toLowerCase(Locale.ROOT))
                .toList();
        this.currentValuePolicy = Objects.requireNonNull(currentValuePolicy, "currentValuePolicy");
        this.parallel = parallel;
    }

    /**
     * Standardwerte ohne Spring-Kontext (Tests, manuelle Verdrahtung).
     */
    public static ExtractionSettings defaults() {
        return new ExtractionSettings(DEFAULT_METER_ID_LENGTH,
                DEFAULT_MIN_CONSUMPTION,
                DEFAULT_MAX_CONSUMPTION,
                DEFAULT_CONTEXT_WINDOW,
                DEFAULT_EXCLUSION_KEYWORDS.toArray(new String[0]),
                CurrentValuePolicy.MAXIMUM,
                false);
    }

    public ExtractionSettings withCurrentValuePolicy(CurrentValuePolicy policy) {
        return new ExtractionSettings(meterIdLength, minConsumptionExclusive, maxConsumptionExclusive,
                contextWindow, exclusionKeywords.toArray(new String[0]), policy, parallel);
    }

    public ExtractionSettings withParallel(boolean parallel) {
        return new ExtractionSettings(meterIdLength, minConsumptionExclusive, maxConsumptionExclusive,
                contextWindow, exclusionKeywords.toArray(new String[0]), currentValuePolicy, parallel);
    }

    public int getMeterIdLength() { return meterIdLength; }
    public BigDecimal getMinConsumptionExclusive() { return minConsumptionExclusive; }
    public BigDecimal getMaxConsumptionExclusive() { return maxConsumptionExclusive; }
    public int getContextWindow() { return contextWindow; }
    public List<String> getExclusionKeywords() { return exclusionKeywords; }
    public CurrentValuePolicy getCurrentValuePolicy() { return currentValuePolicy; }
    public boolean isParallel() { return parallel; }
}
