package UtilityBot.parser;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import UtilityBot.parser.ExtractionSettings.CurrentValuePolicy;

/*
Sucht den aktuellen kWh-Verbrauch.
 * Deutsche Zahlenformate: 2.573,1 bedeutet 2573.1 (Punkt = Tausender, Komma = Dezimal).
 * Der "aktuell"-Wert hat Vorrang vor dem Wert der Vorperiode.
 *
 * Durchgang 1: Zahl direkt nach "aktuell"/"current" und direkt vor "kWh".
 * Durchgang 2 (nur wenn 1 nichts findet): jede Zahl vor "kWh", optional mit Verbrauchs-Label,
 *              Treffer im Umfeld von "Vorperiode"/"previous" werden verworfen.
 * In beiden Durchgängen gewinnt der größte Wert (bei Gleichstand der erste).

Locates the current-period kWh consumption.
*/
@Component
public class ConsumptionLocator {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConsumptionLocator.class);

    // 2.573,1 | 2,573.1 | 2.573 | 2573,1 | 2573.1 | 2573
    static final String NUMBER = "\\d{1,3}(?:[.,]\\d{3})+(?:[.,]\\d+)?|\\d+(?:[.,]\\d+)?";

    private static final Pattern CURRENT_VALUE = Pattern.compile(
            "\\b(?:aktuell|current)\\b[:\\s]*(?<![\\d.,])(" + NUMBER + ")\\s*kwh",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private static final Pattern ANY_VALUE = Pattern.compile(
            "(?:\\b(?:gesamtverbrauch|energieverbrauch|verbrauch|strom)[:\\s]*)?(?<![\\d.,])(" + NUMBER + ")\\s*kwh",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    /**
     * Ein normalisierter Kandidat mit Position im Text.
     */
    public record Candidate(BigDecimal value, int start, int end) { }

    private final GermanNumberNormalizer normalizer;
    private final KeywordProximityFilter proximityFilter;
    private final CurrentValuePolicy currentValuePolicy;

    public ConsumptionLocator(GermanNumberNormalizer normalizer,
                              KeywordProximityFilter proximityFilter,
                              ExtractionSettings settings) {
        this.normalizer = normalizer;
        this.proximityFilter = proximityFilter;
        this.currentValuePolicy = settings.getCurrentValuePolicy();
    }

    /**
     * @return Verbrauch mit genau einer Nachkommastelle, z.B. "2573.1"
     */
    public Optional<String> locateConsumptionKwh(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }

        Optional<BigDecimal> current = findCurrentValue(text);
        if (current.isPresent()) {
            LOGGER.debug("kWh aus Durchgang 1 (aktuell): {}", current.get());
            return current.map(normalizer::format);
        }

        Optional<BigDecimal> fallback = findFallbackValue(text);
        fallback.ifPresent(value -> LOGGER.debug("kWh aus Durchgang 2 (ohne Kontext): {}", value));
        return fallback.map(normalizer::format);
    }

    /**
     * Durchgang 1: Werte mit "aktuell"/"current" davor.
     */
    public Optional<BigDecimal> findCurrentValue(String text) {
        List<Candidate> candidates = collect(CURRENT_VALUE, text, false);
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        if (currentValuePolicy == CurrentValuePolicy.FIRST) {
            return Optional.of(candidates.get(0).value());
        }
        return maximum(candidates);
    }

    /**
     * Durchgang 2: alle Werte vor "kWh", außer im Umfeld der Vorperiode.
     */
    public Optional<BigDecimal> findFallbackValue(String text) {
        return maximum(collect(ANY_VALUE, text, true));
    }

    private List<Candidate> collect(Pattern pattern, String text, boolean applyProximityFilter) {
        List<Candidate> candidates = new ArrayList<>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            if (applyProximityFilter && proximityFilter.isNearExclusion(text, matcher.start(), matcher.end())) {
                LOGGER.trace("Verworfen (Vorperiode in der Nähe): '{}'", matcher.group());
                continue;
            }
            normalizer.parseConsumption(matcher.group(1))
                    .ifPresent(value -> candidates.add(new Candidate(value, matcher.start(), matcher.end())));
        }
        return candidates;
    }

    private static Optional<BigDecimal> maximum(List<Candidate> candidates) {
        Candidate best = null;
        for (Candidate candidate : candidates) {
            // strikt größer: bei Gleichstand bleibt der erste Treffer
            if (best == null || candidate.value().compareTo(best.value()) > 0) {
                best = candidate;
            }
        }
        return Optional.ofNullable(best).map(Candidate::value);
    }
}
