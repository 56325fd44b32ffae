package UtilityBot.parser;

import java.util.List;
import java.util.Locale;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Prüft, ob im Umfeld eines Treffers ein Ausschluss-Schlüsselwort steht
 * (z.B. "Vorperiode" neben einem kWh-Wert der Vorjahresabrechnung).
 */
@Component
public class KeywordProximityFilter {

    private final int window;
    private final List<String> keywords;

    @Autowired
    public KeywordProximityFilter(ExtractionSettings settings) {
        this(settings.getContextWindow(), settings.getExclusionKeywords());
    }

    public KeywordProximityFilter(int window, List<String> keywords) {
        this.window = window;
        this.keywords = keywords.stream()
                .map(keyword -> keyword.toLowerCase(Locale.ROOT))
                .toList();
    }

    /**
     * @param start Start des Treffers (inklusive)
     * @param end   Ende des Treffers (exklusive)
     * @return true, wenn [start - window, end + window) eines der Schlüsselwörter enthält
     */
    public boolean isNearExclusion(String text, int start, int end) {
        if (text == null || text.isEmpty() || keywords.isEmpty()) {
            return false;
        }
        int from = Math.max(0, Math.min(start - window, text.length()));
        int to = Math.max(from, Math.min(end + window, text.length()));
        String context = text.substring(from, to).toLowerCase(Locale.ROOT);

        for (String keyword : keywords) {
            if (context.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    public int getWindow() { return window; }
    public List<String> getKeywords() { return keywords; }
}
