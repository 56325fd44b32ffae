package UtilityBot.model;

/**
 * Herkunft eines Ergebnisses.
 */
public enum ExtractionSource {
    HEURISTIC,
    LLM,
    HEURISTIC_FALLBACK;

    public String displayName() {
        return switch (this) {
            case HEURISTIC -> "Regeln";
            case LLM -> "LLM";
            case HEURISTIC_FALLBACK -> "Regeln (LLM-Fallback)";
        };
    }
}
