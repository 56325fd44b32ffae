package UtilityBot.model;

/**
 * Welcher Extraktionsweg zuerst versucht wird.
 */
public enum ExtractionMode {

    /** Nur die regelbasierte Extraktion, ohne Sprachmodell. */
    HEURISTIC,

    /** Erst das Sprachmodell, bei Fehlern die regelbasierte Extraktion. */
    LLM
}
