package UtilityBot.model;

/**
 * Extrahierte Felder einer Stromrechnung.
 *
 * Extracted fields of a utility invoice.
 * Jedes Feld ist optional: {@code null} bedeutet "kein sicherer Treffer", nicht "leer" oder "0".
 * Every field is optional: {@code null} means "no confident match", never "empty" or "zero".
 *
 * @param address               Adresse, z.B. "Max Mustermann, Hauptstraße 12, 1010 Wien"
 * @param meterPointId          Zählpunktnummer (33 Zeichen, meist mit "AT" beginnend)
 * @param currentConsumptionKwh aktueller Verbrauch als Dezimalstring mit einer Nachkommastelle, z.B. "2573.1"
 */
public record ExtractedInvoiceData(String address, String meterPointId, String currentConsumptionKwh) {

    private static final ExtractedInvoiceData EMPTY = new ExtractedInvoiceData(null, null, null);

    public ExtractedInvoiceData {
        address = blankToNull(address);
        meterPointId = blankToNull(meterPointId);
        currentConsumptionKwh = blankToNull(currentConsumptionKwh);
    }

    public static ExtractedInvoiceData empty() {
        return EMPTY;
    }

    // =====================
    // Utility Methods
    // =====================

    public boolean hasAddress() { return address != null; }
    public boolean hasMeterPointId() { return meterPointId != null; }
    public boolean hasCurrentConsumption() { return currentConsumptionKwh != null; }

    /**
     * Prüft, ob kein einziges Feld gefunden wurde.
     *
     * Checks whether no field was found at all.
     */
    public boolean isEmpty() {
        return presentFieldCount() == 0;
    }

    /**
     * Prüft, ob alle drei Felder vorhanden sind.
     *
     * Checks if all three fields are populated.
     */
    public boolean isComplete() {
        return presentFieldCount() == 3;
    }

    public int presentFieldCount() {
        int count = 0;
        if (hasAddress()) count++;
        if (hasMeterPointId()) count++;
        if (hasCurrentConsumption()) count++;
        return count;
    }

    private static String blankToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
