package UtilityBot.llm;

/**
 * Fehler bei der Kommunikation mit dem LLM-Server (Verbindung, HTTP-Status, Antwortformat).
 */
public class LlmClientException extends RuntimeException {

    private final int statusCode;

    public LlmClientException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public LlmClientException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    /**
     * @return HTTP-Status oder -1, wenn keine Antwort kam
     */
    public int getStatusCode() {
        return statusCode;
    }
}
