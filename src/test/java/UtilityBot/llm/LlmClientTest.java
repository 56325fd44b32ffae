package UtilityBot.llm;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LlmClientTest {

    @Test
    @DisplayName("Inhalt der ersten Antwort-Nachricht wird gelesen")
    void extractsMessageContent() {
        String body = """
            {"choices": [{"index": 0, "message": {"role": "assistant", "content": "{\\"address\\": null}"}}]}
            """;

        assertEquals("{\"address\": null}", LlmClient.extractMessageContent(body));
    }

    @Test
    @DisplayName("Unerwartetes Antwortformat wird als LlmClientException gemeldet")
    void unexpectedFormatThrows() {
        LlmClientException e = assertThrows(LlmClientException.class,
                () -> LlmClient.extractMessageContent("{\"error\": \"model not loaded\"}"));
        assertEquals(-1, e.getStatusCode());
    }

    @Test
    @DisplayName("Markdown-Codeblöcke werden entfernt")
    void cleansCodeFences() {
        assertEquals("{\"a\": 1}", LlmClient.cleanJsonResponse("```json\n{\"a\": 1}\n```"));
        assertEquals("{\"a\": 1}", LlmClient.cleanJsonResponse("```{\"a\": 1}```"));
        assertEquals("{\"a\": 1}", LlmClient.cleanJsonResponse("  {\"a\": 1}  "));
    }

    @Test
    @DisplayName("Modell-IDs aus GET /v1/models")
    void parsesModelIds() {
        String body = """
            {"object": "list", "data": [
              {"id": "meta-llama-3.1-8b-instruct", "object": "model"},
              {"object": "model"},
              {"id": "text-embedding-nomic", "object": "model"}
            ]}
            """;

        assertEquals(List.of("meta-llama-3.1-8b-instruct", "text-embedding-nomic"), LlmClient.parseModelIds(body));
        assertTrue(LlmClient.parseModelIds("{}").isEmpty());
    }

    @Test
    @DisplayName("Abschließender Schrägstrich der Basis-URL wird entfernt")
    void normalizesBaseUrl() {
        LlmClient client = new LlmClient("http://localhost:1234/", "test-model");

        assertEquals("http://localhost:1234", client.getBaseUrl());
        assertEquals("test-model", client.getModelName());
    }

    @Test
    @DisplayName("Nicht erreichbarer Server wird erkannt, ohne zu werfen")
    void unreachableServer() {
        // Port 9 (discard) ist lokal praktisch nie offen
        LlmClient client = new LlmClient("http://127.0.0.1:9", "test-model");

        assertFalse(client.isServerReachable());
        assertThrows(LlmClientException.class, () -> client.sendPrompt("Hallo"));
    }
}
