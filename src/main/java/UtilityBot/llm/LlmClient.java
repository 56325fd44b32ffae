package UtilityBot.llm;

import okhttp3.*;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;


/*
Client für LM Studio (OpenAI-kompatible API auf dem lokalen Rechner).

BEI VERBINDUNGSPROBLEMEN PRÜFEN:
- Server in LM Studio gestartet? Port muss zu llm.base-url passen.
- Modell geladen? GET /v1/models zeigt, was der Server kennt (llm.model muss dabei sein).

Client for LM Studio (OpenAI-compatible API on the local machine).
Transport errors, non-2xx answers and unexpected bodies surface as LlmClientException.
*/
@Component
public class LlmClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(LlmClient.class);

    private static final MediaType JSON_UTF8 = MediaType.get("application/json; charset=utf-8");
    private static final String CHAT_PATH = "/v1/chat/completions";
    private static final String MODELS_PATH = "/v1/models";

    static final String SYSTEM_PROMPT = "You extract fields from OCR text of Austrian electricity invoices. "
            + "Output one valid JSON object only, no explanations. "
            + "Use null for every field that is not clearly present in the text. Never invent values.";

    private final String baseUrl;
    private final String modelName;
    private final OkHttpClient httpClient;

    public LlmClient(@Value("${llm.base-url:http://127.0.0.1:1234}") String baseUrl,
                     @Value("${llm.model:meta-llama-3.1-8b-instruct}") String modelName) {
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.modelName = modelName;

        // lokale Modelle brauchen für 512 Tokens gern über eine Minute
        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(10, TimeUnit.SECONDS)
                .writeTimeout(30, TimeUnit.SECONDS)
                .readTimeout(120, TimeUnit.SECONDS)
                .callTimeout(150, TimeUnit.SECONDS)
                .build();

        LOGGER.info("LlmClient für {} (Modell {})", this.baseUrl, this.modelName);
    }

    /**
     * Schickt einen Prompt als Chat-Completion und liefert den Nachrichtentext ohne Markdown-Codeblock.
     *
     * @throws LlmClientException bei Verbindungsfehler, HTTP-Fehlerstatus oder unerwartetem Antwortformat
     */
    public String sendPrompt(String prompt) {
        JSONObject payload = new JSONObject()
                .put("model", modelName)
                .put("temperature", 0.0)
                .put("max_tokens", 512)
                .put("stream", false)
                .put("messages", new JSONArray()
                        .put(chatMessage("system", SYSTEM_PROMPT))
                        .put(chatMessage("user", prompt)));

        Request request = new Request.Builder()
                .url(baseUrl + CHAT_PATH)
                .post(RequestBody.create(payload.toString(), JSON_UTF8))
                .build();

        LOGGER.debug("Prompt an {} ({} Zeichen)", request.url(), prompt.length());
        long started = System.nanoTime();
        String body = execute(request);
        LOGGER.debug("LLM-Antwort nach {} ms", TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));

        return cleanJsonResponse(extractMessageContent(body));
    }

    /**
     * Liefert die IDs der geladenen Modelle ({@code GET /v1/models}).
     */
    public List<String> listModels() {
        return parseModelIds(execute(modelsRequest()));
    }

    public boolean isServerReachable() {
        try (Response response = httpClient.newCall(modelsRequest()).execute()) {
            return response.isSuccessful();
        } catch (IOException | IllegalArgumentException e) {
            LOGGER.debug("LLM Server nicht erreichbar: {}", e.getMessage());
            return false;
        }
    }

    private Request modelsRequest() {
        return new Request.Builder().url(baseUrl + MODELS_PATH).get().build();
    }

    private String execute(Request request) {
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String body = responseBody != null ? responseBody.string() : "";
            if (!response.isSuccessful()) {
                throw new LlmClientException("LLM Error " + response.code() + " auf " + request.url() + ": " + body,
                        response.code());
            }
            return body;
        } catch (IOException e) {
            throw new LlmClientException("Verbindungsfehler zum LLM Server auf " + request.url(), e);
        }
    }

    private static JSONObject chatMessage(String role, String content) {
        return new JSONObject().put("role", role).put("content", content);
    }

    static String extractMessageContent(String responseBody) {
        try {
            JSONArray choices = new JSONObject(responseBody).getJSONArray("choices");
            return choices.getJSONObject(0).getJSONObject("message").getString("content");
        } catch (JSONException e) {
            throw new LlmClientException("Unerwartetes Antwortformat des LLM: " + e.getMessage(), e);
        }
    }

    static List<String> parseModelIds(String responseBody) {
        List<String> ids = new ArrayList<>();
        try {
            JSONArray models = new JSONObject(responseBody).optJSONArray("data");
            for (int i = 0; models != null && i < models.length(); i++) {
                JSONObject model = models.optJSONObject(i);
                String id = model != null ? model.optString("id", "") : "";
                if (!id.isEmpty()) {
                    ids.add(id);
                }
            }
        } catch (JSONException e) {
            throw new LlmClientException("Unerwartetes Format der Modellliste: " + e.getMessage(), e);
        }
        return ids;
    }

    /**
     * Entfernt einen umschließenden Markdown-Codeblock (```json ... ```).
     */
    static String cleanJsonResponse(String response) {
        String cleaned = response.trim();
        if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(cleaned.startsWith("```json") ? 7 : 3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        return cleaned.trim();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    public String getBaseUrl() { return baseUrl; }
    public String getModelName() { return modelName; }
}
