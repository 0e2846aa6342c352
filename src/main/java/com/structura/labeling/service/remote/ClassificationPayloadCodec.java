package com.structura.labeling.service.remote;

import com.structura.labeling.domain.Paragraph;
import com.structura.labeling.domain.ParagraphRoles;
import com.structura.labeling.domain.Suggestion;
import com.structura.labeling.exception.MalformedRemotePayloadException;
import com.structura.labeling.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Encodes classification requests as OpenAI-compatible chat-completion bodies and decodes the
 * model answer into {@link ClassificationResult}.
 *
 * <p>Decoding is lenient: missing arrays are treated as empty, unknown paragraph types fall back
 * to {@code body}, confidences may be numbers or percent strings and are clamped to [0,1]. Only a
 * body that is not JSON at all (or carries no message content) is rejected with
 * {@link MalformedRemotePayloadException}.
 *
 * <p>Thread-safe: instances are immutable.
 */
public class ClassificationPayloadCodec {

    private static final Logger LOG = LogManager.getLogger(ClassificationPayloadCodec.class);

    static final int PREVIEW_LENGTH = 200;
    private static final int ERROR_PREVIEW_LENGTH = 300;

    static final String STRUCTURE_SYSTEM_PROMPT = String.join("\n",
            "You are an expert in the structure of academic and official documents.",
            "Label every paragraph of the given Word document with its structural type.",
            "Answer with a single JSON object and no other text.",
            "The object must contain: doc_language, total_paragraphs, paragraphs (array).",
            "Each paragraph entry must contain: index, paragraph_type, confidence, reasoning.",
            "paragraph_type must be one of:",
            "  title_1, title_2, title_3, body, list_item, table_caption,",
            "  figure_caption, abstract, keyword, reference, footer, unknown",
            "confidence is a number between 0.0 and 1.0.");

    static final String REVIEW_SYSTEM_PROMPT = String.join("\n",
            "You are an expert in the structure of academic and official documents.",
            "Rule engine labels may be given as context (rule_label).",
            "Review the listed paragraphs and correct their structural type where needed.",
            "Answer with a single JSON object and no other text.",
            "The object must contain: paragraphs (array) and suggestions (array).",
            "Each paragraph entry must contain: index, paragraph_type, confidence, reasoning.",
            "paragraph_type must be one of:",
            "  title_1, title_2, title_3, body, list_item, table_caption,",
            "  figure_caption, abstract, keyword, reference, footer, unknown",
            "Each suggestion must contain: category (hierarchy|ambiguity|structure|style|terminology),",
            "  severity (low|medium|high), confidence, evidence, recommended_action, rationale,",
            "  apply_mode (manual|auto), paragraph_index.",
            "confidence is a number between 0.0 and 1.0.");

    private static final Map<String, String> TYPE_TO_ROLE = Map.ofEntries(
            Map.entry("title_1", ParagraphRoles.H1),
            Map.entry("title_2", ParagraphRoles.H2),
            Map.entry("title_3", ParagraphRoles.H3),
            Map.entry("body", ParagraphRoles.BODY),
            Map.entry("list_item", ParagraphRoles.BODY),
            Map.entry("table_caption", ParagraphRoles.CAPTION),
            Map.entry("figure_caption", ParagraphRoles.CAPTION),
            Map.entry("abstract", ParagraphRoles.BODY),
            Map.entry("keyword", ParagraphRoles.BODY),
            Map.entry("reference", ParagraphRoles.BODY),
            Map.entry("footer", ParagraphRoles.BODY),
            Map.entry("unknown", ParagraphRoles.BODY),
            Map.entry(ParagraphRoles.H1, ParagraphRoles.H1),
            Map.entry(ParagraphRoles.H2, ParagraphRoles.H2),
            Map.entry(ParagraphRoles.H3, ParagraphRoles.H3),
            Map.entry(ParagraphRoles.CAPTION, ParagraphRoles.CAPTION)
    );

    private static final Set<String> CATEGORIES = Set.of("hierarchy", "ambiguity", "structure", "style", "terminology");
    private static final Set<String> SEVERITIES = Set.of("low", "medium", "high");
    private static final Set<String> APPLY_MODES = Set.of("manual", "auto");

    private final String model;
    private final double temperature;

    public ClassificationPayloadCodec(String model, double temperature) {
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.temperature = temperature;
    }

    /**
     * Builds the chat-completion request body.
     */
    public String encode(ClassificationRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        JSONObject body = new JSONObject();
        body.put("model", model);
        body.put("temperature", temperature);
        body.put("response_format", new JSONObject().put("type", "json_object"));

        JSONArray messages = new JSONArray();
        messages.put(message("system", request.operation() == OperationKind.REVIEW
                ? REVIEW_SYSTEM_PROMPT
                : STRUCTURE_SYSTEM_PROMPT));
        messages.put(message("user", buildUserPrompt(request)));
        body.put("messages", messages);
        return body.toString();
    }

    String buildUserPrompt(ClassificationRequest request) {
        JSONArray items = new JSONArray();
        for (Paragraph p : request.paragraphs()) {
            JSONObject item = new JSONObject();
            item.put("index", p.index());
            item.put("text_preview", LogSanitizer.truncate(p.text(), PREVIEW_LENGTH));
            String context = request.contextLabels().get(p.index());
            if (context != null) {
                item.put("rule_label", context);
            }
            items.put(item);
        }
        StringBuilder prompt = new StringBuilder()
                .append("Analyze the following ").append(request.paragraphCount())
                .append(" document paragraphs and label each one.\n\n")
                .append("Paragraphs (JSON):\n").append(items.toString(2)).append("\n\n");
        if (request.operation() == OperationKind.REVIEW && !request.contextLabels().isEmpty()) {
            JSONObject context = new JSONObject();
            request.contextLabels().forEach((index, label) -> context.put(String.valueOf(index), label));
            prompt.append("Rule labels of the whole document (index to label):\n")
                    .append(context.toString()).append("\n\n");
        }
        prompt.append("Answer with the JSON object described in the system prompt only.");
        return prompt.toString();
    }

    /**
     * Decodes a chat-completion response body.
     *
     * @param body    raw HTTP response body
     * @param request request the body answers
     * @return decoded labels and suggestions
     * @throws MalformedRemotePayloadException if the body or its message content is not JSON
     */
    public ClassificationResult decode(String body, ClassificationRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        JSONObject content = parseContent(body);

        List<RemoteLabel> labels = new ArrayList<>();
        JSONArray paragraphs = content.optJSONArray("paragraphs");
        if (paragraphs != null) {
            for (int i = 0; i < paragraphs.length(); i++) {
                JSONObject tag = paragraphs.optJSONObject(i);
                if (tag == null || !tag.has("index")) {
                    continue;
                }
                int index = tag.optInt("index", -1);
                if (index < 0) {
                    continue;
                }
                String type = tag.has("paragraph_type") ? tag.optString("paragraph_type") : tag.optString("label");
                labels.add(new RemoteLabel(index, toRole(type),
                        parseConfidence(tag.opt("confidence")), tag.optString("reasoning", "")));
            }
        }

        List<Suggestion> suggestions = new ArrayList<>();
        if (request.operation() == OperationKind.REVIEW) {
            JSONArray raw = content.optJSONArray("suggestions");
            if (raw != null) {
                for (int i = 0; i < raw.length(); i++) {
                    JSONObject s = raw.optJSONObject(i);
                    if (s != null) {
                        suggestions.add(toSuggestion(s));
                    }
                }
            }
        }
        LOG.debug("Decoded remote payload: {} labels, {} suggestions", labels.size(), suggestions.size());
        return new ClassificationResult(request.operation(), labels, suggestions);
    }

    private JSONObject parseContent(String body) {
        if (body == null || body.isBlank()) {
            throw new MalformedRemotePayloadException("Remote response body is empty", "");
        }
        String preview = LogSanitizer.singleLine(body, ERROR_PREVIEW_LENGTH);
        JSONObject envelope;
        try {
            envelope = new JSONObject(body);
        } catch (JSONException e) {
            throw new MalformedRemotePayloadException("Remote response is not JSON", preview, e);
        }
        if (!envelope.has("choices")) {
            // Some compatible endpoints return the content object directly.
            return envelope;
        }
        JSONArray choices = envelope.optJSONArray("choices");
        JSONObject firstChoice = choices == null ? null : choices.optJSONObject(0);
        JSONObject message = firstChoice == null ? null : firstChoice.optJSONObject("message");
        String content = message == null ? null : message.optString("content", null);
        if (content == null || content.isBlank()) {
            throw new MalformedRemotePayloadException("Remote response has no message content", preview);
        }
        try {
            return new JSONObject(content);
        } catch (JSONException e) {
            throw new MalformedRemotePayloadException("Remote message content is not a JSON object",
                    LogSanitizer.singleLine(content, ERROR_PREVIEW_LENGTH), e);
        }
    }

    static String toRole(String paragraphType) {
        if (paragraphType == null) {
            return ParagraphRoles.BODY;
        }
        return TYPE_TO_ROLE.getOrDefault(paragraphType.trim().toLowerCase(Locale.ROOT), ParagraphRoles.BODY);
    }

    /**
     * Accepts 0.85, "0.85", "85%" or 85 (read as a percentage); anything unreadable is 0.0.
     */
    static double parseConfidence(Object raw) {
        double value;
        if (raw instanceof Number number) {
            value = number.doubleValue();
        } else if (raw instanceof String text) {
            String trimmed = text.trim();
            boolean percent = trimmed.endsWith("%");
            if (percent) {
                trimmed = trimmed.substring(0, trimmed.length() - 1).trim();
            }
            try {
                value = Double.parseDouble(trimmed);
            } catch (NumberFormatException e) {
                return 0.0;
            }
            if (percent) {
                value = value / 100.0;
            }
        } else {
            return 0.0;
        }
        if (Double.isNaN(value)) {
            return 0.0;
        }
        if (value > 1.0 && value <= 100.0) {
            value = value / 100.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static Suggestion toSuggestion(JSONObject s) {
        Integer paragraphIndex = null;
        if (s.has("paragraph_index") && !s.isNull("paragraph_index")) {
            int idx = s.optInt("paragraph_index", -1);
            paragraphIndex = idx >= 0 ? idx : null;
        }
        return new Suggestion(
                canonical(s.optString("category"), CATEGORIES, "ambiguity"),
                canonical(s.optString("severity"), SEVERITIES, "low"),
                parseConfidence(s.opt("confidence")),
                s.optString("evidence", ""),
                s.optString("recommended_action", ""),
                s.optString("rationale", ""),
                canonical(s.optString("apply_mode"), APPLY_MODES, "manual"),
                paragraphIndex);
    }

    private static String canonical(String value, Set<String> allowed, String fallback) {
        if (value == null) {
            return fallback;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return allowed.contains(normalized) ? normalized : fallback;
    }

    private static JSONObject message(String role, String content) {
        return new JSONObject().put("role", role).put("content", content);
    }
}
