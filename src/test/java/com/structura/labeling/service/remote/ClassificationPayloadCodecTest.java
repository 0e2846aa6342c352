package com.structura.labeling.service.remote;

import com.structura.labeling.domain.Paragraph;
import com.structura.labeling.domain.Suggestion;
import com.structura.labeling.exception.MalformedRemotePayloadException;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.structura.labeling.service.remote.RemoteTestDoubles.chatResponse;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClassificationPayloadCodecTest {

    private final ClassificationPayloadCodec codec = new ClassificationPayloadCodec("gpt-4o", 0.0);

    @Test
    void encodesChatCompletionRequest() {
        ClassificationRequest request = ClassificationRequest.structure(List.of(
                Paragraph.of(0, "Title", "h1"),
                Paragraph.of(1, "x".repeat(500), "body")));

        JSONObject body = new JSONObject(codec.encode(request));

        assertThat(body.getString("model")).isEqualTo("gpt-4o");
        assertThat(body.getDouble("temperature")).isEqualTo(0.0);
        assertThat(body.getJSONObject("response_format").getString("type")).isEqualTo("json_object");
        assertThat(body.getJSONArray("messages").getJSONObject(0).getString("role")).isEqualTo("system");
        assertThat(body.getJSONArray("messages").getJSONObject(0).getString("content"))
                .isEqualTo(ClassificationPayloadCodec.STRUCTURE_SYSTEM_PROMPT);
        String user = body.getJSONArray("messages").getJSONObject(1).getString("content");
        assertThat(user).contains("2 document paragraphs");
        assertThat(user).contains("x".repeat(200)).doesNotContain("x".repeat(201));
        assertThat(user).doesNotContain("rule_label");
    }

    @Test
    void previewKeepsSurrogatePairAtCutOff() {
        String emoji = "\uD83D\uDCC4";
        ClassificationRequest request = ClassificationRequest.structure(List.of(
                Paragraph.of(0, "x".repeat(199) + emoji + " trailing text", "body")));

        String user = new JSONObject(codec.encode(request))
                .getJSONArray("messages").getJSONObject(1).getString("content");

        assertThat(user).contains("x".repeat(199) + emoji).doesNotContain("trailing");
        assertThat(user).doesNotContain("x".repeat(199) + "\uD83D\"");
    }

    @Test
    void reviewRequestCarriesContextLabels() {
        ClassificationRequest request = ClassificationRequest.review(
                List.of(Paragraph.of(1, "A rather long second level heading text", "h2")),
                Map.of(0, "h1", 1, "h2", 2, "body"));

        JSONObject body = new JSONObject(codec.encode(request));
        String system = body.getJSONArray("messages").getJSONObject(0).getString("content");
        String user = body.getJSONArray("messages").getJSONObject(1).getString("content");

        assertThat(system).isEqualTo(ClassificationPayloadCodec.REVIEW_SYSTEM_PROMPT);
        assertThat(user).contains("\"rule_label\": \"h2\"");
        assertThat(user).contains("Rule labels of the whole document");
    }

    @Test
    void decodesAndMapsParagraphTypes() {
        String content = "{\"paragraphs\":["
                + "{\"index\":0,\"paragraph_type\":\"title_1\",\"confidence\":0.95,\"reasoning\":\"top\"},"
                + "{\"index\":1,\"paragraph_type\":\"list_item\",\"confidence\":\"85%\"},"
                + "{\"index\":2,\"paragraph_type\":\"figure_caption\",\"confidence\":70},"
                + "{\"index\":3,\"paragraph_type\":\"mystery\",\"confidence\":-0.2}"
                + "]}";
        ClassificationRequest request = ClassificationRequest.structure(RemoteTestDoubles.bodies(4));

        ClassificationResult result = codec.decode(chatResponse(content), request);

        assertThat(result.labels()).extracting(RemoteLabel::label)
                .containsExactly("h1", "body", "caption", "body");
        assertThat(result.labels()).extracting(RemoteLabel::confidence)
                .containsExactly(0.95, 0.85, 0.7, 0.0);
        assertThat(result.labels().get(0).rationale()).isEqualTo("top");
        assertThat(result.suggestions()).isEmpty();
    }

    @Test
    void canonicalizesSuggestions() {
        String content = "{\"paragraphs\":[],\"suggestions\":["
                + "{\"category\":\"HIERARCHY\",\"severity\":\"critical\",\"confidence\":0.8,"
                + "\"evidence\":\"1.1 Scope\",\"recommended_action\":\"promote to h2\","
                + "\"apply_mode\":\"sometimes\",\"paragraph_index\":4},"
                + "{\"category\":\"weird\"}"
                + "]}";
        ClassificationRequest request = ClassificationRequest.review(RemoteTestDoubles.bodies(5), Map.of());

        List<Suggestion> suggestions = codec.decode(chatResponse(content), request).suggestions();

        assertThat(suggestions).hasSize(2);
        Suggestion first = suggestions.get(0);
        assertThat(first.category()).isEqualTo("hierarchy");
        assertThat(first.severity()).isEqualTo("low");
        assertThat(first.applyMode()).isEqualTo("manual");
        assertThat(first.paragraphIndex()).isEqualTo(4);
        assertThat(first.recommendedAction()).isEqualTo("promote to h2");
        assertThat(suggestions.get(1).category()).isEqualTo("ambiguity");
        assertThat(suggestions.get(1).paragraphIndex()).isNull();
    }

    @Test
    void toleratesMissingArraysAndBareContent() {
        ClassificationRequest request = ClassificationRequest.review(RemoteTestDoubles.bodies(1), Map.of());

        assertThat(codec.decode(chatResponse("{}"), request).labels()).isEmpty();
        assertThat(codec.decode("{\"paragraphs\":[{\"index\":0,\"label\":\"h3\",\"confidence\":0.9}]}", request)
                .labels()).extracting(RemoteLabel::label).containsExactly("h3");
    }

    @Test
    void rejectsNonJsonBodies() {
        ClassificationRequest request = ClassificationRequest.structure(RemoteTestDoubles.bodies(1));

        assertThatThrownBy(() -> codec.decode("<html>bad gateway</html>", request))
                .isInstanceOf(MalformedRemotePayloadException.class)
                .hasMessageContaining("not JSON");
        assertThatThrownBy(() -> codec.decode(chatResponse("sorry, I cannot"), request))
                .isInstanceOf(MalformedRemotePayloadException.class);
        assertThatThrownBy(() -> codec.decode("{\"choices\":[]}", request))
                .isInstanceOf(MalformedRemotePayloadException.class)
                .hasMessageContaining("no message content");
        assertThatThrownBy(() -> codec.decode("", request))
                .isInstanceOf(MalformedRemotePayloadException.class);
    }

    @Test
    void parsesConfidenceVariants() {
        assertThat(ClassificationPayloadCodec.parseConfidence(0.7)).isEqualTo(0.7);
        assertThat(ClassificationPayloadCodec.parseConfidence("0.6")).isEqualTo(0.6);
        assertThat(ClassificationPayloadCodec.parseConfidence("90 %")).isEqualTo(0.9);
        assertThat(ClassificationPayloadCodec.parseConfidence(85)).isEqualTo(0.85);
        assertThat(ClassificationPayloadCodec.parseConfidence(250)).isEqualTo(1.0);
        assertThat(ClassificationPayloadCodec.parseConfidence("high")).isEqualTo(0.0);
        assertThat(ClassificationPayloadCodec.parseConfidence(null)).isEqualTo(0.0);
    }
}
