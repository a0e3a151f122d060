package dev.verity.generation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.verity.concurrent.ExternalCallException;
import dev.verity.config.Mode;
import dev.verity.config.PipelineProperties;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * {@link Generator}, {@link ContradictionJudge} and {@link QueryDecomposer} backed by a single
 * LangChain4j {@link ChatModel}.
 *
 * <p>Structured calls ask the model for a JSON object and parse it with Jackson, tolerating a
 * Markdown code fence around the object. A reply that cannot be parsed throws {@link
 * ExternalCallException}, which the calling stage replaces with its conservative default.
 */
@Component
public class ChatModelGenerator implements Generator, ContradictionJudge, QueryDecomposer {

  private static final Logger log = LoggerFactory.getLogger(ChatModelGenerator.class);

  private final ChatModel chatModel;
  private final ObjectMapper objectMapper;
  private final int maxEvidence;
  private final double regenerateTemperature;

  public ChatModelGenerator(
      ChatModel chatModel,
      ObjectMapper objectMapper,
      PipelineProperties properties,
      @Value("${verity.llm.regenerate-temperature:0.7}") double regenerateTemperature) {
    this.chatModel = chatModel;
    this.objectMapper = objectMapper;
    this.maxEvidence = properties.verification().maxEvidence();
    this.regenerateTemperature = regenerateTemperature;
  }

  @Override
  public String answer(String query, List<Evidence> evidence, Mode mode) {
    String prompt =
        PromptTemplates.ANSWER.formatted(query, EvidenceFormatter.numbered(evidence, maxEvidence));
    return chat(List.of(systemMessage(mode), UserMessage.from(prompt)));
  }

  @Override
  public String regenerate(String query, List<Evidence> evidence, Mode mode) {
    String prompt =
        PromptTemplates.REGENERATE.formatted(
            query, EvidenceFormatter.numbered(evidence, maxEvidence));
    ChatRequest request =
        ChatRequest.builder()
            .messages(systemMessage(mode), UserMessage.from(prompt))
            .temperature(regenerateTemperature)
            .build();
    return chatModel.chat(request).aiMessage().text();
  }

  @Override
  public String rewrite(String query) {
    JsonNode reply = chatJson("rewrite", PromptTemplates.REWRITE.formatted(query));
    for (JsonNode rewrite : reply.path("rewrites")) {
      String text = rewrite.asText("").strip();
      if (!text.isEmpty()) {
        return text;
      }
    }
    throw new ExternalCallException("rewrite", "reply contained no rewrites");
  }

  @Override
  public Judgment judge(String question, String answer, List<Evidence> evidence) {
    JsonNode reply =
        chatJson(
            "groundedness",
            PromptTemplates.GROUNDEDNESS.formatted(
                question, answer, EvidenceFormatter.numbered(evidence, maxEvidence)));
    JsonNode score = reply.path("score");
    if (!score.isNumber()) {
      throw new ExternalCallException("groundedness", "reply has no numeric score");
    }
    List<String> unsupported = new ArrayList<>();
    reply.path("unsupported_claims").forEach(claim -> unsupported.add(claim.asText()));
    return new Judgment(
        score.asDouble(), reply.path("admits_ignorance").asBoolean(false), unsupported);
  }

  @Override
  public ConflictAssessment assess(String answer, List<Evidence> evidence, int maxPassages) {
    int compared = Math.min(maxPassages, evidence.size());
    List<PassageConflict> conflicts = new ArrayList<>();
    if (compared >= 2) {
      JsonNode reply =
          chatJson(
              "contradiction",
              PromptTemplates.PASSAGE_CONFLICTS.formatted(
                  EvidenceFormatter.passages(evidence, compared)));
      JsonNode contradictions = reply.path("contradictions");
      if (!contradictions.isArray()) {
        throw new ExternalCallException("contradiction", "reply has no contradictions array");
      }
      for (JsonNode conflict : contradictions) {
        int a = conflict.path("passage_a").asInt(0);
        int b = conflict.path("passage_b").asInt(0);
        if (a >= 1 && b >= 1 && a <= compared && b <= compared && a != b) {
          conflicts.add(new PassageConflict(a, b, conflict.path("description").asText("")));
        } else {
          log.debug("Ignoring out-of-range passage conflict {} / {}", a, b);
        }
      }
    }

    JsonNode answerReply =
        chatJson(
            "contradiction",
            PromptTemplates.ANSWER_CONFLICTS.formatted(
                answer, EvidenceFormatter.numbered(evidence, maxEvidence)));
    JsonNode rate = answerReply.path("contradiction_rate");
    if (!rate.isNumber() || !Double.isFinite(rate.asDouble())) {
      throw new ExternalCallException("contradiction", "reply has no finite contradiction_rate");
    }
    double answerRate = rate.asDouble();
    return new ConflictAssessment(compared, conflicts, answerRate);
  }

  @Override
  public List<String> decompose(String query, int maxSubQuestions) {
    JsonNode reply =
        chatJson("decomposition", PromptTemplates.DECOMPOSE.formatted(maxSubQuestions, query));
    List<String> subQuestions = new ArrayList<>();
    for (JsonNode node : reply.path("sub_questions")) {
      String text = node.asText("").strip();
      if (!text.isEmpty() && subQuestions.size() < maxSubQuestions) {
        subQuestions.add(text);
      }
    }
    return subQuestions;
  }

  private static SystemMessage systemMessage(Mode mode) {
    return SystemMessage.from(
        mode == Mode.STRICT ? PromptTemplates.ANSWER_STRICT_SYSTEM : PromptTemplates.ANSWER_SYSTEM);
  }

  private String chat(List<ChatMessage> messages) {
    return chatModel.chat(messages).aiMessage().text();
  }

  private JsonNode chatJson(String call, String prompt) {
    String raw = chat(List.of(UserMessage.from(prompt)));
    try {
      return objectMapper.readTree(extractJsonObject(call, raw));
    } catch (JsonProcessingException e) {
      throw new ExternalCallException(
          call, "reply is not valid JSON: " + e.getOriginalMessage(), e);
    }
  }

  /** Returns the outermost {@code {...}} of a reply, dropping any code fence or preamble. */
  static String extractJsonObject(String call, String raw) {
    if (raw == null) {
      throw new ExternalCallException(call, "empty reply");
    }
    int start = raw.indexOf('{');
    int end = raw.lastIndexOf('}');
    if (start < 0 || end < start) {
      throw new ExternalCallException(call, "reply contains no JSON object");
    }
    return raw.substring(start, end + 1);
  }
}
