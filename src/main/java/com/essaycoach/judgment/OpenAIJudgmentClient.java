package com.essaycoach.judgment;

import com.essaycoach.errors.JudgmentUnavailableException;
import com.essaycoach.models.Dimension;
import com.essaycoach.models.PromptRecord;
import com.essaycoach.utils.OpenAIClient;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Judgment client that asks an OpenAI-compatible chat model for a JSON verdict
 */
public class OpenAIJudgmentClient implements JudgmentClient {
    private static final Logger logger = LoggerFactory.getLogger(OpenAIJudgmentClient.class);

    private static final String SYSTEM_PROMPT =
            "You are an experienced English teacher marking essays written by language learners. "
            + "Follow the rubric exactly and only award points supported by the essay. Reply with JSON only.";

    private final OpenAIClient client;
    private final String model;
    private final int maxTokens;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public OpenAIJudgmentClient(OpenAIClient client, String model) {
        this(client, model, 800);
    }

    public OpenAIJudgmentClient(OpenAIClient client, String model, int maxTokens) {
        this.client = client;
        this.model = model;
        this.maxTokens = maxTokens;
    }

    @Override
    public Judgment judge(Dimension dimension, String essayText, PromptRecord prompt, String rubricGuidance)
            throws JudgmentUnavailableException {
        String reply;
        try {
            reply = client.chatCompletion(model, SYSTEM_PROMPT,
                    buildPrompt(dimension, essayText, prompt, rubricGuidance), maxTokens);
        } catch (IOException e) {
            logger.warn("⚠️ Judgment request for {} failed: {}", dimension.tag(), e.getMessage());
            throw new JudgmentUnavailableException(dimension, "Judgment request failed: " + e.getMessage(), e);
        }
        Judgment judgment = parseReply(dimension, reply);
        logger.debug("Judged {}: {}/{}", dimension.tag(), judgment.score(), dimension.getCeiling());
        return judgment;
    }

    String buildPrompt(Dimension dimension, String essayText, PromptRecord prompt, String rubricGuidance) {
        StringBuilder text = new StringBuilder();
        text.append("ESSAY TITLE: ").append(prompt.getTitle()).append("\n");
        text.append("WRITING TASK: ").append(prompt.getPrompt()).append("\n");
        text.append("GRADE TIER: ").append(prompt.getGrade().getValue())
            .append(" (").append(prompt.getMinWords()).append("-").append(prompt.getMaxWords()).append(" words)\n");
        text.append("LEVEL: ").append(prompt.getLevel().getValue()).append("\n");
        if (!prompt.getRequirements().isEmpty()) {
            text.append("REQUIREMENTS:\n");
            for (String requirement : prompt.getRequirements()) {
                text.append("- ").append(requirement).append("\n");
            }
        }
        if (!prompt.getKeywords().isEmpty()) {
            text.append("KEYWORDS: ").append(String.join(", ", prompt.getKeywords())).append("\n");
        }
        text.append("\nDIMENSION: ").append(dimension.tag()).append("\n");
        text.append("MAXIMUM POINTS: ").append(dimension.getCeiling()).append("\n");
        text.append("RUBRIC: ").append(rubricGuidance).append("\n\n");
        text.append("STUDENT ESSAY:\n").append(essayText).append("\n\n");
        text.append("Return your response in this JSON format (no extra text):\n");
        text.append("{\n");
        text.append("  \"score\": <points awarded, 0 to ").append(dimension.getCeiling()).append(">,\n");
        text.append("  \"feedback\": \"<at most 3 sentences addressed to the student>\",\n");
        text.append("  \"issues\": [\"<specific problem found in the essay>\"],\n");
        text.append("  \"suggestions\": [\"<concrete next step>\"]\n");
        text.append("}\n");
        return text.toString();
    }

    /**
     * Extract the JSON object between the first '{' and the last '}' of the reply.
     */
    Judgment parseReply(Dimension dimension, String reply) throws JudgmentUnavailableException {
        if (reply == null) {
            throw new JudgmentUnavailableException(dimension, "Empty judgment reply");
        }
        int jsonStart = reply.indexOf('{');
        int jsonEnd = reply.lastIndexOf('}') + 1;
        if (jsonStart < 0 || jsonEnd <= jsonStart) {
            logger.warn("Could not find JSON in judgment reply for {}: {}", dimension.tag(), reply);
            throw new JudgmentUnavailableException(dimension, "Judgment reply contained no JSON object");
        }

        JsonNode node;
        try {
            node = objectMapper.readTree(reply.substring(jsonStart, jsonEnd));
        } catch (JsonProcessingException e) {
            throw new JudgmentUnavailableException(dimension, "Judgment reply is not valid JSON: "
                    + e.getOriginalMessage(), e);
        }

        JsonNode score = node.get("score");
        if (score == null || !score.isNumber()) {
            throw new JudgmentUnavailableException(dimension, "Judgment reply has no numeric score");
        }
        Judgment judgment = new Judgment(score.asDouble(), node.path("feedback").asText(""),
                textList(node.get("issues")), textList(node.get("suggestions")));
        if (!judgment.isWithinCeiling(dimension)) {
            throw new JudgmentUnavailableException(dimension, "Judgment score " + judgment.score()
                    + " outside 0-" + dimension.getCeiling());
        }
        return judgment;
    }

    private static List<String> textList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node == null || node.isNull()) {
            return values;
        }
        if (node.isArray()) {
            for (JsonNode item : node) {
                String value = item.asText("").trim();
                if (!value.isEmpty()) {
                    values.add(value);
                }
            }
        } else if (!node.asText("").isBlank()) {
            values.add(node.asText().trim());
        }
        return values;
    }
}
