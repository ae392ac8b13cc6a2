package com.mockinterview.platform.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.mockinterview.platform.exception.InterviewPlatformException;
import com.mockinterview.platform.model.*;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns free-form model output into typed evaluation sections.
 * <p>
 * Each section has one fallback policy per field, applied when the output is missing,
 * malformed or out of range. Only blank output is treated as irrecoverable.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StructuredOutputParser {

    static final double DEFAULT_SCORE = 50.0;

    private final ObjectMapper objectMapper;

    /**
     * Returns the outermost JSON object embedded in the output, ignoring markdown fences and
     * surrounding prose. A missing node means no object could be read.
     */
    public JsonNode extractObject(String output, String step) {
        if (output == null || output.isBlank()) {
            throw InterviewPlatformException.aiProvider("provider response",
                    "Model returned no output for " + step, null);
        }
        String text = output.trim();
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) {
            log.warn("No JSON object in {} output, using fallback", step);
            return MissingNode.getInstance();
        }
        try {
            JsonNode node = objectMapper.readTree(text.substring(start, end + 1));
            return node != null && node.isObject() ? node : MissingNode.getInstance();
        } catch (JsonProcessingException e) {
            log.warn("Could not parse {} output as JSON, using fallback: {}", step, e.getOriginalMessage());
            return MissingNode.getInstance();
        }
    }

    // ─── Competencies ───────────────────────────────────────────────────

    public Map<String, CompetencyScore> parseCompetencies(String output, List<String> competencies) {
        JsonNode root = extractObject(output, "competency analysis");
        Map<String, CompetencyScore> scores = new LinkedHashMap<>();
        for (String competency : competencies) {
            JsonNode entry = field(root, competency);
            if (!entry.isObject()) {
                log.warn("Competency '{}' missing from model output, defaulting to {}", competency, DEFAULT_SCORE);
                scores.put(competency, CompetencyScore.fallback());
                continue;
            }
            Double score = number(entry.path("score"));
            CompetencyScore parsed = CompetencyScore.builder()
                    .score(score == null ? DEFAULT_SCORE : clamp(score))
                    .confidenceLevel(score == null
                            ? ConfidenceLevel.LOW
                            : ConfidenceLevel.parse(entry.path("confidence_level").asText(null)))
                    .evidence(strings(entry.path("evidence")))
                    .build();
            scores.put(competency, parsed);
        }
        return scores;
    }

    // ─── Feedback ───────────────────────────────────────────────────────

    public Feedback parseFeedback(String output) {
        JsonNode root = extractObject(output, "feedback generation");
        if (root.isMissingNode()) {
            return Feedback.defaults();
        }
        Feedback feedback = new Feedback(
                feedbackItems(root.path("went_well")),
                feedbackItems(root.path("went_okay")),
                feedbackItems(root.path("needs_improvement")));
        if (feedback.isEmpty()) {
            log.warn("Feedback output held no usable items, using default feedback");
            return Feedback.defaults();
        }
        return feedback;
    }

    private List<FeedbackItem> feedbackItems(JsonNode array) {
        List<FeedbackItem> items = new ArrayList<>();
        if (!array.isArray()) {
            return items;
        }
        for (JsonNode node : array) {
            String description = node.isTextual() ? node.asText() : node.path("description").asText("");
            if (description.isBlank()) {
                continue;
            }
            items.add(FeedbackItem.builder()
                    .description(description.trim())
                    .evidence(strings(node.path("evidence")))
                    .build());
        }
        return items;
    }

    // ─── Communication modes ────────────────────────────────────────────

    public ModeAnalysis parseModeAnalysis(String output, Set<CommunicationMode> enabledModes,
                                          Map<MediaKind, Integer> mediaCounts) {
        JsonNode root = extractObject(output, "communication mode analysis");
        ModeAnalysis heuristics = heuristicModeAnalysis(enabledModes, mediaCounts);
        return ModeAnalysis.builder()
                .audioQuality(enabledModes.contains(CommunicationMode.AUDIO)
                        ? text(root, "audio_quality", heuristics.getAudioQuality()) : null)
                .videoPresence(enabledModes.contains(CommunicationMode.VIDEO)
                        ? text(root, "video_presence", heuristics.getVideoPresence()) : null)
                .whiteboardUsage(enabledModes.contains(CommunicationMode.WHITEBOARD)
                        ? text(root, "whiteboard_usage", heuristics.getWhiteboardUsage()) : null)
                .screenShareUsage(enabledModes.contains(CommunicationMode.SCREEN_SHARE)
                        ? text(root, "screen_share_usage", heuristics.getScreenShareUsage()) : null)
                .overallCommunication(text(root, "overall_communication", heuristics.getOverallCommunication()))
                .build();
    }

    /** Assessment derived purely from how much media each enabled mode produced. */
    public ModeAnalysis heuristicModeAnalysis(Set<CommunicationMode> enabledModes, Map<MediaKind, Integer> mediaCounts) {
        ModeAnalysis analysis = new ModeAnalysis();
        int audio = mediaCounts.getOrDefault(MediaKind.AUDIO, 0);
        int video = mediaCounts.getOrDefault(MediaKind.VIDEO, 0);
        int whiteboard = mediaCounts.getOrDefault(MediaKind.WHITEBOARD, 0);
        int screen = mediaCounts.getOrDefault(MediaKind.SCREEN, 0);

        if (enabledModes.contains(CommunicationMode.AUDIO)) {
            analysis.setAudioQuality(audio > 0
                    ? "Good - " + audio + " audio recordings captured"
                    : "No audio recordings found");
        }
        if (enabledModes.contains(CommunicationMode.VIDEO)) {
            analysis.setVideoPresence(video > 0
                    ? "Present - " + video + " video recordings"
                    : "Video enabled but no recordings found");
        }
        if (enabledModes.contains(CommunicationMode.WHITEBOARD)) {
            if (whiteboard > 5) {
                analysis.setWhiteboardUsage("Excellent - " + whiteboard + " snapshots showing active diagram work");
            } else if (whiteboard > 0) {
                analysis.setWhiteboardUsage("Good - " + whiteboard + " snapshots captured");
            } else {
                analysis.setWhiteboardUsage("Whiteboard enabled but no snapshots saved");
            }
        }
        if (enabledModes.contains(CommunicationMode.SCREEN_SHARE)) {
            analysis.setScreenShareUsage(screen > 0
                    ? "Used - " + screen + " screen captures"
                    : "Screen share enabled but not used");
        }

        int total = audio + video + whiteboard + screen;
        if (total > 10) {
            analysis.setOverallCommunication("Excellent use of multiple communication modes");
        } else if (total > 5) {
            analysis.setOverallCommunication("Good use of communication modes");
        } else if (total > 0) {
            analysis.setOverallCommunication("Basic use of communication modes");
        } else {
            analysis.setOverallCommunication("Limited use of communication modes");
        }
        return analysis;
    }

    // ─── Improvement plan ───────────────────────────────────────────────

    public ImprovementPlan parseImprovementPlan(String output, List<String> lowestCompetencies) {
        JsonNode root = extractObject(output, "improvement plan");
        if (root.isMissingNode()) {
            return defaultPlan(lowestCompetencies);
        }
        List<String> priorityAreas = strings(root.path("priority_areas"));
        List<ActionItem> steps = new ArrayList<>();
        for (JsonNode node : root.path("concrete_steps")) {
            String description = node.isTextual() ? node.asText() : node.path("description").asText("");
            if (description.isBlank()) {
                continue;
            }
            steps.add(ActionItem.builder()
                    .stepNumber(steps.size() + 1)
                    .description(description.trim())
                    .resources(strings(node.path("resources")))
                    .build());
        }
        return ImprovementPlan.builder()
                .priorityAreas(priorityAreas.isEmpty() ? new ArrayList<>(lowestCompetencies) : priorityAreas)
                .concreteSteps(steps)
                .resources(strings(root.path("resources")))
                .build();
    }

    ImprovementPlan defaultPlan(List<String> lowestCompetencies) {
        List<ActionItem> steps = new ArrayList<>();
        steps.add(ActionItem.builder()
                .stepNumber(1)
                .description("Review system design fundamentals")
                .resources(new ArrayList<>(List.of("System Design Primer", "Designing Data-Intensive Applications")))
                .build());
        steps.add(ActionItem.builder()
                .stepNumber(2)
                .description("Practice with mock interviews")
                .resources(new ArrayList<>(List.of("Pramp", "interviewing.io")))
                .build());
        return ImprovementPlan.builder()
                .priorityAreas(new ArrayList<>(lowestCompetencies))
                .concreteSteps(steps)
                .resources(new ArrayList<>(List.of("System Design Interview book by Alex Xu")))
                .build();
    }

    // ─── Field helpers ──────────────────────────────────────────────────

    private static JsonNode field(JsonNode root, String name) {
        JsonNode exact = root.path(name);
        if (!exact.isMissingNode()) {
            return exact;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            if (entry.getKey().trim().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        return MissingNode.getInstance();
    }

    private static Double number(JsonNode node) {
        if (node.isNumber()) {
            return node.asDouble();
        }
        if (node.isTextual()) {
            try {
                return Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static double clamp(double score) {
        if (Double.isNaN(score)) {
            return DEFAULT_SCORE;
        }
        return Math.max(0.0, Math.min(100.0, score));
    }

    private static List<String> strings(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node.isTextual() && !node.asText().isBlank()) {
            values.add(node.asText().trim());
        } else if (node.isArray()) {
            for (JsonNode element : node) {
                if (element.isValueNode() && !element.isNull() && !element.asText().isBlank()) {
                    values.add(element.asText().trim());
                }
            }
        }
        return values;
    }

    private static String text(JsonNode root, String field, String fallback) {
        String value = root.path(field).asText("");
        return value.isBlank() ? fallback : value.trim();
    }

    /**
     * The three feedback categories in report order.
     */
    @Value
    public static class Feedback {
        List<FeedbackItem> wentWell;
        List<FeedbackItem> wentOkay;
        List<FeedbackItem> needsImprovement;

        public boolean isEmpty() {
            return wentWell.isEmpty() && wentOkay.isEmpty() && needsImprovement.isEmpty();
        }

        static Feedback defaults() {
            List<FeedbackItem> wentWell = new ArrayList<>();
            wentWell.add(FeedbackItem.of("Participated in the interview"));
            List<FeedbackItem> needsImprovement = new ArrayList<>();
            needsImprovement.add(FeedbackItem.of("Unable to generate detailed feedback"));
            return new Feedback(wentWell, new ArrayList<>(), needsImprovement);
        }
    }
}
