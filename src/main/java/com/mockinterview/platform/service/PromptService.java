package com.mockinterview.platform.service;

import com.mockinterview.platform.model.*;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds every prompt sent to the language model. Prompts that feed the evaluation
 * pipeline ask for a single JSON object so {@link StructuredOutputParser} can read them.
 */
@Service
public class PromptService {

    static final String SYSTEM_DESIGN_PROMPT = """
            You are an expert technical interviewer conducting a system design interview.
            Your role is to:
            1. Ask thoughtful, probing questions about system architecture and design
            2. Evaluate the candidate's understanding of scalability, reliability, and trade-offs
            3. Provide constructive follow-up questions based on their responses
            4. Adapt the difficulty based on the candidate's experience level
            5. Focus on real-world scenarios and practical considerations

            Guidelines:
            - Be professional and encouraging
            - Ask one question at a time
            - Cover key topics: scalability, reliability, data consistency, trade-offs, monitoring
            - Ask clarifying questions when responses are ambiguous
            - Probe deeper into design decisions and their implications

            You are evaluating their thought process, not just the final solution.""";

    static final String DEFAULT_PROBLEM = """
            Design a URL shortening service like bit.ly.

            The service should:
            - Accept long URLs and return short URLs
            - Redirect users from short URLs to original long URLs
            - Handle high traffic (millions of requests per day)
            - Track click analytics for each short URL

            Consider scalability, reliability, and performance in your design.""";

    public String openingPrompt(ResumeData resume) {
        if (resume == null) {
            return """
                    %s

                    Open the interview. Welcome the candidate and present this problem:

                    %s

                    Close by inviting them to clarify requirements and constraints before designing.
                    """.formatted(SYSTEM_DESIGN_PROMPT, DEFAULT_PROBLEM);
        }

        ExperienceLevel level = ExperienceLevel.fromYears(resume.getYearsOfExperience());
        String domain = resume.getDomainExpertise().get(0);
        String recentRole = resume.getWorkExperience() == null || resume.getWorkExperience().isEmpty()
                ? "N/A"
                : resume.getWorkExperience().get(0).getTitle();

        return """
                %s

                Open the interview for a candidate with this background:

                Experience Level: %s
                Years of Experience: %d
                Primary Domain: %s
                Domain Expertise: %s
                Recent Role: %s

                Welcome the candidate and present one system design problem that:
                1. Is set in the %s domain
                2. Matches a %s candidate, focusing on %s
                3. Fits a 45-minute interview
                4. Covers scalability, reliability, data modeling and trade-offs
                5. States concrete requirements and constraints

                Close by inviting them to clarify requirements before designing.
                """.formatted(SYSTEM_DESIGN_PROMPT, level.name().toLowerCase(), resume.getYearsOfExperience(),
                domain, String.join(", ", resume.getDomainExpertise()), recentRole,
                domain, level.name().toLowerCase(), level.focus());
    }

    public String followUpPrompt(List<ConversationMessage> history) {
        return """
                %s

                Conversation so far:
                %s

                Based on the candidate's latest response, ask ONE focused follow-up question that:
                1. Probes deeper into their design decisions
                2. Explores trade-offs and alternatives
                3. Covers important topics (scalability, reliability, consistency)
                4. Asks for clarification if the response was ambiguous

                Reply with the question only.
                """.formatted(SYSTEM_DESIGN_PROMPT, formatTranscript(history));
    }

    // ─── Evaluation ─────────────────────────────────────────────────────

    public String competencyPrompt(String transcript, List<String> competencies) {
        return """
                You are an expert technical interviewer evaluating system design interview performance.

                Evaluate the candidate across these competencies:
                %s

                For each competency provide a score from 0-100, a confidence level (high, medium, low)
                and verbatim evidence from the conversation.

                Conversation:
                %s

                Respond with a single JSON object:
                {
                    "Problem Decomposition": {
                        "score": 85,
                        "confidence_level": "high",
                        "evidence": ["Broke the system into clear components"]
                    }
                }
                Be objective and base scores on actual evidence from the conversation.
                """.formatted(String.join(", ", competencies), transcript);
    }

    public String feedbackPrompt(String transcript, Map<String, CompetencyScore> scores) {
        String summary = scores.entrySet().stream()
                .map(e -> "- %s: %.0f/100 (%s confidence)".formatted(
                        e.getKey(), e.getValue().getScore(), e.getValue().getConfidenceLevel().value()))
                .collect(Collectors.joining("\n"));
        return """
                You are an expert technical interviewer providing constructive feedback.

                Competency Scores:
                %s

                Conversation:
                %s

                Classify concrete moments of the interview into three categories:
                1. went_well: things the candidate did well (3-5 items)
                2. went_okay: acceptable but could be improved (2-4 items)
                3. needs_improvement: needs significant improvement (2-4 items)
                Each item has a short description and verbatim evidence excerpts.

                Respond with a single JSON object:
                {
                    "went_well": [{"description": "...", "evidence": ["..."]}],
                    "went_okay": [{"description": "...", "evidence": ["..."]}],
                    "needs_improvement": [{"description": "...", "evidence": ["..."]}]
                }
                """.formatted(summary, transcript);
    }

    public String modeAnalysisPrompt(String transcript, Set<CommunicationMode> enabledModes,
                                     Map<MediaKind, Integer> mediaCounts) {
        String modes = enabledModes.stream().map(CommunicationMode::value).collect(Collectors.joining(", "));
        String media = mediaCounts.isEmpty()
                ? "none"
                : mediaCounts.entrySet().stream()
                .map(e -> e.getKey().value() + ": " + e.getValue())
                .collect(Collectors.joining(", "));
        return """
                You are an expert technical interviewer assessing how a candidate communicated.

                Enabled communication modes: %s
                Media captured per kind: %s

                Conversation:
                %s

                Assess only the enabled modes. Respond with a single JSON object using these keys,
                omitting keys for modes that were not enabled:
                {
                    "audio_quality": "...",
                    "video_presence": "...",
                    "whiteboard_usage": "...",
                    "screen_share_usage": "...",
                    "overall_communication": "..."
                }
                """.formatted(modes, media, transcript);
    }

    public String improvementPlanPrompt(Map<String, CompetencyScore> lowest, List<FeedbackItem> needsImprovement) {
        String competencies = lowest.entrySet().stream()
                .map(e -> "- %s: %.0f/100".formatted(e.getKey(), e.getValue().getScore()))
                .collect(Collectors.joining("\n"));
        String areas = needsImprovement.isEmpty()
                ? "- none reported"
                : needsImprovement.stream().map(f -> "- " + f.getDescription()).collect(Collectors.joining("\n"));
        return """
                You are an expert technical interviewer creating improvement plans.

                Priority Competencies (lowest scores):
                %s

                Areas Needing Improvement:
                %s

                Create a plan with ranked priority areas, 3-5 concrete numbered action items with
                specific resources (books, courses, practice sites) and a list of general resources.

                Respond with a single JSON object:
                {
                    "priority_areas": ["..."],
                    "concrete_steps": [
                        {"step_number": 1, "description": "...", "resources": ["..."]}
                    ],
                    "resources": ["..."]
                }
                """.formatted(competencies, areas);
    }

    public String formatTranscript(List<ConversationMessage> messages) {
        return messages.stream()
                .map(m -> m.getRole().label() + ": " + m.getContent())
                .collect(Collectors.joining("\n\n"));
    }
}
