package com.deckflow.infrastructure.collaborator;

import com.deckflow.domain.collaborator.exception.CollaboratorException;
import com.deckflow.domain.collaborator.model.valobj.CollaboratorFailureKind;
import com.deckflow.domain.collaborator.model.valobj.CollaboratorRequest;
import com.deckflow.domain.collaborator.model.valobj.CollaboratorResult;
import com.deckflow.domain.collaborator.model.valobj.CollaboratorRole;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 降级协作方实现：基于规则的需求分析与模板化生成，不依赖大模型。
 */
@Slf4j
public class MockCollaboratorGateway extends AbstractCollaboratorGateway {

    public static final String MODE = "mock";

    private static final Pattern NUMBER_PATTERN = Pattern.compile("\\b(\\d{1,2})\\b");
    private static final Pattern AUDIENCE_PATTERN = Pattern.compile(
            "\\b(audience|investors?|executives?|team|students?|customers?|board|stakeholders?|clients?|managers?|engineers?)\\b");
    private static final Pattern PURPOSE_PATTERN = Pattern.compile(
            "\\b(summary|summarize|pitch|report|overview|training|proposal|update|review|introduction|tutorial|plan)\\b");
    private static final Set<String> STOP_WORDS = Set.of(
            "make", "create", "build", "about", "with", "that", "this", "for", "the", "and", "presentation",
            "slides", "slide", "deck", "please", "point", "points", "want", "need", "from", "into", "some");
    private static final int DEFAULT_SLIDES = 5;
    private static final int MAX_SLIDES = 30;

    private final long simulatedLatencyMs;

    public MockCollaboratorGateway(Executor executor, long simulatedLatencyMs) {
        super(executor);
        this.simulatedLatencyMs = Math.max(simulatedLatencyMs, 0L);
    }

    @Override
    public String mode() {
        return MODE;
    }

    @Override
    protected CollaboratorResult doInvoke(CollaboratorRequest request) {
        simulateLatency();
        Map<String, Object> payload = request.getPayload() == null ? Map.of() : request.getPayload();
        String role = request.getRole();
        if (CollaboratorRole.ANALYSIS.equals(role)) {
            return CollaboratorResult.of(role, analyze(payload));
        }
        if (CollaboratorRole.STRUCTURE.equals(role)) {
            return CollaboratorResult.of(role, buildStructure(payload));
        }
        if (CollaboratorRole.RESEARCH.equals(role)) {
            return CollaboratorResult.of(role, buildResearch(payload));
        }
        if (CollaboratorRole.LAYOUT.equals(role)) {
            return CollaboratorResult.of(role, buildLayout(payload));
        }
        throw new CollaboratorException(CollaboratorFailureKind.REJECTED_INPUT, "Unsupported collaborator role: " + role);
    }

    private Map<String, Object> analyze(Map<String, Object> payload) {
        String text = StringUtils.defaultString(asText(payload.get("text"))).toLowerCase(Locale.ROOT);
        Map<String, Object> answers = asMap(payload.get("answers"));

        boolean hasLength = NUMBER_PATTERN.matcher(text).find() || answers.containsKey("slide_count");
        boolean hasAudience = AUDIENCE_PATTERN.matcher(text).find() || answers.containsKey("audience");
        Matcher purposeMatcher = PURPOSE_PATTERN.matcher(text);
        boolean hasPurpose = purposeMatcher.find() || answers.containsKey("purpose");
        boolean detailed = text.split("\\s+").length >= 12 || answers.containsKey("key_topics");

        double score = 0.2D;
        score += hasLength ? 0.3D : 0D;
        score += hasAudience ? 0.2D : 0D;
        score += hasPurpose ? 0.3D : 0D;
        score += detailed ? 0.2D : 0D;
        score = Math.min(1D, Math.round(score * 100D) / 100D);

        List<Map<String, Object>> questions = new ArrayList<>();
        if (!hasPurpose) {
            questions.add(question("purpose", "What is the main goal of the presentation?", "choice",
                    List.of("Inform", "Persuade", "Train", "Report progress")));
        }
        if (!hasAudience) {
            questions.add(question("audience", "Who is the target audience?", "choice",
                    List.of("Executives", "Investors", "Team members", "Customers", "Students")));
        }
        if (!hasLength) {
            questions.add(question("slide_count", "How many slides or key points should it have?", "scale", List.of()));
        }
        if (!detailed) {
            questions.add(question("key_topics", "Which key topics must be covered?", "text", List.of()));
        }

        Map<String, Object> analysis = new LinkedHashMap<>();
        analysis.put("presentation_type", hasPurpose && purposeMatcher.find(0) ? purposeMatcher.group(1) : "general");
        analysis.put("estimated_slides", resolveSlideCount(text, answers));
        analysis.put("key_topics", keyTopics(text, answers));

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("completeness_score", score);
        result.put("questions", questions);
        result.put("analysis", analysis);
        return result;
    }

    private Map<String, Object> buildStructure(Map<String, Object> payload) {
        String text = StringUtils.defaultString(asText(payload.get("text")));
        Map<String, Object> answers = asMap(payload.get("answers"));
        int slideCount = resolveSlideCount(text.toLowerCase(Locale.ROOT), answers);
        List<String> topics = keyTopics(text.toLowerCase(Locale.ROOT), answers);

        List<Map<String, Object>> slides = new ArrayList<>();
        for (int i = 1; i <= slideCount; i++) {
            Map<String, Object> slide = new LinkedHashMap<>();
            slide.put("index", i);
            if (i == 1) {
                slide.put("title", "Overview");
            } else if (i == slideCount && slideCount >= 3) {
                slide.put("title", "Key takeaways");
            } else {
                String topic = topics.isEmpty() ? null : topics.get((i - 2 + topics.size()) % topics.size());
                slide.put("title", topic == null ? "Point " + i : StringUtils.capitalize(topic));
            }
            slide.put("bullets", List.of("Main idea", "Supporting detail"));
            slides.add(slide);
        }
        Map<String, Object> structure = new LinkedHashMap<>();
        structure.put("title", StringUtils.abbreviate(StringUtils.defaultIfBlank(text.trim(), "Presentation"), 60));
        structure.put("slides", slides);
        if (Boolean.TRUE.equals(payload.get("degraded"))) {
            structure.put("notes", "Generated with default assumptions for unanswered questions");
        }
        return structure;
    }

    private Map<String, Object> buildResearch(Map<String, Object> payload) {
        String text = StringUtils.defaultString(asText(payload.get("text"))).toLowerCase(Locale.ROOT);
        List<Map<String, Object>> findings = new ArrayList<>();
        for (String topic : keyTopics(text, asMap(payload.get("answers")))) {
            Map<String, Object> finding = new LinkedHashMap<>();
            finding.put("topic", topic);
            finding.put("note", "Background material to verify for " + topic);
            findings.add(finding);
        }
        Map<String, Object> research = new LinkedHashMap<>();
        research.put("findings", findings);
        return research;
    }

    private Map<String, Object> buildLayout(Map<String, Object> payload) {
        String text = StringUtils.defaultString(asText(payload.get("text"))).toLowerCase(Locale.ROOT);
        Map<String, Object> answers = asMap(payload.get("answers"));
        int slideCount = resolveSlideCount(text, answers);
        List<String> layouts = new ArrayList<>();
        for (int i = 1; i <= slideCount; i++) {
            layouts.add(i == 1 ? "title" : (i == slideCount && slideCount >= 3 ? "closing" : "bullets"));
        }
        String audience = StringUtils.defaultIfBlank(asText(answers.get("audience")), "general");
        Map<String, Object> layout = new LinkedHashMap<>();
        layout.put("theme", audience.toLowerCase(Locale.ROOT).contains("executive") ? "minimal" : "standard");
        layout.put("layouts", layouts);
        return layout;
    }

    private int resolveSlideCount(String text, Map<String, Object> answers) {
        Object answered = answers.get("slide_count");
        if (answered instanceof Number number) {
            return clampSlides(number.intValue());
        }
        if (answered != null && StringUtils.isNumeric(asText(answered))) {
            return clampSlides(Integer.parseInt(asText(answered)));
        }
        Matcher matcher = NUMBER_PATTERN.matcher(text);
        if (matcher.find()) {
            return clampSlides(Integer.parseInt(matcher.group(1)));
        }
        return DEFAULT_SLIDES;
    }

    private int clampSlides(int value) {
        return Math.min(Math.max(value, 1), MAX_SLIDES);
    }

    private List<String> keyTopics(String text, Map<String, Object> answers) {
        Set<String> topics = new LinkedHashSet<>();
        String answered = asText(answers.get("key_topics"));
        if (StringUtils.isNotBlank(answered)) {
            for (String part : answered.split("[,;]")) {
                if (StringUtils.isNotBlank(part)) {
                    topics.add(part.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        for (String word : text.split("[^a-z]+")) {
            if (topics.size() >= 5) {
                break;
            }
            if (word.length() > 3 && !STOP_WORDS.contains(word)) {
                topics.add(word);
            }
        }
        return new ArrayList<>(topics);
    }

    private Map<String, Object> question(String id, String prompt, String kind, List<String> options) {
        Map<String, Object> question = new LinkedHashMap<>();
        question.put("question_id", id);
        question.put("prompt", prompt);
        question.put("kind", kind);
        question.put("options", options);
        question.put("required", true);
        return question;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> asMap(Object value) {
        if (value instanceof Map<?, ?>) {
            return (Map<String, Object>) value;
        }
        return Map.of();
    }

    private String asText(Object value) {
        return value == null ? null : String.valueOf(value);
    }

    private void simulateLatency() {
        if (simulatedLatencyMs <= 0L) {
            return;
        }
        try {
            Thread.sleep(simulatedLatencyMs);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new CollaboratorException(CollaboratorFailureKind.UNAVAILABLE, "Mock collaborator interrupted", ex);
        }
    }
}
