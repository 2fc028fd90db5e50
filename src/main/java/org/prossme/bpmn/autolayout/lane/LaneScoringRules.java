package org.prossme.bpmn.autolayout.lane;

import org.prossme.bpmn.autolayout.bpmn.models.FlowNode;
import org.prossme.bpmn.autolayout.bpmn.models.Lane;
import org.prossme.bpmn.autolayout.bpmn.models.NodeType;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The lane scoring heuristics, in evaluation order.
 */
public final class LaneScoringRules {

    public static final int TOKEN_MATCH = 15;
    public static final int EXACT_NAME_MATCH = 12;
    public static final int AUTOMATED_TASK_MATCH = 8;
    public static final int HUMAN_TASK_MATCH = 5;
    public static final int HUMAN_TASK_OVERSIGHT_MATCH = 3;
    public static final int CAPITALIZED_WORD_MATCH = 10;
    public static final int SUBSTRING_MATCH = 3;

    private static final Set<NodeType> AUTOMATED_TASKS =
            Set.of(NodeType.SERVICE_TASK, NodeType.SEND_TASK, NodeType.RECEIVE_TASK);
    private static final Set<NodeType> HUMAN_TASKS = Set.of(NodeType.USER_TASK, NodeType.MANUAL_TASK);

    private static final List<String> AUTOMATED_LANE_MARKERS = List.of("system", "automated", "back office");
    private static final List<String> OVERSIGHT_LANE_MARKERS = List.of("compliance", "risk", "front office");

    /**
     * (a) +15 for every significant token the node name shares with the lane name.
     */
    public static final LaneScoringRule TOKEN_OVERLAP = (node, lane) -> {
        Set<String> laneTokens = tokens(lane.name());
        return (int) tokens(node.name()).stream().filter(laneTokens::contains).count() * TOKEN_MATCH;
    };

    /**
     * (b) +12 when the whole lane name appears as a word or phrase inside the node name.
     */
    public static final LaneScoringRule EXACT_NAME = (node, lane) -> {
        String laneName = normalize(lane.name());
        if (laneName.isEmpty()) {
            return 0;
        }
        String nodeName = " " + normalize(node.name()) + " ";
        return nodeName.contains(" " + laneName + " ") ? EXACT_NAME_MATCH : 0;
    };

    /**
     * (c) Domain vocabulary: in every table that applies to the lane, each node token credits at
     * most one term, and each term is credited once.
     */
    public static final LaneScoringRule DOMAIN_KEYWORDS = (node, lane) -> {
        Set<String> laneWords = words(lane.name());
        Set<String> nodeTokens = tokens(node.name());

        int score = 0;
        Set<String> counted = new LinkedHashSet<>();
        for (DomainKeywords.Table table : DomainKeywords.TABLES) {
            if (table.laneWords().stream().noneMatch(laneWords::contains)) {
                continue;
            }
            for (String token : nodeTokens) {
                String term = matchTerm(token, table.terms().keySet(), counted);
                if (term != null) {
                    counted.add(term);
                    score += table.terms().get(term);
                }
            }
        }
        return score;
    };

    /**
     * (d) Automated tasks lean towards system lanes, human tasks towards every other lane and a bit
     * more towards oversight lanes.
     */
    public static final LaneScoringRule NODE_KIND = (node, lane) -> {
        String laneName = normalize(lane.name());
        boolean automatedLane = AUTOMATED_LANE_MARKERS.stream().anyMatch(laneName::contains);

        if (AUTOMATED_TASKS.contains(node.type())) {
            return automatedLane ? AUTOMATED_TASK_MATCH : 0;
        }
        if (HUMAN_TASKS.contains(node.type()) && !automatedLane) {
            boolean oversightLane = OVERSIGHT_LANE_MARKERS.stream().anyMatch(laneName::contains);
            return HUMAN_TASK_MATCH + (oversightLane ? HUMAN_TASK_OVERSIGHT_MATCH : 0);
        }
        return 0;
    };

    /**
     * (e) +10 for every capitalized word of the node name that is also a lane name token, e.g.
     * "Contact Patient" in lane "Patient".
     */
    public static final LaneScoringRule CAPITALIZED_WORD = (node, lane) -> {
        Set<String> laneTokens = tokens(lane.name());
        int score = 0;
        for (String word : node.displayName().split("\\s+")) {
            if (word.isEmpty() || !Character.isUpperCase(word.charAt(0))) {
                continue;
            }
            String token = word.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
            if (laneTokens.contains(token)) {
                score += CAPITALIZED_WORD_MATCH;
            }
        }
        return score;
    };

    /**
     * (f) +3, counted once, when any four consecutive characters of the node name occur in the
     * lane name.
     */
    public static final LaneScoringRule SHARED_SUBSTRING = (node, lane) -> {
        String nodeName = node.displayName().toLowerCase(Locale.ROOT);
        String laneName = lane.name() == null ? "" : lane.name().toLowerCase(Locale.ROOT);
        if (nodeName.length() < 4 || laneName.length() < 4) {
            return 0;
        }
        for (int i = 0; i + 4 <= nodeName.length(); i++) {
            if (laneName.contains(nodeName.substring(i, i + 4))) {
                return SUBSTRING_MATCH;
            }
        }
        return 0;
    };

    private LaneScoringRules() {
    }

    public static List<LaneScoringRule> defaults() {
        return List.of(TOKEN_OVERLAP, EXACT_NAME, DOMAIN_KEYWORDS, NODE_KIND, CAPITALIZED_WORD, SHARED_SUBSTRING);
    }

    public static int score(List<LaneScoringRule> rules, FlowNode node, Lane lane) {
        return rules.stream().mapToInt(rule -> rule.score(node, lane)).sum();
    }

    /**
     * Lowercase alphanumeric words longer than two characters.
     */
    static Set<String> tokens(String name) {
        return words(name).stream().filter(word -> word.length() > 2)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static Set<String> words(String name) {
        String normalized = normalize(name);
        if (normalized.isEmpty()) {
            return Set.of();
        }
        return new LinkedHashSet<>(Arrays.asList(normalized.split(" ")));
    }

    private static String normalize(String name) {
        if (name == null) {
            return "";
        }
        return name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", " ").trim();
    }

    // exact term first, else the longest term of 5+ characters the token starts with ("approve" in "approved")
    private static String matchTerm(String token, Set<String> terms, Set<String> counted) {
        if (terms.contains(token)) {
            return counted.contains(token) ? null : token;
        }
        String best = null;
        for (String term : terms) {
            if (counted.contains(term) || term.length() < 5 || !token.startsWith(term)) {
                continue;
            }
            if (best == null || term.length() > best.length()) {
                best = term;
            }
        }
        return best;
    }
}
