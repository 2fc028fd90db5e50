package org.prossme.bpmn.autolayout.lane;

import org.junit.jupiter.api.Test;
import org.prossme.bpmn.autolayout.bpmn.models.FlowNode;
import org.prossme.bpmn.autolayout.bpmn.models.Lane;
import org.prossme.bpmn.autolayout.bpmn.models.NodeType;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LaneScoringRulesTest {

    private static Lane lane(String name) {
        return new Lane("Lane_" + name.replace(' ', '_'), name, List.of());
    }

    private static FlowNode node(String name, NodeType type) {
        return new FlowNode("Node", name, type);
    }

    @Test
    void shouldScoreSharedTokens() {
        int score = LaneScoringRules.TOKEN_OVERLAP.score(node("Notify customer service", NodeType.TASK),
                lane("Customer Service"));
        assertEquals(30, score);
    }

    @Test
    void shouldIgnoreShortTokens() {
        assertEquals(0, LaneScoringRules.TOKEN_OVERLAP.score(node("Go to IT", NodeType.TASK), lane("IT")));
    }

    @Test
    void shouldScoreWholeLaneNameAsPhrase() {
        assertEquals(12, LaneScoringRules.EXACT_NAME.score(node("Call back office team", NodeType.TASK),
                lane("Back Office")));
        assertEquals(0, LaneScoringRules.EXACT_NAME.score(node("Call backoffice", NodeType.TASK),
                lane("Back Office")));
    }

    @Test
    void shouldScoreDomainKeywords() {
        assertEquals(20, LaneScoringRules.DOMAIN_KEYWORDS.score(node("KYC Review", NodeType.USER_TASK),
                lane("Compliance")));
        assertEquals(0, LaneScoringRules.DOMAIN_KEYWORDS.score(node("KYC Review", NodeType.USER_TASK),
                lane("Customer")));
    }

    @Test
    void shouldMatchInflectedDomainTerms() {
        assertEquals(18, LaneScoringRules.DOMAIN_KEYWORDS.score(node("Approved by lead", NodeType.TASK),
                lane("Manager")));
    }

    @Test
    void shouldCreditEachTokenOncePerTable() {
        assertEquals(34, LaneScoringRules.DOMAIN_KEYWORDS.score(node("Sanctions screening", NodeType.TASK),
                lane("Compliance")));
        assertEquals(16, LaneScoringRules.DOMAIN_KEYWORDS.score(node("Schedule delivery", NodeType.TASK),
                lane("Logistics")));
    }

    @Test
    void shouldPreferSystemLanesForAutomatedTasks() {
        FlowNode service = node("Store record", NodeType.SERVICE_TASK);
        assertEquals(8, LaneScoringRules.NODE_KIND.score(service, lane("Core System")));
        assertEquals(8, LaneScoringRules.NODE_KIND.score(service, lane("Back Office")));
        assertEquals(0, LaneScoringRules.NODE_KIND.score(service, lane("Customer")));
    }

    @Test
    void shouldPreferHumanLanesForUserTasks() {
        FlowNode userTask = node("Check", NodeType.USER_TASK);
        assertEquals(5, LaneScoringRules.NODE_KIND.score(userTask, lane("Customer")));
        assertEquals(8, LaneScoringRules.NODE_KIND.score(userTask, lane("Risk Management")));
        assertEquals(8, LaneScoringRules.NODE_KIND.score(userTask, lane("Front Office")));
        assertEquals(0, LaneScoringRules.NODE_KIND.score(userTask, lane("Automated Checks")));
        assertEquals(0, LaneScoringRules.NODE_KIND.score(node("Check", NodeType.EXCLUSIVE_GATEWAY), lane("Customer")));
    }

    @Test
    void shouldScoreCapitalizedActorWords() {
        assertEquals(10, LaneScoringRules.CAPITALIZED_WORD.score(node("Contact Patient", NodeType.TASK),
                lane("Patient")));
        assertEquals(0, LaneScoringRules.CAPITALIZED_WORD.score(node("contact patient", NodeType.TASK),
                lane("Patient")));
    }

    @Test
    void shouldScoreSharedSubstringOnce() {
        assertEquals(3, LaneScoringRules.SHARED_SUBSTRING.score(node("Prescription pharma check", NodeType.TASK),
                lane("Pharmacy")));
        assertEquals(0, LaneScoringRules.SHARED_SUBSTRING.score(node("Pay", NodeType.TASK), lane("Payments")));
    }

    @Test
    void shouldSumDefaultRules() {
        FlowNode kycReview = node("KYC Review", NodeType.USER_TASK);

        assertEquals(28, LaneScoringRules.score(LaneScoringRules.defaults(), kycReview, lane("Compliance")));
        assertEquals(5, LaneScoringRules.score(LaneScoringRules.defaults(), kycReview, lane("Customer")));
    }

    @Test
    void shouldScoreNodesWithoutName() {
        assertEquals(0, LaneScoringRules.score(LaneScoringRules.defaults(), node(null, NodeType.START_EVENT),
                lane("Customer")));
    }
}
