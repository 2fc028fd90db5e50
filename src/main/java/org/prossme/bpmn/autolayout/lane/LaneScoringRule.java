package org.prossme.bpmn.autolayout.lane;

import org.prossme.bpmn.autolayout.bpmn.models.FlowNode;
import org.prossme.bpmn.autolayout.bpmn.models.Lane;

/**
 * One independent contribution to how well a node fits a lane. Rules are pure and their results
 * are summed, so each one can be tested and tuned on its own.
 */
@FunctionalInterface
public interface LaneScoringRule {

    int score(FlowNode node, Lane lane);
}
