package io.storagerouter.core.engine;

/**
 * Two reachable rules whose conditions intersect and whose targets differ. Under the
 * first-match policy the earlier rule wins every contested criteria value; this is
 * reported so authors can confirm the ordering is intended. Informational only.
 *
 * @param earlierPriority  priority of the rule that wins the contested values
 * @param earlierRuleId    id of that rule
 * @param laterPriority    priority of the rule that loses them
 * @param laterRuleId      id of that rule
 * @param contestedCriteria number of criteria values both rules match that the earlier rule
 *                          decides under first-match; always positive
 */
public record RuleOverlap(
        int earlierPriority, String earlierRuleId, int laterPriority, String laterRuleId, int contestedCriteria) {}
