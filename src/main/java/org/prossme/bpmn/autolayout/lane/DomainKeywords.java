package org.prossme.bpmn.autolayout.lane;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Role and department vocabulary. A table applies to a lane when one of the lane's words is in
 * {@code laneWords}; its terms are then looked up in the node name.
 */
public final class DomainKeywords {

    public record Table(Set<String> laneWords, Map<String, Integer> terms) {}

    public static final List<Table> TABLES = List.of(
            new Table(Set.of("compliance", "risk", "legal", "audit", "regulatory"), Map.ofEntries(
                    Map.entry("kyc", 20),
                    Map.entry("aml", 20),
                    Map.entry("sanction", 18),
                    Map.entry("sanctions", 18),
                    Map.entry("screening", 16),
                    Map.entry("audit", 16),
                    Map.entry("regulatory", 16),
                    Map.entry("fraud", 15),
                    Map.entry("risk", 14),
                    Map.entry("legal", 14),
                    Map.entry("verification", 12),
                    Map.entry("contract", 12))),
            new Table(Set.of("finance", "financial", "accounting", "accounts", "billing", "payment", "payments", "treasury"),
                    Map.ofEntries(
                            Map.entry("invoice", 20),
                            Map.entry("payment", 18),
                            Map.entry("billing", 16),
                            Map.entry("refund", 16),
                            Map.entry("ledger", 16),
                            Map.entry("reconcile", 16),
                            Map.entry("reconciliation", 16),
                            Map.entry("budget", 14),
                            Map.entry("charge", 14),
                            Map.entry("expense", 14))),
            new Table(Set.of("customer", "client", "applicant", "patient", "requester", "buyer"), Map.ofEntries(
                    Map.entry("submit", 12),
                    Map.entry("request", 12),
                    Map.entry("apply", 14),
                    Map.entry("application", 14),
                    Map.entry("order", 12),
                    Map.entry("sign", 12))),
            new Table(Set.of("system", "automated", "it", "platform", "backend", "erp", "crm"), Map.ofEntries(
                    Map.entry("api", 16),
                    Map.entry("sync", 14),
                    Map.entry("calculate", 14),
                    Map.entry("notify", 14),
                    Map.entry("notification", 14),
                    Map.entry("email", 12),
                    Map.entry("generate", 12),
                    Map.entry("update", 12),
                    Map.entry("record", 12))),
            new Table(Set.of("sales", "marketing", "account", "business"), Map.ofEntries(
                    Map.entry("quote", 18),
                    Map.entry("lead", 18),
                    Map.entry("campaign", 18),
                    Map.entry("proposal", 16),
                    Map.entry("offer", 14),
                    Map.entry("deal", 14))),
            new Table(Set.of("hr", "human", "resources", "people", "recruiting", "recruitment", "talent"), Map.ofEntries(
                    Map.entry("hire", 18),
                    Map.entry("onboarding", 18),
                    Map.entry("interview", 18),
                    Map.entry("candidate", 18),
                    Map.entry("payroll", 16),
                    Map.entry("employee", 14))),
            new Table(Set.of("warehouse", "logistics", "shipping", "fulfillment", "fulfilment", "delivery"), Map.ofEntries(
                    Map.entry("ship", 18),
                    Map.entry("shipment", 18),
                    Map.entry("inventory", 18),
                    Map.entry("pack", 16),
                    Map.entry("delivery", 16),
                    Map.entry("deliver", 16),
                    Map.entry("pick", 14),
                    Map.entry("stock", 14))),
            new Table(Set.of("manager", "management", "approver", "supervisor", "director", "lead"), Map.ofEntries(
                    Map.entry("approve", 18),
                    Map.entry("approval", 18),
                    Map.entry("authorize", 16),
                    Map.entry("escalate", 14),
                    Map.entry("escalation", 14),
                    Map.entry("review", 12))),
            new Table(Set.of("support", "helpdesk", "desk", "service"), Map.ofEntries(
                    Map.entry("ticket", 18),
                    Map.entry("complaint", 16),
                    Map.entry("incident", 16),
                    Map.entry("troubleshoot", 16),
                    Map.entry("resolve", 14))),
            new Table(Set.of("doctor", "physician", "clinic", "clinician", "nurse", "medical"), Map.ofEntries(
                    Map.entry("diagnose", 18),
                    Map.entry("diagnosis", 18),
                    Map.entry("prescribe", 18),
                    Map.entry("examine", 16),
                    Map.entry("examination", 16),
                    Map.entry("treatment", 16))),
            new Table(Set.of("pharmacy", "pharmacist"), Map.ofEntries(
                    Map.entry("dispense", 18),
                    Map.entry("prescription", 16),
                    Map.entry("medication", 16)))
    );

    private DomainKeywords() {
    }
}
