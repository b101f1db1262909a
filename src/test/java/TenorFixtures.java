import java.nio.file.Path;
import java.nio.file.Paths;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tenor.elaborate.Elaborator;
import com.tenor.elaborate.InMemorySourceProvider;

/** Shared helpers: elaborate inline sources and build fact documents. */
final class TenorFixtures {

    static final ObjectMapper MAPPER = new ObjectMapper();

    private TenorFixtures() {}

    static Path root(String name) {
        return Paths.get("/contracts", name);
    }

    static ObjectNode elaborate(String source) {
        return elaborate("contract.tenor", source);
    }

    static ObjectNode elaborate(String fileName, String source) {
        InMemorySourceProvider files = new InMemorySourceProvider().put(root(fileName).toString(), source);
        return new Elaborator().elaborate(root(fileName), files);
    }

    static JsonNode json(String text) {
        try {
            return MAPPER.readTree(text);
        } catch (Exception e) {
            throw new IllegalArgumentException("bad test json: " + text, e);
        }
    }

    static ObjectNode facts() {
        return MAPPER.createObjectNode();
    }

    /**
     * A small order-approval contract: one Order entity, verdicts in two
     * strata, and an approval flow with a compensation path.
     */
    static String orderContract() {
        return String.join("\n",
                "persona buyer",
                "persona clerk",
                "",
                "fact amount { type: Int(min: 0, max: 10000), source: \"erp.amount\" }",
                "fact vip { type: Bool, source: \"crm.vip\", default: false }",
                "",
                "entity Order {",
                "  states: [pending, confirmed, shipped, cancelled]",
                "  initial: pending",
                "  transitions: [(pending, confirmed), (confirmed, shipped), (pending, cancelled), (confirmed, cancelled)]",
                "}",
                "",
                "rule small_order {",
                "  stratum: 0",
                "  when: amount < 500",
                "  produce: verdict small { payload: Bool = true }",
                "}",
                "",
                "rule auto_approve {",
                "  stratum: 1",
                "  when: verdict_present(small) or vip = true",
                "  produce: verdict approved { payload: Bool = true }",
                "}",
                "",
                "operation confirm {",
                "  allowed_personas: [clerk]",
                "  precondition: verdict_present(approved)",
                "  effects: [(Order, pending, confirmed)]",
                "}",
                "",
                "operation ship {",
                "  allowed_personas: [clerk]",
                "  precondition: amount >= 0",
                "  effects: [(Order, confirmed, shipped)]",
                "}",
                "",
                "operation cancel {",
                "  allowed_personas: [clerk]",
                "  precondition: amount >= 0",
                "  effects: [(Order, confirmed, cancelled)]",
                "}",
                "",
                "flow fulfil {",
                "  snapshot: at_initiation",
                "  entry: step_confirm",
                "  steps: {",
                "    step_confirm: OperationStep {",
                "      op: confirm, persona: clerk",
                "      outcomes: { success: step_ship }",
                "      on_failure: Terminate(outcome: rejected)",
                "    }",
                "    step_ship: OperationStep {",
                "      op: ship, persona: clerk",
                "      outcomes: { success: Terminal(shipped) }",
                "      on_failure: Compensate(steps: [{op: cancel, persona: clerk, on_failure: Terminal(stuck)}], then: Terminal(cancelled))",
                "    }",
                "  }",
                "}");
    }
}
