import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tenor.eval.EvalError;
import com.tenor.eval.EvalException;
import com.tenor.eval.Evaluator;
import com.tenor.eval.Value;
import com.tenor.eval.VerdictInstance;
import com.tenor.eval.VerdictSet;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TenorRuleEngineTest {

    private final Evaluator evaluator = new Evaluator();

    private VerdictSet run(String source, String factsJson) {
        ObjectNode bundle = TenorFixtures.elaborate(source);
        return evaluator.evaluate(bundle, TenorFixtures.json(factsJson));
    }

    private EvalException fails(String source, String factsJson) {
        ObjectNode bundle = TenorFixtures.elaborate(source);
        JsonNode facts = TenorFixtures.json(factsJson);
        return assertThrows(EvalException.class, () -> evaluator.evaluate(bundle, facts));
    }

    // ---------------- strata and provenance ----------------

    @Test
    public void strata_laterRulesSeeEarlierVerdicts() {
        VerdictSet verdicts = run(TenorFixtures.orderContract(), "{\"amount\": 120}");

        assertTrue(verdicts.has("small"));
        assertTrue(verdicts.has("approved"));
        assertEquals(2, verdicts.size());

        VerdictInstance approved = verdicts.get("approved");
        assertEquals("auto_approve", approved.provenance.ruleId);
        assertEquals(1, approved.provenance.stratum);
        assertEquals(List.of("small"), approved.provenance.verdictsUsed);
        assertEquals(Value.bool(true), approved.payload);
    }

    @Test
    public void provenance_recordsFactsActuallyRead() {
        VerdictSet verdicts = run(TenorFixtures.orderContract(), "{\"amount\": 120}");
        assertEquals(List.of("amount"), verdicts.get("small").provenance.factsUsed);
        assertTrue(verdicts.get("small").provenance.verdictsUsed.isEmpty());
    }

    @Test
    public void rulesNotFiring_produceNothing() {
        VerdictSet verdicts = run(TenorFixtures.orderContract(), "{\"amount\": 900}");
        assertFalse(verdicts.has("small"));
        assertFalse(verdicts.has("approved"));
        assertEquals(0, verdicts.size());
    }

    @Test
    public void defaultFact_isUsedWhenAbsent() {
        VerdictSet verdicts = run(TenorFixtures.orderContract(), "{\"amount\": 900, \"vip\": true}");
        assertTrue(verdicts.has("approved"));
        assertFalse(verdicts.has("small"));
    }

    @Test
    public void evaluation_isDeterministic() {
        String first = run(TenorFixtures.orderContract(), "{\"amount\": 10}").toJson().toString();
        String second = run(TenorFixtures.orderContract(), "{\"amount\": 10}").toJson().toString();
        assertEquals(first, second);
    }

    @Test
    public void verdictJson_hasProvenanceBlock() {
        JsonNode json = run(TenorFixtures.orderContract(), "{\"amount\": 10}").toJson();
        JsonNode first = json.get("verdicts").get(0);
        assertEquals("small", first.get("type").asText());
        assertEquals("small_order", first.get("provenance").get("rule").asText());
        assertEquals(0, first.get("provenance").get("stratum").asInt());
        assertEquals("amount", first.get("provenance").get("facts_used").get(0).asText());
    }

    @Test
    public void secondProducerOfAVerdict_isInvariantViolation() {
        ObjectNode bundle = TenorFixtures.elaborate(TenorFixtures.orderContract());
        ArrayNode constructs = (ArrayNode) bundle.get("constructs");
        for (JsonNode c : constructs) {
            if (c.get("id").asText().equals("small_order")) {
                ObjectNode copy = (ObjectNode) c.deepCopy();
                copy.put("id", "small_order_2");
                constructs.add(copy);
                break;
            }
        }

        EvalException e = assertThrows(EvalException.class,
                () -> evaluator.evaluate(bundle, TenorFixtures.json("{\"amount\": 120}")));
        assertEquals(EvalError.INVARIANT, e.kind());
        assertEquals("invariant violated: verdict type 'small' produced by both rule 'small_order' and rule 'small_order_2'",
                e.getMessage());
    }

    // ---------------- payloads ----------------

    @Test
    public void payload_multiplication() {
        String source = String.join("\n",
                "fact qty { type: Int(min: 0, max: 100), source: \"s.qty\" }",
                "rule total {",
                "  stratum: 0",
                "  when: qty > 0",
                "  produce: verdict line_total { payload: Int(min: 0, max: 1000) = qty * 10 }",
                "}");
        VerdictSet verdicts = run(source, "{\"qty\": 7}");
        assertEquals(Value.integer(70), verdicts.get("line_total").payload);
        assertEquals(List.of("qty"), verdicts.get("line_total").provenance.factsUsed);
    }

    @Test
    public void payload_textLiteral() {
        String source = String.join("\n",
                "fact level { type: Enum(values: [\"low\", \"high\"]), source: \"s.level\" }",
                "rule label {",
                "  stratum: 0",
                "  when: level = \"high\"",
                "  produce: verdict tier { payload: Text = \"gold\" }",
                "}");
        VerdictSet verdicts = run(source, "{\"level\": \"high\"}");
        assertEquals("gold", verdicts.get("tier").payload.asString());
        assertEquals(0, run(source, "{\"level\": \"low\"}").size());
    }

    // ---------------- comparisons ----------------

    @Test
    public void decimalComparison_promotesIntLiteral() {
        String source = String.join("\n",
                "fact rate { type: Decimal(precision: 5, scale: 2), source: \"s.rate\" }",
                "rule high { stratum: 0, when: rate >= 3, produce: verdict high_rate { payload: Bool = true } }");
        assertTrue(run(source, "{\"rate\": \"3.00\"}").has("high_rate"));
        assertFalse(run(source, "{\"rate\": \"2.99\"}").has("high_rate"));
    }

    @Test
    public void moneyComparison_withLiteral() {
        String source = String.join("\n",
                "fact price { type: Money(currency: \"USD\"), source: \"s.price\" }",
                "rule pricey {",
                "  stratum: 0",
                "  when: price > Money { amount: \"100.00\", currency: \"USD\" }",
                "  produce: verdict expensive { payload: Bool = true }",
                "}");
        assertTrue(run(source, "{\"price\": {\"amount\": \"100.01\", \"currency\": \"USD\"}}").has("expensive"));
        assertFalse(run(source, "{\"price\": {\"amount\": \"99.99\", \"currency\": \"USD\"}}").has("expensive"));
    }

    @Test
    public void moneyComparison_currencyMismatchAtRuntime() {
        String source = String.join("\n",
                "fact price { type: Money(currency: \"USD\"), source: \"s.price\" }",
                "rule pricey {",
                "  stratum: 0",
                "  when: price > Money { amount: \"100.00\", currency: \"USD\" }",
                "  produce: verdict expensive { payload: Bool = true }",
                "}");
        EvalException e = fails(source, "{\"price\": {\"amount\": \"5.00\", \"currency\": \"EUR\"}}");
        assertEquals(EvalError.TYPE_ERROR, e.kind());
        assertEquals("type error: cannot compare Money with different currencies: EUR vs USD", e.getMessage());
    }

    @Test
    public void dateComparison_isChronological() {
        String source = String.join("\n",
                "fact due { type: Date, source: \"s.due\" }",
                "fact today { type: Date, source: \"s.today\" }",
                "rule late { stratum: 0, when: today > due, produce: verdict overdue { payload: Bool = true } }");
        assertTrue(run(source, "{\"due\": \"2024-01-31\", \"today\": \"2024-02-01\"}").has("overdue"));
        assertFalse(run(source, "{\"due\": \"2024-02-01\", \"today\": \"2024-02-01\"}").has("overdue"));
    }

    @Test
    public void quantifier_forAllAndExists() {
        String source = String.join("\n",
                "type Line { qty: Int(min: 0, max: 100) }",
                "fact lines { type: List(element_type: Line, max: 10), source: \"s.lines\" }",
                "rule all_positive { stratum: 0, when: ∀ l ∈ lines . l.qty > 0, produce: verdict clean { payload: Bool = true } }",
                "rule any_large { stratum: 0, when: ∃ l ∈ lines . l.qty >= 50, produce: verdict bulk { payload: Bool = true } }");

        VerdictSet verdicts = run(source, "{\"lines\": [{\"qty\": 3}, {\"qty\": 60}]}");
        assertTrue(verdicts.has("clean"));
        assertTrue(verdicts.has("bulk"));

        verdicts = run(source, "{\"lines\": [{\"qty\": 0}, {\"qty\": 2}]}");
        assertFalse(verdicts.has("clean"));
        assertFalse(verdicts.has("bulk"));

        verdicts = run(source, "{\"lines\": []}");
        assertTrue(verdicts.has("clean"));
        assertFalse(verdicts.has("bulk"));
    }

    @Test
    public void negationAndConjunction() {
        String source = String.join("\n",
                "fact a { type: Bool, source: \"s.a\" }",
                "fact n { type: Int, source: \"s.n\" }",
                "rule r { stratum: 0, when: ¬ (a = true) ∧ n != 3, produce: verdict v { payload: Bool = true } }");
        assertTrue(run(source, "{\"a\": false, \"n\": 4}").has("v"));
        assertFalse(run(source, "{\"a\": true, \"n\": 4}").has("v"));
        assertFalse(run(source, "{\"a\": false, \"n\": 3}").has("v"));
    }

    // ---------------- fact assembly ----------------

    @Test
    public void missingFact_withoutDefault() {
        EvalException e = fails(TenorFixtures.orderContract(), "{}");
        assertEquals(EvalError.MISSING_FACT, e.kind());
        assertEquals("amount", e.subject());
        assertEquals("missing required fact: amount", e.getMessage());
    }

    @Test
    public void intOutOfDeclaredRange() {
        EvalException e = fails(TenorFixtures.orderContract(), "{\"amount\": 20000}");
        assertEquals(EvalError.TYPE_MISMATCH, e.kind());
        assertEquals("type mismatch for fact 'amount': expected Int(0, 10000), got 20000", e.getMessage());
    }

    @Test
    public void wrongJsonType() {
        EvalException e = fails(TenorFixtures.orderContract(), "{\"amount\": \"lots\"}");
        assertEquals(EvalError.TYPE_MISMATCH, e.kind());
        assertEquals("type mismatch for fact 'amount': expected Int, got string", e.getMessage());
    }

    @Test
    public void enumValueNotDeclared() {
        String source = String.join("\n",
                "fact level { type: Enum(values: [\"low\", \"high\"]), source: \"s.level\" }",
                "rule r { stratum: 0, when: level = \"low\", produce: verdict v { payload: Bool = true } }");
        EvalException e = fails(source, "{\"level\": \"medium\"}");
        assertEquals(EvalError.INVALID_ENUM, e.kind());
    }

    @Test
    public void listLongerThanMax() {
        String source = "fact tags { type: List(element_type: Text, max: 2), source: \"s.tags\" }";
        EvalException e = fails(source, "{\"tags\": [\"a\", \"b\", \"c\"]}");
        assertEquals(EvalError.LIST_OVERFLOW, e.kind());
        assertEquals("list fact 'tags' has 3 elements, max is 2", e.getMessage());
    }

    @Test
    public void invalidDate() {
        String source = "fact due { type: Date, source: \"s.due\" }";
        EvalException e = fails(source, "{\"due\": \"2024-13-45\"}");
        assertEquals(EvalError.TYPE_ERROR, e.kind());
        assertTrue(e.getMessage().contains("invalid Date format '2024-13-45'"), e.getMessage());
    }

    @Test
    public void undeclaredInputKeys_areIgnored() {
        VerdictSet verdicts = run(TenorFixtures.orderContract(), "{\"amount\": 5, \"colour\": \"red\"}");
        assertTrue(verdicts.has("small"));
    }

    @Test
    public void decimalValue_equalityIgnoresScale() {
        assertEquals(Value.decimal(new BigDecimal("1.50")), Value.decimal(new BigDecimal("1.5")));
        assertEquals(Value.decimal(new BigDecimal("1.50")).hashCode(), Value.decimal(new BigDecimal("1.5")).hashCode());
    }
}
