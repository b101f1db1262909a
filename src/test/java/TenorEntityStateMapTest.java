import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tenor.eval.EntityStateMap;
import com.tenor.eval.EvalError;
import com.tenor.eval.EvalException;
import com.tenor.eval.Evaluator;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class TenorEntityStateMapTest {

    @Test
    public void fromJson_flatValuesUseDefaultInstance() {
        EntityStateMap m = EntityStateMap.fromJson(TenorFixtures.json("{\"Order\": \"pending\"}"));
        assertEquals("pending", m.get("Order", "_default"));
        assertNull(m.get("Order", "ord-1"));
    }

    @Test
    public void fromJson_nestedAndFlatMixed() {
        EntityStateMap m = EntityStateMap.fromJson(TenorFixtures.json(
                "{\"Order\": {\"ord-2\": \"shipped\", \"ord-1\": \"pending\"}, \"Invoice\": \"open\"}"));
        assertEquals("pending", m.get("Order", "ord-1"));
        assertEquals("shipped", m.get("Order", "ord-2"));
        assertEquals("open", m.get("Invoice", "_default"));
        assertEquals(List.of("ord-1", "ord-2"), List.copyOf(m.instances("Order").keySet()));
    }

    @Test
    public void fromJson_nullIsEmpty() {
        assertTrue(EntityStateMap.fromJson(null).isEmpty());
    }

    @Test
    public void fromJson_rejectsNonObject() {
        EvalException e = assertThrows(EvalException.class,
                () -> EntityStateMap.fromJson(TenorFixtures.json("[\"pending\"]")));
        assertEquals(EvalError.DESERIALIZE, e.kind());
        assertEquals("deserialization error: entity states must be a JSON object", e.getMessage());
    }

    @Test
    public void fromJson_rejectsNonStringInstanceState() {
        EvalException e = assertThrows(EvalException.class,
                () -> EntityStateMap.fromJson(TenorFixtures.json("{\"Order\": {\"ord-1\": 3}}")));
        assertEquals("deserialization error: state of Order/ord-1 must be a string", e.getMessage());
    }

    @Test
    public void fromJson_rejectsNumberAsEntityState() {
        EvalException e = assertThrows(EvalException.class,
                () -> EntityStateMap.fromJson(TenorFixtures.json("{\"Order\": 7}")));
        assertEquals("deserialization error: state of entity 'Order' must be a string or an object", e.getMessage());
    }

    @Test
    public void copy_isIndependent() {
        EntityStateMap m = new EntityStateMap().set("Order", "ord-1", "pending");
        EntityStateMap c = m.copy();
        assertEquals(m, c);
        assertEquals(m.hashCode(), c.hashCode());

        c.set("Order", "ord-1", "shipped");
        assertEquals("pending", m.get("Order", "ord-1"));
        assertNotEquals(m, c);
    }

    @Test
    public void toJson_isAlwaysNested() {
        ObjectNode json = EntityStateMap.single(Map.of("Order", "pending")).toJson();
        assertEquals("pending", json.get("Order").get("_default").asText());
    }

    @Test
    public void initial_placesEveryEntityInItsInitialState() {
        EntityStateMap m = EntityStateMap.initial(Evaluator.load(TenorFixtures.elaborate(TenorFixtures.orderContract())));
        assertEquals("pending", m.get("Order", "_default"));
        assertEquals(1, m.instances("Order").size());
    }
}
