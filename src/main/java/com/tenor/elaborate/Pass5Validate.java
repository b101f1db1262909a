package com.tenor.elaborate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.tenor.debug.Debug;
import com.tenor.elaborate.parser.RawConstruct.Construct;

/**
 * Pass 5: structural validation. Every validator runs and appends to one list,
 * which is then ordered by construct declaration and line; the earliest
 * violation becomes the reported diagnostic.
 */
final class Pass5Validate {

    private Pass5Validate() {}

    static void validate(ConstructIndex index) {
        List<ElabError> errors = new ArrayList<>();
        EntityValidator.validate(index, errors);
        RuleValidator.validate(index, errors);
        OperationValidator.validate(index, errors);
        SourceValidator.validate(index, errors);
        FlowValidator.validate(index, errors);
        ParallelValidator.validate(index, errors);
        SystemValidator.validate(index, errors);
        if (!errors.isEmpty()) {
            Debug.get().d("tenor.elab", "pass 5: " + errors.size() + " violation(s)");
            throw ElaborationException.of(inDeclarationOrder(index, errors));
        }
    }

    static List<ElabError> inDeclarationOrder(ConstructIndex index, List<ElabError> errors) {
        Map<String, Integer> position = new HashMap<>();
        for (int i = 0; i < index.constructs.size(); i++) {
            Construct c = index.constructs.get(i);
            position.putIfAbsent(c.kind() + ":" + c.id, i);
        }
        List<ElabError> sorted = new ArrayList<>(errors);
        // stable: violations on the same construct and line keep validator order
        sorted.sort(Comparator
                .comparingInt((ElabError e) -> position.getOrDefault(e.constructKind + ":" + e.constructId, Integer.MAX_VALUE))
                .thenComparingInt(e -> e.line));
        return sorted;
    }
}
