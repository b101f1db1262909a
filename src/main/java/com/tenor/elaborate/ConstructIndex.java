package com.tenor.elaborate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.tenor.elaborate.parser.RawConstruct;
import com.tenor.elaborate.parser.RawConstruct.Construct;

/**
 * Pass 2: constructs indexed by kind, in declaration order. Immutable once built.
 */
final class ConstructIndex {

    final List<Construct> constructs;
    final Map<String, RawConstruct.TypeDecl> types;
    final Map<String, RawConstruct.Fact> facts;
    final Map<String, RawConstruct.Entity> entities;
    final Map<String, RawConstruct.Rule> rules;
    final Map<String, RawConstruct.Operation> operations;
    final Map<String, RawConstruct.Flow> flows;
    final Map<String, RawConstruct.Persona> personas;
    final Map<String, RawConstruct.Source> sources;
    final Map<String, RawConstruct.SystemDecl> systems;
    /** verdict type to the first rule producing it */
    final Map<String, RawConstruct.Rule> verdictProducers;

    private ConstructIndex(List<Construct> constructs, List<ElabError> errors) {
        this.constructs = List.copyOf(constructs);
        Map<String, RawConstruct.TypeDecl> types = new LinkedHashMap<>();
        Map<String, RawConstruct.Fact> facts = new LinkedHashMap<>();
        Map<String, RawConstruct.Entity> entities = new LinkedHashMap<>();
        Map<String, RawConstruct.Rule> rules = new LinkedHashMap<>();
        Map<String, RawConstruct.Operation> operations = new LinkedHashMap<>();
        Map<String, RawConstruct.Flow> flows = new LinkedHashMap<>();
        Map<String, RawConstruct.Persona> personas = new LinkedHashMap<>();
        Map<String, RawConstruct.Source> sources = new LinkedHashMap<>();
        Map<String, RawConstruct.SystemDecl> systems = new LinkedHashMap<>();
        Map<String, RawConstruct.Rule> producers = new LinkedHashMap<>();

        for (Construct c : constructs) {
            Construct first;
            if (c instanceof RawConstruct.TypeDecl) first = types.putIfAbsent(c.id, (RawConstruct.TypeDecl) c);
            else if (c instanceof RawConstruct.Fact) first = facts.putIfAbsent(c.id, (RawConstruct.Fact) c);
            else if (c instanceof RawConstruct.Entity) first = entities.putIfAbsent(c.id, (RawConstruct.Entity) c);
            else if (c instanceof RawConstruct.Rule) first = rules.putIfAbsent(c.id, (RawConstruct.Rule) c);
            else if (c instanceof RawConstruct.Operation) first = operations.putIfAbsent(c.id, (RawConstruct.Operation) c);
            else if (c instanceof RawConstruct.Flow) first = flows.putIfAbsent(c.id, (RawConstruct.Flow) c);
            else if (c instanceof RawConstruct.Persona) first = personas.putIfAbsent(c.id, (RawConstruct.Persona) c);
            else if (c instanceof RawConstruct.Source) first = sources.putIfAbsent(c.id, (RawConstruct.Source) c);
            else if (c instanceof RawConstruct.SystemDecl) first = systems.putIfAbsent(c.id, (RawConstruct.SystemDecl) c);
            else continue;

            if (first != null && errors != null) {
                errors.add(new ElabError(2, c.kind(), c.id, "id", c.file, c.line,
                        "duplicate " + c.kind() + " id '" + c.id + "': first declared at line " + first.line));
            }
        }
        for (RawConstruct.Rule r : rules.values()) {
            producers.putIfAbsent(r.verdictType, r);
        }

        this.types = Collections.unmodifiableMap(types);
        this.facts = Collections.unmodifiableMap(facts);
        this.entities = Collections.unmodifiableMap(entities);
        this.rules = Collections.unmodifiableMap(rules);
        this.operations = Collections.unmodifiableMap(operations);
        this.flows = Collections.unmodifiableMap(flows);
        this.personas = Collections.unmodifiableMap(personas);
        this.sources = Collections.unmodifiableMap(sources);
        this.systems = Collections.unmodifiableMap(systems);
        this.verdictProducers = Collections.unmodifiableMap(producers);
    }

    /** Pass 2 entry point: fails on same-file duplicate (kind, id) pairs. */
    static ConstructIndex build(List<Construct> constructs) {
        List<ElabError> errors = new ArrayList<>();
        ConstructIndex index = new ConstructIndex(constructs, errors);
        if (!errors.isEmpty()) throw ElaborationException.of(errors);
        return index;
    }

    /** Re-index constructs already known to be duplicate-free. */
    static ConstructIndex rebuild(List<Construct> constructs) {
        return new ConstructIndex(constructs, null);
    }
}
