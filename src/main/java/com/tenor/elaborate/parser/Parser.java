package com.tenor.elaborate.parser;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.tenor.elaborate.ElabError;
import com.tenor.elaborate.ElaborationException;
import com.tenor.elaborate.parser.RawConstruct.Construct;
import com.tenor.elaborate.parser.RawExpr.ExprNode;
import com.tenor.elaborate.parser.RawExpr.Term;
import com.tenor.elaborate.parser.RawStep.FailureHandler;
import com.tenor.elaborate.parser.RawStep.Step;
import com.tenor.elaborate.parser.RawStep.Target;

/**
 * Recursive-descent parser for one contract file. Commas between fields and
 * list items are optional.
 */
public class Parser {
    private final List<Token> tokens;
    private final String file;
    private int current = 0;

    public Parser(List<Token> tokens, String file) {
        this.tokens = tokens;
        this.file = file;
    }

    /** Lexes and parses {@code source} in one call. */
    public static List<Construct> parse(String source, String file) {
        return new Parser(new Lexer(source, file).tokenize(), file).parse();
    }

    public List<Construct> parse() {
        List<Construct> constructs = new ArrayList<>();
        while (!isAtEnd()) {
            constructs.add(construct());
        }
        checkSystemFile(constructs);
        return constructs;
    }

    private void checkSystemFile(List<Construct> constructs) {
        Construct system = null;
        for (Construct c : constructs) {
            if (c instanceof RawConstruct.SystemDecl) {
                if (system != null) {
                    throw new ElaborationException(ElabError.lexical(file, c.line,
                            "multiple System declarations in a single file"));
                }
                system = c;
            }
        }
        if (system == null) return;
        for (Construct c : constructs) {
            if (!(c instanceof RawConstruct.SystemDecl) && !(c instanceof RawConstruct.Import)) {
                throw new ElaborationException(ElabError.lexical(file, c.line,
                        "System files may not contain contract constructs"));
            }
        }
    }

    private Construct construct() {
        Token t = peek();
        if (t.type != TokenType.WORD) {
            throw error(t, "expected construct keyword, got " + describe(t));
        }
        int line = t.line;
        switch (t.lexeme) {
            case "import": advance(); return new RawConstruct.Import(takeString(), file, line);
            case "type": advance(); return typeDecl(line);
            case "fact": advance(); return fact(line);
            case "entity": advance(); return entity(line);
            case "rule": advance(); return rule(line);
            case "operation": advance(); return operation(line);
            case "flow": advance(); return flow(line);
            case "persona": advance(); return new RawConstruct.Persona(takeWord(), file, line);
            case "source": advance(); return source(line);
            case "system": advance(); return system(line);
            default: throw error(t, "unexpected token '" + t.lexeme + "'");
        }
    }

    // ---------------- types ----------------

    private RawType type() {
        String name = takeWord();
        switch (name) {
            case "Bool": return RawType.bool();
            case "Date": return RawType.date();
            case "DateTime": return RawType.dateTime();
            case "Int": {
                if (!match(TokenType.LEFT_PAREN)) return RawType.integer(Long.MIN_VALUE, Long.MAX_VALUE);
                skipKey("min");
                long min = takeInt();
                match(TokenType.COMMA);
                skipKey("max");
                long max = takeInt();
                consume(TokenType.RIGHT_PAREN, "expected ')'");
                return RawType.integer(min, max);
            }
            case "Decimal": {
                consume(TokenType.LEFT_PAREN, "expected '(' after Decimal");
                skipKey("precision");
                int precision = (int) takeInt();
                match(TokenType.COMMA);
                skipKey("scale");
                int scale = (int) takeInt();
                consume(TokenType.RIGHT_PAREN, "expected ')'");
                return RawType.decimal(precision, scale);
            }
            case "Text": {
                if (!match(TokenType.LEFT_PAREN)) return RawType.text(0);
                skipKey("max_length");
                int maxLength = (int) takeInt();
                consume(TokenType.RIGHT_PAREN, "expected ')'");
                return RawType.text(maxLength);
            }
            case "Money": {
                consume(TokenType.LEFT_PAREN, "expected '(' after Money");
                skipKey("currency");
                String currency = takeString();
                consume(TokenType.RIGHT_PAREN, "expected ')'");
                return RawType.money(currency);
            }
            case "Duration": {
                consume(TokenType.LEFT_PAREN, "expected '(' after Duration");
                String unit = "";
                long min = 0;
                long max = Long.MAX_VALUE;
                while (!check(TokenType.RIGHT_PAREN)) {
                    String key = takeKey();
                    switch (key) {
                        case "unit": unit = takeString(); break;
                        case "min": min = takeInt(); break;
                        case "max": max = takeInt(); break;
                        default: throw error(previous(), "unknown Duration param '" + key + "'");
                    }
                    match(TokenType.COMMA);
                }
                consume(TokenType.RIGHT_PAREN, "expected ')'");
                return RawType.duration(unit, min, max);
            }
            case "Enum": {
                consume(TokenType.LEFT_PAREN, "expected '(' after Enum");
                skipKey("values");
                List<String> values = stringArray();
                consume(TokenType.RIGHT_PAREN, "expected ')'");
                return RawType.enumOf(values);
            }
            case "List": {
                consume(TokenType.LEFT_PAREN, "expected '(' after List");
                RawType element = null;
                int max = 0;
                while (!check(TokenType.RIGHT_PAREN)) {
                    String key = takeKey();
                    switch (key) {
                        case "element_type": element = type(); break;
                        case "max": max = (int) takeInt(); break;
                        default: throw error(previous(), "unknown List param '" + key + "'");
                    }
                    match(TokenType.COMMA);
                }
                consume(TokenType.RIGHT_PAREN, "expected ')'");
                if (element == null) throw error(previous(), "List missing element_type");
                return RawType.list(element, max);
            }
            case "Record":
                return RawType.record(fieldBlock("fields"));
            case "TaggedUnion":
                return RawType.taggedUnion(fieldBlock("variants"));
            default:
                return RawType.ref(name);
        }
    }

    /** {@code ( [key:] { name: Type, ... } )} or a bare {@code { ... }}. */
    private Map<String, RawType> fieldBlock(String key) {
        boolean paren = match(TokenType.LEFT_PAREN);
        if (paren) skipKey(key);
        Map<String, RawType> fields = typedFields();
        if (paren) consume(TokenType.RIGHT_PAREN, "expected ')'");
        return fields;
    }

    private Map<String, RawType> typedFields() {
        consume(TokenType.LEFT_BRACE, "expected '{'");
        Map<String, RawType> fields = new LinkedHashMap<>();
        while (!check(TokenType.RIGHT_BRACE)) {
            String name = takeKey();
            fields.put(name, type());
            match(TokenType.COMMA);
        }
        consume(TokenType.RIGHT_BRACE, "expected '}'");
        return fields;
    }

    // ---------------- literals ----------------

    private RawLiteral literal() {
        Token t = peek();
        switch (t.type) {
            case INT: advance(); return RawLiteral.ofInt((Long) t.literal);
            case FLOAT: advance(); return RawLiteral.ofFloat((BigDecimal) t.literal);
            case STRING: advance(); return RawLiteral.ofString((String) t.literal);
            case WORD:
                if (t.lexeme.equals("true")) { advance(); return RawLiteral.ofBool(true); }
                if (t.lexeme.equals("false")) { advance(); return RawLiteral.ofBool(false); }
                if (t.lexeme.equals("Money")) { advance(); return moneyLiteral(); }
                break;
            default:
                break;
        }
        throw error(t, "expected literal value, got " + describe(t));
    }

    private RawLiteral moneyLiteral() {
        consume(TokenType.LEFT_BRACE, "expected '{' after Money");
        String amount = "0";
        String currency = "";
        while (!check(TokenType.RIGHT_BRACE)) {
            String key = takeKey();
            switch (key) {
                case "amount": amount = takeString(); break;
                case "currency": currency = takeString(); break;
                default: throw error(previous(), "unknown Money key '" + key + "'");
            }
            match(TokenType.COMMA);
        }
        consume(TokenType.RIGHT_BRACE, "expected '}'");
        try {
            return RawLiteral.ofMoney(new BigDecimal(amount), currency);
        } catch (NumberFormatException e) {
            throw error(previous(), "invalid Money amount '" + amount + "'");
        }
    }

    // ---------------- expressions ----------------

    ExprNode expression() {
        return or();
    }

    private ExprNode or() {
        ExprNode left = and();
        while (match(TokenType.OR)) {
            left = new RawExpr.Or(left, and());
        }
        return left;
    }

    private ExprNode and() {
        ExprNode left = unary();
        while (match(TokenType.AND)) {
            left = new RawExpr.And(left, unary());
        }
        return left;
    }

    private ExprNode unary() {
        if (match(TokenType.NOT)) {
            return new RawExpr.Not(atom());
        }
        return atom();
    }

    private ExprNode atom() {
        if (check(TokenType.FORALL) || check(TokenType.EXISTS)) {
            Token q = advance();
            String var = takeWord();
            if (!match(TokenType.IN)) throw error(peek(), "expected ∈ after quantifier variable");
            String domain = takeWord();
            if (!match(TokenType.DOT)) throw error(peek(), "expected '.' after quantifier domain");
            ExprNode body = expression();
            return new RawExpr.Quantifier(q.type == TokenType.FORALL, var, domain, body, q.line);
        }
        if (isWord("verdict_present")) {
            int line = advance().line;
            consume(TokenType.LEFT_PAREN, "expected '(' after verdict_present");
            String id = takeWord();
            consume(TokenType.RIGHT_PAREN, "expected ')'");
            return new RawExpr.VerdictPresent(id, line);
        }
        if (match(TokenType.LEFT_PAREN)) {
            ExprNode e = expression();
            consume(TokenType.RIGHT_PAREN, "expected ')'");
            return e;
        }
        int line = peek().line;
        Term left = term();
        String op = compareOp();
        Term right = term();
        return new RawExpr.Compare(left, op, right, line);
    }

    private String compareOp() {
        Token t = peek();
        String op;
        switch (t.type) {
            case EQUAL: op = "="; break;
            case BANG_EQUAL: op = "!="; break;
            case LESS: op = "<"; break;
            case LESS_EQUAL: op = "<="; break;
            case GREATER: op = ">"; break;
            case GREATER_EQUAL: op = ">="; break;
            default: throw error(t, "expected comparison operator, got " + describe(t));
        }
        advance();
        return op;
    }

    private Term term() {
        Term left = baseTerm();
        if (match(TokenType.STAR)) {
            return new RawExpr.Mul(left, baseTerm());
        }
        return left;
    }

    private Term baseTerm() {
        Token t = peek();
        if (t.type == TokenType.WORD && !t.lexeme.equals("true") && !t.lexeme.equals("false")
                && !t.lexeme.equals("Money")) {
            advance();
            if (match(TokenType.DOT)) {
                return new RawExpr.FieldRef(t.lexeme, takeWord());
            }
            return new RawExpr.FactRef(t.lexeme);
        }
        if (t.type == TokenType.WORD || t.type == TokenType.INT || t.type == TokenType.FLOAT
                || t.type == TokenType.STRING) {
            return new RawExpr.Literal(literal());
        }
        throw error(t, "expected term, got " + describe(t));
    }

    // ---------------- constructs ----------------

    private Construct typeDecl(int line) {
        String id = takeWord();
        return new RawConstruct.TypeDecl(id, typedFields(), file, line);
    }

    private Construct fact(int line) {
        String id = takeWord();
        consume(TokenType.LEFT_BRACE, "expected '{' after fact id");
        RawType type = null;
        RawConstruct.FactSource source = null;
        RawLiteral def = null;
        while (!check(TokenType.RIGHT_BRACE)) {
            String key = takeKey();
            switch (key) {
                case "type": type = type(); break;
                case "source": source = factSource(); break;
                case "default": def = literal(); break;
                default: throw error(previous(), "unknown Fact field '" + key + "'");
            }
            match(TokenType.COMMA);
        }
        consume(TokenType.RIGHT_BRACE, "expected '}'");
        if (type == null) throw error(previous(), "Fact missing 'type'");
        if (source == null) throw error(previous(), "Fact missing 'source'");
        return new RawConstruct.Fact(id, type, source, def, file, line);
    }

    private RawConstruct.FactSource factSource() {
        if (check(TokenType.STRING)) {
            return RawConstruct.FactSource.freetext(takeString());
        }
        String sourceId = takeWord();
        consume(TokenType.LEFT_BRACE, "expected '{' after source id");
        expectWord("path");
        consume(TokenType.COLON, "expected ':'");
        String path = takeString();
        consume(TokenType.RIGHT_BRACE, "expected '}'");
        return RawConstruct.FactSource.structured(sourceId, path);
    }

    private Construct source(int line) {
        String id = takeWord();
        consume(TokenType.LEFT_BRACE, "expected '{' after source id");
        String protocol = null;
        String description = null;
        Map<String, String> fields = new LinkedHashMap<>();
        while (!check(TokenType.RIGHT_BRACE)) {
            String key = takeKey();
            switch (key) {
                case "protocol": protocol = protocolTag(); break;
                case "description": description = takeString(); break;
                default: fields.put(key, check(TokenType.STRING) ? takeString() : takeWord());
            }
            match(TokenType.COMMA);
        }
        consume(TokenType.RIGHT_BRACE, "expected '}'");
        if (protocol == null) throw error(previous(), "Source missing 'protocol'");
        return new RawConstruct.Source(id, protocol, fields, description, file, line);
    }

    private String protocolTag() {
        StringBuilder tag = new StringBuilder(takeWord());
        while (match(TokenType.DOT)) {
            tag.append('.').append(takeWord());
        }
        return tag.toString();
    }

    private Construct entity(int line) {
        String id = takeWord();
        consume(TokenType.LEFT_BRACE, "expected '{' after entity id");
        List<String> states = new ArrayList<>();
        String initial = "";
        int initialLine = line;
        List<RawConstruct.Transition> transitions = new ArrayList<>();
        String parent = null;
        int parentLine = 0;
        while (!check(TokenType.RIGHT_BRACE)) {
            int fieldLine = peek().line;
            String key = takeKey();
            switch (key) {
                case "states": states = wordArray(); break;
                case "initial": initialLine = fieldLine; initial = takeWord(); break;
                case "transitions": transitions = transitions(); break;
                case "parent": parentLine = fieldLine; parent = takeWord(); break;
                default: throw error(previous(), "unknown Entity field '" + key + "'");
            }
            match(TokenType.COMMA);
        }
        consume(TokenType.RIGHT_BRACE, "expected '}'");
        return new RawConstruct.Entity(id, states, initial, initialLine, transitions, parent, parentLine, file, line);
    }

    private List<RawConstruct.Transition> transitions() {
        consume(TokenType.LEFT_BRACKET, "expected '['");
        List<RawConstruct.Transition> out = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACKET)) {
            int line = peek().line;
            consume(TokenType.LEFT_PAREN, "expected '(' before transition");
            String from = takeWord();
            if (!match(TokenType.COMMA, TokenType.ARROW)) {
                throw error(peek(), "expected ',' or '->' in transition, got " + describe(peek()));
            }
            String to = takeWord();
            consume(TokenType.RIGHT_PAREN, "expected ')' after transition");
            out.add(new RawConstruct.Transition(from, to, line));
            match(TokenType.COMMA);
        }
        consume(TokenType.RIGHT_BRACKET, "expected ']'");
        return out;
    }

    private Construct rule(int line) {
        String id = takeWord();
        consume(TokenType.LEFT_BRACE, "expected '{' after rule id");
        Long stratum = null;
        int stratumLine = line;
        ExprNode when = null;
        String verdictType = "";
        RawType payloadType = RawType.bool();
        Term payloadValue = new RawExpr.Literal(RawLiteral.ofBool(true));
        int produceLine = line;
        while (!check(TokenType.RIGHT_BRACE)) {
            int fieldLine = peek().line;
            String key = takeKey();
            switch (key) {
                case "stratum":
                    stratumLine = fieldLine;
                    stratum = takeInt();
                    break;
                case "when":
                    when = expression();
                    break;
                case "produce": {
                    produceLine = fieldLine;
                    expectWord("verdict");
                    verdictType = takeWord();
                    consume(TokenType.LEFT_BRACE, "expected '{' after verdict type");
                    expectWord("payload");
                    consume(TokenType.COLON, "expected ':'");
                    payloadType = type();
                    consume(TokenType.EQUAL, "expected '=', got " + describe(peek()));
                    payloadValue = term();
                    consume(TokenType.RIGHT_BRACE, "expected '}'");
                    break;
                }
                default:
                    throw error(previous(), "unknown Rule field '" + key + "'");
            }
            match(TokenType.COMMA);
        }
        consume(TokenType.RIGHT_BRACE, "expected '}'");
        if (stratum == null) throw error(previous(), "Rule missing 'stratum'");
        if (when == null) throw error(previous(), "Rule missing 'when'");
        return new RawConstruct.Rule(id, stratum, stratumLine, when, verdictType, payloadType,
                payloadValue, produceLine, file, line);
    }

    private Construct operation(int line) {
        String id = takeWord();
        consume(TokenType.LEFT_BRACE, "expected '{' after operation id");
        List<String> personas = new ArrayList<>();
        int personasLine = line;
        ExprNode precondition = null;
        List<RawConstruct.Effect> effects = new ArrayList<>();
        List<String> errorContract = new ArrayList<>();
        List<String> outcomes = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACE)) {
            int fieldLine = peek().line;
            String key = takeKey();
            switch (key) {
                case "allowed_personas": personasLine = fieldLine; personas = wordArray(); break;
                case "precondition": precondition = expression(); break;
                case "effects": effects = effects(); break;
                case "error_contract": errorContract = wordArray(); break;
                case "outcomes": outcomes = wordArray(); break;
                default: throw error(previous(), "unknown Operation field '" + key + "'");
            }
            match(TokenType.COMMA);
        }
        consume(TokenType.RIGHT_BRACE, "expected '}'");
        if (precondition == null) throw error(previous(), "Operation missing 'precondition'");
        return new RawConstruct.Operation(id, personas, personasLine, precondition, effects,
                errorContract, outcomes, file, line);
    }

    private List<RawConstruct.Effect> effects() {
        consume(TokenType.LEFT_BRACKET, "expected '['");
        List<RawConstruct.Effect> out = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACKET)) {
            int line = peek().line;
            consume(TokenType.LEFT_PAREN, "expected '(' before effect");
            String entity = takeWord();
            consume(TokenType.COMMA, "expected ','");
            String from = takeWord();
            consume(TokenType.COMMA, "expected ','");
            String to = takeWord();
            String outcome = null;
            if (match(TokenType.COMMA) && check(TokenType.WORD)) {
                outcome = takeWord();
            }
            consume(TokenType.RIGHT_PAREN, "expected ')' after effect");
            out.add(new RawConstruct.Effect(entity, from, to, outcome, line));
            match(TokenType.COMMA);
        }
        consume(TokenType.RIGHT_BRACKET, "expected ']'");
        return out;
    }

    private Construct flow(int line) {
        String id = takeWord();
        consume(TokenType.LEFT_BRACE, "expected '{' after flow id");
        String snapshot = "";
        String entry = "";
        int entryLine = line;
        Map<String, Step> steps = new LinkedHashMap<>();
        while (!check(TokenType.RIGHT_BRACE)) {
            int fieldLine = peek().line;
            String key = takeKey();
            switch (key) {
                case "snapshot": snapshot = takeWord(); break;
                case "entry": entryLine = fieldLine; entry = takeWord(); break;
                case "steps": steps = steps(); break;
                default: throw error(previous(), "unknown Flow field '" + key + "'");
            }
            match(TokenType.COMMA);
        }
        consume(TokenType.RIGHT_BRACE, "expected '}'");
        return new RawConstruct.Flow(id, snapshot, entry, entryLine, steps, file, line);
    }

    private Construct system(int line) {
        String id = takeWord();
        consume(TokenType.LEFT_BRACE, "expected '{' after system id");
        List<RawConstruct.Member> members = new ArrayList<>();
        List<RawConstruct.Shared> sharedPersonas = new ArrayList<>();
        List<RawConstruct.Shared> sharedEntities = new ArrayList<>();
        List<RawConstruct.Trigger> triggers = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACE)) {
            String key = takeKey();
            switch (key) {
                case "members": {
                    consume(TokenType.LEFT_BRACKET, "expected '['");
                    while (!check(TokenType.RIGHT_BRACKET)) {
                        String member = takeKey();
                        members.add(new RawConstruct.Member(member, takeString()));
                        match(TokenType.COMMA);
                    }
                    consume(TokenType.RIGHT_BRACKET, "expected ']'");
                    break;
                }
                case "shared_personas": sharedPersonas = sharedList("persona"); break;
                case "shared_entities": sharedEntities = sharedList("entity"); break;
                case "triggers": triggers = triggers(); break;
                default: throw error(previous(), "unknown System field '" + key + "'");
            }
            match(TokenType.COMMA);
        }
        consume(TokenType.RIGHT_BRACE, "expected '}'");
        return new RawConstruct.SystemDecl(id, members, sharedPersonas, sharedEntities, triggers, file, line);
    }

    /** {@code [ { <nameKey>: id, contracts: [a, b] }, ... ]} */
    private List<RawConstruct.Shared> sharedList(String nameKey) {
        consume(TokenType.LEFT_BRACKET, "expected '['");
        List<RawConstruct.Shared> out = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACKET)) {
            consume(TokenType.LEFT_BRACE, "expected '{'");
            String name = "";
            List<String> contracts = new ArrayList<>();
            while (!check(TokenType.RIGHT_BRACE)) {
                String key = takeKey();
                if (key.equals(nameKey)) name = takeWord();
                else if (key.equals("contracts")) contracts = wordArray();
                else throw error(previous(), "unknown shared_" + nameKey + "s field '" + key + "'");
                match(TokenType.COMMA);
            }
            consume(TokenType.RIGHT_BRACE, "expected '}'");
            out.add(new RawConstruct.Shared(name, contracts));
            match(TokenType.COMMA);
        }
        consume(TokenType.RIGHT_BRACKET, "expected ']'");
        return out;
    }

    private List<RawConstruct.Trigger> triggers() {
        consume(TokenType.LEFT_BRACKET, "expected '['");
        List<RawConstruct.Trigger> out = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACKET)) {
            consume(TokenType.LEFT_BRACE, "expected '{'");
            String[] source = {"", ""};
            String[] target = {"", ""};
            String on = "";
            String persona = "";
            while (!check(TokenType.RIGHT_BRACE)) {
                String key = takeKey();
                switch (key) {
                    case "source": source = qualifiedFlow("source"); break;
                    case "target": target = qualifiedFlow("target"); break;
                    case "on": on = takeWord(); break;
                    case "persona": persona = takeWord(); break;
                    default: throw error(previous(), "unknown trigger field '" + key + "'");
                }
                match(TokenType.COMMA);
            }
            consume(TokenType.RIGHT_BRACE, "expected '}'");
            out.add(new RawConstruct.Trigger(source[0], source[1], on, target[0], target[1], persona));
            match(TokenType.COMMA);
        }
        consume(TokenType.RIGHT_BRACKET, "expected ']'");
        return out;
    }

    private String[] qualifiedFlow(String role) {
        String contract = takeWord();
        if (!match(TokenType.DOT)) throw error(peek(), "expected '.' after " + role + " contract in trigger");
        return new String[] {contract, takeWord()};
    }

    // ---------------- flow steps ----------------

    private Map<String, Step> steps() {
        consume(TokenType.LEFT_BRACE, "expected '{' before steps");
        Map<String, Step> steps = new LinkedHashMap<>();
        while (!check(TokenType.RIGHT_BRACE)) {
            int line = peek().line;
            String id = takeKey();
            String kind = takeWord();
            steps.put(id, stepBody(kind, line));
            match(TokenType.COMMA);
        }
        consume(TokenType.RIGHT_BRACE, "expected '}'");
        return steps;
    }

    private Step stepBody(String kind, int line) {
        Token kindToken = previous();
        consume(TokenType.LEFT_BRACE, "expected '{' after step kind");
        Step step;
        switch (kind) {
            case "OperationStep": step = operationStep(line); break;
            case "BranchStep": step = branchStep(line); break;
            case "HandoffStep": step = handoffStep(line); break;
            case "SubFlowStep": step = subFlowStep(line); break;
            case "ParallelStep": step = parallelStep(line); break;
            default: throw error(kindToken, "unknown step kind '" + kind + "'");
        }
        consume(TokenType.RIGHT_BRACE, "expected '}' after step body");
        return step;
    }

    private Step operationStep(int line) {
        String op = "";
        String persona = "";
        Map<String, Target> outcomes = new LinkedHashMap<>();
        FailureHandler onFailure = null;
        while (!check(TokenType.RIGHT_BRACE)) {
            String key = takeKey();
            switch (key) {
                case "op": op = takeWord(); break;
                case "persona": persona = takeWord(); break;
                case "outcomes": {
                    consume(TokenType.LEFT_BRACE, "expected '{'");
                    while (!check(TokenType.RIGHT_BRACE)) {
                        String label = takeKey();
                        outcomes.put(label, target());
                        match(TokenType.COMMA);
                    }
                    consume(TokenType.RIGHT_BRACE, "expected '}'");
                    break;
                }
                case "on_failure": onFailure = failureHandler(); break;
                default: throw error(previous(), "unknown OperationStep field '" + key + "'");
            }
            match(TokenType.COMMA);
        }
        return new RawStep.OperationStep(op, persona, outcomes, onFailure, line);
    }

    private Step branchStep(int line) {
        ExprNode condition = null;
        String persona = "";
        Target ifTrue = null;
        Target ifFalse = null;
        while (!check(TokenType.RIGHT_BRACE)) {
            String key = takeKey();
            switch (key) {
                case "condition": condition = expression(); break;
                case "persona": persona = takeWord(); break;
                case "if_true": ifTrue = target(); break;
                case "if_false": ifFalse = target(); break;
                default: throw error(previous(), "unknown BranchStep field '" + key + "'");
            }
            match(TokenType.COMMA);
        }
        if (condition == null) throw error(peek(), "BranchStep missing condition");
        if (ifTrue == null) throw error(peek(), "BranchStep missing if_true");
        if (ifFalse == null) throw error(peek(), "BranchStep missing if_false");
        return new RawStep.BranchStep(condition, persona, ifTrue, ifFalse, line);
    }

    private Step handoffStep(int line) {
        String from = "";
        String to = "";
        String next = "";
        int nextLine = line;
        while (!check(TokenType.RIGHT_BRACE)) {
            int fieldLine = peek().line;
            String key = takeKey();
            switch (key) {
                case "from_persona": from = takeWord(); break;
                case "to_persona": to = takeWord(); break;
                case "next": nextLine = fieldLine; next = takeWord(); break;
                default: throw error(previous(), "unknown HandoffStep field '" + key + "'");
            }
            match(TokenType.COMMA);
        }
        return new RawStep.HandoffStep(from, to, next, nextLine, line);
    }

    private Step subFlowStep(int line) {
        String flow = "";
        int flowLine = line;
        String persona = "";
        Target onSuccess = null;
        FailureHandler onFailure = null;
        while (!check(TokenType.RIGHT_BRACE)) {
            int fieldLine = peek().line;
            String key = takeKey();
            switch (key) {
                case "flow": flowLine = fieldLine; flow = takeWord(); break;
                case "persona": persona = takeWord(); break;
                case "on_success": onSuccess = target(); break;
                case "on_failure": onFailure = failureHandler(); break;
                default: throw error(previous(), "unknown SubFlowStep field '" + key + "'");
            }
            match(TokenType.COMMA);
        }
        if (onSuccess == null) throw error(peek(), "SubFlowStep missing on_success");
        if (onFailure == null) throw error(peek(), "SubFlowStep missing on_failure");
        return new RawStep.SubFlowStep(flow, flowLine, persona, onSuccess, onFailure, line);
    }

    private Step parallelStep(int line) {
        List<RawStep.Branch> branches = new ArrayList<>();
        int branchesLine = line;
        RawStep.JoinPolicy join = null;
        while (!check(TokenType.RIGHT_BRACE)) {
            int fieldLine = peek().line;
            String key = takeKey();
            switch (key) {
                case "branches": {
                    branchesLine = fieldLine;
                    consume(TokenType.LEFT_BRACKET, "expected '['");
                    while (!check(TokenType.RIGHT_BRACKET)) {
                        branches.add(branch());
                        match(TokenType.COMMA);
                    }
                    consume(TokenType.RIGHT_BRACKET, "expected ']'");
                    break;
                }
                case "join": join = joinPolicy(); break;
                default: throw error(previous(), "unknown ParallelStep field '" + key + "'");
            }
            match(TokenType.COMMA);
        }
        if (join == null) throw error(peek(), "ParallelStep missing join");
        return new RawStep.ParallelStep(branches, branchesLine, join, line);
    }

    private RawStep.Branch branch() {
        expectWord("Branch");
        consume(TokenType.LEFT_BRACE, "expected '{' after Branch");
        String id = "";
        String entry = "";
        Map<String, Step> steps = new LinkedHashMap<>();
        while (!check(TokenType.RIGHT_BRACE)) {
            String key = takeKey();
            switch (key) {
                case "id": id = takeWord(); break;
                case "entry": entry = takeWord(); break;
                case "steps": steps = steps(); break;
                default: throw error(previous(), "unknown Branch field '" + key + "'");
            }
            match(TokenType.COMMA);
        }
        consume(TokenType.RIGHT_BRACE, "expected '}'");
        return new RawStep.Branch(id, entry, steps);
    }

    private RawStep.JoinPolicy joinPolicy() {
        expectWord("JoinPolicy");
        consume(TokenType.LEFT_BRACE, "expected '{' after JoinPolicy");
        Target onAllSuccess = null;
        FailureHandler onAnyFailure = null;
        Target onAllComplete = null;
        while (!check(TokenType.RIGHT_BRACE)) {
            String key = takeKey();
            switch (key) {
                case "on_all_success": onAllSuccess = target(); break;
                case "on_any_failure": onAnyFailure = failureHandler(); break;
                case "on_all_complete":
                    if (isWord("null")) advance();
                    else onAllComplete = target();
                    break;
                default: throw error(previous(), "unknown JoinPolicy field '" + key + "'");
            }
            match(TokenType.COMMA);
        }
        consume(TokenType.RIGHT_BRACE, "expected '}'");
        return new RawStep.JoinPolicy(onAllSuccess, onAnyFailure, onAllComplete);
    }

    private Target target() {
        if (isWord("Terminal")) {
            return Target.terminal(terminalOutcome());
        }
        int line = peek().line;
        return Target.step(takeWord(), line);
    }

    private String terminalOutcome() {
        expectWord("Terminal");
        consume(TokenType.LEFT_PAREN, "expected '(' after Terminal");
        String outcome = takeWord();
        consume(TokenType.RIGHT_PAREN, "expected ')'");
        return outcome;
    }

    private FailureHandler failureHandler() {
        Token kind = peek();
        String name = takeWord();
        consume(TokenType.LEFT_PAREN, "expected '(' after " + name);
        FailureHandler handler;
        switch (name) {
            case "Terminate": {
                skipKey("outcome");
                handler = FailureHandler.terminate(takeWord(), kind.line);
                break;
            }
            case "Compensate": {
                List<RawStep.CompStep> steps = new ArrayList<>();
                String then = "";
                while (!check(TokenType.RIGHT_PAREN)) {
                    String key = takeKey();
                    switch (key) {
                        case "steps": steps = compSteps(); break;
                        case "then": then = terminalOutcome(); break;
                        default: throw error(previous(), "unknown Compensate field '" + key + "'");
                    }
                    match(TokenType.COMMA);
                }
                handler = FailureHandler.compensate(steps, then, kind.line);
                break;
            }
            case "Escalate": {
                String to = "";
                String next = "";
                while (!check(TokenType.RIGHT_PAREN)) {
                    String key = takeKey();
                    switch (key) {
                        case "to":
                        case "to_persona": to = takeWord(); break;
                        case "next": next = takeWord(); break;
                        default: throw error(previous(), "unknown Escalate field '" + key + "'");
                    }
                    match(TokenType.COMMA);
                }
                handler = FailureHandler.escalate(to, next, kind.line);
                break;
            }
            default:
                throw error(kind, "unknown failure handler kind '" + name + "'");
        }
        consume(TokenType.RIGHT_PAREN, "expected ')' after " + name);
        return handler;
    }

    private List<RawStep.CompStep> compSteps() {
        consume(TokenType.LEFT_BRACKET, "expected '['");
        List<RawStep.CompStep> out = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACKET)) {
            consume(TokenType.LEFT_BRACE, "expected '{'");
            String op = "";
            String persona = "";
            String onFailure = "";
            while (!check(TokenType.RIGHT_BRACE)) {
                String key = takeKey();
                switch (key) {
                    case "op": op = takeWord(); break;
                    case "persona": persona = takeWord(); break;
                    case "on_failure": onFailure = terminalOutcome(); break;
                    default: throw error(previous(), "unknown comp step field '" + key + "'");
                }
                match(TokenType.COMMA);
            }
            consume(TokenType.RIGHT_BRACE, "expected '}'");
            out.add(new RawStep.CompStep(op, persona, onFailure));
            match(TokenType.COMMA);
        }
        consume(TokenType.RIGHT_BRACKET, "expected ']'");
        return out;
    }

    // ---------------- token helpers ----------------

    private List<String> wordArray() {
        consume(TokenType.LEFT_BRACKET, "expected '['");
        List<String> items = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACKET)) {
            items.add(takeWord());
            match(TokenType.COMMA);
        }
        consume(TokenType.RIGHT_BRACKET, "expected ']'");
        return items;
    }

    private List<String> stringArray() {
        consume(TokenType.LEFT_BRACKET, "expected '['");
        List<String> items = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACKET)) {
            items.add(takeString());
            match(TokenType.COMMA);
        }
        consume(TokenType.RIGHT_BRACKET, "expected ']'");
        return items;
    }

    /** A field name followed by ':'. */
    private String takeKey() {
        String key = takeWord();
        consume(TokenType.COLON, "expected ':' after '" + key + "'");
        return key;
    }

    /** Consumes an optional {@code key:} prefix of a positional parameter. */
    private void skipKey(String key) {
        if (isWord(key) && peekNext().type == TokenType.COLON) {
            advance();
            advance();
        }
    }

    private void expectWord(String w) {
        if (!isWord(w)) throw error(peek(), "expected '" + w + "', got " + describe(peek()));
        advance();
    }

    private String takeWord() {
        return consume(TokenType.WORD, "expected identifier, got " + describe(peek())).lexeme;
    }

    private String takeString() {
        return (String) consume(TokenType.STRING, "expected string, got " + describe(peek())).literal;
    }

    private long takeInt() {
        return (Long) consume(TokenType.INT, "expected integer, got " + describe(peek())).literal;
    }

    private boolean isWord(String w) {
        return check(TokenType.WORD) && peek().lexeme.equals(w);
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }
    private Token peek() { return tokens.get(current); }
    private Token peekNext() { return tokens.get(Math.min(current + 1, tokens.size() - 1)); }
    private Token previous() { return tokens.get(current - 1); }

    private static String describe(Token t) {
        return t.type == TokenType.EOF ? "end of file" : "'" + t.lexeme + "'";
    }

    private ElaborationException error(Token token, String message) {
        return new ElaborationException(ElabError.lexical(file, token.line, message));
    }
}
