import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tenor.elaborate.ElabError;
import com.tenor.elaborate.ElaborationException;
import com.tenor.elaborate.parser.Lexer;
import com.tenor.elaborate.parser.Token;
import com.tenor.elaborate.parser.TokenType;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TenorParserTest {

    private static ElabError failure(String source) {
        ElaborationException e = assertThrows(ElaborationException.class, () -> TenorFixtures.elaborate(source));
        return e.error();
    }

    @Test
    public void lexer_unicodeAndAsciiOperatorsProduceSameTokens() {
        List<Token> unicode = new Lexer("a ∧ b ∨ ¬ c → d", "t.tenor").tokenize();
        List<Token> ascii = new Lexer("a and b or not c -> d", "t.tenor").tokenize();
        assertEquals(unicode.size(), ascii.size());
        for (int i = 0; i < unicode.size(); i++) {
            assertEquals(unicode.get(i).type, ascii.get(i).type, "token " + i);
        }
        assertEquals(TokenType.AND, unicode.get(1).type);
        assertEquals(TokenType.ARROW, unicode.get(6).type);
    }

    @Test
    public void lexer_negativeNumbersAndComments() {
        List<Token> tokens = new Lexer(String.join("\n",
                "// leading comment",
                "x /* block",
                "   spans lines */ -42 3.50"), "t.tenor").tokenize();
        assertEquals(TokenType.WORD, tokens.get(0).type);
        assertEquals(TokenType.INT, tokens.get(1).type);
        assertEquals(-42L, tokens.get(1).literal);
        assertEquals(3, tokens.get(1).line);
        assertEquals(TokenType.FLOAT, tokens.get(2).type);
    }

    @Test
    public void lexer_unterminatedString_isPassZeroError() {
        ElabError err = failure("fact x { type: Bool, source: \"sys.x }");
        assertEquals(0, err.pass);
        assertEquals("unterminated string literal", err.message);
        assertNull(err.constructKind);
        assertNull(err.constructId);
        assertNull(err.field);
        assertEquals("contract.tenor", err.file);
    }

    @Test
    public void lexer_unterminatedBlockComment() {
        ElabError err = failure("persona p\n/* never closed");
        assertEquals("unterminated block comment", err.message);
    }

    @Test
    public void lexer_unexpectedCharacter_reportsLine() {
        ElabError err = failure("persona p\npersona q\n#");
        assertEquals("unexpected character '#'", err.message);
        assertEquals(3, err.line);
    }

    @Test
    public void parser_factWithoutSource_isRejected() {
        ElabError err = failure("fact x { type: Bool }");
        assertEquals(0, err.pass);
        assertEquals("Fact missing 'source'", err.message);
    }

    @Test
    public void parser_ruleWithoutStratum_isRejected() {
        ElabError err = failure(String.join("\n",
                "fact x { type: Bool, source: \"s.x\" }",
                "rule r { when: x = true, produce: verdict v { payload: Bool = true } }"));
        assertEquals("Rule missing 'stratum'", err.message);
    }

    @Test
    public void parser_operationWithoutPrecondition_isRejected() {
        ElabError err = failure(String.join("\n",
                "persona p",
                "operation o { allowed_personas: [p], effects: [] }"));
        assertEquals("Operation missing 'precondition'", err.message);
    }

    @Test
    public void parser_unknownField_namesTheConstruct() {
        ElabError err = failure("fact x { type: Bool, source: \"s.x\", colour: red }");
        assertEquals("unknown Fact field 'colour'", err.message);
    }

    @Test
    public void parser_expressionWithoutOperator() {
        ElabError err = failure(String.join("\n",
                "fact x { type: Int, source: \"s.x\" }",
                "rule r {",
                "  stratum: 0",
                "  when: x }",
                "}"));
        assertTrue(err.message.startsWith("expected comparison operator"), err.message);
        assertEquals(4, err.line);
    }

    @Test
    public void parser_systemFileWithContractConstructs_isRejected() {
        ElabError err = failure(String.join("\n",
                "system s { members: [a: \"a.tenor\"] }",
                "persona p"));
        assertEquals("System files may not contain contract constructs", err.message);
    }

    @Test
    public void errorJson_alwaysWritesAllKeys() {
        ElabError err = failure("fact x { type: Bool }");
        ObjectNode json = err.toJson();
        assertEquals(7, json.size());
        assertTrue(json.get("construct_kind").isNull());
        assertTrue(json.get("construct_id").isNull());
        assertTrue(json.get("field").isNull());
        assertEquals(0, json.get("pass").asInt());
    }
}
