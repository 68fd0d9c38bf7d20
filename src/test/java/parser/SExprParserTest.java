package parser;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Arrays;
import java.util.Collections;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SExprParserTest {

    @Test
    void parsesNestedLists() {
        SExpr parsed = SExprParser.parse("(fp< 50.0 (heart-rate 12815))").get();
        assertEquals(Arrays.asList("fp<", "50.0", Arrays.asList("heart-rate", "12815")), parsed.toPlain());
        assertEquals("fp<", ((SExpr.Lst) parsed).head());
    }

    @Test
    void parsesBareAtom() {
        SExpr parsed = SExprParser.parse("  true ").get();
        assertFalse(parsed.isList());
        assertEquals("true", parsed.toPlain());
    }

    @Test
    void quotedStringsKeepSpacesAndParens() {
        SExpr.Lst parsed = (SExpr.Lst) SExprParser.parse("(= name \"Joe (the) Bloggs\")").get();
        SExpr.Atom name = (SExpr.Atom) parsed.get(2);
        assertTrue(name.isQuoted());
        assertEquals("Joe (the) Bloggs", name.getText());
        assertEquals("(= name \"Joe (the) Bloggs\")", parsed.toString());
    }

    @Test
    void onlyQuoteAndBackslashEscapesAreInterpreted() {
        SExpr.Atom atom = (SExpr.Atom) SExprParser.parse("\"a\\\"b\\\\c\\nd\"").get();
        assertEquals("a\"b\\c\\nd", atom.getText());
    }

    @Test
    void emptyListHasNoHead() {
        SExpr.Lst parsed = (SExpr.Lst) SExprParser.parse("()").get();
        assertEquals(0, parsed.size());
        assertNull(parsed.head());
        assertEquals(Collections.emptyList(), parsed.toPlain());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "(= a 1", "(= a 1))", ")", "(= name \"Joe)", "a b"})
    void malformedInputIsEmptyNotAnException(String text) {
        Optional<SExpr> parsed = SExprParser.parse(text);
        assertFalse(parsed.isPresent());
    }

    @Test
    void nullInputIsEmpty() {
        assertFalse(SExprParser.parse(null).isPresent());
    }

    @Test
    void deeplyNestedUnbalancedInputIsEmpty() {
        assertFalse(SExprParser.parse("(".repeat(200000)).isPresent());
        assertFalse(SExprParser.parse("(".repeat(200000) + ")".repeat(199999)).isPresent());
    }

    @Test
    void nestingIsLimited() {
        int depth = SExprParser.MAX_DEPTH;
        assertTrue(SExprParser.parse("(".repeat(depth) + ")".repeat(depth)).isPresent());
        assertFalse(SExprParser.parse("(".repeat(depth + 1) + ")".repeat(depth + 1)).isPresent());
    }
}
