package work.lcod.preview.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import work.lcod.preview.model.PropertyValue;

class ArgumentListTest {
    @Test
    void splitsOutsideQuotesAndBrackets() {
        var parts = ArgumentList.split("root, text=\"a, b\", padx=(1, 2), values=['x', 'y']");
        assertEquals(4, parts.size());
        assertEquals(" text=\"a, b\"", parts.get(1));
        assertEquals(" padx=(1, 2)", parts.get(2));
    }

    @Test
    void readsParentAndKeywords() {
        var args = ArgumentList.parse("frame, text='Hi', width=10");
        assertEquals(Optional.of("frame"), args.parent());
        assertEquals(PropertyValue.text("Hi"), args.keywords().get("text").orElseThrow());
        assertEquals(PropertyValue.integer(10), args.keywords().get("width").orElseThrow());
    }

    @Test
    void comparisonIsNotAKeyword() {
        var args = ArgumentList.parse("x == 1");
        assertTrue(args.keywords().isEmpty());
        assertEquals(List.of("x == 1"), args.positional());
    }

    @Test
    void typesLiterals() {
        assertEquals(PropertyValue.bool(true), ArgumentList.parseLiteral("True"));
        assertEquals(PropertyValue.none(), ArgumentList.parseLiteral("None"));
        assertEquals(PropertyValue.integer(-4), ArgumentList.parseLiteral("-4"));
        assertEquals(PropertyValue.decimal(0.5), ArgumentList.parseLiteral(".5"));
        assertEquals(PropertyValue.text("nsew"), ArgumentList.parseLiteral("'nsew'"));
        assertEquals(PropertyValue.symbol("tk.LEFT"), ArgumentList.parseLiteral("tk.LEFT"));
        assertEquals(PropertyValue.symbol("\"unterminated"), ArgumentList.parseLiteral("\"unterminated"));
    }

    @Test
    void keepsLargeIntegersExact() {
        var value = ArgumentList.parseLiteral("9007199254740993");
        assertEquals(PropertyValue.integer(9007199254740993L), value);
        assertEquals("9007199254740993", value.display());
        assertEquals(9007199254740993L, value.toPlain());
        assertEquals(PropertyValue.decimal(1e20), ArgumentList.parseLiteral("100000000000000000000"));
    }

    @Test
    void findsMatchingParenthesis() {
        String call = "f(a, g(b), ')')";
        assertEquals(call.length() - 1, ArgumentList.findClosingParen(call, 1));
        assertEquals(-1, ArgumentList.findClosingParen("f(a, b", 1));
        assertEquals(-1, ArgumentList.findClosingParen("f(a)", 0));
    }
}
