package org.dxworks.mathframe.catalog;

import org.dxworks.mathframe.model.NodeIdGenerator;
import org.dxworks.mathframe.model.symbol.BinaryOperator;
import org.dxworks.mathframe.model.symbol.Digit;
import org.dxworks.mathframe.model.symbol.MathSymbol;
import org.dxworks.mathframe.model.symbol.Punctuation;
import org.dxworks.mathframe.model.symbol.Relation;
import org.dxworks.mathframe.model.symbol.Variable;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SymbolFactoryTest {

    private final NodeIdGenerator ids = new NodeIdGenerator();

    @Test
    void sourceCharactersGetDedicatedTypes() {
        assertInstanceOf(Digit.class, SymbolFactory.forSourceChar(ids, '7'));
        assertInstanceOf(Variable.class, SymbolFactory.forSourceChar(ids, 'x'));
        assertInstanceOf(BinaryOperator.class, SymbolFactory.forSourceChar(ids, '+'));
        assertInstanceOf(Relation.class, SymbolFactory.forSourceChar(ids, '='));
        assertInstanceOf(Punctuation.class, SymbolFactory.forSourceChar(ids, ','));
    }

    @Test
    void minusDisplaysAsMinusSignButSerializesAsHyphen() {
        MathSymbol minus = SymbolFactory.forSourceChar(ids, '-');

        assertEquals(SymbolFactory.MINUS_GLYPH, minus.getGlyph());
        assertEquals("-", minus.getLatexForm());
    }

    @Test
    void typedAsteriskBecomesCdot() {
        MathSymbol times = SymbolFactory.forTypedChar(ids, '*');

        assertEquals("·", times.getGlyph());
        assertEquals("\\cdot", times.getLatexForm());
    }

    @Test
    void definitionsProduceClassifiedSymbols() {
        CommandDefinition neq = CommandCatalog.getDefault().lookup("neq").orElseThrow();

        MathSymbol symbol = SymbolFactory.forDefinition(ids, neq);

        assertInstanceOf(Relation.class, symbol);
        assertTrue(symbol.canDegrade());
        assertEquals("=", symbol.createDegraded(ids).getLatexForm());
    }

    @Test
    void nonSymbolDefinitionsAreRejected() {
        CommandDefinition frac = CommandCatalog.getDefault().lookup("frac").orElseThrow();

        assertThrows(IllegalArgumentException.class, () -> SymbolFactory.forDefinition(ids, frac));
    }

    @Test
    void unknownCommandKeepsItsSource() {
        MathSymbol unknown = SymbolFactory.forUnknownCommand(ids, "foo");

        assertEquals("foo", unknown.getGlyph());
        assertEquals("\\foo", unknown.getLatexForm());
    }
}
