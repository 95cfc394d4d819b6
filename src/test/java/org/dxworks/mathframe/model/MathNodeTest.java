package org.dxworks.mathframe.model;

import org.dxworks.mathframe.model.command.Fraction;
import org.dxworks.mathframe.model.command.SquareRoot;
import org.dxworks.mathframe.model.symbol.Digit;
import org.dxworks.mathframe.model.symbol.Variable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MathNodeTest {

    private NodeIdGenerator ids;
    private Block root;
    private Fraction fraction;
    private SquareRoot sqrt;
    private Variable x;
    private Digit two;

    // \frac{\sqrt{x}}{2}
    @BeforeEach
    void setUp() {
        ids = new NodeIdGenerator();
        root = Block.root(ids);
        fraction = new Fraction(ids);
        sqrt = new SquareRoot(ids);
        x = new Variable(ids, "x");
        two = new Digit(ids, "2");
        root.append(fraction);
        fraction.getNumerator().append(sqrt);
        sqrt.getRadicand().append(x);
        fraction.getDenominator().append(two);
    }

    @Test
    void ownersAndDepth() {
        assertNull(fraction.getOwner());
        assertSame(fraction, sqrt.getOwner());
        assertSame(sqrt, x.getOwner());
        assertEquals(0, fraction.depth());
        assertEquals(2, x.depth());
        assertSame(fraction, x.root());
    }

    @Test
    void ancestry() {
        assertTrue(fraction.isAncestorOf(x));
        assertTrue(sqrt.isAncestorOf(x));
        assertFalse(sqrt.isAncestorOf(two));
        assertFalse(x.isAncestorOf(x));
    }

    @Test
    void preAndPostOrder() {
        List<MathNode> pre = new ArrayList<>();
        fraction.preOrder(pre::add);
        assertEquals(List.of(fraction, sqrt, x, two), pre);

        List<MathNode> post = new ArrayList<>();
        fraction.postOrder(post::add);
        assertEquals(List.of(x, sqrt, two, fraction), post);

        assertEquals(List.of(sqrt, x, two), fraction.descendants());
    }

    @Test
    void childrenSpanAllBlocks() {
        assertEquals(List.of(sqrt, two), fraction.children());
        assertEquals(List.of(two, sqrt), fraction.childrenReverse());
        assertTrue(x.children().isEmpty());
    }

    @Test
    void extremeLeaves() {
        assertSame(x, fraction.leftmostLeaf());
        assertSame(two, fraction.rightmostLeaf());

        SquareRoot empty = new SquareRoot(ids);
        assertSame(empty, empty.leftmostLeaf());
    }

    @Test
    void removeDetachesAndSecondRemoveFails() {
        two.remove();

        assertFalse(two.isAttached());
        assertNull(two.getParent());
        assertTrue(fraction.getDenominator().isEmpty());
        NotAttachedException error = assertThrows(NotAttachedException.class, two::remove);
        assertTrue(error instanceof StructuralIntegrityException);
    }

    @Test
    void kindsAndLeafFlag() {
        assertTrue(x.isLeaf());
        assertFalse(fraction.isLeaf());
        assertEquals(NodeKind.FRACTION, fraction.getKind());
        assertEquals(2, fraction.getBlocks().size());
        assertTrue(x.getBlocks().isEmpty());
    }

    @Test
    void renderings() {
        assertEquals("\\frac{\\sqrt{x}}{2}", fraction.latex());
        assertEquals("(sqrt(x))/(2)", fraction.text());
        assertEquals("fraction, square root of, x, end square root, over, 2, end fraction", fraction.speech());
    }
}
