package com.example.doccompare.alignment;

import com.example.doccompare.domain.DiffSpan;
import com.example.doccompare.domain.TokenClass;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TokenDifferTest {

    private final TokenDiffer differ = new TokenDiffer();

    @Test
    void classifiesByteEqualTokensAsEqual() {
        assertEquals(TokenClass.EQUAL, differ.classify("Revenue", "Revenue"));
    }

    @Test
    void caseDifferenceTakesPrecedenceOverNumericComparison() {
        assertEquals(TokenClass.CASE_DIFF, differ.classify("Hello", "hello"));
        assertEquals(TokenClass.CASE_DIFF, differ.classify("1E3", "1e3"));
    }

    @Test
    void numericallyEqualTokensAreDecimalDiff() {
        assertEquals(TokenClass.DECIMAL_DIFF, differ.classify("3.0", "3.00"));
        assertEquals(TokenClass.DECIMAL_DIFF, differ.classify("1000", "1_000"));
        assertEquals(TokenClass.DECIMAL_DIFF, differ.classify("\u0663.\u0660", "3.0"));
    }

    @Test
    void everythingElseIsDiff() {
        assertEquals(TokenClass.DIFF, differ.classify("3.0", "3.5"));
        assertEquals(TokenClass.DIFF, differ.classify("cat", "dog"));
        assertEquals(TokenClass.DIFF, differ.classify("3", "three"));
    }

    @Test
    void decimalFormattingDifferenceIsMarkedOnBothSides() {
        TokenDiff diff = differ.diff("Revenue was 3.0 million.", "Revenue was 3.00 million.");

        assertEquals(
                List.of(
                        DiffSpan.equal("Revenue"),
                        DiffSpan.equal("was"),
                        new DiffSpan("3.0", TokenClass.DECIMAL_DIFF),
                        DiffSpan.equal("million"),
                        DiffSpan.equal(".")),
                diff.left());
        assertEquals(new DiffSpan("3.00", TokenClass.DECIMAL_DIFF), diff.right().get(2));
    }

    @Test
    void overflowOnTheRightIsExtraAndHasNoLeftOutput() {
        TokenDiff diff = differ.diff(List.of("a", "b"), List.of("a", "b", "c", "d"));

        assertEquals(List.of(DiffSpan.equal("a"), DiffSpan.equal("b")), diff.left());
        assertEquals(
                List.of(
                        DiffSpan.equal("a"),
                        DiffSpan.equal("b"),
                        new DiffSpan("c", TokenClass.EXTRA),
                        new DiffSpan("d", TokenClass.EXTRA)),
                diff.right());
    }

    @Test
    void overflowOnTheLeftIsMissingAndHasNoRightOutput() {
        TokenDiff diff = differ.diff(List.of("x", "y", "z"), List.of("x"));

        assertEquals(
                List.of(
                        DiffSpan.equal("x"),
                        new DiffSpan("y", TokenClass.MISSING),
                        new DiffSpan("z", TokenClass.MISSING)),
                diff.left());
        assertEquals(List.of(DiffSpan.equal("x")), diff.right());
    }

    @Test
    void insertedWordShiftsEveryLaterPosition() {
        TokenDiff diff = differ.diff("The cat sat.", "The big cat sat.");

        assertEquals(
                List.of(
                        TokenClass.EQUAL, TokenClass.DIFF, TokenClass.DIFF, TokenClass.DIFF),
                diff.left().stream().map(DiffSpan::tokenClass).toList());
        assertEquals(new DiffSpan(".", TokenClass.EXTRA), diff.right().get(4));
    }

    @Test
    void everyPositionResolvesToExactlyOneClass() {
        TokenDiff diff =
                differ.diff("Total: 3.0 units, Shipped ON time", "total: 3.00 items, shipped on");

        Set<TokenClass> pairedClasses =
                EnumSet.of(
                        TokenClass.EQUAL,
                        TokenClass.CASE_DIFF,
                        TokenClass.DECIMAL_DIFF,
                        TokenClass.DIFF);
        int shared = Math.min(diff.left().size(), diff.right().size());
        for (int i = 0; i < shared; i++) {
            assertEquals(diff.left().get(i).tokenClass(), diff.right().get(i).tokenClass());
            assertTrue(pairedClasses.contains(diff.left().get(i).tokenClass()));
        }
        for (int i = shared; i < diff.left().size(); i++) {
            assertEquals(TokenClass.MISSING, diff.left().get(i).tokenClass());
        }
        assertEquals(shared, diff.right().size());
    }
}
