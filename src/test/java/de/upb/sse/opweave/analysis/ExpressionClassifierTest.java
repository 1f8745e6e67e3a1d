package de.upb.sse.opweave.analysis;

import de.upb.sse.opweave.SyntheticTrees;
import de.upb.sse.opweave.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static de.upb.sse.opweave.SyntheticTrees.*;
import static org.junit.jupiter.api.Assertions.*;

public class ExpressionClassifierTest {
    private ExpressionClassifier classifier;

    @BeforeEach
    void setup() {
        classifier = new ExpressionClassifier();
    }

    @Test
    @DisplayName("Index access is classified with base and index operands")
    void index_access() {
        SyntheticTrees trees = new SyntheticTrees("v = values[i];");
        TreeNode access = trees.index(trees.name("values", INT_ARRAY), trees.name("i", 10, INT), INT);

        CandidateExpression candidate = classifier.classify(access).get();
        assertEquals(CandidateKind.INDEX_ACCESS, candidate.getKind());
        assertEquals(OperatorCategory.INDEX_ACCESS, candidate.getCategory());
        assertEquals(SourceSpan.of(4, 13), candidate.getSpan());
        assertEquals(List.of(SourceSpan.of(4, 10), SourceSpan.of(11, 12)), candidate.getOperandSpans());
        assertFalse(candidate.isDependentType());
    }

    @Test
    @DisplayName("Binary operators map to their category")
    void binary_categories() {
        SyntheticTrees trees = new SyntheticTrees("a + b; a < b; a & b;");
        TreeNode sum = trees.binary("+", trees.name("a", INT), trees.name("b", INT), INT);
        TreeNode less = trees.binary("<", trees.name("a", 7, INT), trees.name("b", 7, INT), BOOLEAN);
        TreeNode and = trees.binary("&", trees.name("a", 14, INT), trees.name("b", 14, INT), INT);

        assertEquals(CandidateKind.ARITHMETIC_BINARY, classifier.classify(sum).get().getKind());
        assertEquals(OperatorCategory.COMPARISON, classifier.classify(less).get().getCategory());
        assertTrue(classifier.classify(and).isEmpty());
    }

    @Test
    @DisplayName("Element assignment is flattened to base, index and value")
    void element_assignment() {
        SyntheticTrees trees = new SyntheticTrees("d[i] += 0.5;");
        TreeNode target = trees.index(trees.name("d", BasicTypeDescriptor.arrayOf(DOUBLE)), trees.name("i", INT),
                DOUBLE);
        TreeNode assign = trees.binary("+=", target, trees.literal("0.5", 0, DOUBLE), DOUBLE);

        CandidateExpression candidate = classifier.classify(assign).get();
        assertEquals(CandidateKind.ASSIGNMENT_BINARY, candidate.getKind());
        assertTrue(candidate.isElementAssignment());
        assertEquals(3, candidate.operandCount());
        assertEquals("+=", candidate.getOperator());
    }

    @Test
    @DisplayName("Assignment to a plain variable is a candidate without element target")
    void plain_assignment() {
        SyntheticTrees trees = new SyntheticTrees("x = y;");
        TreeNode assign = trees.binary("=", trees.name("x", INT), trees.name("y", INT), INT);
        CandidateExpression candidate = classifier.classify(assign).get();
        assertFalse(candidate.isElementAssignment());
        assertEquals(2, candidate.operandCount());
    }

    @Test
    @DisplayName("A signed literal is not a unary candidate")
    void signed_literal() {
        SyntheticTrees trees = new SyntheticTrees("-5; -v;");
        TreeNode literal = trees.unary("-", trees.literal("5", 0, INT), INT);
        TreeNode negation = trees.unary("-", trees.name("v", INT), INT);

        assertTrue(classifier.classify(literal).isEmpty());
        CandidateExpression candidate = classifier.classify(negation).get();
        assertTrue(candidate.isUnary());
        assertEquals(OperatorCategory.UNARY, candidate.getCategory());
    }

    @Test
    @DisplayName("Dependent operand types mark the candidate dependent")
    void dependent_candidate() {
        SyntheticTrees trees = new SyntheticTrees("items[0]");
        TreeNode access = trees.index(trees.name("items", T_ARRAY), trees.literal("0", 0, INT), T);
        assertTrue(classifier.classify(access).get().isDependentType());
    }

    @Test
    @DisplayName("Operator calls are classified by symbol and arity")
    void operator_calls() {
        TreeNode call = TreeNode.of(NodeShape.OPERATOR_CALL, "[]", 0, 4)
                .addOperand(TreeNode.of(NodeShape.OTHER, null, 0, 1))
                .addOperand(TreeNode.of(NodeShape.OTHER, null, 2, 3))
                .markOperatorOverloadCall();
        CandidateExpression candidate = classifier.classify(call).get();
        assertEquals(CandidateKind.OVERLOADED_OPERATOR_CALL, candidate.getKind());
        assertEquals(OperatorCategory.INDEX_ACCESS, candidate.getCategory());
        assertTrue(candidate.isOverloaded());

        assertEquals(Optional.of(OperatorCategory.UNARY), ExpressionClassifier.categoryOfSymbol("~", 1));
        assertTrue(ExpressionClassifier.categoryOfSymbol("<<", 2).isEmpty());
        assertTrue(ExpressionClassifier.categoryOfSymbol(null, 2).isEmpty());
    }

    @Test
    @DisplayName("Nodes without span or of other shapes are not candidates")
    void non_candidates() {
        assertTrue(classifier.classify(new TreeNode(NodeShape.INDEX_ACCESS)).isEmpty());
        assertTrue(classifier.classify(TreeNode.of(NodeShape.LITERAL, null, 0, 1)).isEmpty());
        assertTrue(classifier.classify(TreeNode.of(NodeShape.GROUPING, null, 0, 3)).isEmpty());
        assertTrue(classifier.classify(null).isEmpty());
    }

    @Test
    @DisplayName("Classification looks at the node alone")
    void deterministic() {
        SyntheticTrees trees = new SyntheticTrees("a * b");
        TreeNode product = trees.binary("*", trees.name("a", INT), trees.name("b", LONG), LONG);
        CandidateExpression first = classifier.classify(product).get();
        trees.root(product);
        CandidateExpression second = classifier.classify(product).get();
        assertEquals(first.getKind(), second.getKind());
        assertEquals(first.getSpan(), second.getSpan());
        assertEquals(first.getOperandSpans(), second.getOperandSpans());
    }
}
