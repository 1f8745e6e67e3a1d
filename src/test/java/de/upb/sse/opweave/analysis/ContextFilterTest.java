package de.upb.sse.opweave.analysis;

import de.upb.sse.opweave.SyntheticTrees;
import de.upb.sse.opweave.configuration.OpWeaveConfiguration;
import de.upb.sse.opweave.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static de.upb.sse.opweave.SyntheticTrees.*;
import static org.junit.jupiter.api.Assertions.*;

public class ContextFilterTest {
    private OpWeaveConfiguration config;
    private ContextFilter filter;
    private ExpressionClassifier classifier;

    @BeforeEach
    void setup() {
        config = OpWeaveConfiguration.allOperators();
        filter = new ContextFilter(config);
        classifier = new ExpressionClassifier();
    }

    private FilterDecision check(TreeNode node) {
        return filter.check(classifier.classify(node).get());
    }

    private static RejectionReason reason(FilterDecision decision) {
        return decision.getReason().orElse(null);
    }

    @Test
    @DisplayName("An index access in plain value position passes")
    void value_position() {
        SyntheticTrees trees = new SyntheticTrees("x = a[i] + 1;");
        TreeNode access = trees.index(trees.name("a", INT_ARRAY), trees.name("i", INT), INT);
        trees.root(trees.binary("+", access, trees.literal("1", 9, INT), INT));
        assertTrue(check(access).isPassed());
    }

    @Test
    @DisplayName("Operand of address-of is rejected, also through parentheses")
    void address_of() {
        SyntheticTrees trees = new SyntheticTrees("p = &a[i]; q = &(a[j]);");
        TreeNode direct = trees.index(trees.name("a", INT_ARRAY), trees.name("i", INT), INT);
        trees.wrap(NodeShape.ADDRESS_OF, "&", direct, 1, 0);
        TreeNode grouped = trees.index(trees.name("a", 15, INT_ARRAY), trees.name("j", INT), INT);
        trees.wrap(NodeShape.ADDRESS_OF, "&", trees.grouping(grouped), 1, 0);

        assertEquals(RejectionReason.ADDRESS_OF_OPERAND, reason(check(direct)));
        assertEquals(RejectionReason.ADDRESS_OF_OPERAND, reason(check(grouped)));
    }

    @Test
    @DisplayName("Unevaluated operands are rejected")
    void unevaluated_operand() {
        SyntheticTrees trees = new SyntheticTrees("sizeof(a[i])");
        TreeNode access = trees.index(trees.name("a", INT_ARRAY), trees.name("i", 7, INT), INT);
        trees.wrap(NodeShape.UNEVALUATED_OPERAND, "sizeof", access, 7, 1);
        assertEquals(RejectionReason.UNEVALUATED_OPERAND, reason(check(access)));
    }

    @Test
    @DisplayName("Assignment targets and increment operands are lvalue positions")
    void lvalue_positions() {
        SyntheticTrees trees = new SyntheticTrees("a[i] = 1; a[j]++;");
        TreeNode target = trees.index(trees.name("a", INT_ARRAY), trees.name("i", INT), INT);
        trees.binary("=", target, trees.literal("1", 0, INT), INT);
        TreeNode incremented = trees.index(trees.name("a", 10, INT_ARRAY), trees.name("j", INT), INT);
        trees.wrap(NodeShape.INCREMENT_DECREMENT, "++", incremented, 0, 2);

        assertEquals(RejectionReason.LVALUE_POSITION, reason(check(target)));
        assertEquals(RejectionReason.LVALUE_POSITION, reason(check(incremented)));
    }

    @Test
    @DisplayName("The value side of an assignment is not an lvalue")
    void assignment_value() {
        SyntheticTrees trees = new SyntheticTrees("x = a[i];");
        TreeNode value = trees.index(trees.name("a", INT_ARRAY), trees.name("i", INT), INT);
        trees.binary("=", trees.name("x", INT), value, INT);
        assertTrue(check(value).isPassed());
    }

    @Test
    @DisplayName("System origin is skipped only when configured")
    void system_origin() {
        SyntheticTrees trees = new SyntheticTrees("a[i]");
        TreeNode access = trees.index(trees.name("a", INT_ARRAY), trees.name("i", INT), INT).markSystemOrigin();
        assertEquals(RejectionReason.SYSTEM_ORIGIN, reason(check(access)));

        config.setSkipSystemOrigin(false);
        assertTrue(check(access).isPassed());
    }

    @Test
    @DisplayName("Constant contexts, user overloads and unaddressable targets are rejected")
    void other_rejections() {
        SyntheticTrees trees = new SyntheticTrees("10 * 2; x = y;");
        TreeNode constant = trees.binary("*", trees.literal("10", 0, INT), trees.literal("2", 0, INT), INT)
                .markConstantContext();
        TreeNode plain = trees.binary("=", trees.name("x", INT), trees.name("y", INT), INT);
        TreeNode overload = TreeNode.of(NodeShape.OPERATOR_CALL, "+", 0, 6)
                .addOperand(TreeNode.of(NodeShape.OTHER, null, 0, 2))
                .addOperand(TreeNode.of(NodeShape.OTHER, null, 5, 6))
                .markOperatorOverloadCall();

        assertEquals(RejectionReason.CONSTANT_CONTEXT, reason(check(constant)));
        assertEquals(RejectionReason.UNADDRESSABLE_TARGET, reason(check(plain)));
        assertEquals(RejectionReason.USER_OVERLOAD, reason(check(overload)));
    }

    @Test
    @DisplayName("Calls into user operator implementations are skipped in every category")
    void user_overload_any_category() {
        for (String op : new String[]{"+", "<", "[]", "+="}) {
            TreeNode call = TreeNode.of(NodeShape.OPERATOR_CALL, op, 0, 6)
                    .addOperand(TreeNode.of(NodeShape.OTHER, null, 0, 2))
                    .addOperand(TreeNode.of(NodeShape.OTHER, null, 5, 6))
                    .markOperatorOverloadCall();
            CandidateExpression candidate = classifier.classify(call).get();

            assertTrue(candidate.isOverloaded(), op);
            assertEquals(RejectionReason.USER_OVERLOAD, reason(filter.check(candidate)), op);
        }
    }

    @Test
    @DisplayName("A root candidate without parent passes")
    void no_parent() {
        SyntheticTrees trees = new SyntheticTrees("a[i]");
        TreeNode access = trees.index(trees.name("a", INT_ARRAY), trees.name("i", INT), INT);
        assertTrue(filter.check(classifier.classify(access).get(), null).isPassed());
    }
}
