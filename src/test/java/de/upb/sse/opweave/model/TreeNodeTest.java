package de.upb.sse.opweave.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TreeNodeTest {

    @Test
    @DisplayName("Operands are children with a back reference to the parent")
    void operands_are_children() {
        TreeNode base = TreeNode.of(NodeShape.OTHER, null, 0, 1);
        TreeNode index = TreeNode.of(NodeShape.OTHER, null, 2, 3);
        TreeNode access = TreeNode.of(NodeShape.INDEX_ACCESS, "[]", 0, 4).addOperand(base).addOperand(index);

        assertEquals(2, access.getOperands().size());
        assertEquals(2, access.getChildren().size());
        assertSame(access, base.getParent().get());
        assertThrows(UnsupportedOperationException.class, () -> access.getOperands().clear());
    }

    @Test
    @DisplayName("A node cannot be attached to two parents")
    void single_parent() {
        TreeNode child = new TreeNode(NodeShape.LITERAL);
        new TreeNode(NodeShape.OTHER).addChild(child);
        assertThrows(IllegalArgumentException.class, () -> new TreeNode(NodeShape.OTHER).addChild(child));
    }

    @Test
    @DisplayName("Array descriptors follow their component")
    void array_descriptor() {
        BasicTypeDescriptor ints = BasicTypeDescriptor.arrayOf(BasicTypeDescriptor.primitive("int"));
        assertEquals("int[]", ints.getLiteralName());
        assertTrue(ints.isPointerLike());
        assertFalse(ints.isDependent());
        assertEquals("java.lang.Integer", ints.getComponentType().get().getTypeExpression());

        BasicTypeDescriptor ts = BasicTypeDescriptor.arrayOf(BasicTypeDescriptor.typeVariable("T"));
        assertTrue(ts.isDependent());
        assertEquals("T[]", ts.getTypeExpression());
        assertThrows(IllegalArgumentException.class, () -> BasicTypeDescriptor.primitive("string"));
    }
}
