package de.upb.sse.opweave.frontend;

import com.github.javaparser.Range;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Modifier;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.expr.*;
import com.github.javaparser.ast.nodeTypes.NodeWithAnnotations;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.type.Type;
import de.upb.sse.opweave.configuration.OpWeaveConfiguration;
import de.upb.sse.opweave.model.*;
import de.upb.sse.opweave.util.LineOffsetTable;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Converts a JavaParser {@link CompilationUnit} into a {@link TreeNode} tree with
 * buffer offsets, resolved types and the context flags the pipeline consults.
 * <p>
 * Flags set here:
 * <ul>
 *   <li>system origin: the unit's package or path matches a configured prefix, or the node
 *   lies inside a declaration annotated {@code @Generated};</li>
 *   <li>constant context: case labels, annotation values, initializers of constant
 *   variables, expressions built from literals alone, and values narrowed to
 *   {@code byte}, {@code short} or {@code char} (or their boxes) by assignment;</li>
 *   <li>volatile: operands naming a volatile field of the unit.</li>
 * </ul>
 */
public class JavaSyntaxTreeBuilder {
    private static final Set<String> NARROW_TARGETS = Set.of("byte", "short", "char",
            "Byte", "Short", "Character", "java.lang.Byte", "java.lang.Short", "java.lang.Character");

    private final OpWeaveConfiguration config;
    private final String fileName;
    private final LineOffsetTable lines;

    public JavaSyntaxTreeBuilder(OpWeaveConfiguration config, String source) {
        this(config, null, source);
    }

    public JavaSyntaxTreeBuilder(OpWeaveConfiguration config, String fileName, String source) {
        this.config = config;
        this.fileName = fileName;
        this.lines = new LineOffsetTable(source);
    }

    private static final class Frame {
        final Node node;
        final TreeNode parent;
        final boolean operand;
        final boolean constant;
        final boolean systemOrigin;

        Frame(Node node, TreeNode parent, boolean operand, boolean constant, boolean systemOrigin) {
            this.node = node;
            this.parent = parent;
            this.operand = operand;
            this.constant = constant;
            this.systemOrigin = systemOrigin;
        }
    }

    public TreeNode build(CompilationUnit cu) {
        boolean systemUnit = cu.getPackageDeclaration()
                .map(p -> config.isSystemOriginPackage(p.getNameAsString()))
                .orElse(false) || config.isSystemOriginPath(fileName);
        Set<String> volatileFields = cu.findAll(FieldDeclaration.class).stream()
                .filter(f -> f.hasModifier(Modifier.Keyword.VOLATILE))
                .flatMap(f -> f.getVariables().stream())
                .map(VariableDeclarator::getNameAsString)
                .collect(Collectors.toSet());

        TreeNode root = null;
        Deque<Frame> pending = new ArrayDeque<>();
        pending.push(new Frame(cu, null, false, false, systemUnit));
        while (!pending.isEmpty()) {
            Frame frame = pending.pop();
            Node node = frame.node;
            boolean systemOrigin = frame.systemOrigin || isGenerated(node);
            boolean constant = frame.constant || node instanceof AnnotationExpr || isLiteralOnly(node);

            TreeNode tree = createNode(node, volatileFields);
            if (systemOrigin) tree.markSystemOrigin();
            if (constant) tree.markConstantContext();

            if (frame.parent == null) {
                root = tree;
            } else if (frame.operand) {
                frame.parent.addOperand(tree);
            } else {
                frame.parent.addChild(tree);
            }

            List<Node> operands = operandsOf(node);
            List<Node> children = operands != null ? operands : childrenOf(node);
            Set<Node> constantChildren = constantChildrenOf(node);
            // reversed, so children are attached in source order
            for (int i = children.size() - 1; i >= 0; i--) {
                Node child = children.get(i);
                boolean childConstant = constant || constantChildren.contains(child);
                pending.push(new Frame(child, tree, operands != null, childConstant, systemOrigin));
            }
        }
        return root;
    }

    private TreeNode createNode(Node node, Set<String> volatileFields) {
        TreeNode tree;
        if (node instanceof ArrayAccessExpr) {
            tree = new TreeNode(NodeShape.INDEX_ACCESS).withOperator("[]");
        } else if (node instanceof BinaryExpr) {
            tree = new TreeNode(NodeShape.BINARY_OPERATOR).withOperator(((BinaryExpr) node).getOperator().asString());
        } else if (node instanceof AssignExpr) {
            tree = new TreeNode(NodeShape.BINARY_OPERATOR).withOperator(((AssignExpr) node).getOperator().asString());
        } else if (node instanceof UnaryExpr) {
            UnaryExpr.Operator op = ((UnaryExpr) node).getOperator();
            NodeShape shape = isIncrementOrDecrement(op) ? NodeShape.INCREMENT_DECREMENT : NodeShape.UNARY_OPERATOR;
            tree = new TreeNode(shape).withOperator(op.asString());
        } else if (node instanceof EnclosedExpr) {
            tree = new TreeNode(NodeShape.GROUPING);
        } else if (node instanceof LiteralExpr) {
            tree = new TreeNode(NodeShape.LITERAL);
        } else {
            tree = new TreeNode(NodeShape.OTHER);
        }

        spanOf(node).ifPresent(tree::withSpan);
        if (node instanceof Expression && needsType((Expression) node)) {
            BasicTypeDescriptor type = JavaTypeDescriptors.describe((Expression) node);
            if (namesVolatileField((Expression) node, volatileFields)) {
                type = type.toBuilder().volatileQualified(true).build();
            }
            tree.withType(type);
        }
        return tree;
    }

    private Optional<SourceSpan> spanOf(Node node) {
        Optional<Range> range = node.getRange();
        if (range.isEmpty()) return Optional.empty();
        try {
            int start = lines.offsetOf(range.get().begin.line, range.get().begin.column);
            // JavaParser ranges end on the last character, inclusive
            int end = lines.offsetOf(range.get().end.line, range.get().end.column) + 1;
            return Optional.of(new SourceSpan(start, end));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /** Operator nodes and their direct operands carry types. */
    private static boolean needsType(Expression expression) {
        if (isOperatorNode(expression)) return true;
        return expression.getParentNode().map(JavaSyntaxTreeBuilder::isOperatorNode).orElse(false);
    }

    private static boolean isOperatorNode(Node node) {
        return node instanceof ArrayAccessExpr || node instanceof BinaryExpr || node instanceof AssignExpr
                || node instanceof UnaryExpr;
    }

    private static List<Node> operandsOf(Node node) {
        if (node instanceof ArrayAccessExpr) {
            return List.of(((ArrayAccessExpr) node).getName(), ((ArrayAccessExpr) node).getIndex());
        }
        if (node instanceof BinaryExpr) {
            return List.of(((BinaryExpr) node).getLeft(), ((BinaryExpr) node).getRight());
        }
        if (node instanceof AssignExpr) {
            return List.of(((AssignExpr) node).getTarget(), ((AssignExpr) node).getValue());
        }
        if (node instanceof UnaryExpr) {
            return List.of(((UnaryExpr) node).getExpression());
        }
        if (node instanceof EnclosedExpr) {
            return List.of(((EnclosedExpr) node).getInner());
        }
        return null;
    }

    private static List<Node> childrenOf(Node node) {
        return node.getChildNodes().stream()
                .filter(child -> !(child instanceof Comment))
                .collect(Collectors.toList());
    }

    private static Set<Node> constantChildrenOf(Node node) {
        Set<Node> result = Collections.newSetFromMap(new IdentityHashMap<>());
        if (node instanceof SwitchEntry) {
            result.addAll(((SwitchEntry) node).getLabels());
        } else if (node instanceof VariableDeclarator) {
            VariableDeclarator declarator = (VariableDeclarator) node;
            if (isConstantVariable(declarator)) {
                declarator.getInitializer().filter(JavaSyntaxTreeBuilder::mayBeConstant).ifPresent(result::add);
            } else if (isNarrowTarget(declarator.getType())) {
                declarator.getInitializer().filter(JavaSyntaxTreeBuilder::isNarrowedConstant).ifPresent(result::add);
            }
        } else if (node instanceof AssignExpr) {
            AssignExpr assign = (AssignExpr) node;
            if (assign.getOperator() == AssignExpr.Operator.ASSIGN && isNarrowedConstant(assign.getValue())
                    && NARROW_TARGETS.contains(JavaTypeDescriptors.describe(assign.getTarget()).getLiteralName())) {
                result.add(assign.getValue());
            }
        } else if (node instanceof ReturnStmt) {
            ReturnStmt ret = (ReturnStmt) node;
            enclosingMethod(ret)
                    .filter(method -> isNarrowTarget(method.getType()))
                    .flatMap(method -> ret.getExpression())
                    .filter(JavaSyntaxTreeBuilder::isNarrowedConstant)
                    .ifPresent(result::add);
        } else if (node instanceof ArrayInitializerExpr) {
            ArrayInitializerExpr initializer = (ArrayInitializerExpr) node;
            if (arrayElementType(initializer).filter(JavaSyntaxTreeBuilder::isNarrowTarget).isPresent()) {
                initializer.getValues().stream()
                        .filter(JavaSyntaxTreeBuilder::isNarrowedConstant)
                        .forEach(result::add);
            }
        }
        return result;
    }

    private static boolean isNarrowTarget(Type type) {
        return !type.isVarType() && NARROW_TARGETS.contains(type.asString());
    }

    /**
     * An operator expression stored into a {@code byte}, {@code short} or {@code char}
     * slot compiles only as a constant expression, since its own type is at least {@code int}.
     * An explicit cast makes the conversion its own and leaves the operands free.
     */
    private static boolean isNarrowedConstant(Expression value) {
        Expression current = value;
        while (current instanceof EnclosedExpr) {
            current = ((EnclosedExpr) current).getInner();
        }
        boolean operator = current instanceof BinaryExpr || current instanceof ConditionalExpr
                || (current instanceof UnaryExpr && !isIncrementOrDecrement(((UnaryExpr) current).getOperator()));
        return operator && mayBeConstant(current);
    }

    /** The method a return statement leaves, unless a lambda body lies in between. */
    private static Optional<MethodDeclaration> enclosingMethod(ReturnStmt ret) {
        Optional<Node> current = ret.getParentNode();
        while (current.isPresent()) {
            Node node = current.get();
            if (node instanceof LambdaExpr) return Optional.empty();
            if (node instanceof MethodDeclaration) return Optional.of((MethodDeclaration) node);
            current = node.getParentNode();
        }
        return Optional.empty();
    }

    /** Innermost element type of the array an initializer builds, nested initializers included. */
    private static Optional<Type> arrayElementType(ArrayInitializerExpr initializer) {
        Optional<Node> current = initializer.getParentNode();
        while (current.isPresent()) {
            Node node = current.get();
            if (node instanceof VariableDeclarator) {
                return Optional.of(((VariableDeclarator) node).getType().getElementType());
            }
            if (node instanceof ArrayCreationExpr) {
                return Optional.of(((ArrayCreationExpr) node).getElementType());
            }
            if (!(node instanceof ArrayInitializerExpr)) return Optional.empty();
            current = node.getParentNode();
        }
        return Optional.empty();
    }

    /** A final variable of primitive or String type; its initializer may be folded into constants. */
    private static boolean isConstantVariable(VariableDeclarator declarator) {
        Type type = declarator.getType();
        boolean constantType = type.isPrimitiveType()
                || "String".equals(type.asString()) || "java.lang.String".equals(type.asString());
        if (!constantType) return false;

        Optional<Node> parent = declarator.getParentNode();
        if (parent.isEmpty()) return false;
        if (parent.get() instanceof FieldDeclaration) {
            FieldDeclaration field = (FieldDeclaration) parent.get();
            if (field.isFinal()) return true;
            return field.getParentNode()
                    .filter(owner -> owner instanceof ClassOrInterfaceDeclaration)
                    .map(owner -> ((ClassOrInterfaceDeclaration) owner).isInterface())
                    .orElse(false);
        }
        if (parent.get() instanceof VariableDeclarationExpr) {
            return ((VariableDeclarationExpr) parent.get()).isFinal();
        }
        return false;
    }

    /** True for operator expressions whose leaves are all literals, e.g. {@code -5 + 1}. */
    private static boolean isLiteralOnly(Node node) {
        if (!isOperatorNode(node) || node instanceof AssignExpr || node instanceof ArrayAccessExpr) return false;
        Deque<Node> pending = new ArrayDeque<>();
        pending.push(node);
        while (!pending.isEmpty()) {
            Node current = pending.pop();
            if (current instanceof LiteralExpr) continue;
            if (current instanceof BinaryExpr || current instanceof EnclosedExpr
                    || (current instanceof UnaryExpr && !isIncrementOrDecrement(((UnaryExpr) current).getOperator()))) {
                childrenOf(current).forEach(pending::push);
                continue;
            }
            return false;
        }
        return true;
    }

    /** Built only from literals, names, casts and operators, so it may be a constant expression. */
    private static boolean mayBeConstant(Expression expression) {
        Deque<Node> pending = new ArrayDeque<>();
        pending.push(expression);
        while (!pending.isEmpty()) {
            Node current = pending.pop();
            if (current instanceof LiteralExpr || current instanceof Type || current instanceof SimpleName) continue;
            if (current instanceof NameExpr || current instanceof FieldAccessExpr || current instanceof BinaryExpr
                    || current instanceof EnclosedExpr || current instanceof CastExpr
                    || current instanceof ConditionalExpr
                    || (current instanceof UnaryExpr && !isIncrementOrDecrement(((UnaryExpr) current).getOperator()))) {
                childrenOf(current).forEach(pending::push);
                continue;
            }
            return false;
        }
        return true;
    }

    private static boolean isGenerated(Node node) {
        if (!(node instanceof NodeWithAnnotations)) return false;
        for (AnnotationExpr annotation : ((NodeWithAnnotations<?>) node).getAnnotations()) {
            String name = annotation.getNameAsString();
            if ("Generated".equals(name) || name.endsWith(".Generated")) return true;
        }
        return false;
    }

    private static boolean namesVolatileField(Expression expression, Set<String> volatileFields) {
        if (volatileFields.isEmpty()) return false;
        Expression current = expression;
        while (current instanceof EnclosedExpr) {
            current = ((EnclosedExpr) current).getInner();
        }
        if (current instanceof NameExpr) {
            return volatileFields.contains(((NameExpr) current).getNameAsString());
        }
        if (current instanceof FieldAccessExpr) {
            return volatileFields.contains(((FieldAccessExpr) current).getNameAsString());
        }
        return false;
    }

    private static boolean isIncrementOrDecrement(UnaryExpr.Operator op) {
        return op == UnaryExpr.Operator.PREFIX_INCREMENT || op == UnaryExpr.Operator.PREFIX_DECREMENT
                || op == UnaryExpr.Operator.POSTFIX_INCREMENT || op == UnaryExpr.Operator.POSTFIX_DECREMENT;
    }
}
