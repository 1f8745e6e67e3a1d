package de.upb.sse.opweave.model;

import lombok.Builder;
import lombok.Getter;

import java.util.Map;
import java.util.Optional;

@Builder(toBuilder = true)
public class BasicTypeDescriptor implements TypeDescriptor {
    private static final Map<String, String> BOXES = Map.of(
            "boolean", "java.lang.Boolean",
            "byte", "java.lang.Byte",
            "short", "java.lang.Short",
            "char", "java.lang.Character",
            "int", "java.lang.Integer",
            "long", "java.lang.Long",
            "float", "java.lang.Float",
            "double", "java.lang.Double");

    @Getter private final String name;
    @Getter private final String literalName;
    @Getter private final String typeExpression;
    private final TypeDescriptor componentType;
    @Getter private final boolean dependent;
    @Getter private final boolean pointerLike;
    @Getter private final boolean arithmetic;
    @Getter private final boolean primitive;
    @Getter private final boolean constQualified;
    @Getter private final boolean volatileQualified;
    @Getter @Builder.Default private final boolean complete = true;
    private final boolean userIndexOverload;
    private final boolean userArithmeticOverload;

    public static BasicTypeDescriptor primitive(String name) {
        String box = BOXES.get(name);
        if (box == null) {
            throw new IllegalArgumentException("not a primitive type: " + name);
        }
        return BasicTypeDescriptor.builder()
                .name(name)
                .literalName(name)
                .typeExpression(box)
                .primitive(true)
                .arithmetic(!"boolean".equals(name))
                .build();
    }

    public static BasicTypeDescriptor arrayOf(TypeDescriptor component) {
        return BasicTypeDescriptor.builder()
                .name(component.getName() + "[]")
                .literalName(component.getLiteralName() + "[]")
                .typeExpression(component.getName() + "[]")
                .componentType(component)
                .pointerLike(true)
                .dependent(component.isDependent())
                .complete(component.isComplete())
                .build();
    }

    public static BasicTypeDescriptor reference(String qualifiedName) {
        return reference(qualifiedName, qualifiedName);
    }

    /**
     * @param describedName full name including type arguments
     * @param erasure       qualified name without type arguments
     */
    public static BasicTypeDescriptor reference(String describedName, String erasure) {
        return BasicTypeDescriptor.builder()
                .name(describedName)
                .literalName(erasure)
                .typeExpression(describedName)
                .build();
    }

    public static BasicTypeDescriptor typeVariable(String name) {
        return BasicTypeDescriptor.builder()
                .name(name)
                .literalName("java.lang.Object")
                .typeExpression(name)
                .dependent(true)
                .build();
    }

    public static BasicTypeDescriptor incomplete(String name) {
        return BasicTypeDescriptor.builder()
                .name(name)
                .literalName(name)
                .typeExpression(name)
                .complete(false)
                .build();
    }

    public static Optional<String> boxOf(String primitiveName) {
        return Optional.ofNullable(BOXES.get(primitiveName));
    }

    /** Primitive name for a box type name, e.g. {@code java.lang.Integer -> int}. */
    public static Optional<String> unboxedName(String boxName) {
        return BOXES.entrySet().stream()
                .filter(e -> e.getValue().equals(boxName))
                .map(Map.Entry::getKey)
                .findFirst();
    }

    @Override
    public Optional<TypeDescriptor> getComponentType() {
        return Optional.ofNullable(componentType);
    }

    @Override
    public boolean hasUserIndexOverload() {
        return userIndexOverload;
    }

    @Override
    public boolean hasUserArithmeticOverload() {
        return userArithmeticOverload;
    }

    @Override
    public String toString() {
        return name;
    }
}
