package com.visual.vgc.types;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Language-neutral description of a pin or property type.
 *
 * <p>
 * The variant is closed: a type is a {@link Primitive}, a {@link Named}
 * reference type, an {@link ArrayOf} some element type, or a {@link Generic}
 * instantiation. Equality is structural, so two descriptors parsed from the same
 * text are equal and can be used as map keys.
 *
 * <p>
 * Descriptors never hold {@code Class} objects. Compatibility questions are
 * answered by a {@link TypeCatalog}, which knows the supertypes and conversions of
 * the named types that have been registered with it.
 */
public interface TypeDescriptor {

    /** Java source text for this type, e.g. {@code java.util.List<java.lang.String>}. */
    String sourceName();

    /** Name used for persistence and registry keys. Same as {@link #sourceName()}. */
    default String typeName() {
        return sourceName();
    }

    default boolean isPrimitive() {
        return this instanceof Primitive;
    }

    default boolean isVoid() {
        return this instanceof Primitive p && p.kind() == PrimitiveKind.VOID;
    }

    /** A primitive type such as {@code int} or {@code boolean}. */
    record Primitive(PrimitiveKind kind) implements TypeDescriptor {
        public Primitive {
            Objects.requireNonNull(kind, "kind");
        }

        @Override
        public String sourceName() {
            return kind.keyword();
        }

        @Override
        public String toString() {
            return sourceName();
        }
    }

    /** A reference type identified by its fully qualified name. */
    record Named(String qualifiedName) implements TypeDescriptor {
        public Named {
            Objects.requireNonNull(qualifiedName, "qualifiedName");
            if (qualifiedName.isBlank())
                throw new IllegalArgumentException("Type name must not be blank");
        }

        @Override
        public String sourceName() {
            return qualifiedName.replace('$', '.');
        }

        /** The part after the last dot. */
        public String simpleName() {
            String s = sourceName();
            return s.substring(s.lastIndexOf('.') + 1);
        }

        @Override
        public String toString() {
            return qualifiedName;
        }
    }

    /** An array of some element type. */
    record ArrayOf(TypeDescriptor element) implements TypeDescriptor {
        public ArrayOf {
            Objects.requireNonNull(element, "element");
        }

        @Override
        public String sourceName() {
            return element.sourceName() + "[]";
        }

        @Override
        public String toString() {
            return sourceName();
        }
    }

    /** A parameterized reference type such as {@code java.util.Optional<java.lang.Integer>}. */
    record Generic(Named base, List<TypeDescriptor> arguments) implements TypeDescriptor {
        public Generic {
            Objects.requireNonNull(base, "base");
            arguments = List.copyOf(arguments);
            if (arguments.isEmpty())
                throw new IllegalArgumentException("Generic type needs at least one argument: " + base);
        }

        @Override
        public String sourceName() {
            return base.sourceName() + arguments.stream()
                    .map(TypeDescriptor::sourceName)
                    .collect(Collectors.joining(", ", "<", ">"));
        }

        @Override
        public String toString() {
            return sourceName();
        }
    }
}
