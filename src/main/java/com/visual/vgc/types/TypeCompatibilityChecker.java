package com.visual.vgc.types;

/**
 * Decides whether a value of one type may flow into a slot of another.
 *
 * <p>
 * The rules are deliberately permissive. A pair is compatible when any of these
 * holds:
 * <ol>
 * <li>the types are equal;</li>
 * <li>the target is a supertype or interface of the source;</li>
 * <li>after unwrapping nullable wrappers on either or both sides the underlying
 * types are compatible;</li>
 * <li>both are numeric, narrowing included;</li>
 * <li>the target is {@code java.lang.String};</li>
 * <li>the target is {@code java.lang.Object};</li>
 * <li>a conversion from source to target is declared by either type.</li>
 * </ol>
 */
public final class TypeCompatibilityChecker {
    private final TypeCatalog catalog;

    public TypeCompatibilityChecker(TypeCatalog catalog) {
        this.catalog = catalog;
    }

    public TypeCatalog catalog() {
        return catalog;
    }

    public boolean areCompatible(TypeDescriptor source, TypeDescriptor target) {
        if (source.equals(target))
            return true;

        if (catalog.isSubtype(source, target))
            return true;

        TypeDescriptor sourceUnderlying = catalog.unwrapNullable(source);
        TypeDescriptor targetUnderlying = catalog.unwrapNullable(target);
        if (sourceUnderlying != null && targetUnderlying != null)
            return areCompatible(sourceUnderlying, targetUnderlying);
        if (targetUnderlying != null && areCompatible(source, targetUnderlying))
            return true;
        if (sourceUnderlying != null && areCompatible(sourceUnderlying, target))
            return true;

        // Narrowing is accepted too; the generated code casts where javac requires it.
        if (catalog.isNumeric(source) && catalog.isNumeric(target))
            return true;

        if (target.equals(Types.STRING) || target.equals(Types.OBJECT))
            return true;

        return catalog.hasDeclaredConversion(source, target);
    }

    /** True for the numeric kinds (primitive or registered numeric classes). */
    public boolean isNumeric(TypeDescriptor type) {
        return catalog.isNumeric(type);
    }
}
