package io.linecsv.annotations;

import org.immutables.value.Value;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Style for value types that are configured through a builder, such as {@link io.linecsv.CsvSpecs}. The generated
 * implementation class is package-private; callers reach it only through the abstract type's {@code builder()} factory.
 */
@Target({ElementType.TYPE, ElementType.PACKAGE})
@Retention(RetentionPolicy.CLASS)
@Value.Style(visibility = Value.Style.ImplementationVisibility.PACKAGE,
        defaults = @Value.Immutable(copy = false), strictBuilder = false, weakInterning = true,
        jdkOnly = true)
public @interface BuildableStyle {
    // Produces ImmutableX.builder() for the annotated type
}
