package wirelay.util.annotations;

import org.immutables.value.Value;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Style for small positional value types (vectors, ports, wires): the generated immutable type exposes a static
 * {@code of} factory taking every attribute in declaration order, instead of a builder.
 * <p/>
 * Must be combined with {@link Value.Immutable}.
 * @see Value.Style#allParameters
 */
@Retention(RetentionPolicy.CLASS)
@Target({ElementType.TYPE, ElementType.PACKAGE})
@Value.Style(allParameters = true, defaults = @Value.Immutable(builder = false))
public @interface Tuple {
}
