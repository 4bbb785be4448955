// SPDX-License-Identifier: MIT OR Apache-2.0
package io.cardwire.core;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a type or method as internal API not intended for public use.
 *
 * <p>Elements annotated with {@code @InternalApi} are implementation details
 * that may change or be removed without notice between versions. They are
 * public only because another Cardwire module needs them.
 */
@Documented
@Retention(RetentionPolicy.CLASS)
@Target({ElementType.TYPE, ElementType.METHOD, ElementType.CONSTRUCTOR, ElementType.FIELD})
public @interface InternalApi {
}
