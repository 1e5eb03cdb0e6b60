package io.b2mash.orgguard.rbac;

import io.b2mash.orgguard.api.Permission;
import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Restricts a handler to members holding any of {@link #value()}, or all of them when {@link
 * #requireAll()} is set. Implies organization context resolution.
 */
@Target({ElementType.METHOD, ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface RequiresPermission {

  Permission[] value();

  boolean requireAll() default false;
}
