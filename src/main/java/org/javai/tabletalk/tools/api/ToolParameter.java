package org.javai.tabletalk.tools.api;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.PARAMETER)
public @interface ToolParameter {

	/**
	 * Parameter name advertised to models. Defaults to the Java parameter name in snake_case.
	 */
	String name() default "";

	/**
	 * Human-readable description of the parameter, used to guide the model.
	 */
	String description() default "";

	boolean required() default true;

	/**
	 * Explicit whitelist of allowed values, matched case-insensitively. Enum parameters derive
	 * theirs from the constants.
	 */
	String[] allowedValues() default {};

	/**
	 * Value used when an optional parameter is absent. Empty means no default.
	 */
	String defaultValue() default "";

	/**
	 * Example values shown in prompts.
	 */
	String[] examples() default {};
}
