package org.javai.tabletalk.tools.api;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a method as a tool the resolution strategies can select.
 * <p>
 * Example:
 *
 * <pre>
 * {@code
 * @AnalysisTool(name = "get_file_schema", description = "Show the columns of one file")
 * public String getFileSchema(@ToolParameter(name = "file_name") String fileName) {
 *     ...
 * }
 * }
 * </pre>
 *
 * Tool methods return human-readable text and never modify the schema store.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface AnalysisTool {

	/**
	 * Tool name advertised to models, e.g. {@code "get_files"}. Defaults to the method name in
	 * snake_case.
	 */
	String name() default "";

	/**
	 * What the tool does, forwarded to model prompts.
	 */
	String description() default "";
}
