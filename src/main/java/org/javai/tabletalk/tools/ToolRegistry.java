package org.javai.tabletalk.tools;

import java.lang.reflect.Method;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.javai.tabletalk.error.TableTalkException;
import org.javai.tabletalk.error.ToolExecutionException;
import org.javai.tabletalk.error.UnknownToolException;
import org.javai.tabletalk.tools.api.AnalysisTool;
import org.javai.tabletalk.tools.api.ToolParameter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Catalog of tools by name.
 * <p>
 * Tools are registered at startup, either from {@link AnalysisTool}-annotated methods of a bean or
 * programmatically, after which {@link #freeze()} makes the catalog immutable. Registering the same
 * tool twice is a no-op; registering a different tool under a taken name is an error.
 */
public final class ToolRegistry {

	private static final Logger logger = LoggerFactory.getLogger(ToolRegistry.class);

	private final Map<String, ToolBinding> entries = new LinkedHashMap<>();
	private volatile boolean frozen;

	public ToolRegistry registerTools(Object bean) {
		// getMethods() order is unspecified
		Method[] methods = bean.getClass().getMethods();
		Arrays.sort(methods, Comparator.comparing(Method::getName));
		for (Method method : methods) {
			AnalysisTool tool = method.getAnnotation(AnalysisTool.class);
			if (tool == null) continue;

			String name = !tool.name().isBlank() ? tool.name() : snakeCase(method.getName());
			String description = !tool.description().isBlank()
					? tool.description()
					: "Tool to " + nameBreakdown(method.getName());
			ToolDescriptor descriptor = new ToolDescriptor(name, description, createParameterDescriptors(method));
			add(new ToolBinding(descriptor, new MethodToolHandler(bean, method, descriptor), method));
		}
		return this;
	}

	public ToolRegistry register(ToolDescriptor descriptor, ToolHandler handler) {
		add(new ToolBinding(descriptor, handler, handler));
		return this;
	}

	private synchronized void add(ToolBinding binding) {
		if (frozen) {
			throw new IllegalStateException("Tool registry is frozen; cannot register " + binding.name());
		}
		ToolBinding existing = entries.get(binding.name());
		if (existing != null) {
			if (existing.descriptor().equals(binding.descriptor()) && existing.source().equals(binding.source())) {
				logger.debug("Tool {} already registered", binding.name());
				return;
			}
			throw new IllegalStateException("Duplicate tool definition: " + binding.name());
		}
		entries.put(binding.name(), binding);
		logger.debug("Registered tool {}", binding.name());
	}

	/**
	 * Ends the registration phase.
	 */
	public ToolRegistry freeze() {
		frozen = true;
		return this;
	}

	public boolean contains(String name) {
		return name != null && entries.containsKey(name);
	}

	public Optional<ToolDescriptor> descriptor(String name) {
		ToolBinding binding = name != null ? entries.get(name) : null;
		return Optional.ofNullable(binding).map(ToolBinding::descriptor);
	}

	/**
	 * Descriptions of every tool in registration order, for advertising to models.
	 */
	public List<ToolDescriptor> schemas() {
		return entries.values().stream().map(ToolBinding::descriptor).toList();
	}

	public List<String> toolNames() {
		return List.copyOf(entries.keySet());
	}

	/**
	 * Runs a tool.
	 *
	 * @throws UnknownToolException   if no tool has that name
	 * @throws org.javai.tabletalk.error.InvalidParametersException if the arguments do not fit
	 * @throws ToolExecutionException if the tool fails
	 */
	public String execute(String name, Map<String, ?> arguments) {
		ToolBinding binding = name != null ? entries.get(name) : null;
		if (binding == null) {
			throw new UnknownToolException(name);
		}
		Map<String, Object> normalized = ToolArguments.normalize(binding.descriptor(), arguments);
		logger.debug("Executing tool {} with {}", name, normalized);
		try {
			return binding.handler().execute(normalized);
		}
		catch (TableTalkException e) {
			throw e;
		}
		catch (RuntimeException e) {
			throw new ToolExecutionException("Tool " + name + " failed: " + e.getMessage(), e);
		}
	}

	private static List<ToolParameterDescriptor> createParameterDescriptors(Method method) {
		List<ToolParameterDescriptor> descriptors = new ArrayList<>();
		for (Parameter parameter : method.getParameters()) {
			descriptors.add(createParameterDescriptor(method, parameter));
		}
		return descriptors;
	}

	private static ToolParameterDescriptor createParameterDescriptor(Method method, Parameter parameter) {
		ToolParameter annotation = parameter.getAnnotation(ToolParameter.class);
		String name = annotation != null && !annotation.name().isBlank()
				? annotation.name()
				: snakeCase(parameter.getName());
		boolean required = annotation == null || annotation.required();
		String defaultValue = annotation != null ? annotation.defaultValue() : "";
		if (!required && defaultValue.isEmpty() && parameter.getType().isPrimitive()) {
			throw new IllegalStateException("Optional primitive parameter " + name + " of " + method.getName()
					+ " needs a default value");
		}
		String description = annotation != null && !annotation.description().isBlank()
				? annotation.description()
				: "Parameter to " + nameBreakdown(parameter.getName());
		return new ToolParameterDescriptor(
				name,
				ParameterType.forJavaType(parameter.getType()),
				description,
				required,
				deriveAllowedValues(parameter, annotation),
				defaultValue,
				annotation != null ? Arrays.asList(annotation.examples()) : List.of());
	}

	private static List<String> deriveAllowedValues(Parameter parameter, ToolParameter annotation) {
		// Explicit allowedValues wins
		if (annotation != null && annotation.allowedValues().length > 0) {
			return Arrays.asList(annotation.allowedValues());
		}
		Class<?> type = parameter.getType();
		if (type.isEnum()) {
			return Arrays.stream(type.getEnumConstants()).map(Object::toString).toList();
		}
		return List.of();
	}

	static String snakeCase(String name) {
		return nameBreakdown(name).replace(' ', '_');
	}

	private static String nameBreakdown(String name) {
		// getFileSchema -> "get file schema", HTTPServerURL -> "http server url"
		if (name == null || name.isBlank()) return "";
		return name
				.replaceAll("([A-Z]+)([A-Z][a-z])", "$1 $2")
				.replaceAll("([a-z0-9])([A-Z])", "$1 $2")
				.replace('_', ' ')
				.replace('-', ' ')
				.trim()
				.toLowerCase();
	}
}
