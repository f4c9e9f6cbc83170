package org.javai.tabletalk.tools;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.List;
import java.util.Map;
import org.javai.tabletalk.error.InvalidParametersException;
import org.javai.tabletalk.error.TableTalkException;
import org.javai.tabletalk.error.ToolExecutionException;

/**
 * Invokes an {@link org.javai.tabletalk.tools.api.AnalysisTool} method reflectively, converting
 * normalized arguments to the method's parameter types and filling declared defaults.
 */
final class MethodToolHandler implements ToolHandler {

	private final Object bean;
	private final Method method;
	private final ToolDescriptor descriptor;

	MethodToolHandler(Object bean, Method method, ToolDescriptor descriptor) {
		this.bean = bean;
		this.method = method;
		this.descriptor = descriptor;
	}

	@Override
	public String execute(Map<String, Object> arguments) {
		Class<?>[] types = method.getParameterTypes();
		List<ToolParameterDescriptor> parameters = descriptor.parameters();
		Object[] values = new Object[types.length];
		for (int i = 0; i < types.length; i++) {
			ToolParameterDescriptor parameter = parameters.get(i);
			Object value = arguments.get(parameter.name());
			if (value == null && parameter.defaultValue() != null) {
				value = ToolArguments.convert(descriptor, parameter, parameter.defaultValue());
			}
			values[i] = toJava(value, types[i], parameter);
		}
		try {
			Object result = method.invoke(bean, values);
			return result != null ? result.toString() : "";
		}
		catch (InvocationTargetException e) {
			Throwable cause = e.getCause();
			if (cause instanceof TableTalkException tableTalkException) {
				throw tableTalkException;
			}
			throw new ToolExecutionException("Tool " + descriptor.name() + " failed: " + cause.getMessage(), cause);
		}
		catch (IllegalAccessException e) {
			throw new ToolExecutionException("Tool " + descriptor.name() + " is not accessible", e);
		}
	}

	private Object toJava(Object value, Class<?> type, ToolParameterDescriptor parameter) {
		if (value == null) {
			if (type.isPrimitive()) {
				throw new InvalidParametersException(
						"Missing value for parameter '" + parameter.name() + "' of tool " + descriptor.name());
			}
			return null;
		}
		if (type.isEnum()) {
			for (Object constant : type.getEnumConstants()) {
				if (constant.toString().equalsIgnoreCase(value.toString())
						|| ((Enum<?>) constant).name().equalsIgnoreCase(value.toString())) {
					return constant;
				}
			}
			throw new InvalidParametersException("Value for parameter '" + parameter.name() + "' must be one of: "
					+ String.join(", ", parameter.allowedValues()));
		}
		if (type == int.class || type == Integer.class) {
			return ((Number) value).intValue();
		}
		if (type == long.class || type == Long.class) {
			return ((Number) value).longValue();
		}
		if (type == double.class || type == Double.class) {
			return ((Number) value).doubleValue();
		}
		if (type == float.class || type == Float.class) {
			return ((Number) value).floatValue();
		}
		return value;
	}
}
