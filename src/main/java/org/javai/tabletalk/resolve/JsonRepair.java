package org.javai.tabletalk.resolve;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Recovers a single JSON object from model output.
 * <p>
 * Code fences and comments outside string values are removed, the first balanced object is kept and
 * anything after it is dropped, duplicate top-level keys keep their first value, and numbers written
 * with redundant leading zeros ({@code 00.95}) are fixed. Exponents are left alone. Valid JSON comes
 * back unchanged.
 */
public final class JsonRepair {

	private static final String FENCE = "```";
	// a sign or digit before the zeros means they sit inside a number or an exponent
	private static final Pattern LEADING_ZEROS = Pattern.compile("(?<![\\w.+-])(-?)0+(?=\\d)");

	private JsonRepair() {
	}

	/**
	 * @return the repaired object, or empty when the text contains no balanced object
	 */
	public static Optional<String> repair(String text) {
		if (text == null || text.isEmpty()) {
			return Optional.empty();
		}
		String cleaned = stripFencesAndComments(text);
		Optional<String> object = firstBalancedObject(cleaned);
		return object.map(JsonRepair::dropDuplicateKeys).map(JsonRepair::normalizeNumbers);
	}

	static String stripFencesAndComments(String text) {
		StringBuilder out = new StringBuilder(text.length());
		boolean inString = false;
		int i = 0;
		while (i < text.length()) {
			char c = text.charAt(i);
			if (inString) {
				out.append(c);
				if (c == '\\' && i + 1 < text.length()) {
					out.append(text.charAt(++i));
				}
				else if (c == '"') {
					inString = false;
				}
				i++;
				continue;
			}
			if (c == '"') {
				inString = true;
				out.append(c);
				i++;
			}
			else if (text.startsWith(FENCE, i)) {
				i += FENCE.length();
				while (i < text.length() && Character.isLetter(text.charAt(i))) {
					i++;
				}
			}
			else if (c == '/' && i + 1 < text.length() && text.charAt(i + 1) == '/') {
				while (i < text.length() && text.charAt(i) != '\n') {
					i++;
				}
			}
			else if (c == '/' && i + 1 < text.length() && text.charAt(i + 1) == '*') {
				int end = text.indexOf("*/", i + 2);
				i = end < 0 ? text.length() : end + 2;
			}
			else {
				out.append(c);
				i++;
			}
		}
		return out.toString();
	}

	static Optional<String> firstBalancedObject(String text) {
		int start = text.indexOf('{');
		if (start < 0) {
			return Optional.empty();
		}
		int depth = 0;
		boolean inString = false;
		for (int i = start; i < text.length(); i++) {
			char c = text.charAt(i);
			if (inString) {
				if (c == '\\') {
					i++;
				}
				else if (c == '"') {
					inString = false;
				}
				continue;
			}
			if (c == '"') {
				inString = true;
			}
			else if (c == '{') {
				depth++;
			}
			else if (c == '}') {
				depth--;
				if (depth == 0) {
					return Optional.of(text.substring(start, i + 1));
				}
			}
		}
		return Optional.empty();
	}

	/**
	 * Rebuilds the object from its first occurrence of each top-level key. Objects without duplicates
	 * are returned as they are.
	 */
	static String dropDuplicateKeys(String object) {
		List<String> members = topLevelMembers(object);
		Set<String> seen = new LinkedHashSet<>();
		List<String> kept = new ArrayList<>();
		for (String member : members) {
			String key = memberKey(member);
			if (key == null || seen.add(key)) {
				kept.add(member);
			}
		}
		if (kept.size() == members.size()) {
			return object;
		}
		return "{" + String.join(",", kept) + "}";
	}

	private static List<String> topLevelMembers(String object) {
		List<String> members = new ArrayList<>();
		String body = object.substring(1, object.length() - 1);
		int depth = 0;
		boolean inString = false;
		int memberStart = 0;
		for (int i = 0; i < body.length(); i++) {
			char c = body.charAt(i);
			if (inString) {
				if (c == '\\') {
					i++;
				}
				else if (c == '"') {
					inString = false;
				}
				continue;
			}
			switch (c) {
				case '"' -> inString = true;
				case '{', '[' -> depth++;
				case '}', ']' -> depth--;
				case ',' -> {
					if (depth == 0) {
						members.add(body.substring(memberStart, i));
						memberStart = i + 1;
					}
				}
				default -> {
				}
			}
		}
		if (!body.substring(memberStart).isBlank()) {
			members.add(body.substring(memberStart));
		}
		return members;
	}

	private static String memberKey(String member) {
		String trimmed = member.strip();
		if (!trimmed.startsWith("\"")) {
			return null;
		}
		for (int i = 1; i < trimmed.length(); i++) {
			char c = trimmed.charAt(i);
			if (c == '\\') {
				i++;
			}
			else if (c == '"') {
				return trimmed.substring(1, i);
			}
		}
		return null;
	}

	static String normalizeNumbers(String json) {
		StringBuilder out = new StringBuilder(json.length());
		StringBuilder segment = new StringBuilder();
		boolean inString = false;
		for (int i = 0; i < json.length(); i++) {
			char c = json.charAt(i);
			if (inString) {
				out.append(c);
				if (c == '\\' && i + 1 < json.length()) {
					out.append(json.charAt(++i));
				}
				else if (c == '"') {
					inString = false;
				}
			}
			else if (c == '"') {
				out.append(LEADING_ZEROS.matcher(segment).replaceAll("$1"));
				segment.setLength(0);
				out.append(c);
				inString = true;
			}
			else {
				segment.append(c);
			}
		}
		out.append(LEADING_ZEROS.matcher(segment).replaceAll("$1"));
		return out.toString();
	}
}
