package org.javai.tabletalk.sql;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.select.TableFunction;
import net.sf.jsqlparser.util.TablesNamesFinder;
import org.apache.commons.lang3.StringUtils;
import org.javai.tabletalk.error.PlanParseException;
import org.javai.tabletalk.error.UnsafeSqlException;

/**
 * A single SQL query known to be read-only.
 * <p>
 * Model output is cleaned first (code fences, a leading {@code SQL:} label and trailing semicolons
 * are removed), then the statement must start with {@code SELECT} or {@code WITH}, contain no
 * further statements, parse as a {@link Select}, and read from no table other than
 * {@value #TABLE}. Table functions such as {@code read_csv} are refused wherever they appear.
 * Anything else is rejected and never reaches the database.
 */
public final class ReadOnlySql {

	private static final Pattern CODE_FENCE = Pattern.compile("```(?:sql|SQL)?\\s*(.*?)```", Pattern.DOTALL);
	private static final Pattern LABEL = Pattern.compile("^(?i)(sql|query)\\s*:\\s*");
	private static final Pattern READ_KEYWORD = Pattern.compile("^[(\\s]*(SELECT|WITH)\\b", Pattern.CASE_INSENSITIVE);
	private static final Pattern FIRST_WORD = Pattern.compile("^[(\\s]*(\\w*)");

	/**
	 * The only table generated SQL may read.
	 */
	public static final String TABLE = "schema_info";

	private final String sql;
	private final Select select;

	private ReadOnlySql(String sql, Select select) {
		this.sql = sql;
		this.select = select;
	}

	/**
	 * Cleans and validates model-produced SQL.
	 *
	 * @throws UnsafeSqlException  if the statement is not a single SELECT or WITH query over {@value #TABLE}
	 * @throws PlanParseException  if it is empty or does not parse
	 */
	public static ReadOnlySql fromSql(String raw) {
		String cleaned = cleanup(raw);
		if (cleaned.isEmpty()) {
			throw new PlanParseException("No SQL statement found");
		}
		if (!READ_KEYWORD.matcher(cleaned).find()) {
			Matcher first = FIRST_WORD.matcher(cleaned);
			String keyword = first.find() ? first.group(1).toUpperCase(Locale.ROOT) : "";
			throw new UnsafeSqlException("Only SELECT or WITH queries are allowed, got: " + keyword);
		}
		if (hasStatementSeparator(cleaned)) {
			throw new UnsafeSqlException("Only a single statement is allowed");
		}
		Statement statement;
		try {
			statement = CCJSqlParserUtil.parse(cleaned);
		}
		catch (JSQLParserException e) {
			throw new PlanParseException("Invalid SQL syntax: " + e.getMessage(), e);
		}
		if (!(statement instanceof Select select)) {
			throw new UnsafeSqlException(
					"Only SELECT statements are allowed, got: " + statement.getClass().getSimpleName());
		}
		checkSources(select);
		return new ReadOnlySql(cleaned, select);
	}

	private static void checkSources(Select select) {
		SourceFinder finder = new SourceFinder();
		Set<String> tables;
		try {
			// Cast to Statement to resolve method ambiguity in JSqlParser
			tables = finder.getTables((Statement) select);
		}
		catch (UnsupportedOperationException e) {
			throw new UnsafeSqlException("Cannot determine the tables this query reads: " + e.getMessage(), e);
		}
		if (!finder.tableFunctions.isEmpty()) {
			throw new UnsafeSqlException("Table functions are not allowed: " + String.join(", ", finder.tableFunctions));
		}
		for (String table : tables) {
			if (!TABLE.equalsIgnoreCase(unqualified(table))) {
				throw new UnsafeSqlException("Only the " + TABLE + " table can be queried, got: " + table);
			}
		}
	}

	private static String unqualified(String table) {
		String name = table.replace("\"", "");
		int dot = name.lastIndexOf('.');
		return dot >= 0 ? name.substring(dot + 1) : name;
	}

	/**
	 * Strips code fences, a leading label, surrounding whitespace and trailing semicolons.
	 */
	public static String cleanup(String raw) {
		if (raw == null) {
			return "";
		}
		String text = raw.trim();
		Matcher fence = CODE_FENCE.matcher(text);
		if (fence.find()) {
			text = fence.group(1).trim();
		}
		text = LABEL.matcher(text).replaceFirst("");
		text = text.trim();
		while (text.endsWith(";")) {
			text = StringUtils.removeEnd(text, ";").trim();
		}
		return text;
	}

	private static boolean hasStatementSeparator(String sql) {
		boolean inSingle = false;
		boolean inDouble = false;
		for (int i = 0; i < sql.length(); i++) {
			char c = sql.charAt(i);
			if (c == '\'' && !inDouble) {
				inSingle = !inSingle;
			}
			else if (c == '"' && !inSingle) {
				inDouble = !inDouble;
			}
			else if (c == ';' && !inSingle && !inDouble) {
				return true;
			}
		}
		return false;
	}

	public String sql() {
		return sql;
	}

	public Select select() {
		return select;
	}

	@Override
	public String toString() {
		return sql;
	}

	/**
	 * Collects table names like its parent and additionally records every table function.
	 */
	private static final class SourceFinder extends TablesNamesFinder<Void> {

		private final List<String> tableFunctions = new ArrayList<>();

		@Override
		public <S> Void visit(TableFunction tableFunction, S context) {
			tableFunctions.add(tableFunction.getFunction().getName());
			return super.visit(tableFunction, context);
		}
	}
}
