package org.javai.tabletalk.tools.catalog;

import org.javai.tabletalk.analysis.ConsistencyAnalyzer;
import org.javai.tabletalk.analysis.RelationshipAnalyzer;
import org.javai.tabletalk.config.TableTalkConfig.AnalysisSettings;
import org.javai.tabletalk.schema.QueryableSchemaStore;
import org.javai.tabletalk.schema.SchemaStore;
import org.javai.tabletalk.semantic.SemanticMatcher;
import org.javai.tabletalk.tools.ToolRegistry;

/**
 * Builds the frozen registry of every analysis tool over one store.
 */
public final class ToolCatalog {

	private ToolCatalog() {
	}

	public static ToolRegistry create(SchemaStore store, SemanticMatcher matcher, AnalysisSettings settings) {
		AnalysisSettings effective = settings != null ? settings : AnalysisSettings.defaults();
		RelationshipAnalyzer relationships = new RelationshipAnalyzer(matcher);
		ConsistencyAnalyzer consistency = new ConsistencyAnalyzer(matcher);
		ToolRegistry registry = new ToolRegistry()
				.registerTools(new FileTools(store))
				.registerTools(new SearchTools(store, matcher, effective.searchThreshold()))
				.registerTools(new RelationshipTools(store, relationships, effective))
				.registerTools(new ConsistencyTools(store, relationships, consistency))
				.registerTools(new AnalysisTools(store, relationships, consistency, effective));
		if (store instanceof QueryableSchemaStore queryable) {
			registry.registerTools(new SqlTools(queryable));
		}
		return registry.freeze();
	}
}
