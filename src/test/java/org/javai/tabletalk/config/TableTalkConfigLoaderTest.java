package org.javai.tabletalk.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TableTalkConfigLoaderTest {

	@Test
	void bundledConfigurationMatchesTheDefaults() {
		TableTalkConfig config = new TableTalkConfigLoader(Map.of()).load();

		assertThat(config).isEqualTo(TableTalkConfig.defaults());
		assertThat(config.inference().timeout()).isEqualTo(Duration.ofSeconds(30));
		assertThat(config.store().path()).isEqualTo("database/metadata.duckdb");
	}

	@Test
	void overrideFileReplacesOnlyWhatItNames(@TempDir Path dir) throws IOException {
		Path file = dir.resolve("override.yml");
		Files.writeString(file, """
				inference:
				  model: phi4-mini:fc
				  timeout-seconds: 5
				analysis:
				  naming-threshold: "0.9"
				""");

		TableTalkConfig config = new TableTalkConfigLoader(Map.of()).load(file);

		assertThat(config.inference().model()).isEqualTo("phi4-mini:fc");
		assertThat(config.inference().timeout()).isEqualTo(Duration.ofSeconds(5));
		assertThat(config.inference().baseUrl()).isEqualTo("http://localhost:11434");
		assertThat(config.analysis().namingThreshold()).isEqualTo(0.9);
		assertThat(config.analysis().conceptThreshold()).isEqualTo(0.7);
	}

	@Test
	void environmentWinsOverFiles() {
		TableTalkConfigLoader loader = new TableTalkConfigLoader(Map.of(
				"TABLETALK_MODEL", "llama3.2",
				"TABLETALK_STRATEGY", "SQL_Generation"));

		TableTalkConfig config = loader.load(new StringReader("inference:\n  model: phi4-mini:latest\n"));

		assertThat(config.inference().model()).isEqualTo("llama3.2");
		assertThat(config.inference().strategy()).isEqualTo("sql_generation");
	}

	@Test
	void emptyDocumentGivesDefaults() {
		assertThat(new TableTalkConfigLoader(Map.of()).load(new StringReader("")))
				.isEqualTo(TableTalkConfig.defaults());
	}

	@Test
	void embeddingAndStoreSections() {
		TableTalkConfig config = new TableTalkConfigLoader(Map.of()).load(new StringReader("""
				embedding:
				  enabled: false
				  cache-directory: /tmp/models
				store:
				  path: ""
				"""));

		assertThat(config.embedding().enabled()).isFalse();
		assertThat(config.embedding().cacheDirectory()).isEqualTo("/tmp/models");
		assertThat(config.store().path()).isEqualTo("database/metadata.duckdb");
	}

	@Test
	void invalidValuesAreRejected() {
		TableTalkConfigLoader loader = new TableTalkConfigLoader(Map.of());

		assertThatThrownBy(() -> loader.load(new StringReader("analysis:\n  diff-threshold: 1.5\n")))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("analysis.diff-threshold");
		assertThatThrownBy(() -> loader.load(new StringReader("inference:\n  timeout-seconds: 0\n")))
				.hasMessageContaining("timeout-seconds must be positive");
		assertThatThrownBy(() -> loader.load(new StringReader("inference:\n  temperature: warm\n")))
				.hasMessageContaining("must be a number");
		assertThatThrownBy(() -> loader.load(new StringReader("inference: fast\n")))
				.hasMessageContaining("must be a mapping");
		assertThatThrownBy(() -> loader.load(new StringReader("- a\n- b\n")))
				.hasMessage("Configuration root must be a mapping");
	}

	@Test
	void missingOverrideFileFails(@TempDir Path dir) {
		assertThatThrownBy(() -> new TableTalkConfigLoader(Map.of()).load(dir.resolve("absent.yml")))
				.isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("absent.yml");
	}
}
