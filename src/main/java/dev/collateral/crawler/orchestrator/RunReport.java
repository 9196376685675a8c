package dev.collateral.crawler.orchestrator;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import dev.collateral.crawler.util.FileUtils;
import java.io.IOException;
import java.nio.file.Path;

/** Writes a {@link RunSummary} as a JSON report */
public class RunReport {
	private static final ObjectMapper mapper = JsonMapper.builder()
			.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false)
			.enable(SerializationFeature.INDENT_OUTPUT)
			.build();

	private RunReport() {
		// Utility class
	}

	public static void write(RunSummary summary, Path file) throws IOException {
		Path parent = file.toAbsolutePath().getParent();
		if (parent != null) {
			FileUtils.ensureDirectory(parent);
		}
		mapper.writeValue(file.toFile(), summary);
	}

	public static String toJson(RunSummary summary) throws IOException {
		return mapper.writeValueAsString(summary);
	}
}
