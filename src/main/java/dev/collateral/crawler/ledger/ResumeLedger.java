package dev.collateral.crawler.ledger;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.collateral.crawler.model.AssetKind;
import dev.collateral.crawler.model.Fingerprint;
import dev.collateral.crawler.model.LedgerEntry;
import dev.collateral.crawler.util.FileUtils;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Durable record of finalized (model code, asset kind) pairs. The backing file holds one JSON
 * object per line and is appended to on every commit, so an interrupted run keeps everything
 * committed up to the last finalized asset. When a key appears more than once the last line wins.
 *
 * <p>Commits are synchronized, several worker sessions may share one ledger.
 */
public class ResumeLedger implements Closeable {
	private static final Logger logger = LoggerFactory.getLogger(ResumeLedger.class);

	private static final ObjectMapper mapper =
			new ObjectMapper().configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);

	private final Path file;
	private final Clock clock;
	private final Map<Key, LedgerEntry> entries = new LinkedHashMap<>();
	private BufferedWriter writer;
	private boolean loaded;

	public ResumeLedger(Path file) {
		this(file, Clock.systemUTC());
	}

	public ResumeLedger(Path file, Clock clock) {
		this.file = file;
		this.clock = clock;
	}

	/**
	 * Read the ledger file. A missing file is an empty ledger. Lines that can not be parsed, such as a
	 * record truncated by a crash, are skipped.
	 */
	public synchronized void load() throws IOException {
		entries.clear();
		if (Files.exists(file)) {
			int lineNo = 0;
			for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
				lineNo++;
				if (line.isBlank()) {
					continue;
				}
				try {
					LedgerEntry entry = mapper.readValue(line, LedgerEntry.class);
					if (entry.modelCode() == null || entry.kind() == null) {
						logger.warn("Ignoring incomplete ledger record at {}:{}", file, lineNo);
						continue;
					}
					entries.put(new Key(entry.modelCode(), entry.kind()), entry);
				} catch (JsonProcessingException e) {
					logger.warn("Ignoring unreadable ledger record at {}:{} - {}", file, lineNo, e.getOriginalMessage());
				}
			}
		}
		loaded = true;
		logger.info("Loaded {} ledger entries from {}", entries.size(), file);
	}

	public synchronized boolean hasCompleted(String modelCode, AssetKind kind) {
		return entries.containsKey(new Key(modelCode, kind));
	}

	public synchronized Optional<LedgerEntry> entry(String modelCode, AssetKind kind) {
		return Optional.ofNullable(entries.get(new Key(modelCode, kind)));
	}

	/**
	 * Commit a finalized asset. The record is appended to the ledger file and flushed before this
	 * method returns.
	 *
	 * @param modelCode The product model code
	 * @param kind The asset kind
	 * @param relativePath Canonical path of the asset relative to the output root
	 * @param fingerprint Fingerprint of the canonical file
	 * @return The committed entry
	 */
	public synchronized LedgerEntry markCompleted(
			String modelCode, AssetKind kind, String relativePath, Fingerprint fingerprint) throws IOException {
		ensureLoaded();
		LedgerEntry entry = LedgerEntry.of(
				modelCode, kind, relativePath, fingerprint, clock.instant().toString());
		BufferedWriter out = writer();
		out.write(mapper.writeValueAsString(entry));
		out.newLine();
		flush();
		entries.put(new Key(modelCode, kind), entry);
		logger.debug("Committed {} {} to ledger", modelCode, kind.label());
		return entry;
	}

	/** Push buffered records to the ledger file */
	public synchronized void flush() throws IOException {
		if (writer != null) {
			writer.flush();
		}
	}

	/**
	 * Rewrite the ledger file with exactly one line per key. The new file replaces the old one
	 * atomically.
	 */
	public synchronized void compact() throws IOException {
		ensureLoaded();
		closeWriter();
		FileUtils.ensureDirectory(file.toAbsolutePath().getParent());
		Path temp = file.resolveSibling(file.getFileName() + ".compact");
		try (BufferedWriter out = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
			for (LedgerEntry entry : entries.values()) {
				out.write(mapper.writeValueAsString(entry));
				out.newLine();
			}
		}
		FileUtils.moveIntoPlace(temp, file);
		logger.info("Compacted ledger {} to {} entries", file, entries.size());
	}

	public synchronized int size() {
		return entries.size();
	}

	public synchronized List<LedgerEntry> entries() {
		return new ArrayList<>(entries.values());
	}

	public Path file() {
		return file;
	}

	@Override
	public synchronized void close() throws IOException {
		closeWriter();
	}

	private void ensureLoaded() throws IOException {
		if (!loaded) {
			load();
		}
	}

	private BufferedWriter writer() throws IOException {
		if (writer == null) {
			FileUtils.ensureDirectory(file.toAbsolutePath().getParent());
			boolean danglingLine = endsWithoutNewline();
			writer = Files.newBufferedWriter(
					file, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
			if (danglingLine) {
				// a crash mid-append left a partial record, keep ours on a line of its own
				writer.newLine();
			}
		}
		return writer;
	}

	private boolean endsWithoutNewline() throws IOException {
		if (!Files.exists(file) || Files.size(file) == 0) {
			return false;
		}
		try (var channel = Files.newByteChannel(file)) {
			channel.position(channel.size() - 1);
			ByteBuffer last = ByteBuffer.allocate(1);
			channel.read(last);
			return last.get(0) != '\n';
		}
	}

	private void closeWriter() throws IOException {
		if (writer != null) {
			try {
				writer.close();
			} finally {
				writer = null;
			}
		}
	}

	private record Key(String modelCode, AssetKind kind) {}
}
