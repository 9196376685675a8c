package dev.collateral.crawler.model;

/** The categories of collateral collected for every product */
public enum AssetKind {
	CATALOG("_Catalog", "pdf", Requirement.REQUIRED, false),
	DIMENSION("_Dimension", "pdf", Requirement.REQUIRED, false),
	DXF("_DXF", "zip", Requirement.REQUIRED, true),
	STEP("_STEP", "zip", Requirement.REQUIRED, true),
	DATASHEET("_Datasheet", "pdf", Requirement.EXPECTED, false),
	MANUAL("_Manual", "pdf", Requirement.OPTIONAL, false),
	IMAGE("", "png", Requirement.OPTIONAL, false);

	/**
	 * How strongly an asset is expected. Required kinds make up the batch group and decide whether a
	 * product is complete. Expected kinds are always attempted. Optional kinds are only attempted
	 * when the portal offers them.
	 */
	public enum Requirement {
		REQUIRED,
		EXPECTED,
		OPTIONAL
	}

	private final String suffix;
	private final String extension;
	private final Requirement requirement;
	private final boolean archive;

	AssetKind(String suffix, String extension, Requirement requirement, boolean archive) {
		this.suffix = suffix;
		this.extension = extension;
		this.requirement = requirement;
		this.archive = archive;
	}

	/** Suffix appended to the model code in the canonical file name */
	public String suffix() {
		return suffix;
	}

	/** Extension of the canonical file, for images the fallback when the source has none */
	public String extension() {
		return extension;
	}

	public Requirement requirement() {
		return requirement;
	}

	public boolean required() {
		return requirement == Requirement.REQUIRED;
	}

	/** Whether the portal retrieves this kind as part of a combined download */
	public boolean inBatchGroup() {
		return required();
	}

	public boolean optional() {
		return requirement == Requirement.OPTIONAL;
	}

	/** DXF and STEP are always stored as zip containers, whatever the portal delivers */
	public boolean archive() {
		return archive;
	}

	public boolean pdf() {
		return "pdf".equals(extension);
	}

	/** Lower case label used in log messages, ledger records and manifests */
	public String label() {
		return name().toLowerCase();
	}

	/**
	 * Parse a kind from its label or enum name, ignoring case.
	 *
	 * @throws IllegalArgumentException for unknown labels
	 */
	public static AssetKind fromLabel(String label) {
		for (AssetKind kind : values()) {
			if (kind.name().equalsIgnoreCase(label.trim())) {
				return kind;
			}
		}
		throw new IllegalArgumentException("Unknown asset kind: " + label);
	}
}
