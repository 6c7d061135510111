package org.scriptonbasestar.dataloader.core.exception;

/**
 * @author archmagece
 * @since 2025-02
 */
public class SBUnknownSourceException extends SBDataloaderException {

	private final String sourceName;

	public SBUnknownSourceException(String sourceName) {
		super("Unknown source : " + sourceName);
		this.sourceName = sourceName;
	}

	public String getSourceName() {
		return sourceName;
	}
}
