package org.scriptonbasestar.dataloader.core.exception;

/**
 * sb-dataloader 예외의 최상위 타입
 *
 * @author archmagece
 * @since 2025-02
 */
public class SBDataloaderException extends RuntimeException {

	public SBDataloaderException() {
		super();
	}

	public SBDataloaderException(String message) {
		super(message);
	}

	public SBDataloaderException(String message, Throwable cause) {
		super(message, cause);
	}

	public SBDataloaderException(Throwable cause) {
		super(cause);
	}
}
