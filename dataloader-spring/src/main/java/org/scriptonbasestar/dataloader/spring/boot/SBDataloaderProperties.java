package org.scriptonbasestar.dataloader.spring.boot;

import org.scriptonbasestar.dataloader.core.strategy.MissingKeyPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.Map;

/**
 * Configuration properties for SB Dataloader.
 * <p>
 * Bind to {@code sb-dataloader.*} properties in application.yml/properties.
 * </p>
 *
 * <h3>Example Configuration:</h3>
 * <pre>{@code
 * # application.yml
 * sb-dataloader:
 *   fetch-threads: 16
 *   fetch-timeout-ms: 3000
 *   missing-key-policy: resolve-null
 *   enable-metrics: true
 *   sources:
 *     users:
 *       fetch-timeout-ms: 500
 *     orders:
 *       missing-key-policy: fail
 * }</pre>
 *
 * @author archmagece
 * @since 2025-02
 */
@ConfigurationProperties(prefix = "sb-dataloader")
public class SBDataloaderProperties {

	/**
	 * Number of threads in the shared fetch pool.
	 */
	private int fetchThreads = 8;

	/**
	 * Default per-group fetch timeout in milliseconds (0 = none).
	 */
	private long fetchTimeoutMs = 0;

	/**
	 * Default handling of requested keys absent from a batch result.
	 */
	private MissingKeyPolicy missingKeyPolicy = MissingKeyPolicy.RESOLVE_NULL;

	/**
	 * Enable metrics collection for all sources.
	 */
	private boolean enableMetrics = false;

	/**
	 * Per-source configurations, keyed by source name.
	 */
	private Map<String, SourceConfig> sources = new HashMap<>();

	// Getters and Setters

	public int getFetchThreads() {
		return fetchThreads;
	}

	public void setFetchThreads(int fetchThreads) {
		this.fetchThreads = fetchThreads;
	}

	public long getFetchTimeoutMs() {
		return fetchTimeoutMs;
	}

	public void setFetchTimeoutMs(long fetchTimeoutMs) {
		this.fetchTimeoutMs = fetchTimeoutMs;
	}

	public MissingKeyPolicy getMissingKeyPolicy() {
		return missingKeyPolicy;
	}

	public void setMissingKeyPolicy(MissingKeyPolicy missingKeyPolicy) {
		this.missingKeyPolicy = missingKeyPolicy;
	}

	public boolean isEnableMetrics() {
		return enableMetrics;
	}

	public void setEnableMetrics(boolean enableMetrics) {
		this.enableMetrics = enableMetrics;
	}

	public Map<String, SourceConfig> getSources() {
		return sources;
	}

	public void setSources(Map<String, SourceConfig> sources) {
		this.sources = sources;
	}

	/**
	 * 소스 설정에 기본값을 채운 결과를 반환합니다. 설정이 없는 소스는 기본값만 사용합니다.
	 */
	SourceConfig resolve(String sourceName) {
		SourceConfig config = sources.get(sourceName);
		SourceConfig resolved = new SourceConfig();
		resolved.setFetchTimeoutMs(config != null && config.getFetchTimeoutMs() != null
			? config.getFetchTimeoutMs() : fetchTimeoutMs);
		resolved.setMissingKeyPolicy(config != null && config.getMissingKeyPolicy() != null
			? config.getMissingKeyPolicy() : missingKeyPolicy);
		resolved.setEnableMetrics(config != null && config.getEnableMetrics() != null
			? config.getEnableMetrics() : enableMetrics);
		return resolved;
	}

	/**
	 * Per-source configuration.
	 */
	public static class SourceConfig {
		/**
		 * Source-specific fetch timeout in milliseconds (overrides default).
		 */
		private Long fetchTimeoutMs;

		/**
		 * Source-specific missing key policy (overrides default).
		 */
		private MissingKeyPolicy missingKeyPolicy;

		/**
		 * Enable metrics for this source (overrides default).
		 */
		private Boolean enableMetrics;

		public Long getFetchTimeoutMs() {
			return fetchTimeoutMs;
		}

		public void setFetchTimeoutMs(Long fetchTimeoutMs) {
			this.fetchTimeoutMs = fetchTimeoutMs;
		}

		public MissingKeyPolicy getMissingKeyPolicy() {
			return missingKeyPolicy;
		}

		public void setMissingKeyPolicy(MissingKeyPolicy missingKeyPolicy) {
			this.missingKeyPolicy = missingKeyPolicy;
		}

		public Boolean getEnableMetrics() {
			return enableMetrics;
		}

		public void setEnableMetrics(Boolean enableMetrics) {
			this.enableMetrics = enableMetrics;
		}
	}
}
