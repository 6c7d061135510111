package org.scriptonbasestar.dataloader.core.exception;

/**
 * load 되지 않았거나, load 후 아직 run 하지 않은 키를 {@code get} 할 때 발생합니다.
 *
 * @author archmagece
 * @since 2025-02
 */
public class SBNotLoadedException extends SBDataloaderException {

	private final transient Object groupingKey;
	private final transient Object itemKey;

	public SBNotLoadedException(Object groupingKey, Object itemKey) {
		super("Not loaded - groupingKey : " + groupingKey + ", itemKey : " + itemKey
			+ " (call load() and run() before get())");
		this.groupingKey = groupingKey;
		this.itemKey = itemKey;
	}

	public Object getGroupingKey() {
		return groupingKey;
	}

	public Object getItemKey() {
		return itemKey;
	}
}
