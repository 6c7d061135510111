package org.scriptonbasestar.dataloader.source.jdbc;

import java.util.Objects;

/**
 * 엔티티의 연관 필드가 이미 로드되었는지를 명시하는 마커.
 *
 * <p>{@link #of(Object)}로 감싼 값만 로드된 것으로 봅니다. {@code null} 연관 값(소유자가 없는
 * belongs-to 등)도 {@code Preloaded.of(null)}로 표현할 수 있습니다.</p>
 *
 * @param <T> 연관 값 타입
 * @author archmagece
 * @since 2025-02
 */
public final class Preloaded<T> {

	private static final Preloaded<?> NOT_LOADED = new Preloaded<>(false, null);

	private final boolean loaded;
	private final T value;

	private Preloaded(boolean loaded, T value) {
		this.loaded = loaded;
		this.value = value;
	}

	public static <T> Preloaded<T> of(T value) {
		return new Preloaded<>(true, value);
	}

	@SuppressWarnings("unchecked")
	public static <T> Preloaded<T> notLoaded() {
		return (Preloaded<T>) NOT_LOADED;
	}

	public boolean isLoaded() {
		return loaded;
	}

	/**
	 * @throws IllegalStateException 로드되지 않은 경우
	 */
	public T get() {
		if (!loaded) {
			throw new IllegalStateException("Association is not loaded");
		}
		return value;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Preloaded)) {
			return false;
		}
		Preloaded<?> that = (Preloaded<?>) o;
		return loaded == that.loaded && Objects.equals(value, that.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(loaded, value);
	}

	@Override
	public String toString() {
		return loaded ? "Preloaded{" + value + "}" : "Preloaded{not loaded}";
	}
}
