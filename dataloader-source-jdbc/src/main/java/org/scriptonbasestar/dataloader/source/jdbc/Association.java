package org.scriptonbasestar.dataloader.source.jdbc;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@link AssociationSource}의 grouping key. 소유 타입, 관계 이름, 쿼리 파라미터로 구성됩니다.
 *
 * <p>파라미터가 다르면 같은 관계라도 다른 그룹으로 따로 조회됩니다.
 * 파라미터는 {@link QueryCustomizer}에 전달됩니다.</p>
 *
 * @author archmagece
 * @since 2025-02
 */
public final class Association {

	private final Class<?> ownerType;
	private final String name;
	private final Map<String, Object> params;

	private Association(Class<?> ownerType, String name, Map<String, Object> params) {
		if (ownerType == null) {
			throw new IllegalArgumentException("ownerType cannot be null");
		}
		if (name == null || name.trim().isEmpty()) {
			throw new IllegalArgumentException("name cannot be null or empty");
		}
		this.ownerType = ownerType;
		this.name = name;
		this.params = params == null || params.isEmpty()
			? Collections.emptyMap()
			: Collections.unmodifiableMap(new LinkedHashMap<>(params));
	}

	public static Association of(Class<?> ownerType, String name) {
		return new Association(ownerType, name, null);
	}

	public static Association of(Class<?> ownerType, String name, Map<String, ?> params) {
		return new Association(ownerType, name, params == null ? null : new LinkedHashMap<>(params));
	}

	public Class<?> getOwnerType() {
		return ownerType;
	}

	public String getName() {
		return name;
	}

	public Map<String, Object> getParams() {
		return params;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Association)) {
			return false;
		}
		Association that = (Association) o;
		return ownerType.equals(that.ownerType) && name.equals(that.name) && params.equals(that.params);
	}

	@Override
	public int hashCode() {
		return Objects.hash(ownerType, name, params);
	}

	@Override
	public String toString() {
		return ownerType.getSimpleName() + "." + name + (params.isEmpty() ? "" : params.toString());
	}
}
