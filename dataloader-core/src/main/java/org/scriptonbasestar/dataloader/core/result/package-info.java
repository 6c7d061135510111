/**
 * 로드 결과 타입
 *
 * @author archmagece
 * @since 2025-02
 */
package org.scriptonbasestar.dataloader.core.result;
