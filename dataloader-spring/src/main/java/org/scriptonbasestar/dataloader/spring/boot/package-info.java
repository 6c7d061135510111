/**
 * Spring Boot 통합
 *
 * <p>{@code sb-dataloader.*} 설정, 공유 fetch executor, {@link org.scriptonbasestar.dataloader.spring.boot.SBDataloaderFactory}를
 * 자동 구성합니다.</p>
 *
 * @since 2025-02
 * @author archmagece
 */
package org.scriptonbasestar.dataloader.spring.boot;
