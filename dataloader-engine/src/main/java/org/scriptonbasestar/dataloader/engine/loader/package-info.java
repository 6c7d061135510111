/**
 * 여러 소스를 묶어 한 번에 run 하는 로더.
 *
 * @author archmagece
 * @since 2025-02
 */
package org.scriptonbasestar.dataloader.engine.loader;
