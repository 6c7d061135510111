package org.scriptonbasestar.dataloader.spring.boot;

import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Enables SB Dataloader without relying on auto-configuration scanning.
 *
 * <h3>Basic Usage:</h3>
 * <pre>{@code
 * @Configuration
 * @EnableSBDataloader
 * public class DataloaderConfig {
 * }
 * }</pre>
 *
 * <p>
 * If you define your own {@link SBDataloaderFactory} or {@code sbDataloaderExecutor} bean,
 * the auto-configured one backs off.
 * </p>
 *
 * @author archmagece
 * @since 2025-02
 * @see SBDataloaderAutoConfiguration
 * @see SBDataloaderProperties
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(SBDataloaderAutoConfiguration.class)
public @interface EnableSBDataloader {
}
