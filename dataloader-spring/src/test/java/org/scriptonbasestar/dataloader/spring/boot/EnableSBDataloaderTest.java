package org.scriptonbasestar.dataloader.spring.boot;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.scriptonbasestar.dataloader.engine.loader.SBDataloader;
import org.scriptonbasestar.dataloader.engine.source.KVSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Configuration;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.junit4.SpringJUnit4ClassRunner;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.*;

/**
 * @EnableSBDataloader 통합 테스트
 *
 * @author archmagece
 * @since 2025-02
 */
@RunWith(SpringJUnit4ClassRunner.class)
@ContextConfiguration(classes = EnableSBDataloaderTest.TestConfig.class)
@TestPropertySource(properties = {
	"sb-dataloader.fetch-threads=2",
	"sb-dataloader.enable-metrics=true"
})
public class EnableSBDataloaderTest {

	@Autowired
	private SBDataloaderFactory factory;

	@Autowired
	private SBDataloaderProperties properties;

	@Test
	public void testFactoryLoadsThroughSharedPool() {
		AtomicInteger calls = new AtomicInteger();
		Map<Long, String> names = new HashMap<>();
		names.put(1L, "Ben Wilson");
		names.put(2L, "Andy McVitty");
		KVSource<String, Long, String> users = factory.kvSource("users", (type, ids) -> {
			calls.incrementAndGet();
			return names;
		});

		SBDataloader loader = factory.newLoader()
			.addSource("users", users)
			.loadMany("users", "user", Arrays.asList(1L, 2L))
			.run();
		SBDataloader again = loader.loadMany("users", "user", Arrays.asList(2L, 1L)).run();

		List<String> result = again.getMany("users", "user", Arrays.asList(2L, 1L));
		assertEquals(Arrays.asList("Andy McVitty", "Ben Wilson"), result);
		assertSame(loader, again);
		assertEquals(1, calls.get());
	}

	@Test
	public void testPropertiesBound() {
		assertEquals(2, properties.getFetchThreads());
		assertTrue(properties.isEnableMetrics());
	}

	@Configuration
	@EnableSBDataloader
	static class TestConfig {
	}
}
