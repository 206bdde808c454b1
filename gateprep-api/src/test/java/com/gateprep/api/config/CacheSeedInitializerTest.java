package com.gateprep.api.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gateprep.common.constants.ContentKind;
import com.gateprep.core.cache.ContentCache;
import com.gateprep.core.parser.ContentBinder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class CacheSeedInitializerTest {

    @TempDir
    Path tempDir;

    private ContentCache cache;
    private CacheSeedInitializer initializer;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        ContentBinder binder = new ContentBinder();
        cache = new ContentCache(objectMapper, binder, tempDir.resolve("cache.json").toString(), 100);
        initializer = new CacheSeedInitializer(cache, binder, objectMapper, new DefaultResourceLoader());
        ReflectionTestUtils.setField(initializer, "seedResource", "classpath:seed/starter-content.json");
    }

    @Test
    void disabledByDefault() {
        initializer.run();

        assertThat(cache.load().isEmpty()).isTrue();
    }

    @Test
    void bundledStarterContentSeedsEveryKind() {
        ReflectionTestUtils.setField(initializer, "seedEnabled", true);

        initializer.run();

        assertThat(cache.sizes())
            .containsEntry(ContentKind.QUESTION, 5)
            .containsEntry(ContentKind.FACT, 7)
            .containsEntry(ContentKind.FORMULA, 5)
            .containsEntry(ContentKind.LANGUAGE, 2);
    }

    @Test
    void missingResourceIsIgnored() {
        ReflectionTestUtils.setField(initializer, "seedEnabled", true);
        ReflectionTestUtils.setField(initializer, "seedResource", "classpath:seed/does-not-exist.json");

        initializer.run();

        assertThat(cache.load().isEmpty()).isTrue();
    }
}
