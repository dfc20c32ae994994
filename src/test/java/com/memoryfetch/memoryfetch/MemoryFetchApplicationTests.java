package com.memoryfetch.memoryfetch;

import com.memoryfetch.memoryfetch.cli.MemoriesCommandLineRunner;
import com.memoryfetch.memoryfetch.memories.MemoriesProperties;
import com.memoryfetch.memoryfetch.memories.MemoryDownloadService;
import com.memoryfetch.memoryfetch.memories.MemoryTransport;
import com.memoryfetch.memoryfetch.memories.RestClientMemoryTransport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest(properties = "memories.cli.enabled=false")
class MemoryFetchApplicationTests {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private MemoriesProperties properties;

    @Autowired
    private MemoryTransport transport;

    @Test
    void contextLoadsWithConfiguredDefaults() {
        assertEquals(1, context.getBeansOfType(MemoryDownloadService.class).size());
        assertTrue(context.getBeansOfType(MemoriesCommandLineRunner.class).isEmpty());
        assertInstanceOf(RestClientMemoryTransport.class, transport);

        assertEquals("downloads", properties.getOutputDir());
        assertEquals(1.0, properties.getDelay());
        assertEquals(3, properties.getMaxRetries());
        assertEquals(1, properties.getConcurrency());
        assertEquals(10, properties.getConfirmConcurrencyAbove());
        assertEquals(Duration.ofSeconds(1), properties.getBackoffUnit());
        assertEquals("mem-dmd", properties.getRouteHeaderValue());
    }
}
