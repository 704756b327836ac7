package com.chih.JTemplate.core;

import com.chih.JTemplate.core.engine.TemplateManager;
import com.chih.JTemplate.core.impl.MapTemplateRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * 并发测试
 *
 * 同一个 Template / TemplateManager 被多个线程同时渲染时，
 * 每次渲染使用独立的上下文栈，结果互不干扰
 */
@DisplayName("并发测试")
class ConcurrencyTest {

    @Test
    @DisplayName("同一模板并发渲染不同上下文")
    void testConcurrentRenderOfSharedTemplate() throws Exception {
        Template template = new Template(
                "{{name}}:{{#items}}{{.}}{{#Separator}},{{/Separator}}{{/items}}");

        int threadCount = 16;
        int iterationsPerThread = 200;
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CountDownLatch latch = new CountDownLatch(threadCount);
        AtomicInteger successCount = new AtomicInteger(0);
        List<String> errors = new CopyOnWriteArrayList<>();

        for (int i = 0; i < threadCount; i++) {
            final int threadId = i;
            executor.submit(() -> {
                try {
                    for (int j = 0; j < iterationsPerThread; j++) {
                        List<Integer> items = List.of(threadId, j, threadId + j);
                        String expected = "t" + threadId + ":" + threadId + "," + j + "," + (threadId + j);
                        String actual = template.render(Map.of("name", "t" + threadId, "items", items));
                        if (expected.equals(actual)) {
                            successCount.incrementAndGet();
                        } else {
                            errors.add(actual);
                        }
                    }
                } catch (Exception e) {
                    errors.add(e.toString());
                } finally {
                    latch.countDown();
                }
            });
        }

        assertThat(latch.await(30, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        assertThat(errors).isEmpty();
        assertThat(successCount.get()).isEqualTo(threadCount * iterationsPerThread);
    }

    @Test
    @DisplayName("TemplateManager 并发渲染带包含的模板")
    void testConcurrentManagerRender() throws Exception {
        MapTemplateRepository repository = new MapTemplateRepository()
                .put("row", "<{{.}}>")
                .put("table", "{{#rows}}{{>row}}{{/rows}}");
        TemplateManager manager = new TemplateManager(repository);

        ExecutorService executor = Executors.newFixedThreadPool(8);
        List<Future<String>> futures = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            final int n = i;
            futures.add(executor.submit(() -> manager.render("table", Map.of("rows", List.of(n, n + 1)))));
        }

        for (int i = 0; i < futures.size(); i++) {
            assertThat(futures.get(i).get(10, TimeUnit.SECONDS)).isEqualTo("<" + i + "><" + (i + 1) + ">");
        }
        executor.shutdown();
    }
}
