package com.autonomous.analysis.orchestration;

import com.autonomous.analysis.exception.DuplicateWriteException;
import com.autonomous.analysis.exception.ResultNotFoundException;
import com.autonomous.analysis.model.AgentResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ResultStoreTest {

    private ResultStore store;

    @BeforeEach
    void setUp() {
        store = new ResultStore(List.of("macro", "finance", "market"));
    }

    private static AgentResult result(String role, String content) {
        return AgentResult.builder().role(role).content(content).summary(content).attempt(1).build();
    }

    @Test
    void shouldRejectSecondWrite() {
        store.put("macro", result("macro", "first"));

        assertThrows(DuplicateWriteException.class, () -> store.put("macro", result("macro", "second")));
        assertEquals("first", store.require("macro").getContent());
    }

    @Test
    void shouldKeepHistoryOnReplace() {
        store.put("macro", result("macro", "first"));
        store.replace("macro", result("macro", "second"));

        assertEquals("second", store.require("macro").getContent());
        assertEquals(2, store.history("macro").size());
    }

    @Test
    void shouldSnapshotInDeclaredOrder() {
        store.put("market", result("market", "m"));
        store.put("macro", result("macro", "a"));

        assertEquals(List.of("macro", "market"), List.copyOf(store.snapshot().keySet()));
    }

    @Test
    void shouldFailRequireForMissingRole() {
        assertTrue(store.get("finance").isEmpty());
        assertThrows(ResultNotFoundException.class, () -> store.require("finance"));
    }

    @Test
    void shouldRejectForeignRoleAndMismatchedResult() {
        assertThrows(IllegalArgumentException.class, () -> store.put("policy", result("policy", "x")));
        assertThrows(IllegalArgumentException.class, () -> store.put("macro", result("finance", "x")));
    }

    @Test
    void shouldAcceptExactlyOneOfConcurrentWrites() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger rejected = new AtomicInteger();
        for (int i = 0; i < 8; i++) {
            int n = i;
            pool.submit(() -> {
                start.await();
                try {
                    store.put("finance", result("finance", "writer-" + n));
                } catch (DuplicateWriteException e) {
                    rejected.incrementAndGet();
                }
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));

        assertEquals(7, rejected.get());
        assertEquals(1, store.history("finance").size());
    }
}
