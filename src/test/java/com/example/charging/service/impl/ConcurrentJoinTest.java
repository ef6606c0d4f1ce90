package com.example.charging.service.impl;

import com.example.charging.dto.JoinResult;
import com.example.charging.dto.QueueError;
import com.example.charging.dto.QueueResult;
import com.example.charging.model.QueueEntry;
import com.example.charging.support.QueueFixture;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ConcurrentJoinTest {

    @Test
    void shouldNeverExceedCapacityOrDuplicatePositions() throws Exception {
        QueueFixture fx = new QueueFixture().station(5, 30);
        int users = 12;
        ExecutorService pool = Executors.newFixedThreadPool(users);
        CountDownLatch go = new CountDownLatch(1);

        List<Future<QueueResult<JoinResult>>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < users; i++) {
                String userId = "u" + i;
                Callable<QueueResult<JoinResult>> join = () -> {
                    go.await();
                    return fx.coordinator.join(userId, 7L);
                };
                futures.add(pool.submit(join));
            }
            go.countDown();

            int joined = 0;
            int full = 0;
            for (Future<QueueResult<JoinResult>> future : futures) {
                QueueResult<JoinResult> result = future.get(10, TimeUnit.SECONDS);
                if (result.isSuccess()) {
                    joined++;
                } else {
                    assertThat(result.error()).isEqualTo(QueueError.QUEUE_FULL);
                    full++;
                }
            }

            assertThat(joined).isEqualTo(5);
            assertThat(full).isEqualTo(users - 5);
            assertThat(fx.store.findQueuedEntries(7L))
                    .extracting(QueueEntry::getPosition)
                    .containsExactly(1, 2, 3, 4, 5);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void shouldAdmitSameUserOnlyOnceUnderContention() throws Exception {
        QueueFixture fx = new QueueFixture().station(5, 30);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch go = new CountDownLatch(1);

        List<Future<QueueResult<JoinResult>>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < 4; i++) {
                Callable<QueueResult<JoinResult>> join = () -> {
                    go.await();
                    return fx.coordinator.join("same-user", 7L);
                };
                futures.add(pool.submit(join));
            }
            go.countDown();

            long ok = 0;
            for (Future<QueueResult<JoinResult>> future : futures) {
                if (future.get(10, TimeUnit.SECONDS).isSuccess()) {
                    ok++;
                }
            }

            assertThat(ok).isEqualTo(1);
            assertThat(fx.store.findQueuedEntries(7L)).hasSize(1);
        } finally {
            pool.shutdownNow();
        }
    }
}
