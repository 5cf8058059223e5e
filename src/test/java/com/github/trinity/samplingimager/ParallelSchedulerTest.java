package com.github.trinity.samplingimager;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ParallelScheduler")
class ParallelSchedulerTest {

    private static final SearchGrid GRID = SyntheticScene.grid();

    private static PointEvaluation fake(int index) {
        PointDiagnostics diagnostics = new PointDiagnostics(1.0, 0.0, 0.0, 1.0, 1, SolveStatus.OK);
        return new PointEvaluation(index, index * 0.5, diagnostics);
    }

    @Nested
    @DisplayName("Partitioning")
    class PartitionTests {

        @Test
        @DisplayName("contiguous chunks cover every index once and differ in size by at most one")
        void testContiguous() {
            List<int[]> chunks = ParallelScheduler.partition(50, 4, ParallelScheduler.ChunkStrategy.CONTIGUOUS);
            assertEquals(4, chunks.size());
            int expected = 0;
            for (int[] chunk : chunks) {
                assertTrue(chunk.length == 12 || chunk.length == 13);
                for (int idx : chunk) {
                    assertEquals(expected++, idx);
                }
            }
            assertEquals(50, expected);
            assertArrayEquals(new int[]{26, 37}, new int[]{chunks.get(2)[0], chunks.get(2)[11]});
        }

        @Test
        @DisplayName("round-robin chunks interleave and cover every index once")
        void testRoundRobin() {
            List<int[]> chunks = ParallelScheduler.partition(10, 3, ParallelScheduler.ChunkStrategy.ROUND_ROBIN);
            assertArrayEquals(new int[]{0, 3, 6, 9}, chunks.get(0));
            assertArrayEquals(new int[]{1, 4, 7}, chunks.get(1));
            assertArrayEquals(new int[]{2, 5, 8}, chunks.get(2));
        }
    }

    @Nested
    @DisplayName("Runs")
    class RunTests {

        @Test
        @DisplayName("every grid point is evaluated exactly once and merged in grid order")
        void testEvaluatesAll() {
            Set<Integer> seen = ConcurrentHashMap.newKeySet();
            AssembledField assembled = new ParallelScheduler(ParallelScheduler.ChunkStrategy.ROUND_ROBIN)
                .run(GRID, 6, idx -> {
                    assertTrue(seen.add(idx), "index evaluated twice: " + idx);
                    return fake(idx);
                });
            assertEquals(GRID.size(), seen.size());
            for (int i = 0; i < GRID.size(); i++) {
                assertEquals(i * 0.5, assembled.getField().get(i), 0.0);
            }
            assertEquals(GRID.size(), assembled.getDiagnostics().size());
        }

        @Test
        @DisplayName("more workers than grid points is capped")
        void testWorkerCap() {
            SearchGrid tiny = new SearchGrid(new double[][]{{0, 0}, {1, 0}, {0, 1}});
            AssembledField assembled = new ParallelScheduler().run(tiny, 64, ParallelSchedulerTest::fake);
            assertEquals(3, assembled.getField().size());
        }

        @Test
        @DisplayName("worker count below one is rejected")
        void testZeroWorkers() {
            assertThrows(IllegalArgumentException.class,
                () -> new ParallelScheduler().run(GRID, 0, ParallelSchedulerTest::fake));
        }

        @Test
        @DisplayName("a failing evaluation aborts the run and reports its chunk")
        void testWorkerFailure() {
            WorkerFailureException e = assertThrows(WorkerFailureException.class,
                () -> new ParallelScheduler().run(GRID, 4, idx -> {
                    if (idx == 30) {
                        throw new IllegalStateException("boom");
                    }
                    return fake(idx);
                }));
            assertTrue(e.covers(30));
            assertEquals(26, e.getFirstIndex());
            assertEquals(37, e.getLastIndex());
            assertEquals(30, e.getFailedIndex());
            assertInstanceOf(IllegalStateException.class, e.getCause());
        }

        @Test
        @DisplayName("interrupting the caller cancels the run and keeps the interrupt flag")
        void testCancellation() {
            Thread.currentThread().interrupt();
            try {
                assertThrows(ImagingCancelledException.class,
                    () -> new ParallelScheduler().run(GRID, 2, ParallelSchedulerTest::fake));
                assertTrue(Thread.currentThread().isInterrupted());
            } finally {
                Thread.interrupted();
            }
        }
    }
}
