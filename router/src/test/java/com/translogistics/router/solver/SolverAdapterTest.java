package com.translogistics.router.solver;

import com.translogistics.router.algorithm.RouteContext;
import com.translogistics.router.dto.Stop;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SolverAdapterTest {

    @Mock
    private RoutingSolver routingSolver;

    private ExecutorService executor;
    private List<Stop> stops;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadExecutor();
        stops = Arrays.asList(
                createStop("a", 5.31, -4.01, 10.0),
                createStop("b", 5.32, -4.02, 20.5),
                createStop("c", 5.33, -4.03, null));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldFallBackWhenNoSolverIsInstalled() {
        SolverAdapter adapter = new SolverAdapter(Optional.empty(), executor,
                Duration.ofSeconds(1), Duration.ofMillis(500), 100);

        SolverOutcome outcome = adapter.solve(context(true), stops);

        assertFalse(adapter.isAvailable());
        assertFalse(outcome.isSolved());
        assertEquals("unavailable", outcome.getFallbackReason());
    }

    @Test
    void shouldMapNodeIndicesBackToStops() throws Exception {
        when(routingSolver.solve(any(), any(), any())).thenReturn(Arrays.asList(3, 1, 2));
        when(routingSolver.name()).thenReturn("fake");

        SolverOutcome outcome = adapter().solve(context(true), stops);

        assertTrue(outcome.isSolved());
        assertEquals(List.of("c", "a", "b"),
                outcome.getRoute().stream().map(Stop::getId).collect(Collectors.toList()));
    }

    @Test
    void shouldPassConfiguredSearchLimits() throws Exception {
        when(routingSolver.solve(any(), any(), any())).thenReturn(Arrays.asList(1, 2, 3));
        when(routingSolver.name()).thenReturn("fake");

        adapter().solve(context(true), stops);

        ArgumentCaptor<SearchLimits> limits = ArgumentCaptor.forClass(SearchLimits.class);
        verify(routingSolver).solve(any(), limits.capture(), any());
        assertEquals(Duration.ofMillis(500), limits.getValue().getTimeLimit());
        assertEquals(100, limits.getValue().getMaxSolutionsWithoutImprovement());
    }

    @Test
    void shouldFallBackWhenSolverThrows() throws Exception {
        when(routingSolver.solve(any(), any(), any())).thenThrow(new SolverException("boom"));
        when(routingSolver.name()).thenReturn("fake");

        SolverOutcome outcome = adapter().solve(context(true), stops);

        assertEquals("failed", outcome.getFallbackReason());
    }

    @Test
    void shouldFallBackWhenSolverFindsNothing() throws Exception {
        when(routingSolver.solve(any(), any(), any())).thenReturn(List.of());
        when(routingSolver.name()).thenReturn("fake");

        SolverOutcome outcome = adapter().solve(context(true), stops);

        assertEquals("found no solution", outcome.getFallbackReason());
    }

    @Test
    void shouldRejectIncompleteSolution() throws Exception {
        when(routingSolver.solve(any(), any(), any())).thenReturn(Arrays.asList(2, 2, 0, 9));
        when(routingSolver.name()).thenReturn("fake");

        SolverOutcome outcome = adapter().solve(context(true), stops);

        assertEquals("returned an incomplete solution", outcome.getFallbackReason());
    }

    @Test
    void shouldGiveUpOnSlowSolverAndCancelIt() throws Exception {
        ArgumentCaptor<CancellationToken> token = ArgumentCaptor.forClass(CancellationToken.class);
        when(routingSolver.solve(any(), any(), token.capture())).thenAnswer(invocation -> {
            Thread.sleep(10_000);
            return Arrays.asList(1, 2, 3);
        });
        when(routingSolver.name()).thenReturn("fake");

        SolverAdapter adapter = new SolverAdapter(Optional.of(routingSolver), executor,
                Duration.ofMillis(200), Duration.ofMillis(100), 100);

        long started = System.nanoTime();
        SolverOutcome outcome = adapter.solve(context(true), stops);
        long elapsedMillis = (System.nanoTime() - started) / 1_000_000;

        assertEquals("timed out", outcome.getFallbackReason());
        assertTrue(elapsedMillis < 2_000, "waited " + elapsedMillis + " ms");
        assertTrue(token.getValue().isCancelled());
    }

    @Test
    void shouldFallBackWhenExecutorIsShutDown() {
        when(routingSolver.name()).thenReturn("fake");
        executor.shutdown();

        SolverOutcome outcome = adapter().solve(context(true), stops);

        assertEquals("rejected the request", outcome.getFallbackReason());
    }

    @Test
    void shouldScaleDistancesDemandsAndServiceTimes() {
        RoutingProblem problem = adapter().buildProblem(context(true), stops);

        assertEquals(4, problem.nodeCount());
        assertEquals(0, problem.getServiceSeconds()[0]);
        assertEquals(600, problem.getServiceSeconds()[1]);
        assertArrayEquals(new long[]{0, 1000, 2050, 0}, problem.getDemands());
        assertEquals(3000, problem.getVehicleCapacity());
        assertTrue(problem.getDistanceMeters()[0][1] > 0);
        assertEquals(problem.getDistanceMeters()[1][2], problem.getDistanceMeters()[2][1]);
        assertEquals(0, problem.getDistanceMeters()[2][2]);
    }

    @Test
    void shouldMakeReturnArcsFreeForOpenRoutes() {
        RoutingProblem open = adapter().buildProblem(context(false), stops);
        RoutingProblem closed = adapter().buildProblem(context(true), stops);

        for (int i = 1; i < open.nodeCount(); i++) {
            assertEquals(0, open.getDistanceMeters()[i][0]);
            assertEquals(0, open.getTravelSeconds()[i][0]);
            assertTrue(closed.getDistanceMeters()[i][0] > 0);
        }
        assertEquals(closed.getDistanceMeters()[0][1], open.getDistanceMeters()[0][1]);
    }

    private SolverAdapter adapter() {
        return new SolverAdapter(Optional.of(routingSolver), executor,
                Duration.ofSeconds(5), Duration.ofMillis(500), 100);
    }

    private RouteContext context(boolean returnToDepot) {
        return new RouteContext(5.30, -4.00, 30.0, 50, 25, 10, returnToDepot);
    }

    private Stop createStop(String id, double lat, double lng, Double demandKg) {
        Stop stop = new Stop(id, "Stop " + id, lat, lng);
        stop.setDemandKg(demandKg);
        return stop;
    }
}
