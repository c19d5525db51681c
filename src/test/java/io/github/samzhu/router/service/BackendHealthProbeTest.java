package io.github.samzhu.router.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.ArgumentMatchers.notNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestClient;

import com.sun.net.httpserver.HttpServer;

import io.github.samzhu.router.Fixtures;
import io.github.samzhu.router.config.HealthCheckProperties;
import io.github.samzhu.router.model.BackendProfile;
import io.github.samzhu.router.model.HealthState;
import io.github.samzhu.router.store.BackendProfileStore;
import io.github.samzhu.router.store.BackendStatistics;

class BackendHealthProbeTest {

    private HttpServer server;
    private String baseUrl;
    private BackendProfileStore store;
    private BackendStatistics statistics;
    private BackendHealthProbe probe;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        respond("/up/health", 200);
        respond("/degraded/health", 503);
        respond("/broken/health", 500);
        server.start();
        baseUrl = "http://localhost:" + server.getAddress().getPort();

        store = mock(BackendProfileStore.class);
        statistics = mock(BackendStatistics.class);
        probe = new BackendHealthProbe(store, statistics,
            new HealthCheckProperties(true, null, Duration.ofSeconds(2), null), RestClient.builder());
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void mapsHealthEndpointStatus() {
        assertThat(probe.probe(Fixtures.backend("A", baseUrl + "/up"))).isEqualTo(HealthState.UP);
        assertThat(probe.probe(Fixtures.backend("B", baseUrl + "/degraded/"))).isEqualTo(HealthState.DEGRADED);
        assertThat(probe.probe(Fixtures.backend("C", baseUrl + "/broken"))).isEqualTo(HealthState.DOWN);

        verify(statistics).recordHealth(eq("A"), eq(HealthState.UP), notNull());
        verify(statistics).recordHealth(eq("B"), eq(HealthState.DEGRADED), notNull());
    }

    @Test
    void unreachableBackendIsDownWithoutLatencySample() {
        assertThat(probe.probe(Fixtures.backend("Gone", "http://localhost:1"))).isEqualTo(HealthState.DOWN);

        verify(statistics).recordHealth(eq("Gone"), eq(HealthState.DOWN), isNull());
    }

    @Test
    void probeAllSkipsInactiveBackends() {
        BackendProfile inactive = new BackendProfile("Off", baseUrl + "/up", HealthState.UP,
            50, 0, 100, 100, false, 30, 0, 0);
        when(store.findAll()).thenReturn(List.of(Fixtures.backend("A", baseUrl + "/up"), inactive));

        probe.probeAll();

        verify(statistics).recordHealth(eq("A"), eq(HealthState.UP), notNull());
        verify(statistics, never()).recordHealth(eq("Off"), any(), any());
        verify(statistics, never()).recordSuccess(anyString(), anyLong());
    }

    private void respond(String path, int status) {
        server.createContext(path, exchange -> {
            exchange.sendResponseHeaders(status, -1);
            exchange.close();
        });
    }
}
