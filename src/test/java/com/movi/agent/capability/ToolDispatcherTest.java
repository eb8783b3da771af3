package com.movi.agent.capability;

import com.movi.agent.model.CapabilityCall;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ToolDispatcherTest {

    private Capability failing;
    private ToolDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        failing = mock(Capability.class);
        when(failing.getName()).thenReturn("get_trip_details");
        CapabilityRegistry registry = new CapabilityRegistry(List.of(
                new CapabilityRegistryTest.FixedCapability("list_all_routes", "[{\"route_id\":\"r1\"}]"),
                new CapabilityRegistryTest.FixedCapability("list_todays_trips", null),
                failing));
        dispatcher = new ToolDispatcher(registry);
    }

    @Test
    void execute_returnsHandlerResult() {
        assertThat(dispatcher.execute(call("c1", "list_all_routes"))).isEqualTo("[{\"route_id\":\"r1\"}]");
    }

    @Test
    void execute_nullResult_becomesEmptyObservation() {
        assertThat(dispatcher.execute(call("c2", "list_todays_trips"))).isEmpty();
    }

    @Test
    void execute_unknownCapability_returnsErrorListingKnownNames() {
        String result = dispatcher.execute(call("c1", "teleport_bus"));

        assertThat(result).startsWith("ERROR: Unknown capability 'teleport_bus'")
                .contains("list_all_routes");
    }

    @Test
    void execute_handlerThrows_returnsErrorObservation() {
        when(failing.execute(anyMap())).thenThrow(new IllegalArgumentException("bad trip"));

        String result = dispatcher.execute(call("c1", "get_trip_details"));

        assertThat(result).isEqualTo("ERROR: Capability execution failed: bad trip");
    }

    private static CapabilityCall call(String id, String name) {
        return CapabilityCall.builder().id(id).name(name).arguments(Map.of()).build();
    }
}
