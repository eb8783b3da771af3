package com.movi.agent.transport;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TransportRepositoryTest {

    private static final String BOOKING_SQL =
            "SELECT booking_status_percentage FROM daily_trips WHERE trip_id = ?";

    @Mock JdbcTemplate jdbcTemplate;

    @InjectMocks
    TransportRepository repository;

    @Test
    void findBookingPercentage_readsNumericColumn() {
        when(jdbcTemplate.queryForList(BOOKING_SQL, "trip_1"))
                .thenReturn(List.of(Map.of("booking_status_percentage", new BigDecimal("60.00"))));

        assertThat(repository.findBookingPercentage("trip_1")).contains(60.0);
    }

    @Test
    void findBookingPercentage_noRow_isEmpty() {
        when(jdbcTemplate.queryForList(BOOKING_SQL, "trip_x")).thenReturn(List.of());

        assertThat(repository.findBookingPercentage("trip_x")).isEmpty();
    }

    @Test
    void findBookingPercentage_nullColumn_isEmpty() {
        when(jdbcTemplate.queryForList(BOOKING_SQL, "trip_2"))
                .thenReturn(List.of(Collections.singletonMap("booking_status_percentage", null)));

        assertThat(repository.findBookingPercentage("trip_2")).isEmpty();
    }

    @Test
    void removeVehicle_returnsDeletedRows() {
        when(jdbcTemplate.update("DELETE FROM deployments WHERE trip_id = ?", "trip_1")).thenReturn(1);

        assertThat(repository.removeVehicle("trip_1")).isEqualTo(1);
    }

    @Test
    void createStop_generatesPrefixedId() {
        String stopId = repository.createStop("Gate 4", 12.9, 77.5);

        assertThat(stopId).startsWith("stop_");
        verify(jdbcTemplate).update(anyString(), eq(stopId), eq("Gate 4"), eq(12.9), eq(77.5));
    }
}
