package fr.tictak.courier.service.implementation;

import fr.tictak.courier.model.LocationSample;
import fr.tictak.courier.repository.LocationSampleRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class LocationHistoryServiceImplTest {

    @Mock
    private LocationSampleRepository locationSampleRepository;

    @InjectMocks
    private LocationHistoryServiceImpl locationHistoryService;

    @Test
    @DisplayName("append inserts the sample as a new document")
    void append_Inserts() {
        LocationSample sample = LocationSample.of("A1", "O1", 17.40, 78.47, Instant.now());

        locationHistoryService.append(sample);

        verify(locationSampleRepository).insert(sample);
    }

    @Test
    @DisplayName("A store failure is logged and swallowed")
    void append_StoreDown_Swallowed() {
        LocationSample sample = LocationSample.of("A1", "O1", 17.40, 78.47, Instant.now());
        given(locationSampleRepository.insert(any(LocationSample.class)))
                .willThrow(new DataAccessResourceFailureException("mongo down"));

        assertThatCode(() -> locationHistoryService.append(sample)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("trail returns the samples of an agent and order in time order")
    void trail_ReadsInTimeOrder() {
        Instant t0 = Instant.parse("2024-05-01T10:00:00Z");
        List<LocationSample> samples = List.of(
                LocationSample.of("A1", "O1", 17.40, 78.47, t0),
                LocationSample.of("A1", "O1", 17.41, 78.48, t0.plusSeconds(5)));
        given(locationSampleRepository.findByAgentIdAndOrderIdOrderByTimestampAsc("A1", "O1")).willReturn(samples);

        assertThat(locationHistoryService.trail("A1", "O1")).containsExactlyElementsOf(samples);
    }
}
