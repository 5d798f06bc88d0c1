package fr.tictak.courier.service.implementation;

import fr.tictak.courier.config.AsyncConfig;
import fr.tictak.courier.model.LocationSample;
import fr.tictak.courier.repository.LocationSampleRepository;
import fr.tictak.courier.service.LocationHistoryService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
public class LocationHistoryServiceImpl implements LocationHistoryService {

    private final LocationSampleRepository locationSampleRepository;

    public LocationHistoryServiceImpl(LocationSampleRepository locationSampleRepository) {
        this.locationSampleRepository = locationSampleRepository;
    }

    @Async(AsyncConfig.LOCATION_EXECUTOR)
    @Override
    public void append(LocationSample sample) {
        try {
            locationSampleRepository.insert(sample);
            log.debug("Stored location of agent {} for order {} at {}",
                    sample.getAgentId(), sample.getOrderId(), sample.getTimestamp());
        } catch (DataAccessException e) {
            log.error("Error storing location of agent {} for order {}: {}",
                    sample.getAgentId(), sample.getOrderId(), e.getMessage(), e);
        }
    }

    @Override
    public List<LocationSample> trail(String agentId, String orderId) {
        return locationSampleRepository.findByAgentIdAndOrderIdOrderByTimestampAsc(agentId, orderId);
    }
}
