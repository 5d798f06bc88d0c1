package fr.tictak.courier.repository;

import fr.tictak.courier.model.LocationSample;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface LocationSampleRepository extends MongoRepository<LocationSample, String> {

    List<LocationSample> findByAgentIdAndOrderIdOrderByTimestampAsc(String agentId, String orderId);
}
