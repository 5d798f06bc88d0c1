package fr.tictak.courier.repository;

import fr.tictak.courier.model.Order;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface OrderRepository extends MongoRepository<Order, String>, OrderRepositoryCustom {

    // Unknown agents simply yield an empty list
    List<Order> findByAssignedAgentId(String assignedAgentId, Pageable pageable);

    boolean existsByOrderNumber(String orderNumber);
}
