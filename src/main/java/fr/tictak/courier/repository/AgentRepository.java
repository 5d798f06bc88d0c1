package fr.tictak.courier.repository;

import fr.tictak.courier.model.Agent;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface AgentRepository extends MongoRepository<Agent, String> {

    Optional<Agent> findByUsername(String username);

    boolean existsByUsername(String username);
}
