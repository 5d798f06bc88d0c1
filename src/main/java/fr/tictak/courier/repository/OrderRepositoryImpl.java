package fr.tictak.courier.repository;

import fr.tictak.courier.model.Order;
import fr.tictak.courier.model.enums.OrderStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.Optional;

@Slf4j
public class OrderRepositoryImpl implements OrderRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    public OrderRepositoryImpl(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public Optional<Order> applyTransition(String orderId, OrderStatus expected, OrderStatus target, Instant at) {
        // Compare-and-swap on the current status so concurrent devices cannot double-transition
        Query query = new Query(Criteria.where("id").is(orderId)
                .and("status").is(expected));

        Update update = new Update()
                .set("status", target)
                .set(target.getTimestampField(), at);

        Order updated = mongoTemplate.findAndModify(
                query,
                update,
                new FindAndModifyOptions().returnNew(true),
                Order.class
        );

        if (updated == null) {
            log.debug("No order {} in status {} to move to {}", orderId, expected, target);
        }
        return Optional.ofNullable(updated);
    }
}
