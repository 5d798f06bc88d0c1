package fr.tictak.courier.config;

import fr.tictak.courier.model.enums.AgentStatus;
import fr.tictak.courier.model.enums.OrderStatus;
import org.jetbrains.annotations.NotNull;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;
import org.springframework.data.convert.WritingConverter;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;

import java.util.List;

/**
 * Statuses are stored with their lowercase values ({@code "pending"}, {@code "active"}) so the
 * collections stay readable by every client of the same database.
 */
@Configuration
public class MongoConfig {

    @Bean
    public MongoCustomConversions mongoCustomConversions() {
        return new MongoCustomConversions(List.of(
                new OrderStatusWriter(),
                new OrderStatusReader(),
                new AgentStatusWriter(),
                new AgentStatusReader()
        ));
    }

    @WritingConverter
    static class OrderStatusWriter implements Converter<OrderStatus, String> {
        @Override
        public String convert(@NotNull OrderStatus source) {
            return source.getValue();
        }
    }

    @ReadingConverter
    static class OrderStatusReader implements Converter<String, OrderStatus> {
        @Override
        public OrderStatus convert(@NotNull String source) {
            return OrderStatus.fromValue(source);
        }
    }

    @WritingConverter
    static class AgentStatusWriter implements Converter<AgentStatus, String> {
        @Override
        public String convert(@NotNull AgentStatus source) {
            return source.getValue();
        }
    }

    @ReadingConverter
    static class AgentStatusReader implements Converter<String, AgentStatus> {
        @Override
        public AgentStatus convert(@NotNull String source) {
            return AgentStatus.fromValue(source);
        }
    }
}
