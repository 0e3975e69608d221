package com.podium.infrastructure.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import com.podium.application.events.MarketEvent;
import com.podium.domain.account.Address;

/**
 * JSON rendering of market events: {@code {"type": ..., <record fields>}}.
 * Addresses are written as their hex string.
 */
public final class EventJson {

    private EventJson() {}

    public static ObjectMapper mapper() {
        SimpleModule addresses = new SimpleModule("podium-addresses");
        addresses.addSerializer(Address.class, ToStringSerializer.instance);
        return new ObjectMapper().registerModule(addresses);
    }

    public static ObjectNode toNode(ObjectMapper mapper, MarketEvent event) {
        ObjectNode body = mapper.valueToTree(event);
        ObjectNode out = mapper.createObjectNode();
        out.put("type", event.type());
        out.setAll(body);
        return out;
    }

    public static String toJson(ObjectMapper mapper, MarketEvent event) throws JsonProcessingException {
        return mapper.writeValueAsString(toNode(mapper, event));
    }
}
