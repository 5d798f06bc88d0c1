package fr.tictak.courier.service;

import fr.tictak.courier.model.LocationSample;

import java.util.List;

public interface LocationHistoryService {

    /**
     * Appends a sample to the location history. Runs detached from the caller; a store failure
     * is logged and never propagated.
     */
    void append(LocationSample sample);

    List<LocationSample> trail(String agentId, String orderId);
}
