package com.ai.booking.service;

import com.ai.booking.dto.TurnResult;
import com.ai.booking.entity.QueuedMessage;

/**
 * Produces the reply for one aggregated turn. Runs outside any coordinator
 * lock; throwing fails the turn.
 */
public interface TurnProcessor {

    TurnResult process(QueuedMessage item);
}
