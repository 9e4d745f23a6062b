package com.clocked.backend.modules.realtime.application;

import java.time.Clock;

import com.clocked.backend.modules.realtime.domain.BroadcastMessage;
import com.clocked.backend.modules.realtime.domain.GroupActivityEvent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Maps group activity to broadcasts. Holds no state.
 */
@Component
public class GroupEventRouter {

    private static final Logger log = LoggerFactory.getLogger(GroupEventRouter.class);

    private final BroadcastHub hub;
    private final Clock clock;

    public GroupEventRouter(BroadcastHub hub, Clock clock) {
        this.hub = hub;
        this.clock = clock;
    }

    public int route(GroupActivityEvent event) {
        BroadcastMessage message = new BroadcastMessage(
                event.type().messageType(),
                event.groupId(),
                event.payload(),
                clock.instant()
        );
        return hub.broadcastToGroup(message, event.excludeActor() ? event.actorUserId() : null);
    }

    @TransactionalEventListener(fallbackExecution = true)
    public void onGroupActivity(GroupActivityEvent event) {
        try {
            route(event);
        } catch (RuntimeException ex) {
            log.error("Failed to broadcast {} for group {}", event.type(), event.groupId(), ex);
        }
    }
}
