package com.droidassist.service;

import com.droidassist.call.CallEvent;
import com.droidassist.call.CallEventListener;
import com.droidassist.dto.CallMonitorDTO;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Pushes call state changes to WebSocket subscribers.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CallEventPublisher implements CallEventListener {

    public static final String EVENTS_DESTINATION = "/topic/calls/events";

    private final SimpMessagingTemplate messagingTemplate;
    private final Clock clock;

    @Override
    public void onCallEvent(CallEvent event) {
        messagingTemplate.convertAndSend(EVENTS_DESTINATION, toMessage(event));
        log.debug("Sent call event {} -> {}", event.getFromState(), event.getToState());
    }

    public CallMonitorDTO.EventMessage toMessage(CallEvent event) {
        return CallMonitorDTO.EventMessage.builder()
            .fromState(event.getFromState())
            .toState(event.getToState())
            .timestampNanos(event.getTimestampNanos())
            .risingEdge(event.isRisingEdge())
            .observedAt(clock.instant())
            .build();
    }
}
