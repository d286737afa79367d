package com.droidassist.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import com.droidassist.call.CallEvent;
import com.droidassist.call.CallState;
import com.droidassist.dto.CallMonitorDTO;

@ExtendWith(MockitoExtension.class)
@DisplayName("CallEventPublisher Tests")
class CallEventPublisherTest {

    private static final Instant NOW = Instant.parse("2026-03-01T09:30:00Z");

    @Mock
    private SimpMessagingTemplate messagingTemplate;

    private CallEventPublisher publisher;

    @BeforeEach
    void setUp() {
        publisher = new CallEventPublisher(messagingTemplate, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should broadcast state changes to the events topic")
    void shouldBroadcastEvent() {
        publisher.onCallEvent(new CallEvent(CallState.IDLE, CallState.RINGING, 42L));

        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(messagingTemplate).convertAndSend(eq(CallEventPublisher.EVENTS_DESTINATION), captor.capture());
        CallMonitorDTO.EventMessage message = (CallMonitorDTO.EventMessage) captor.getValue();
        assertEquals(CallState.RINGING, message.getToState());
        assertTrue(message.isRisingEdge());
        assertEquals(42L, message.getTimestampNanos());
        assertEquals(NOW, message.getObservedAt());
    }
}
