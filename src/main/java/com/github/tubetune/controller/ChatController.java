package com.github.tubetune.controller;

import com.github.tubetune.model.InboundCallback;
import com.github.tubetune.model.InboundMessage;
import com.github.tubetune.service.delivery.DeliveryCoordinator;
import com.github.tubetune.service.messaging.SseMessagingGateway;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Chat transport endpoints. Inbound events are accepted immediately; replies
 * arrive on the owner's SSE stream.
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ChatController {

    private final DeliveryCoordinator deliveryCoordinator;
    private final SseMessagingGateway messagingGateway;

    /**
     * Submit a link or search phrase
     */
    @PostMapping("/messages")
    public ResponseEntity<Void> postMessage(@Valid @RequestBody InboundMessage message) {
        log.debug("Message from {}", message.getOwnerId());
        deliveryCoordinator.submitText(message.getOwnerId(), message.getText());
        return ResponseEntity.accepted().build();
    }

    /**
     * Submit a button press
     */
    @PostMapping("/callbacks")
    public ResponseEntity<Void> postCallback(@Valid @RequestBody InboundCallback callback) {
        log.debug("Callback from {}: {}", callback.getOwnerId(), callback.getData());
        deliveryCoordinator.submitCallback(callback.getOwnerId(), callback.getData());
        return ResponseEntity.accepted().build();
    }

    /**
     * SSE endpoint for an owner's replies
     */
    @GetMapping("/stream/{ownerId}")
    public SseEmitter stream(@PathVariable String ownerId) {
        log.info("New SSE connection established for {}", ownerId);
        return messagingGateway.createEmitter(ownerId);
    }
}
