package com.crosscheck.dispatch.api;

import com.crosscheck.core.bus.DeliveryException;
import com.crosscheck.core.bus.RetryingPublisher;
import com.crosscheck.core.message.InvalidMessageException;
import com.crosscheck.core.message.Message;
import com.crosscheck.core.message.MessageCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Entry point for agents running outside this process. They post protocol messages in the
 * JSON wire shape and the messages are published to the bus unchanged.
 */
@RestController
@RequestMapping("/api/v1/messages")
public class MessageController {

    private static final Logger log = LoggerFactory.getLogger(MessageController.class);

    private final MessageCodec codec;
    private final RetryingPublisher publisher;

    public MessageController(MessageCodec codec, RetryingPublisher publisher) {
        this.codec = codec;
        this.publisher = publisher;
    }

    /**
     * POST /api/v1/messages: Publish one wire-format message. 400 if it does not decode,
     * 503 if the bus does not accept it.
     */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> publish(@RequestBody String body) {
        Message message;
        try {
            message = codec.decode(body);
        } catch (InvalidMessageException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
        try {
            publisher.publish(message);
        } catch (DeliveryException e) {
            log.error("Could not publish external {} {}: {}", message.type().wireName(), message.id(),
                    e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", e.getMessage()));
        }
        log.info("Accepted external {} {} from {} for task {}", message.type().wireName(), message.id(),
                message.senderId(), message.taskId());
        return ResponseEntity.accepted().body(Map.of(
                "message_id", message.id(),
                "type", message.type().wireName()
        ));
    }
}
