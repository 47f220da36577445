package com.pairup.server.im.web;

import com.pairup.server.im.service.MessagingService;
import com.pairup.server.im.web.dto.ReactionRequest;
import com.pairup.server.im.web.dto.ReactionResponse;
import com.pairup.server.im.web.dto.StatusResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@RequestMapping("/messages")
public class MessageController {

    private final MessagingService messagingService;

    @PostMapping("/{messageId}/reactions")
    public ResponseEntity<ReactionResponse> addReaction(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) long userId,
                                                        @PathVariable String messageId,
                                                        @RequestBody ReactionRequest request) {
        // a repeated reaction id is answered like the first one
        messagingService.addReaction(userId, request.getReactionId(), messageId, request.getReactionCode());
        return ResponseEntity.ok(new ReactionResponse(request.getReactionId()));
    }

    @DeleteMapping("/{messageId}/reactions/{reactionCode}")
    public ResponseEntity<StatusResponse> removeReaction(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) long userId,
                                                         @PathVariable String messageId,
                                                         @PathVariable String reactionCode) {
        messagingService.removeReaction(userId, messageId, reactionCode);
        return ResponseEntity.ok(new StatusResponse("success"));
    }
}
