package com.pairup.server.im.web;

import com.pairup.server.im.exception.ErrorKind;
import com.pairup.server.im.exception.MessagingException;
import com.pairup.server.im.service.MessageResult;
import com.pairup.server.im.service.MessagingService;
import com.pairup.server.im.web.dto.ChatIdResponse;
import com.pairup.server.im.web.dto.ChatResponse;
import com.pairup.server.im.web.dto.CreateChatRequest;
import com.pairup.server.im.web.dto.DirectChatRequest;
import com.pairup.server.im.web.dto.MessageResponse;
import com.pairup.server.im.web.dto.ParticipantRequest;
import com.pairup.server.im.web.dto.SendMessageRequest;
import com.pairup.server.im.web.dto.StatusResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequiredArgsConstructor
@RequestMapping("/chats")
public class ChatController {

    private final MessagingService messagingService;

    @PostMapping
    public ResponseEntity<ChatIdResponse> createChat(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) long userId,
                                                     @RequestBody CreateChatRequest request) {
        String chatId = messagingService.createChat(userId, request.getChatId(), request.getChatName(), request.getParticipants());
        return ResponseEntity.status(HttpStatus.CREATED).body(new ChatIdResponse(chatId));
    }

    @PostMapping("/direct")
    public ResponseEntity<ChatIdResponse> directChat(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) long userId,
                                                     @RequestBody DirectChatRequest request) {
        if (request.getUserId() == null) {
            throw new MessagingException(ErrorKind.INVALID_REQUEST, "user_id is required");
        }
        return ResponseEntity.ok(new ChatIdResponse(messagingService.getOrCreateDirectChat(userId, request.getUserId())));
    }

    @GetMapping
    public ResponseEntity<List<ChatResponse>> chats(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) long userId) {
        return ResponseEntity.ok(messagingService.chats(userId).stream()
                .map(ChatResponse::from)
                .collect(Collectors.toList()));
    }

    @GetMapping("/{chatId}")
    public ResponseEntity<ChatResponse> chat(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) long userId,
                                             @PathVariable String chatId) {
        return ResponseEntity.ok(ChatResponse.from(messagingService.chat(userId, chatId)));
    }

    @GetMapping("/{chatId}/messages")
    public ResponseEntity<List<MessageResponse>> messages(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) long userId,
                                                          @PathVariable String chatId,
                                                          @RequestParam(required = false) Integer limit,
                                                          @RequestParam(required = false) Integer offset) {
        return ResponseEntity.ok(messagingService.messages(userId, chatId, limit, offset).stream()
                .map(MessageResponse::from)
                .collect(Collectors.toList()));
    }

    /** Same write and fan-out as a {@code chat_message} frame. A repeated message id returns the original. */
    @PostMapping("/{chatId}/messages")
    public ResponseEntity<MessageResponse> sendMessage(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) long userId,
                                                       @PathVariable String chatId,
                                                       @RequestBody SendMessageRequest request) {
        MessageResult result = messagingService.sendMessage(userId, chatId, request.getMessageId(), request.getContent());
        return ResponseEntity.ok(MessageResponse.from(result.getMessage()));
    }

    @PostMapping("/{chatId}/participants")
    public ResponseEntity<StatusResponse> addParticipant(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) long userId,
                                                         @PathVariable String chatId,
                                                         @RequestBody ParticipantRequest request) {
        if (request.getUserId() == null) {
            throw new MessagingException(ErrorKind.INVALID_REQUEST, "user_id is required");
        }
        messagingService.addParticipant(userId, chatId, request.getUserId());
        return ResponseEntity.status(HttpStatus.CREATED).body(new StatusResponse("success"));
    }

    @DeleteMapping("/{chatId}/participants/{participantId}")
    public ResponseEntity<StatusResponse> removeParticipant(@RequestAttribute(AuthInterceptor.USER_ID_ATTRIBUTE) long userId,
                                                            @PathVariable String chatId,
                                                            @PathVariable long participantId) {
        messagingService.removeParticipant(userId, chatId, participantId);
        return ResponseEntity.ok(new StatusResponse("success"));
    }
}
