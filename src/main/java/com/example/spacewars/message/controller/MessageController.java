package com.example.spacewars.message.controller;

import java.util.List;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.example.spacewars.global.concurrency.LockContext;
import com.example.spacewars.global.dto.CommonResponse;
import com.example.spacewars.message.dto.request.SendMessageRequest;
import com.example.spacewars.message.dto.response.MessageResponse;
import com.example.spacewars.message.service.MessageService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/users/{userId}/messages")
@RequiredArgsConstructor
public class MessageController {

    private final MessageService messageService;

    @GetMapping
    public ResponseEntity<CommonResponse<List<MessageResponse>>> getMessages(@PathVariable Long userId) {
        return ResponseEntity.ok(CommonResponse.success(messageService.getMessages(LockContext.empty(), userId)));
    }

    @GetMapping("/unread")
    public ResponseEntity<CommonResponse<List<MessageResponse>>> getUnreadMessages(@PathVariable Long userId) {
        return ResponseEntity.ok(CommonResponse.success(messageService.getUnreadMessages(LockContext.empty(), userId)));
    }

    @GetMapping("/unread/count")
    public ResponseEntity<CommonResponse<Map<String, Integer>>> getUnreadCount(@PathVariable Long userId) {
        int count = messageService.getUnreadCount(LockContext.empty(), userId);
        return ResponseEntity.ok(CommonResponse.success(Map.of("unread", count)));
    }

    @PostMapping("/read-all")
    public ResponseEntity<CommonResponse<Map<String, Integer>>> markAllAsRead(@PathVariable Long userId) {
        int marked = messageService.markAllAsRead(LockContext.empty(), userId);
        return ResponseEntity.ok(CommonResponse.success(Map.of("marked", marked), "모든 메시지를 읽음 처리했습니다."));
    }

    @PostMapping
    public ResponseEntity<CommonResponse<MessageResponse>> sendMessage(@PathVariable Long userId,
                                                                       @Valid @RequestBody SendMessageRequest requestDto) {
        MessageResponse message = messageService.sendMessage(LockContext.empty(), userId, requestDto.content());
        return ResponseEntity.status(HttpStatus.CREATED).body(CommonResponse.success(message, "메시지가 전송되었습니다."));
    }
}
