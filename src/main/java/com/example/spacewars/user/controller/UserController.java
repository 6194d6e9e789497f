package com.example.spacewars.user.controller;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.example.spacewars.global.concurrency.LockContext;
import com.example.spacewars.global.dto.CommonResponse;
import com.example.spacewars.user.dto.request.CreateUserRequest;
import com.example.spacewars.user.dto.response.UserResponse;
import com.example.spacewars.user.service.UserService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/users")
@RequiredArgsConstructor
public class UserController {

    private final UserService userService;

    @PostMapping
    public ResponseEntity<CommonResponse<UserResponse>> createUser(@Valid @RequestBody CreateUserRequest requestDto) {
        UserResponse user = userService.createUser(LockContext.empty(), requestDto.username());

        return ResponseEntity.status(HttpStatus.CREATED).body(CommonResponse.success(user, "유저가 생성되었습니다."));
    }

    @GetMapping("/{userId}")
    public ResponseEntity<CommonResponse<UserResponse>> getUser(@PathVariable Long userId) {
        return ResponseEntity.ok(CommonResponse.success(userService.getUser(LockContext.empty(), userId)));
    }

    @GetMapping
    public ResponseEntity<CommonResponse<UserResponse>> getUserByUsername(@RequestParam String username) {
        return ResponseEntity.ok(CommonResponse.success(userService.getUserByUsername(LockContext.empty(), username)));
    }
}
