package com.example.spacewars.world.controller;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.example.spacewars.global.concurrency.LockContext;
import com.example.spacewars.global.dto.CommonResponse;
import com.example.spacewars.world.dto.request.SetCourseRequest;
import com.example.spacewars.world.dto.response.SpaceObjectResponse;
import com.example.spacewars.world.dto.response.WorldResponse;
import com.example.spacewars.world.service.WorldService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/world")
@RequiredArgsConstructor
public class WorldController {

    private final WorldService worldService;

    @GetMapping
    public ResponseEntity<CommonResponse<WorldResponse>> getWorld() {
        return ResponseEntity.ok(CommonResponse.success(worldService.getWorld(LockContext.empty())));
    }

    @PostMapping("/ships/{userId}/course")
    public ResponseEntity<CommonResponse<SpaceObjectResponse>> setCourse(@PathVariable Long userId,
                                                                        @Valid @RequestBody SetCourseRequest requestDto) {
        SpaceObjectResponse ship = worldService.setShipCourse(
                LockContext.empty(), userId, requestDto.speed(), requestDto.angle());
        return ResponseEntity.ok(CommonResponse.success(ship, "항로가 변경되었습니다."));
    }
}
