package com.example.spacewars.world.dto.request;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.PositiveOrZero;

public record SetCourseRequest(
        @PositiveOrZero double speed,
        @DecimalMin("0") @DecimalMax("360") double angle
) {
}
