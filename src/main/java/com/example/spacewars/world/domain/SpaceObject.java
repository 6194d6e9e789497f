package com.example.spacewars.world.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "space_objects")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SpaceObject {

    // 속도 1 = 분당 50 거리 단위
    static final double SPEED_FACTOR = 50.0;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SpaceObjectType type;

    @Column(nullable = false)
    private double x;

    @Column(nullable = false)
    private double y;

    @Column(nullable = false)
    private double speed;

    // 도(degree) 단위, 0-360
    @Column(nullable = false)
    private double angle;

    @Column(nullable = false)
    private long lastPositionUpdateMs;

    @Builder.Default
    @Column(nullable = false)
    private int pictureId = 1;

    // PLAYER_SHIP인 경우 소유 유저
    private Long ownerId;

    /**
     * 직선 운동 후 월드 경계에서 반대편으로 감싼다.
     */
    public void advance(long nowMs, double worldWidth, double worldHeight) {
        long elapsedMs = nowMs - lastPositionUpdateMs;
        if (elapsedMs <= 0) {
            return;
        }
        double radians = Math.toRadians(angle);
        double distance = speed * elapsedMs / 60000.0 * SPEED_FACTOR;
        x = wrap(x + Math.cos(radians) * distance, worldWidth);
        y = wrap(y + Math.sin(radians) * distance, worldHeight);
        lastPositionUpdateMs = nowMs;
    }

    public void stop() {
        this.speed = 0;
    }

    public void moveTo(double newX, double newY, long nowMs) {
        this.x = newX;
        this.y = newY;
        this.lastPositionUpdateMs = nowMs;
    }

    public double distanceTo(double otherX, double otherY) {
        return Math.hypot(x - otherX, y - otherY);
    }

    private static double wrap(double value, double bound) {
        return ((value % bound) + bound) % bound;
    }
}
