package com.transittracker.engine.interpolation;

import java.time.Duration;
import java.time.Instant;

/**
 * One in-flight move from {@code start} to {@code target}.
 *
 * @param start     Position displayed when the move began
 * @param target    Newly observed position
 * @param startedAt Start of the move
 * @param duration  Fixed length of the move
 * @param easing    Progress curve
 */
public record AnimationState(
    Coordinates start,
    Coordinates target,
    Instant startedAt,
    Duration duration,
    Easing easing
) {

    public AnimationState {
        if (start == null || target == null || startedAt == null) {
            throw new IllegalArgumentException("Start, target and start time are required");
        }
        if (duration == null || duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException("Animation duration must be positive");
        }
        if (easing == null) {
            easing = Easing.EASE_OUT_CUBIC;
        }
    }

    /**
     * Linear progress clamped to [0, 1].
     */
    public double progress(Instant now) {
        double elapsed = Duration.between(startedAt, now).toNanos();
        return Easing.clamp(elapsed / duration.toNanos());
    }

    public Coordinates positionAt(Instant now) {
        return start.lerp(target, easing.apply(progress(now)));
    }

    public boolean isComplete(Instant now) {
        return progress(now) >= 1.0;
    }
}
