package com.transittracker.engine.interpolation;

import java.time.Duration;
import java.time.Instant;

/**
 * Rotates a marker toward a new bearing along the shorter arc.
 *
 * Runs on its own clock, independent of {@link PositionAnimator}.
 */
public class HeadingAnimator {

    private final Duration duration;
    private final Easing easing;

    private double startDegrees;
    private double deltaDegrees;
    private double targetDegrees;
    private Instant startedAt;

    public HeadingAnimator(double initialDegrees) {
        this(initialDegrees, PositionAnimator.DEFAULT_DURATION, Easing.EASE_OUT_CUBIC);
    }

    public HeadingAnimator(double initialDegrees, Duration duration, Easing easing) {
        this.startDegrees = normalize(initialDegrees);
        this.deltaDegrees = 0.0;
        this.targetDegrees = this.startDegrees;
        this.duration = duration;
        this.easing = easing;
    }

    /**
     * Starts a rotation toward {@code degrees}.
     *
     * @return false when the bearing is already displayed or already being
     *         approached
     */
    public boolean retarget(double degrees, Instant now) {
        double target = normalize(degrees);
        if (isRotating(now) && target == targetDegrees) {
            return false;
        }

        double displayed = displayedAt(now);
        double delta = shortestDelta(displayed, target);
        if (delta == 0.0) {
            return false;
        }

        startDegrees = displayed;
        deltaDegrees = delta;
        targetDegrees = target;
        startedAt = now;
        return true;
    }

    public boolean isRotating(Instant now) {
        return startedAt != null && Duration.between(startedAt, now).compareTo(duration) < 0;
    }

    public double displayedAt(Instant now) {
        if (startedAt == null) {
            return startDegrees;
        }
        double progress = Easing.clamp((double) Duration.between(startedAt, now).toNanos() / duration.toNanos());
        return normalize(startDegrees + deltaDegrees * easing.apply(progress));
    }

    /**
     * Signed rotation in (-180, 180] taking {@code from} to {@code to}.
     */
    static double shortestDelta(double from, double to) {
        double delta = (to - from) % 360.0;
        if (delta > 180.0) {
            delta -= 360.0;
        } else if (delta <= -180.0) {
            delta += 360.0;
        }
        return delta;
    }

    static double normalize(double degrees) {
        double normalized = degrees % 360.0;
        return normalized < 0 ? normalized + 360.0 : normalized;
    }
}
