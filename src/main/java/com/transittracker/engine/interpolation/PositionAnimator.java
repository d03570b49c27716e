package com.transittracker.engine.interpolation;

import java.time.Duration;
import java.time.Instant;

/**
 * Smooths one vehicle's marker between consecutive observed positions.
 *
 * A new target never queues behind the running move: the move restarts
 * from whatever point is displayed at that instant. Not thread-safe; a
 * renderer drives it from its own frame loop.
 */
public class PositionAnimator {

    public static final Duration DEFAULT_DURATION = Duration.ofMillis(2000);

    private final Duration duration;
    private final Easing easing;

    private Coordinates settled;
    private AnimationState animation;

    public PositionAnimator(Coordinates initial) {
        this(initial, DEFAULT_DURATION, Easing.EASE_OUT_CUBIC);
    }

    public PositionAnimator(Coordinates initial, Duration duration, Easing easing) {
        if (initial == null) {
            throw new IllegalArgumentException("Initial position is required");
        }
        this.settled = initial;
        this.duration = duration;
        this.easing = easing;
    }

    /**
     * Starts a move toward {@code target}.
     *
     * @return false when the target is already displayed or already being
     *         approached, in which case nothing changes
     */
    public boolean retarget(Coordinates target, Instant now) {
        Coordinates displayed = displayedAt(now);
        if (displayed.equals(target)) {
            return false;
        }
        if (animation != null && !animation.isComplete(now) && animation.target().equals(target)) {
            return false;
        }

        animation = new AnimationState(displayed, target, now, duration, easing);
        return true;
    }

    /**
     * Position to draw at {@code now}. Settles the animation once complete.
     */
    public Coordinates displayedAt(Instant now) {
        if (animation == null) {
            return settled;
        }
        if (animation.isComplete(now)) {
            settled = animation.target();
            animation = null;
            return settled;
        }
        return animation.positionAt(now);
    }

    public boolean isAnimating(Instant now) {
        return animation != null && !animation.isComplete(now);
    }

    public Coordinates target() {
        return animation != null ? animation.target() : settled;
    }
}
