package com.transittracker.engine.interpolation;

/**
 * Maps linear progress t in [0, 1] to eased progress in [0, 1].
 */
public enum Easing {

    /** {@code 1 - (1 - t)^3}: fast start, gentle arrival. */
    EASE_OUT_CUBIC {
        @Override
        public double apply(double t) {
            double inverse = 1.0 - clamp(t);
            return 1.0 - inverse * inverse * inverse;
        }
    },

    LINEAR {
        @Override
        public double apply(double t) {
            return clamp(t);
        }
    };

    public abstract double apply(double t);

    static double clamp(double t) {
        if (Double.isNaN(t) || t <= 0.0) {
            return 0.0;
        }
        return Math.min(t, 1.0);
    }
}
