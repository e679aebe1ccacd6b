package com.acme.fleet.admission.resource;

/**
 * Fixed-size simple moving average over the most recent samples.
 * Not thread-safe; owned by {@link ResourceMonitor}.
 */
final class MovingAverage {
    private final double[] window;
    private int next;
    private int count;
    private double sum;

    MovingAverage(int size) {
        this.window = new double[Math.max(1, size)];
    }

    void add(double value) {
        if (count == window.length) {
            sum -= window[next];
        } else {
            count++;
        }
        window[next] = value;
        sum += value;
        next = (next + 1) % window.length;
    }

    double average() {
        return count == 0 ? 0.0d : sum / count;
    }
}
