package io.github.jakubt4.meridian.simulation;

/**
 * Consumer of finished frames, typically the render layer.
 */
public interface FrameSink {

    void publish(FrameSnapshot snapshot);
}
