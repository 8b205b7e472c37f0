package io.github.jakubt4.meridian.dto;

/**
 * @param rate simulated seconds added per frame
 */
public record WarpRequest(boolean enabled, double rate) {
}
