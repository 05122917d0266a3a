package com.flamingo.ai.stripsequencer.domain.model;

/**
 * One chaining step: {@code to} was selected as the nearest remaining segment to {@code from}.
 *
 * @param from the segment placed last before this step
 * @param to the segment selected by this step
 * @param distance the oracle distance from {@code from} to {@code to}
 */
public record ChainStep(SegmentIdentity from, SegmentIdentity to, double distance) {}
