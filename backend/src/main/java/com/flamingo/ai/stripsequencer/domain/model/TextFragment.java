package com.flamingo.ai.stripsequencer.domain.model;

/**
 * Text that has already been extracted from an upload, waiting to be sequenced.
 *
 * @param name display name of the originating upload
 * @param text extracted text (may be empty)
 */
public record TextFragment(String name, String text) {}
