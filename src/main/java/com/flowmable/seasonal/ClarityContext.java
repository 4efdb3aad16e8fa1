package com.flowmable.seasonal;

/**
 * Clarity findings that shaped a personalized rating.
 *
 * @param clarityCap      Rating the clarity rules capped to, or null if none applied
 * @param vividWarning    Garment is bolder than a muted user's coloring
 * @param chromaLevel     Intensity band of the garment
 * @param nearFace        Garment is worn near the face
 * @param tooVividForUser Muted user, clear or high-chroma garment
 * @param tooSoftForUser  Clear user, muted or low-chroma garment
 */
public record ClarityContext(
        ColorRating clarityCap,
        boolean vividWarning,
        ChromaLevel chromaLevel,
        boolean nearFace,
        boolean tooVividForUser,
        boolean tooSoftForUser
) {}
