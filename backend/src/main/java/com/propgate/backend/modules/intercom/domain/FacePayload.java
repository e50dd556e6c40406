package com.propgate.backend.modules.intercom.domain;

/**
 * Base64 encoded front, left and right face images, optionally prefixed with a data URL header.
 */
public record FacePayload(String frontImage, String leftImage, String rightImage) {
}
