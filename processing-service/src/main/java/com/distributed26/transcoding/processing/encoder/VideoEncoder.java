package com.distributed26.transcoding.processing.encoder;

/**
 * Runs one encode to completion. Returns normally when the variant playlist has been produced,
 * throws {@link EncodeException} with the encoder's diagnostic otherwise.
 */
@FunctionalInterface
public interface VideoEncoder {
    void encode(EncodeRequest request, EncodeListener listener) throws EncodeException;
}
