package com.yoursp.ledger.modules.biometric;

import java.util.List;

/**
 * Face-detection collaborator. Turns an image into zero or more fixed-dimension
 * encodings, in detector order.
 */
public interface FaceEncoder {

    /**
     * @param image raw image bytes (JPEG/PNG)
     * @return one encoding per detected face; empty when no face is found
     * @throws com.yoursp.ledger.exception.FeatureExtractionException if the image
     *         cannot be processed
     */
    List<double[]> encode(byte[] image);
}
