package com.phillippitts.scalogram.exception;

/**
 * Thrown when a mother-wavelet identifier does not name a supported family.
 */
public class InvalidWaveletFamilyException extends ScalogramException {

    private final String familyId;

    public InvalidWaveletFamilyException(String familyId) {
        super(ErrorKind.INVALID_WAVELET_FAMILY, "Unsupported wavelet family: " + familyId);
        this.familyId = familyId;
    }

    public String getFamilyId() {
        return familyId;
    }
}
