package com.phillippitts.scalogram.exception;

/**
 * Thrown when the renderer receives a coefficient matrix with a zero dimension.
 */
public class EmptyMatrixException extends ScalogramException {

    public EmptyMatrixException(int rows, int columns) {
        super(ErrorKind.EMPTY_MATRIX, "Coefficient matrix is empty (" + rows + " x " + columns + ")");
    }
}
