package com.pgschema.upgrader.exception;

/**
 * A nested directory was found inside the migration directory.
 */
public class DirectoryLayoutException extends StepSourceException {

    public DirectoryLayoutException(String message, String fileName) {
        super(message, fileName);
    }
}
