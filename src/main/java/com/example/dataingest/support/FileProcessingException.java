package com.example.dataingest.support;

public class FileProcessingException extends RuntimeException {

    public FileProcessingException(String message) {
        super(message);
    }

    public FileProcessingException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Description of a failure and its cause chain, suitable for metadata records and run summaries.
     */
    public static String describe(Throwable ex) {
        if (ex instanceof FileProcessingException) {
            Throwable cause = ex.getCause();
            return cause == null ? ex.getMessage() : ex.getMessage() + ": " + describe(cause);
        }
        String type = ex.getClass().getSimpleName();
        return ex.getMessage() == null ? type : type + ": " + ex.getMessage();
    }
}
