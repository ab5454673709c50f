package edu.harvard.hms.dbmi.avillach.idmap.exception;

public class MappingException extends RuntimeException {

    private static final long serialVersionUID = 4127781940325166503L;

    public MappingException(String message) {
        super(message);
    }

    public MappingException(String message, Throwable cause) {
        super(message, cause);
    }
}
