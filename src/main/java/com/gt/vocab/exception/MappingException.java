package com.gt.vocab.exception;

// Thrown when a stored value cannot be converted back into its model representation
public class MappingException extends RuntimeException {

    public MappingException(String errMsg)  {
        super(errMsg);
    }

    public MappingException(String errMsg, Exception ex) {
        super(errMsg, ex);
    }
}
