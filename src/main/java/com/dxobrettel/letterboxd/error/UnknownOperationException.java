package com.dxobrettel.letterboxd.error;

public class UnknownOperationException extends ValidationException {

    public UnknownOperationException(String operationName) {
        super("Operation '" + operationName + "' is not registered");
    }
}
