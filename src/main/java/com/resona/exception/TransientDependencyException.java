package com.resona.exception;

/**
 * A remote dependency (object store, synthesis provider, edge network) failed in a way
 * that may succeed on a later attempt.
 */
public class TransientDependencyException extends ResonaException {

    private final String dependency;

    public TransientDependencyException(String dependency, String message, Throwable cause) {
        super(dependency + ": " + message, cause);
        this.dependency = dependency;
    }

    public TransientDependencyException(String dependency, String message) {
        this(dependency, message, null);
    }

    public String getDependency() {
        return dependency;
    }
}
