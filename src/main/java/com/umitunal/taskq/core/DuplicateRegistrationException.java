package com.umitunal.taskq.core;

/**
 * Thrown when a name is registered twice under {@link RegistrationPolicy#REJECT}.
 */
public class DuplicateRegistrationException extends RuntimeException {

    public DuplicateRegistrationException(String kind, String name) {
        super(kind + " already registered: " + name);
    }
}
