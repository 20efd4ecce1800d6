package com.umitunal.taskq.core;

/**
 * What happens when a handler or schedule is registered under a name that is already taken.
 */
public enum RegistrationPolicy {
    REPLACE,   // Last registration wins, logged as a warning
    REJECT     // Throw DuplicateRegistrationException
}
