package com.contactsbook.backend.modules.auth.application;

public enum DenylistStatus {
    LISTED,
    CLEAR,
    /** The cache could not be consulted. */
    UNKNOWN
}
